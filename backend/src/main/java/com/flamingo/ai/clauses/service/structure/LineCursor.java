package com.flamingo.ai.clauses.service.structure;

import com.flamingo.ai.clauses.service.layout.Line;
import java.util.List;
import java.util.Optional;

/**
 * Forward-only position over a line sequence that supports looking ahead without consuming.
 *
 * <p>Callers peek freely and only move the position with {@link #advance(int)} once they have
 * decided how many lines a read consumed.
 */
final class LineCursor {

  private final List<Line> lines;
  private int position;

  LineCursor(List<Line> lines) {
    this.lines = lines;
  }

  int position() {
    return position;
  }

  boolean hasNext() {
    return position < lines.size();
  }

  Line current() {
    return lines.get(position);
  }

  /** Line {@code offset} places after the current one, if any. */
  Optional<Line> peek(int offset) {
    int index = position + offset;
    return index < lines.size() ? Optional.of(lines.get(index)) : Optional.empty();
  }

  void advance(int count) {
    position = Math.min(position + count, lines.size());
  }
}
