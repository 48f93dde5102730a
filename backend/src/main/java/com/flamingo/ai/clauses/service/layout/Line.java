package com.flamingo.ai.clauses.service.layout;

import com.google.common.base.CharMatcher;
import java.util.Comparator;
import java.util.List;

/**
 * Fragments sharing a page and vertical position, kept in left-to-right order.
 *
 * <p>All text and typography signals are recomputed from the fragments on every call; a line
 * never caches derived state.
 *
 * @param page 1-based page number shared by every fragment
 * @param top vertical position of the line
 * @param fragments fragments ordered by {@link TextFragment#left()}
 * @param fragmentGap horizontal gap above which a space separates two fragments
 */
public record Line(int page, float top, List<TextFragment> fragments, float fragmentGap) {

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  public Line {
    fragments =
        fragments.stream().sorted(Comparator.comparingDouble(TextFragment::left)).toList();
  }

  /** Left edge of the first fragment, or 0 for an empty line. */
  public float left() {
    return fragments.isEmpty() ? 0.0f : fragments.get(0).left();
  }

  /** Concatenated fragment text with a space wherever two fragments are visibly apart. */
  public String rawText() {
    StringBuilder text = new StringBuilder();
    Float lastRight = null;
    for (TextFragment fragment : fragments) {
      if (fragment.text().isEmpty()) {
        continue;
      }
      if (lastRight != null && fragment.left() - lastRight > fragmentGap) {
        text.append(' ');
      }
      text.append(fragment.text());
      lastRight = fragment.right();
    }
    return text.toString();
  }

  /** {@link #rawText()} with whitespace runs collapsed to single spaces and trimmed. */
  public String cleanedText() {
    return WHITESPACE.trimAndCollapseFrom(rawText(), ' ');
  }

  public float maxFontSize() {
    return (float) fragments.stream().mapToDouble(TextFragment::fontSize).max().orElse(0.0);
  }

  /** Share of non-blank characters that belong to bold fragments; 0 when there is no text. */
  public double boldRatio() {
    int total = 0;
    int bold = 0;
    for (TextFragment fragment : fragments) {
      int length = WHITESPACE.trimFrom(fragment.text()).length();
      total += length;
      if (fragment.bold()) {
        bold += length;
      }
    }
    return total == 0 ? 0.0 : (double) bold / total;
  }
}
