package com.flamingo.ai.clauses.service.structure;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Dotted-decimal clause number such as {@code 4.2.10}.
 *
 * <p>Ordering compares segment by segment as unbounded non-negative integers, so {@code 4.2 <
 * 4.10} and {@code 4.9 < 4.10}. A shorter identifier that is a prefix of a longer one sorts first.
 *
 * <p>The ordering is not consistent with {@link #equals}: leading zeros are ignored when comparing,
 * so {@code 4.01} and {@code 4.1} compare as equal while remaining distinct identifiers. Only
 * sorting relies on the ordering; lookups go through the literal {@link #value()}.
 */
public record ClauseIdentifier(String value, List<String> segments)
    implements Comparable<ClauseIdentifier> {

  private static final Pattern SYNTAX = Pattern.compile("\\d+(?:\\.\\d+)*");
  private static final Splitter DOT_SPLITTER = Splitter.on('.');
  private static final Joiner DOT_JOINER = Joiner.on('.');
  private static final CharMatcher ZERO = CharMatcher.is('0');

  public ClauseIdentifier {
    segments = List.copyOf(segments);
  }

  public static ClauseIdentifier parse(String value) {
    if (value == null || !SYNTAX.matcher(value).matches()) {
      throw new IllegalArgumentException("Not a dotted clause number: " + value);
    }
    return new ClauseIdentifier(value, DOT_SPLITTER.splitToList(value));
  }

  /** {@code true} for top-level clauses, i.e. identifiers without a dot. */
  public boolean isTopLevel() {
    return segments.size() == 1;
  }

  public int depth() {
    return segments.size();
  }

  /** Identifier with the last segment removed; empty for top-level identifiers. */
  public Optional<ClauseIdentifier> parent() {
    if (isTopLevel()) {
      return Optional.empty();
    }
    List<String> parentSegments = segments.subList(0, segments.size() - 1);
    return Optional.of(new ClauseIdentifier(DOT_JOINER.join(parentSegments), parentSegments));
  }

  @Override
  public int compareTo(ClauseIdentifier other) {
    int shared = Math.min(segments.size(), other.segments.size());
    for (int i = 0; i < shared; i++) {
      int cmp = compareNumeric(segments.get(i), other.segments.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(segments.size(), other.segments.size());
  }

  private static int compareNumeric(String a, String b) {
    String left = stripLeadingZeros(a);
    String right = stripLeadingZeros(b);
    if (left.length() != right.length()) {
      return Integer.compare(left.length(), right.length());
    }
    return left.compareTo(right);
  }

  private static String stripLeadingZeros(String digits) {
    String stripped = ZERO.trimLeadingFrom(digits);
    return stripped.isEmpty() ? "0" : stripped;
  }

  @Override
  public String toString() {
    return value;
  }
}
