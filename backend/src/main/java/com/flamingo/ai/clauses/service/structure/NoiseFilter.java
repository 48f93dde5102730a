package com.flamingo.ai.clauses.service.structure;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import com.flamingo.ai.clauses.service.layout.Line;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Recognises body lines that are page furniture rather than clause prose.
 *
 * <p>Both checks are pure functions of their arguments and the shared settings.
 */
@Component
@RequiredArgsConstructor
public class NoiseFilter {

  private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final CharMatcher SENTENCE_PUNCTUATION = CharMatcher.anyOf(".,;:!?");
  private static final String TOC_LEADER = "...";
  private static final String SEPARATOR_RUN = "--```";
  private static final String LIST_MARKERS = "•–-()";

  private final ExtractionSettings settings;

  /**
   * Returns {@code true} for boilerplate: table-of-contents leader lines, separator runs and the
   * configured header/footer patterns.
   *
   * @param text cleaned line text
   */
  public boolean shouldSkip(String text) {
    String stripped = CharMatcher.whitespace().trimFrom(text);
    if (stripped.isEmpty()) {
      return false;
    }
    if (stripped.contains(TOC_LEADER) && isPageNumber(lastWord(stripped))) {
      return true;
    }
    if (stripped.contains(SEPARATOR_RUN)) {
      return true;
    }
    for (Pattern pattern : settings.skipPatterns()) {
      if (pattern.matcher(stripped).find()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns {@code true} for short, plain, unpunctuated lines left behind by the layout engine
   * (stray running headers, column debris). Bold lines, list items and anything carrying
   * sentence punctuation are kept.
   *
   * @param line the source line, for its bold ratio
   * @param text the line's cleaned text
   */
  public boolean looksLikeFragment(Line line, String text) {
    if (text.isEmpty()) {
      return false;
    }
    if (line.boldRatio() > 0.0) {
      return false;
    }
    if (LIST_MARKERS.indexOf(text.charAt(0)) >= 0) {
      return false;
    }
    if (SENTENCE_PUNCTUATION.matchesAnyOf(text)) {
      return false;
    }
    int words = WORDS.splitToList(text).size();
    return words >= settings.minFragmentWords() && words <= settings.maxFragmentWords();
  }

  private static String lastWord(String text) {
    List<String> words = WORDS.splitToList(text);
    return words.get(words.size() - 1);
  }

  private static boolean isPageNumber(String token) {
    return !token.isEmpty() && DIGITS.matchesAllOf(token);
  }
}
