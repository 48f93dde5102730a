package com.flamingo.ai.clauses.config;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable tuning values shared by every stage of the extraction pipeline.
 *
 * <p>One instance is built at startup from {@link ExtractionConfig} (or from {@link #defaults()}
 * outside Spring) and handed to each stage. Nothing in here changes while a document is being
 * processed, so a single instance can serve concurrent requests.
 *
 * @param headingMinFontSize smallest font size (pt) a heading line may use
 * @param headingMinBoldRatio smallest bold-character ratio a heading line may have
 * @param fragmentGap horizontal gap above which a space is inserted between two fragments
 * @param paragraphGap vertical gap between kept body lines that forces a paragraph break
 * @param minFragmentWords lower word-count bound for the layout-debris heuristic
 * @param maxFragmentWords upper word-count bound for the layout-debris heuristic
 * @param boldFontMarkers lower-case font-name fragments that mark a glyph as bold
 * @param skipPatterns compiled, case-insensitive boilerplate patterns
 */
public record ExtractionSettings(
    float headingMinFontSize,
    double headingMinBoldRatio,
    float fragmentGap,
    float paragraphGap,
    int minFragmentWords,
    int maxFragmentWords,
    List<String> boldFontMarkers,
    List<Pattern> skipPatterns) {

  public static final float DEFAULT_HEADING_MIN_FONT_SIZE = 14.0f;
  public static final double DEFAULT_HEADING_MIN_BOLD_RATIO = 0.5;
  public static final float DEFAULT_FRAGMENT_GAP = 1.5f;
  public static final float DEFAULT_PARAGRAPH_GAP = 18.0f;
  public static final int DEFAULT_MIN_FRAGMENT_WORDS = 2;
  public static final int DEFAULT_MAX_FRAGMENT_WORDS = 6;

  public static final List<String> DEFAULT_BOLD_FONT_MARKERS = List.of("bold", "black", "heavy");

  /** Headers, footers and licensing stamps of the BS EN / IEC 61513 document family. */
  public static final List<String> DEFAULT_SKIP_PATTERNS =
      List.of(
          "^copyright british standards institution",
          "^provided by accuris",
          "^licensee=",
          "^not for resale",
          "^no reproduction or networking permitted",
          "^bs en ",
          "^iec 61513",
          "^61513",
          "^raising standards worldwide",
          "^–\\s*\\d+\\s*–",
          "^--[`',.-]{5,}");

  public ExtractionSettings {
    boldFontMarkers =
        boldFontMarkers.stream().map(marker -> marker.toLowerCase(Locale.ROOT)).toList();
    skipPatterns = List.copyOf(skipPatterns);
  }

  /** Settings tuned for the standards documents this service was built for. */
  public static ExtractionSettings defaults() {
    return new ExtractionSettings(
        DEFAULT_HEADING_MIN_FONT_SIZE,
        DEFAULT_HEADING_MIN_BOLD_RATIO,
        DEFAULT_FRAGMENT_GAP,
        DEFAULT_PARAGRAPH_GAP,
        DEFAULT_MIN_FRAGMENT_WORDS,
        DEFAULT_MAX_FRAGMENT_WORDS,
        DEFAULT_BOLD_FONT_MARKERS,
        compile(DEFAULT_SKIP_PATTERNS));
  }

  /**
   * Compiles boilerplate patterns with the flags the noise filter expects.
   *
   * @param patterns regular expressions, matched with {@code find()} against trimmed line text
   * @return compiled case-insensitive patterns
   */
  public static List<Pattern> compile(List<String> patterns) {
    return patterns.stream()
        .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
        .toList();
  }
}
