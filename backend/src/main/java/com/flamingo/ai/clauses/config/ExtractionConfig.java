package com.flamingo.ai.clauses.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the clause extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  private Heading heading = new Heading();
  private Layout layout = new Layout();
  private Noise noise = new Noise();

  /** Largest accepted upload, in bytes. */
  private long maxUploadBytes = 10L * 1024 * 1024;

  @Getter
  @Setter
  public static class Heading {
    private float minFontSize = ExtractionSettings.DEFAULT_HEADING_MIN_FONT_SIZE;
    private double minBoldRatio = ExtractionSettings.DEFAULT_HEADING_MIN_BOLD_RATIO;
  }

  @Getter
  @Setter
  public static class Layout {
    /** Horizontal gap (layout units) above which two fragments are separated by a space. */
    private float fragmentGap = ExtractionSettings.DEFAULT_FRAGMENT_GAP;

    /** Vertical gap (layout units) between body lines that starts a new paragraph. */
    private float paragraphGap = ExtractionSettings.DEFAULT_PARAGRAPH_GAP;

    private List<String> boldFontMarkers =
        new ArrayList<>(ExtractionSettings.DEFAULT_BOLD_FONT_MARKERS);
  }

  @Getter
  @Setter
  public static class Noise {
    private int minFragmentWords = ExtractionSettings.DEFAULT_MIN_FRAGMENT_WORDS;
    private int maxFragmentWords = ExtractionSettings.DEFAULT_MAX_FRAGMENT_WORDS;
    private List<String> skipPatterns = new ArrayList<>(ExtractionSettings.DEFAULT_SKIP_PATTERNS);
  }

  /** Snapshot of the bound properties, shared read-only by every pipeline stage. */
  @Bean
  public ExtractionSettings extractionSettings() {
    return toSettings();
  }

  public ExtractionSettings toSettings() {
    return new ExtractionSettings(
        heading.getMinFontSize(),
        heading.getMinBoldRatio(),
        layout.getFragmentGap(),
        layout.getParagraphGap(),
        noise.getMinFragmentWords(),
        noise.getMaxFragmentWords(),
        layout.getBoldFontMarkers(),
        ExtractionSettings.compile(noise.getSkipPatterns()));
  }
}
