package com.flamingo.ai.clauses.service.structure;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import com.flamingo.ai.clauses.service.layout.Line;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds clause headings in the unfiltered line sequence.
 *
 * <p>A heading is a line whose whole text is a dotted clause number, optionally followed by a
 * title, set in a large bold face. When the number stands alone, the title is read from the
 * following prominent lines, skipping blank ones, until a line that is not prominent or that
 * starts another clause number. A bare top-level number without any title is discarded as a
 * stray page number.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeadingDetector {

  static final Pattern HEADING_NUMBER = Pattern.compile("^(\\d+(?:\\.\\d+)*)(?:\\s+(.*\\S))?$");

  private final ExtractionSettings settings;

  /** Returns {@code true} when the text has the shape of a numbered heading. */
  public static boolean matchesHeadingNumber(String text) {
    return HEADING_NUMBER.matcher(text).matches();
  }

  public List<Heading> detect(List<Line> lines) {
    List<Heading> headings = new ArrayList<>();
    LineCursor cursor = new LineCursor(lines);
    int discarded = 0;

    while (cursor.hasNext()) {
      Line line = cursor.current();
      String text = line.cleanedText();
      Matcher matcher = HEADING_NUMBER.matcher(text);
      if (text.isEmpty() || !matcher.matches() || !isProminent(line)) {
        cursor.advance(1);
        continue;
      }

      String identifier = matcher.group(1);
      String title = matcher.group(2) == null ? "" : matcher.group(2).strip();
      int consumed = 1;
      if (title.isEmpty()) {
        List<String> titleParts = new ArrayList<>();
        Optional<Line> next;
        while ((next = cursor.peek(consumed)).isPresent()) {
          Line candidate = next.get();
          String candidateText = candidate.cleanedText();
          if (candidateText.isEmpty()) {
            consumed++;
            continue;
          }
          if (!isProminent(candidate) || matchesHeadingNumber(candidateText)) {
            break;
          }
          titleParts.add(candidateText);
          consumed++;
        }
        title = String.join(" ", titleParts).strip();
      }

      if (title.isEmpty() && !identifier.contains(".")) {
        log.debug("Discarding bare number '{}' on page {}", identifier, line.page());
        discarded++;
        cursor.advance(consumed);
        continue;
      }

      headings.add(
          new Heading(ClauseIdentifier.parse(identifier), title, cursor.position(), consumed));
      cursor.advance(consumed);
    }

    log.debug("Detected {} headings, discarded {} bare numbers", headings.size(), discarded);
    return headings;
  }

  boolean isProminent(Line line) {
    return line.maxFontSize() >= settings.headingMinFontSize()
        && line.boldRatio() >= settings.headingMinBoldRatio();
  }
}
