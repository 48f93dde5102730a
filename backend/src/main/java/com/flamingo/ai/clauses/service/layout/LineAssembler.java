package com.flamingo.ai.clauses.service.layout;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import com.google.common.base.CharMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns the layout engine's fragments into reading-order {@link Line}s.
 *
 * <p>Fragments are sorted by (page, top, left); fragments with exactly the same page and top are
 * merged into one line. Blank fragments and the engine's own "link to page" annotations are
 * dropped first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LineAssembler {

  private static final String LINK_ANNOTATION_PREFIX = "link to page";

  private static final Comparator<TextFragment> READING_ORDER =
      Comparator.comparingInt(TextFragment::page)
          .thenComparingDouble(TextFragment::top)
          .thenComparingDouble(TextFragment::left);

  private final ExtractionSettings settings;

  public List<Line> assemble(List<TextFragment> fragments) {
    List<TextFragment> ordered =
        fragments.stream().filter(LineAssembler::isContent).sorted(READING_ORDER).toList();

    List<Line> lines = new ArrayList<>();
    List<TextFragment> current = new ArrayList<>();
    for (TextFragment fragment : ordered) {
      if (!current.isEmpty() && !sharesLine(current.get(0), fragment)) {
        lines.add(toLine(current));
        current = new ArrayList<>();
      }
      current.add(fragment);
    }
    if (!current.isEmpty()) {
      lines.add(toLine(current));
    }

    log.debug("Assembled {} lines from {} fragments", lines.size(), fragments.size());
    return lines;
  }

  private Line toLine(List<TextFragment> fragments) {
    TextFragment first = fragments.get(0);
    return new Line(first.page(), first.top(), fragments, settings.fragmentGap());
  }

  private static boolean sharesLine(TextFragment a, TextFragment b) {
    return a.page() == b.page() && Float.compare(a.top(), b.top()) == 0;
  }

  private static boolean isContent(TextFragment fragment) {
    String trimmed = CharMatcher.whitespace().trimFrom(fragment.text());
    return !trimmed.isEmpty()
        && !trimmed.toLowerCase(Locale.ROOT).startsWith(LINK_ANNOTATION_PREFIX);
  }
}
