package com.flamingo.ai.clauses.service.structure;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Folds a clause's body lines into paragraphs.
 *
 * <p>Empty lines are paragraph breaks. A line ending in a hyphen is joined directly onto the next
 * line when that line starts in lower case ("exam-" + "ple" becomes "example"). Paragraphs are
 * separated by a blank line in the result.
 */
@Component
public class TextReconstructor {

  static final String PARAGRAPH_SEPARATOR = "\n\n";

  public String reconstruct(List<String> bodyLines) {
    List<String> paragraphs = new ArrayList<>();
    List<String> buffer = new ArrayList<>();
    for (String line : bodyLines) {
      if (line.isEmpty()) {
        flush(buffer, paragraphs);
        continue;
      }
      int last = buffer.size() - 1;
      if (last >= 0 && buffer.get(last).endsWith("-") && Character.isLowerCase(line.charAt(0))) {
        String previous = buffer.get(last);
        buffer.set(last, previous.substring(0, previous.length() - 1) + line);
      } else {
        buffer.add(line);
      }
    }
    flush(buffer, paragraphs);
    return String.join(PARAGRAPH_SEPARATOR, paragraphs);
  }

  private static void flush(List<String> buffer, List<String> paragraphs) {
    if (buffer.isEmpty()) {
      return;
    }
    String paragraph = String.join(" ", buffer).strip();
    if (!paragraph.isEmpty()) {
      paragraphs.add(paragraph);
    }
    buffer.clear();
  }
}
