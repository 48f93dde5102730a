package com.flamingo.ai.clauses.service.structure;

import java.util.List;

/**
 * A node of the recovered clause hierarchy.
 *
 * @param identifier dotted clause number
 * @param title heading title
 * @param bodyLines kept body lines in reading order; empty strings mark paragraph breaks
 * @param text paragraphs rebuilt from {@code bodyLines}, separated by blank lines
 * @param children subclauses in the order their headings were found
 */
public record Clause(
    ClauseIdentifier identifier,
    String title,
    List<String> bodyLines,
    String text,
    List<Clause> children) {

  public Clause {
    bodyLines = List.copyOf(bodyLines);
    children = List.copyOf(children);
  }
}
