package com.flamingo.ai.clauses.service.structure;

/**
 * A detected clause heading.
 *
 * @param identifier dotted clause number
 * @param title heading title, possibly read from several lines; may be empty for subclauses
 * @param startLineIndex index of the line carrying the clause number
 * @param lineSpan number of lines consumed by the heading, blank lines included
 */
public record Heading(ClauseIdentifier identifier, String title, int startLineIndex, int lineSpan) {

  /** Index of the first line after the heading. */
  public int endLineIndex() {
    return startLineIndex + lineSpan;
  }
}
