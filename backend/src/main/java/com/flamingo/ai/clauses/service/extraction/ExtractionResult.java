package com.flamingo.ai.clauses.service.extraction;

import com.flamingo.ai.clauses.service.structure.Clause;
import java.util.List;

/**
 * Output of one document extraction.
 *
 * @param clauses root clauses in numeric order
 * @param rows tabular projection, header row first
 */
public record ExtractionResult(List<Clause> clauses, List<List<String>> rows) {

  /** Number of clauses at every depth, i.e. the table rows without the header. */
  public int clauseCount() {
    return rows.size() - 1;
  }
}
