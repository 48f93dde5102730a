package com.flamingo.ai.clauses.service.export;

import com.flamingo.ai.clauses.service.structure.Clause;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Flattens a clause forest into spreadsheet rows.
 *
 * <p>The first row is the header; each clause then gets one row in depth-first order with its
 * parent's identifier (empty for roots) and its depth starting at 1.
 */
@Component
public class ClauseTableProjector {

  public static final List<String> HEADER = List.of("Clause", "Title", "Parent", "Level", "Text");

  public List<List<String>> toRows(List<Clause> clauses) {
    List<List<String>> rows = new ArrayList<>();
    rows.add(HEADER);
    for (Clause clause : clauses) {
      flatten(clause, "", 1, rows);
    }
    return rows;
  }

  private void flatten(Clause clause, String parent, int level, List<List<String>> rows) {
    String id = clause.identifier().value();
    rows.add(List.of(id, clause.title(), parent, String.valueOf(level), clause.text()));
    for (Clause child : clause.children()) {
      flatten(child, id, level + 1, rows);
    }
  }
}
