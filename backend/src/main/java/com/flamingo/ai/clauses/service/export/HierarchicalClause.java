package com.flamingo.ai.clauses.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.clauses.service.structure.Clause;
import java.util.List;

/**
 * Hierarchical projection of a clause: {@code {clause, title, text, subclauses?}}.
 *
 * <p>{@code subclauses} is omitted from the JSON output when the clause has no children.
 */
@JsonPropertyOrder({"clause", "title", "text", "subclauses"})
public record HierarchicalClause(
    String clause,
    String title,
    String text,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<HierarchicalClause> subclauses) {

  public static HierarchicalClause from(Clause clause) {
    return new HierarchicalClause(
        clause.identifier().value(),
        clause.title(),
        clause.text(),
        clause.children().stream().map(HierarchicalClause::from).toList());
  }

  public static List<HierarchicalClause> fromAll(List<Clause> clauses) {
    return clauses.stream().map(HierarchicalClause::from).toList();
  }
}
