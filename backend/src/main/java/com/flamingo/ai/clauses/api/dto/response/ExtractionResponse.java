package com.flamingo.ai.clauses.api.dto.response;

import com.flamingo.ai.clauses.service.export.HierarchicalClause;
import com.flamingo.ai.clauses.service.extraction.ExtractionResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an extracted document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResponse {

  private String fileName;
  private Integer clauseCount;
  private String message;
  private List<String> headers;
  private List<List<String>> rows;
  private List<HierarchicalClause> clauses;

  /** Creates an ExtractionResponse from an extraction result. */
  public static ExtractionResponse fromResult(String fileName, ExtractionResult result) {
    return ExtractionResponse.builder()
        .fileName(fileName)
        .clauseCount(result.clauseCount())
        .message("Extracted " + result.clauseCount() + " clauses from " + fileName + ".")
        .headers(result.rows().get(0))
        .rows(result.rows().subList(1, result.rows().size()))
        .clauses(HierarchicalClause.fromAll(result.clauses()))
        .build();
  }
}
