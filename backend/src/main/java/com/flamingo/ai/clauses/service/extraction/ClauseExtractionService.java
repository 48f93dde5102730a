package com.flamingo.ai.clauses.service.extraction;

import com.flamingo.ai.clauses.service.layout.TextFragment;
import com.flamingo.ai.clauses.service.structure.Clause;
import java.nio.file.Path;
import java.util.List;

/** Recovers the numbered clause hierarchy of a standards document. */
public interface ClauseExtractionService {

  /**
   * Extracts clauses from a PDF on disk.
   *
   * @param pdf path to the PDF
   * @return the clause forest and its tabular projection
   * @throws com.flamingo.ai.clauses.exception.SourceDocumentNotFoundException if the file does not
   *     exist
   * @throws com.flamingo.ai.clauses.exception.ClauseExtractionException for any other terminal
   *     failure
   */
  ExtractionResult extract(Path pdf);

  /**
   * Extracts clauses from an uploaded PDF.
   *
   * @param pdfBytes raw PDF bytes
   * @param fileName original file name, for logging
   * @return the clause forest and its tabular projection
   */
  ExtractionResult extract(byte[] pdfBytes, String fileName);

  /**
   * Runs the structure recovery stages on fragments that were already extracted.
   *
   * @param fragments positioned text fragments of the whole document
   * @return root clauses in numeric order, never empty
   * @throws com.flamingo.ai.clauses.exception.EmptyExtractionException if no line is left
   * @throws com.flamingo.ai.clauses.exception.NoClausesDetectedException if no clause is found
   */
  List<Clause> buildClauses(List<TextFragment> fragments);
}
