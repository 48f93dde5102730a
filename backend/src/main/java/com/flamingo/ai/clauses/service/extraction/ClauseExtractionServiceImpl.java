package com.flamingo.ai.clauses.service.extraction;

import com.flamingo.ai.clauses.exception.EmptyExtractionException;
import com.flamingo.ai.clauses.exception.NoClausesDetectedException;
import com.flamingo.ai.clauses.exception.SourceDocumentNotFoundException;
import com.flamingo.ai.clauses.service.export.ClauseTableProjector;
import com.flamingo.ai.clauses.service.layout.LayoutExtractor;
import com.flamingo.ai.clauses.service.layout.Line;
import com.flamingo.ai.clauses.service.layout.LineAssembler;
import com.flamingo.ai.clauses.service.layout.TextFragment;
import com.flamingo.ai.clauses.service.structure.Clause;
import com.flamingo.ai.clauses.service.structure.ClauseTreeBuilder;
import com.flamingo.ai.clauses.service.structure.Heading;
import com.flamingo.ai.clauses.service.structure.HeadingDetector;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ClauseExtractionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClauseExtractionServiceImpl implements ClauseExtractionService {

  private final LayoutExtractor layoutExtractor;
  private final LineAssembler lineAssembler;
  private final HeadingDetector headingDetector;
  private final ClauseTreeBuilder clauseTreeBuilder;
  private final ClauseTableProjector tableProjector;

  @Override
  @Timed(value = "clauses.extract.file", description = "Time to extract clauses from a PDF file")
  public ExtractionResult extract(Path pdf) {
    Path resolved = pdf.toAbsolutePath().normalize();
    if (!Files.exists(resolved)) {
      throw new SourceDocumentNotFoundException(resolved);
    }
    log.info("Extracting clauses from {}", resolved);
    return toResult(buildClauses(layoutExtractor.extract(resolved)));
  }

  @Override
  @Timed(value = "clauses.extract.upload", description = "Time to extract clauses from an upload")
  public ExtractionResult extract(byte[] pdfBytes, String fileName) {
    log.info("Extracting clauses from upload {} ({} bytes)", fileName, pdfBytes.length);
    return toResult(buildClauses(layoutExtractor.extract(pdfBytes)));
  }

  @Override
  public List<Clause> buildClauses(List<TextFragment> fragments) {
    List<Line> lines = lineAssembler.assemble(fragments);
    if (lines.isEmpty()) {
      throw new EmptyExtractionException();
    }
    List<Heading> headings = headingDetector.detect(lines);
    List<Clause> clauses = clauseTreeBuilder.build(lines, headings);
    if (clauses.isEmpty()) {
      throw new NoClausesDetectedException(lines.size());
    }
    log.info(
        "Recovered {} root clauses from {} headings over {} lines",
        clauses.size(),
        headings.size(),
        lines.size());
    return clauses;
  }

  private ExtractionResult toResult(List<Clause> clauses) {
    return new ExtractionResult(clauses, tableProjector.toRows(clauses));
  }
}
