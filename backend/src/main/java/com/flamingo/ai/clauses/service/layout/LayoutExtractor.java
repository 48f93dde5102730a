package com.flamingo.ai.clauses.service.layout;

import java.nio.file.Path;
import java.util.List;

/**
 * Decodes a PDF into positioned {@link TextFragment}s.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * extraction requests.
 */
public interface LayoutExtractor {

  /**
   * Extracts fragments from a PDF on disk.
   *
   * @param pdf path to an existing PDF file
   * @return fragments of every page, in no guaranteed order
   * @throws com.flamingo.ai.clauses.exception.ExtractionNotPermittedException if the document
   *     forbids text extraction
   * @throws com.flamingo.ai.clauses.exception.MalformedDocumentException if the document cannot be
   *     decoded
   */
  List<TextFragment> extract(Path pdf);

  /**
   * Extracts fragments from an in-memory PDF.
   *
   * @param pdfBytes raw PDF bytes
   * @return fragments of every page, in no guaranteed order
   */
  List<TextFragment> extract(byte[] pdfBytes);
}
