package com.flamingo.ai.clauses.service.layout;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import com.flamingo.ai.clauses.exception.ExtractionNotPermittedException;
import com.flamingo.ai.clauses.exception.MalformedDocumentException;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Service;

/**
 * {@link LayoutExtractor} backed by Apache PDFBox 3.x.
 *
 * <p>A {@link PDFTextStripper} subclass groups glyphs into text lines in reading order and emits
 * one {@link TextFragment} per text line, carrying:
 *
 * <ul>
 *   <li>the line's left edge, width and top edge (converted to a top-of-page origin);
 *   <li>the largest glyph size in points;
 *   <li>a bold flag set when at least half of the non-blank glyph weight uses a font whose name
 *       contains one of the configured bold markers ("bold", "black", "heavy").
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfBoxLayoutExtractor implements LayoutExtractor {

  private static final double BOLD_LINE_RATIO = 0.5;
  private static final float SAME_LINE_TOLERANCE = 2.0f;

  private final ExtractionSettings settings;

  @Override
  public List<TextFragment> extract(Path pdf) {
    try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
      return extractFragments(document);
    } catch (InvalidPasswordException e) {
      throw new ExtractionNotPermittedException("PDF is encrypted: " + e.getMessage(), e);
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", pdf, e.getMessage());
      throw new MalformedDocumentException(e.getMessage(), e);
    }
  }

  @Override
  public List<TextFragment> extract(byte[] pdfBytes) {
    try (PDDocument document = Loader.loadPDF(pdfBytes)) {
      return extractFragments(document);
    } catch (InvalidPasswordException e) {
      throw new ExtractionNotPermittedException("PDF is encrypted: " + e.getMessage(), e);
    } catch (IOException e) {
      log.error("PDFBox parsing failed: {}", e.getMessage());
      throw new MalformedDocumentException(e.getMessage(), e);
    }
  }

  private List<TextFragment> extractFragments(PDDocument document) throws IOException {
    if (!document.getCurrentAccessPermission().canExtractContent()) {
      throw new ExtractionNotPermittedException("Document permissions forbid text extraction");
    }
    FragmentStripper stripper = new FragmentStripper();
    stripper.writeText(document, Writer.nullWriter());
    List<TextFragment> fragments = stripper.getFragments();
    log.debug(
        "Extracted {} text lines from {} pages", fragments.size(), document.getNumberOfPages());
    return fragments;
  }

  boolean isBoldFont(String fontName) {
    if (fontName == null || fontName.isEmpty()) {
      return false;
    }
    String lowered = fontName.toLowerCase(Locale.ROOT);
    return settings.boldFontMarkers().stream().anyMatch(lowered::contains);
  }

  static String normalize(String text) {
    return text.replace('\r', ' ').replace('\n', ' ').replace('\u00A0', ' ').replace("\0", "");
  }

  // ---- inner types ----

  /** Collects per-line positions and fonts during PDFTextStripper traversal. */
  private final class FragmentStripper extends PDFTextStripper {

    private final List<TextFragment> fragments = new ArrayList<>();
    private final List<TextPosition> currentPositions = new ArrayList<>();
    private final StringBuilder currentText = new StringBuilder();
    private float lastY = Float.NaN;

    FragmentStripper() throws IOException {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
      if (!textPositions.isEmpty()) {
        float y = textPositions.get(0).getYDirAdj();
        if (!Float.isNaN(lastY) && Math.abs(y - lastY) > SAME_LINE_TOLERANCE) {
          flushLine();
        }
        lastY = y;
      }
      currentText.append(text);
      currentPositions.addAll(textPositions);
    }

    @Override
    protected void writeWordSeparator() {
      currentText.append(' ');
    }

    @Override
    protected void writeLineSeparator() {
      flushLine();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      lastY = Float.NaN;
      super.endPage(page);
    }

    private void flushLine() {
      if (currentPositions.isEmpty()) {
        currentText.setLength(0);
        return;
      }
      String text = normalize(currentText.toString());
      if (!text.isBlank()) {
        fragments.add(toFragment(text));
      }
      currentPositions.clear();
      currentText.setLength(0);
    }

    private TextFragment toFragment(String text) {
      float x0 = Float.MAX_VALUE;
      float x1 = -Float.MAX_VALUE;
      float topEdge = Float.MAX_VALUE;
      float fontSize = 0.0f;
      int totalWeight = 0;
      int boldWeight = 0;
      for (TextPosition position : currentPositions) {
        x0 = Math.min(x0, position.getXDirAdj());
        x1 = Math.max(x1, position.getXDirAdj() + position.getWidthDirAdj());
        topEdge = Math.min(topEdge, position.getYDirAdj() - position.getHeightDir());
        fontSize = Math.max(fontSize, position.getFontSizeInPt());

        String glyph = position.getUnicode() == null ? "" : position.getUnicode();
        int weight = glyph.strip().isEmpty() ? glyph.length() : glyph.strip().length();
        totalWeight += weight;
        String fontName = position.getFont() == null ? null : position.getFont().getName();
        if (isBoldFont(fontName)) {
          boldWeight += weight;
        }
      }
      float top = Math.max(topEdge, 0.0f);
      boolean bold = totalWeight > 0 && (double) boldWeight / totalWeight >= BOLD_LINE_RATIO;
      return new TextFragment(
          getCurrentPageNo(), top, x0, Math.max(x1 - x0, 0.0f), text, fontSize, bold);
    }

    List<TextFragment> getFragments() {
      return fragments;
    }
  }
}
