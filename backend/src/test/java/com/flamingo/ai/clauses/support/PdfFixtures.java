package com.flamingo.ai.clauses.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/** Writes small PDFs with PDFBox for extraction tests. */
public final class PdfFixtures {

  private static final float MARGIN_LEFT = 72.0f;
  private static final float FIRST_BASELINE = 720.0f;

  private PdfFixtures() {}

  /** One line of text to draw; {@code page} is 1-based. */
  public record TextLine(int page, String text, float fontSize, boolean bold, float extraGap) {}

  public static final class Builder {
    private final List<TextLine> lines = new ArrayList<>();
    private int page = 1;
    private boolean forbidExtraction;

    public Builder heading(String text) {
      lines.add(new TextLine(page, text, 16.0f, true, 0.0f));
      return this;
    }

    public Builder subheading(String text) {
      lines.add(new TextLine(page, text, 15.0f, true, 0.0f));
      return this;
    }

    public Builder body(String text) {
      lines.add(new TextLine(page, text, 11.0f, false, 0.0f));
      return this;
    }

    public Builder bodyAfterGap(String text, float gap) {
      lines.add(new TextLine(page, text, 11.0f, false, gap));
      return this;
    }

    public Builder nextPage() {
      page++;
      return this;
    }

    public Builder forbidExtraction() {
      forbidExtraction = true;
      return this;
    }

    public byte[] build() throws IOException {
      try (PDDocument document = new PDDocument()) {
        PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        for (int p = 1; p <= page; p++) {
          PDPage pdPage = new PDPage(PDRectangle.LETTER);
          document.addPage(pdPage);
          try (PDPageContentStream content = new PDPageContentStream(document, pdPage)) {
            float baseline = FIRST_BASELINE;
            for (TextLine line : lines) {
              if (line.page() != p) {
                continue;
              }
              baseline -= line.extraGap();
              content.beginText();
              content.setFont(line.bold() ? bold : regular, line.fontSize());
              content.newLineAtOffset(MARGIN_LEFT, baseline);
              content.showText(line.text());
              content.endText();
              baseline -= line.fontSize() + 4.0f;
            }
          }
        }
        if (forbidExtraction) {
          AccessPermission permission = new AccessPermission();
          permission.setCanExtractContent(false);
          StandardProtectionPolicy policy =
              new StandardProtectionPolicy("owner-secret", "", permission);
          policy.setEncryptionKeyLength(128);
          document.protect(policy);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);
        return out.toByteArray();
      }
    }
  }

  public static Builder pdf() {
    return new Builder();
  }
}
