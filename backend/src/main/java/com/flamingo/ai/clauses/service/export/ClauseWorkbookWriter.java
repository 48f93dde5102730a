package com.flamingo.ai.clauses.service.export;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.xssf.streaming.SXSSFCell;
import org.apache.poi.xssf.streaming.SXSSFRow;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.springframework.stereotype.Component;

/**
 * Packages tabular clause rows into an {@code .xlsx} workbook with a single "Clauses" sheet.
 *
 * <p>The streaming workbook writes every value as an inline string; line breaks inside a value are
 * kept as the spreadsheet line-break entity and rendered through a wrap-text style. Empty values
 * leave the cell out.
 */
@Component
@Slf4j
public class ClauseWorkbookWriter {

  public static final String SHEET_NAME = "Clauses";

  private static final int ROW_WINDOW = 100;

  public void write(List<List<String>> rows, OutputStream out) throws IOException {
    SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_WINDOW);
    try {
      CellStyle wrap = workbook.createCellStyle();
      wrap.setWrapText(true);
      SXSSFSheet sheet = workbook.createSheet(SHEET_NAME);
      for (int r = 0; r < rows.size(); r++) {
        List<String> values = rows.get(r);
        SXSSFRow row = sheet.createRow(r);
        for (int c = 0; c < values.size(); c++) {
          String value = values.get(c);
          if (value == null || value.isEmpty()) {
            continue;
          }
          SXSSFCell cell = row.createCell(c);
          cell.setCellValue(value);
          cell.setCellStyle(wrap);
        }
      }
      workbook.write(out);
      log.debug("Wrote workbook with {} rows", rows.size());
    } finally {
      workbook.dispose();
      workbook.close();
    }
  }

  public byte[] toBytes(List<List<String>> rows) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      write(rows, out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to build workbook", e);
    }
    return out.toByteArray();
  }

  public void write(List<List<String>> rows, Path target) {
    try (OutputStream out = Files.newOutputStream(target)) {
      write(rows, out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + target, e);
    }
  }
}
