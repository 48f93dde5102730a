package com.flamingo.ai.clauses.api.rest;

import com.flamingo.ai.clauses.api.dto.response.ExtractionResponse;
import com.flamingo.ai.clauses.config.ExtractionConfig;
import com.flamingo.ai.clauses.exception.ApiError;
import com.flamingo.ai.clauses.exception.InvalidUploadException;
import com.flamingo.ai.clauses.service.export.ClauseWorkbookWriter;
import com.flamingo.ai.clauses.service.extraction.ClauseExtractionService;
import com.flamingo.ai.clauses.service.extraction.ExtractionResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for uploading standards PDFs and downloading their clause structure. */
@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
@Slf4j
public class ClauseExtractionController {

  static final MediaType XLSX =
      MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

  private static final String DEFAULT_FILE_NAME = "uploaded file";

  private final ClauseExtractionService extractionService;
  private final ClauseWorkbookWriter workbookWriter;
  private final ExtractionConfig extractionConfig;

  /** Extracts the clause tree and table of an uploaded PDF. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ExtractionResponse> extract(
      @RequestParam(value = "file", required = false) MultipartFile file) {
    byte[] bytes = readUpload(file);
    String fileName = fileNameOf(file);
    ExtractionResult result = extractionService.extract(bytes, fileName);
    return ResponseEntity.ok(ExtractionResponse.fromResult(fileName, result));
  }

  /** Extracts an uploaded PDF and returns the clause table as an Excel workbook. */
  @PostMapping(value = "/workbook", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> extractWorkbook(
      @RequestParam(value = "file", required = false) MultipartFile file) {
    byte[] bytes = readUpload(file);
    ExtractionResult result = extractionService.extract(bytes, fileNameOf(file));
    byte[] workbook = workbookWriter.toBytes(result.rows());
    String downloadName = baseName(file.getOriginalFilename()) + ".xlsx";
    return ResponseEntity.ok()
        .contentType(XLSX)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(downloadName).build().toString())
        .body(workbook);
  }

  private byte[] readUpload(MultipartFile file) {
    if (file == null) {
      throw new InvalidUploadException(ApiError.MISSING_UPLOAD, "No PDF file provided.");
    }
    if (file.isEmpty()) {
      throw new InvalidUploadException(ApiError.EMPTY_UPLOAD, "Uploaded file is empty.");
    }
    if (file.getSize() > extractionConfig.getMaxUploadBytes()) {
      throw new InvalidUploadException(
          ApiError.UPLOAD_TOO_LARGE, "Uploaded file exceeds size limit.", true);
    }
    try {
      return file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read upload {}: {}", file.getOriginalFilename(), e.getMessage());
      throw new UncheckedIOException("Failed to read uploaded file", e);
    }
  }

  private static String fileNameOf(MultipartFile file) {
    String name = file.getOriginalFilename();
    return name == null || name.isBlank() ? DEFAULT_FILE_NAME : name;
  }

  static String baseName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return "clauses";
    }
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
