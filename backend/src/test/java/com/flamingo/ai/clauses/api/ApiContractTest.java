package com.flamingo.ai.clauses.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.clauses.api.rest.ClauseExtractionController;
import com.flamingo.ai.clauses.api.rest.HealthController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.multipart.MultipartFile;

/**
 * Contract tests to verify the HTTP endpoints keep their published paths:
 *
 * <ul>
 *   <li>POST /api/extractions - Extract clauses from an uploaded PDF
 *   <li>POST /api/extractions/workbook - Download the clause table as xlsx
 *   <li>GET /api/health - Health check
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("ClauseExtractionController API contract")
  class ClauseExtractionControllerContract {

    @Test
    @DisplayName("should be mapped to /api/extractions")
    void shouldBeMappedToApiExtractions() {
      RequestMapping mapping =
          ClauseExtractionController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/extractions");
    }

    @Test
    @DisplayName("should expose the workbook download under /workbook")
    void shouldExposeWorkbookEndpoint() throws Exception {
      PostMapping mapping =
          ClauseExtractionController.class
              .getMethod("extractWorkbook", MultipartFile.class)
              .getAnnotation(PostMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/workbook");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /api/health")
    void shouldBeMappedToApiHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/health");
    }
  }
}
