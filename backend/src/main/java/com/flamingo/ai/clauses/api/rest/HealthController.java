package com.flamingo.ai.clauses.api.rest;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and the active extraction tuning. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final ExtractionSettings settings;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "clause-extractor");
    health.put("headingMinFontSize", settings.headingMinFontSize());
    health.put("headingMinBoldRatio", settings.headingMinBoldRatio());
    health.put("paragraphGap", settings.paragraphGap());
    health.put("skipPatterns", settings.skipPatterns().size());
    return ResponseEntity.ok(health);
  }
}
