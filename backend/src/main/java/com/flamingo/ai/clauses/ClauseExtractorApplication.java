package com.flamingo.ai.clauses;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot entry point for the clause extraction HTTP service. */
@SpringBootApplication
public class ClauseExtractorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClauseExtractorApplication.class, args);
  }
}
