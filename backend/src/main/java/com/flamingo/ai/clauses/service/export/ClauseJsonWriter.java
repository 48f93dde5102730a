package com.flamingo.ai.clauses.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.clauses.service.structure.Clause;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Writes the hierarchical clause form as pretty-printed JSON. */
@Component
public class ClauseJsonWriter {

  private final ObjectMapper objectMapper;

  public ClauseJsonWriter() {
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  public String toJson(List<Clause> clauses) {
    try {
      return objectMapper.writeValueAsString(HierarchicalClause.fromAll(clauses));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize clauses", e);
    }
  }

  public void write(List<Clause> clauses, Path target) {
    try {
      objectMapper.writeValue(target.toFile(), HierarchicalClause.fromAll(clauses));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + target, e);
    }
  }
}
