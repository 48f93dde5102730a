package com.flamingo.ai.clauses.service.structure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClauseIdentifier Tests")
class ClauseIdentifierTest {

  private static ClauseIdentifier id(String value) {
    return ClauseIdentifier.parse(value);
  }

  @Test
  @DisplayName("should compare segments numerically rather than lexicographically")
  void shouldCompareNumerically() {
    assertThat(id("4.2")).isLessThan(id("4.10"));
    assertThat(id("4.9")).isLessThan(id("4.10"));
    assertThat(id("10")).isGreaterThan(id("9"));
  }

  @Test
  @DisplayName("should sort a parent before its own subclauses")
  void shouldSortPrefixFirst() {
    List<String> sorted =
        Stream.of("4.10", "4", "4.2.1", "4.2", "3.9", "10")
            .map(ClauseIdentifier::parse)
            .sorted()
            .map(ClauseIdentifier::value)
            .toList();

    assertThat(sorted).containsExactly("3.9", "4", "4.2", "4.2.1", "4.10", "10");
  }

  @Test
  @DisplayName("should ignore leading zeros and survive very long numbers")
  void shouldHandleLeadingZerosAndLongSegments() {
    assertThat(id("4.02").compareTo(id("4.2"))).isZero();
    assertThat(id("123456789012345678901234567890"))
        .isGreaterThan(id("99999999999999999999999999999"));
  }

  @Test
  @DisplayName("should keep zero-padded identifiers distinct even though they compare equal")
  void shouldKeepZeroPaddedIdentifiersDistinct() {
    assertThat(id("4.01").compareTo(id("4.1"))).isZero();
    assertThat(id("4.01")).isNotEqualTo(id("4.1"));
    assertThat(id("4.01").value()).isEqualTo("4.01");
  }

  @Test
  @DisplayName("should derive the parent by dropping the last segment")
  void shouldDeriveParent() {
    assertThat(id("3.2.1").parent()).map(ClauseIdentifier::value).contains("3.2");
    assertThat(id("3").parent()).isEmpty();
    assertThat(id("3.2.1").depth()).isEqualTo(3);
    assertThat(id("3").isTopLevel()).isTrue();
  }

  @Test
  @DisplayName("should reject text that is not a dotted number")
  void shouldRejectInvalidIdentifiers() {
    assertThatThrownBy(() -> id("A.1")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> id("4.")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> id("")).isInstanceOf(IllegalArgumentException.class);
  }
}
