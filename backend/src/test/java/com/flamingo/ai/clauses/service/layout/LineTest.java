package com.flamingo.ai.clauses.service.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Line Tests")
class LineTest {

  private static TextFragment fragment(float left, float width, String text, boolean bold) {
    return new TextFragment(1, 100.0f, left, width, text, 11.0f, bold);
  }

  @Test
  @DisplayName("should insert a space only where fragments are visibly apart")
  void shouldInsertSpace_whenGapExceedsThreshold() {
    Line line =
        new Line(
            1,
            100.0f,
            List.of(
                fragment(10.0f, 20.0f, "Safe", false),
                fragment(31.0f, 10.0f, "ty", false),
                fragment(45.0f, 30.0f, "rules", false)),
            1.5f);

    assertThat(line.cleanedText()).isEqualTo("Safety rules");
  }

  @Test
  @DisplayName("should order fragments left to right regardless of input order")
  void shouldSortFragmentsByLeft() {
    Line line =
        new Line(
            1,
            100.0f,
            List.of(fragment(60.0f, 20.0f, "world", false), fragment(10.0f, 20.0f, "hello", false)),
            1.5f);

    assertThat(line.cleanedText()).isEqualTo("hello world");
    assertThat(line.left()).isEqualTo(10.0f);
  }

  @Test
  @DisplayName("should collapse inner whitespace and trim")
  void shouldCollapseWhitespace() {
    Line line =
        new Line(
            1, 0.0f, List.of(fragment(0.0f, 50.0f, "  4   Safety\trequirements ", true)), 1.5f);

    assertThat(line.cleanedText()).isEqualTo("4 Safety requirements");
  }

  @Test
  @DisplayName("should weigh bold ratio by trimmed characters")
  void shouldComputeBoldRatio() {
    Line line =
        new Line(
            1,
            0.0f,
            List.of(fragment(0.0f, 10.0f, " 4.1 ", true), fragment(20.0f, 30.0f, "General", false)),
            1.5f);

    assertThat(line.boldRatio()).isCloseTo(3.0 / 10.0, within(1e-9));
  }

  @Test
  @DisplayName("should report zero signals for an empty line")
  void shouldReturnZero_forEmptyLine() {
    Line line = new Line(1, 0.0f, List.of(), 1.5f);

    assertThat(line.maxFontSize()).isZero();
    assertThat(line.boldRatio()).isZero();
    assertThat(line.cleanedText()).isEmpty();
  }

  @Test
  @DisplayName("should take the largest fragment font size")
  void shouldReturnMaxFontSize() {
    Line line =
        new Line(
            1,
            0.0f,
            List.of(
                new TextFragment(1, 0.0f, 0.0f, 10.0f, "4", 16.0f, true),
                new TextFragment(1, 0.0f, 20.0f, 10.0f, "x", 9.0f, false)),
            1.5f);

    assertThat(line.maxFontSize()).isEqualTo(16.0f);
  }
}
