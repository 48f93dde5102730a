package com.flamingo.ai.clauses.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.clauses.support.PdfFixtures;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ClauseExtractorCli Tests")
class ClauseExtractorCliTest {

  @TempDir Path dir;

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
  private ClauseExtractorCli cli;

  @BeforeEach
  void setUp() {
    cli = ClauseExtractorCli.withDefaults();
  }

  private int run(String... args) {
    return cli.run(
        args,
        new PrintStream(outBytes, true, StandardCharsets.UTF_8),
        new PrintStream(errBytes, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return outBytes.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return errBytes.toString(StandardCharsets.UTF_8);
  }

  private Path writePdf(PdfFixtures.Builder builder) throws Exception {
    Path pdf = dir.resolve("standard.pdf");
    Files.write(pdf, builder.build());
    return pdf;
  }

  @Nested
  @DisplayName("run")
  class Run {

    @Test
    @DisplayName("should write clauses.json and clauses.xlsx and report both paths")
    void shouldWriteBothOutputs() throws Exception {
      Path pdf =
          writePdf(
              PdfFixtures.pdf()
                  .heading("1 Scope")
                  .body("This standard applies to safety systems."));
      Path outputDir = dir.resolve("out");

      int exit = run(pdf.toString(), "--output-dir", outputDir.toString());

      assertThat(exit).isZero();
      assertThat(outputDir.resolve(ClauseExtractorCli.JSON_FILE)).isRegularFile();
      assertThat(outputDir.resolve(ClauseExtractorCli.WORKBOOK_FILE)).isRegularFile();
      assertThat(Files.readString(outputDir.resolve(ClauseExtractorCli.JSON_FILE)))
          .contains("\"clause\" : \"1\"")
          .contains("Scope");
      assertThat(out()).contains("Wrote JSON: ").contains("Wrote Excel: ");
      assertThat(err()).isEmpty();
    }

    @Test
    @DisplayName("should exit with 1 when the PDF does not exist")
    void shouldFail_whenPdfMissing() {
      int exit = run(dir.resolve("nope.pdf").toString(), "--output-dir", dir.toString());

      assertThat(exit).isEqualTo(1);
      assertThat(err()).contains("PDF not found:");
      assertThat(dir.resolve(ClauseExtractorCli.JSON_FILE)).doesNotExist();
    }

    @Test
    @DisplayName("should exit with 1 and write nothing when no clauses are found")
    void shouldFail_whenNoClauses() throws Exception {
      Path pdf = writePdf(PdfFixtures.pdf().body("Only prose, nothing numbered."));
      Path outputDir = dir.resolve("out");

      int exit = run(pdf.toString(), "--output-dir=" + outputDir);

      assertThat(exit).isEqualTo(1);
      assertThat(err()).contains("No clauses were detected");
      assertThat(outputDir.resolve(ClauseExtractorCli.WORKBOOK_FILE)).doesNotExist();
    }

    @Test
    @DisplayName("should exit with 1 and print usage when the PDF argument is missing")
    void shouldFail_withoutArguments() {
      assertThat(run()).isEqualTo(1);
      assertThat(err()).contains("Missing PDF path").contains("usage:");
    }

    @Test
    @DisplayName("should print usage and exit with 0 for --help")
    void shouldPrintHelp() {
      assertThat(run("--help")).isZero();
      assertThat(out()).startsWith("usage: clause-extractor");
    }
  }

  @Nested
  @DisplayName("Arguments.parse")
  class Parse {

    @Test
    @DisplayName("should default the output directory")
    void shouldDefaultOutputDir() {
      ClauseExtractorCli.Arguments arguments =
          ClauseExtractorCli.Arguments.parse(new String[] {"a.pdf"});

      assertThat(arguments.pdf()).isEqualTo(Path.of("a.pdf"));
      assertThat(arguments.outputDir()).isEqualTo(Path.of("output"));
      assertThat(arguments.help()).isFalse();
    }

    @Test
    @DisplayName("should reject unknown options and extra arguments")
    void shouldRejectBadArguments() {
      assertThatThrownBy(() -> ClauseExtractorCli.Arguments.parse(new String[] {"a.pdf", "--x"}))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown option: --x");
      assertThatThrownBy(() -> ClauseExtractorCli.Arguments.parse(new String[] {"a.pdf", "b"}))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unexpected argument: b");
      assertThatThrownBy(
              () -> ClauseExtractorCli.Arguments.parse(new String[] {"a.pdf", "--output-dir"}))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
