package com.flamingo.ai.clauses.cli;

import com.flamingo.ai.clauses.config.ExtractionSettings;
import com.flamingo.ai.clauses.exception.ClauseExtractionException;
import com.flamingo.ai.clauses.service.export.ClauseJsonWriter;
import com.flamingo.ai.clauses.service.export.ClauseTableProjector;
import com.flamingo.ai.clauses.service.export.ClauseWorkbookWriter;
import com.flamingo.ai.clauses.service.extraction.ClauseExtractionService;
import com.flamingo.ai.clauses.service.extraction.ClauseExtractionServiceImpl;
import com.flamingo.ai.clauses.service.extraction.ExtractionResult;
import com.flamingo.ai.clauses.service.layout.LineAssembler;
import com.flamingo.ai.clauses.service.layout.PdfBoxLayoutExtractor;
import com.flamingo.ai.clauses.service.structure.ClauseTreeBuilder;
import com.flamingo.ai.clauses.service.structure.HeadingDetector;
import com.flamingo.ai.clauses.service.structure.NoiseFilter;
import com.flamingo.ai.clauses.service.structure.TextReconstructor;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Command-line front end: splits a standards PDF into {@code clauses.json} and {@code
 * clauses.xlsx}.
 *
 * <pre>
 * clause-extractor &lt;pdf&gt; [--output-dir &lt;dir&gt;]
 * </pre>
 *
 * <p>Exits with 0 on success and 1 on any failure, with the reason on standard error.
 */
@Slf4j
public class ClauseExtractorCli {

  static final String JSON_FILE = "clauses.json";
  static final String WORKBOOK_FILE = "clauses.xlsx";
  static final String DEFAULT_OUTPUT_DIR = "output";

  private static final String OUTPUT_DIR_OPTION = "--output-dir";
  private static final String USAGE =
      "usage: clause-extractor <pdf> [" + OUTPUT_DIR_OPTION + " <dir>]";

  private final ClauseExtractionService extractionService;
  private final ClauseJsonWriter jsonWriter;
  private final ClauseWorkbookWriter workbookWriter;

  public ClauseExtractorCli(
      ClauseExtractionService extractionService,
      ClauseJsonWriter jsonWriter,
      ClauseWorkbookWriter workbookWriter) {
    this.extractionService = extractionService;
    this.jsonWriter = jsonWriter;
    this.workbookWriter = workbookWriter;
  }

  /** Wires the pipeline with the default tuning, without a Spring context. */
  public static ClauseExtractorCli withDefaults() {
    ExtractionSettings settings = ExtractionSettings.defaults();
    ClauseExtractionService service =
        new ClauseExtractionServiceImpl(
            new PdfBoxLayoutExtractor(settings),
            new LineAssembler(settings),
            new HeadingDetector(settings),
            new ClauseTreeBuilder(settings, new NoiseFilter(settings), new TextReconstructor()),
            new ClauseTableProjector());
    return new ClauseExtractorCli(service, new ClauseJsonWriter(), new ClauseWorkbookWriter());
  }

  public static void main(String[] args) {
    System.exit(withDefaults().run(args, System.out, System.err));
  }

  /**
   * Runs one extraction.
   *
   * @return the process exit code
   */
  public int run(String[] args, PrintStream out, PrintStream err) {
    Arguments arguments;
    try {
      arguments = Arguments.parse(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 1;
    }
    if (arguments.help()) {
      out.println(USAGE);
      return 0;
    }

    Path pdf = arguments.pdf().toAbsolutePath().normalize();
    Path outputDir = arguments.outputDir().toAbsolutePath().normalize();
    try {
      Files.createDirectories(outputDir);
      ExtractionResult result = extractionService.extract(pdf);

      Path jsonPath = outputDir.resolve(JSON_FILE);
      jsonWriter.write(result.clauses(), jsonPath);
      Path workbookPath = outputDir.resolve(WORKBOOK_FILE);
      workbookWriter.write(result.rows(), workbookPath);

      out.println("Wrote JSON: " + jsonPath);
      out.println("Wrote Excel: " + workbookPath);
      return 0;
    } catch (ClauseExtractionException e) {
      log.debug("Extraction of {} failed", pdf, e);
      err.println(e.getUserMessage());
      return 1;
    } catch (IOException | UncheckedIOException e) {
      log.error("Failed to write outputs to {}: {}", outputDir, e.getMessage());
      err.println("Failed to write outputs: " + e.getMessage());
      return 1;
    }
  }

  /** Parsed command line. */
  record Arguments(Path pdf, Path outputDir, boolean help) {

    static Arguments parse(String[] args) {
      Path pdf = null;
      Path outputDir = Path.of(DEFAULT_OUTPUT_DIR);
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if ("-h".equals(arg) || "--help".equals(arg)) {
          return new Arguments(null, outputDir, true);
        } else if (OUTPUT_DIR_OPTION.equals(arg)) {
          if (i + 1 >= args.length) {
            throw new IllegalArgumentException(OUTPUT_DIR_OPTION + " expects a directory");
          }
          outputDir = Path.of(args[++i]);
        } else if (arg.startsWith(OUTPUT_DIR_OPTION + "=")) {
          outputDir = Path.of(arg.substring(OUTPUT_DIR_OPTION.length() + 1));
        } else if (arg.startsWith("--")) {
          throw new IllegalArgumentException("Unknown option: " + arg);
        } else if (pdf == null) {
          pdf = Path.of(arg);
        } else {
          throw new IllegalArgumentException("Unexpected argument: " + arg);
        }
      }
      if (pdf == null) {
        throw new IllegalArgumentException("Missing PDF path");
      }
      return new Arguments(pdf, outputDir, false);
    }
  }
}
