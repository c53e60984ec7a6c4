package com.flamingo.ai.curriculum.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.curriculum.exception.SourceDocumentException;
import com.flamingo.ai.curriculum.exception.StoreWriteException;
import com.flamingo.ai.curriculum.exception.StructuralParseException;
import com.flamingo.ai.curriculum.service.importer.BatchImportService;
import com.flamingo.ai.curriculum.service.importer.CurriculumImportService;
import com.flamingo.ai.curriculum.service.importer.ImportReport;
import com.flamingo.ai.curriculum.service.importer.ImportRequest;
import com.flamingo.ai.curriculum.service.importer.ImportStatus;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Imports one subject, or a batch from a manifest, and prints the per-level node breakdown.
 *
 * <p>Exit codes: 0 success, 1 source or parse failure, 2 guard abort, 3 store failure, 64 invalid
 * usage. A batch exits with the highest code of its subjects.
 */
@Component
@CommandLine.Command(
    name = "curriculum-outline",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = OutlineCommand.EXIT_USAGE,
    description = "Recover a curriculum topic tree from a specification and store it")
@Slf4j
public class OutlineCommand implements Callable<Integer> {

  public static final int EXIT_OK = 0;
  public static final int EXIT_PARSE_FAILURE = 1;
  public static final int EXIT_GUARD_ABORTED = 2;
  public static final int EXIT_STORE_FAILURE = 3;
  public static final int EXIT_USAGE = 64;

  private final CurriculumImportService curriculumImportService;
  private final BatchImportService batchImportService;
  private final ObjectMapper objectMapper;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = "--board", description = "Exam board, e.g. AQA", paramLabel = "BOARD")
  private String board;

  @CommandLine.Option(
      names = "--qualification",
      description = "Qualification, e.g. GCSE",
      paramLabel = "QUALIFICATION")
  private String qualification;

  @CommandLine.Option(
      names = "--subject-code",
      description = "Board subject code, e.g. 8461",
      paramLabel = "CODE")
  private String subjectCode;

  @CommandLine.Option(names = "--name", description = "Subject display name", paramLabel = "NAME")
  private String displayName;

  @CommandLine.Option(
      names = "--source",
      description = "Specification URL, file: URI or path",
      paramLabel = "URI")
  private String source;

  @CommandLine.Option(
      names = "--profile",
      description = "Subject profile overriding the outline settings (application-<profile>.yml)",
      paramLabel = "PROFILE")
  private String profile;

  @CommandLine.Option(names = "--dry-run", description = "Parse and report without storing")
  private boolean dryRun;

  @CommandLine.Option(
      names = "--manifest",
      description = "JSON file listing several subjects to import concurrently",
      paramLabel = "FILE")
  private Path manifest;

  public OutlineCommand(
      CurriculumImportService curriculumImportService,
      BatchImportService batchImportService,
      ObjectMapper objectMapper) {
    this.curriculumImportService = curriculumImportService;
    this.batchImportService = batchImportService;
    this.objectMapper = objectMapper;
  }

  @Override
  public Integer call() {
    if (manifest != null) {
      return runBatch();
    }
    if (isBlank(board) || isBlank(qualification) || isBlank(subjectCode) || isBlank(source)) {
      throw new CommandLine.ParameterException(
          spec.commandLine(),
          "--board, --qualification, --subject-code and --source are required without --manifest");
    }
    if (profile != null) {
      log.info("Using outline profile '{}'", profile);
    }
    ImportRequest request =
        new ImportRequest(
            new SubjectKey(board, qualification, subjectCode), displayName, source, dryRun);
    return runSingle(request);
  }

  private int runSingle(ImportRequest request) {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    try {
      ImportReport report = curriculumImportService.importSubject(request);
      print(report, out, err);
      return exitCode(report);
    } catch (SourceDocumentException | StructuralParseException e) {
      err.printf("%s aborted: %s%n", request.key(), e.getMessage());
      return EXIT_PARSE_FAILURE;
    } catch (StoreWriteException e) {
      err.printf("%s failed while storing: %s%n", request.key(), e.getUserMessage());
      return EXIT_STORE_FAILURE;
    }
  }

  private int runBatch() {
    ImportManifest parsed;
    try {
      parsed = objectMapper.readValue(manifest.toFile(), ImportManifest.class);
    } catch (IOException e) {
      throw new CommandLine.ParameterException(
          spec.commandLine(),
          "Cannot read manifest " + manifest + ": " + e.getMessage(),
          e,
          null,
          null);
    }
    List<ImportReport> reports = batchImportService.importAll(parsed.toRequests(dryRun));
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    int worst = EXIT_OK;
    for (ImportReport report : reports) {
      print(report, out, err);
      worst = Math.max(worst, exitCode(report));
    }
    out.printf("%d subject(s), exit code %d%n", reports.size(), worst);
    return worst;
  }

  static int exitCode(ImportReport report) {
    return switch (report.getStatus()) {
      case SYNCED, DRY_RUN -> EXIT_OK;
      case GUARD_ABORTED -> EXIT_GUARD_ABORTED;
      case FAILED -> report.getFailure() instanceof StoreWriteException
          ? EXIT_STORE_FAILURE
          : EXIT_PARSE_FAILURE;
    };
  }

  private static void print(ImportReport report, PrintWriter out, PrintWriter err) {
    if (!report.isSuccessful()) {
      err.printf(
          "%s %s: %s%n",
          report.getSubject(),
          report.getStatus() == ImportStatus.GUARD_ABORTED ? "aborted" : "failed",
          report.getMessage());
      return;
    }
    out.printf(
        "%s %s: %d node(s)%n",
        report.getSubject(),
        report.getStatus() == ImportStatus.DRY_RUN ? "parsed (dry run)" : "synced",
        report.getNodeCount());
    for (Map.Entry<Integer, Long> level : report.getLevelCounts().entrySet()) {
      out.printf("  level %d: %d%n", level.getKey(), level.getValue());
    }
    if (report.getTablesSkipped() > 0) {
      out.printf("  %d table(s) skipped, no column boundaries%n", report.getTablesSkipped());
    }
    if (report.isLowConfidenceColumns()) {
      out.println("  columns guessed from keywords, check the table content");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
