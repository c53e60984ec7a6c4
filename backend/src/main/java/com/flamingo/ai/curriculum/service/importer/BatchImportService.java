package com.flamingo.ai.curriculum.service.importer;

import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Imports several subjects concurrently, one independent pipeline per subject.
 *
 * <p>A failing subject is reported as {@link ImportStatus#FAILED} and does not stop the others.
 */
@Service
@Slf4j
public class BatchImportService {

  private final CurriculumImportService curriculumImportService;
  private final Executor importExecutor;

  public BatchImportService(
      CurriculumImportService curriculumImportService,
      @Qualifier("importExecutor") Executor importExecutor) {
    this.curriculumImportService = curriculumImportService;
    this.importExecutor = importExecutor;
  }

  /** Returns one report per request, in request order. */
  public List<ImportReport> importAll(List<ImportRequest> requests) {
    log.info("Starting batch import of {} subject(s)", requests.size());
    List<CompletableFuture<ImportReport>> futures =
        requests.stream()
            .map(r -> CompletableFuture.supplyAsync(() -> importOne(r), importExecutor))
            .toList();
    List<ImportReport> reports = futures.stream().map(CompletableFuture::join).toList();
    long failed = reports.stream().filter(r -> !r.isSuccessful()).count();
    log.info("Batch import finished: {} subject(s), {} not synced", reports.size(), failed);
    return reports;
  }

  private ImportReport importOne(ImportRequest request) {
    try {
      return curriculumImportService.importSubject(request);
    } catch (RuntimeException e) {
      log.error("Import of {} failed: {}", request.key(), e.getMessage(), e);
      return ImportReport.builder()
          .subject(request.key().toString())
          .status(ImportStatus.FAILED)
          .levelCounts(new TreeMap<>())
          .message(e.getMessage())
          .failure(e)
          .build();
    }
  }
}
