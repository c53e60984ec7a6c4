package com.flamingo.ai.curriculum.service.importer;

import com.flamingo.ai.curriculum.service.outline.OutlineParser;
import com.flamingo.ai.curriculum.service.outline.ParseOutcome;
import com.flamingo.ai.curriculum.service.outline.model.ExtractedSource;
import com.flamingo.ai.curriculum.service.outline.model.MaterializedTree;
import com.flamingo.ai.curriculum.service.source.SourceDocument;
import com.flamingo.ai.curriculum.service.source.SourceDocumentFetcher;
import com.flamingo.ai.curriculum.service.source.SourceExtractorRouter;
import com.flamingo.ai.curriculum.service.subject.SubjectDetails;
import com.flamingo.ai.curriculum.service.sync.SyncResult;
import com.flamingo.ai.curriculum.service.sync.TopicTreeSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Imports one subject: fetch the source, extract it, parse the outline and synchronize it.
 *
 * <p>Source and structural failures propagate before the store is touched. A guard abort is a
 * normal outcome and is reported, not thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurriculumImportService {

  private final SourceDocumentFetcher sourceDocumentFetcher;
  private final SourceExtractorRouter sourceExtractorRouter;
  private final OutlineParser outlineParser;
  private final TopicTreeSynchronizer topicTreeSynchronizer;

  /**
   * Runs the import.
   *
   * @throws com.flamingo.ai.curriculum.exception.SourceDocumentException if the source is unusable
   * @throws com.flamingo.ai.curriculum.exception.StructuralParseException if the outline is invalid
   * @throws com.flamingo.ai.curriculum.exception.StoreWriteException if the replacement failed
   */
  public ImportReport importSubject(ImportRequest request) {
    log.info("Importing {} from {}", request.key(), request.sourceUri());
    SourceDocument document = sourceDocumentFetcher.fetch(request.sourceUri());
    ExtractedSource extracted =
        sourceExtractorRouter.route(document.mimeType()).extract(document);
    ParseOutcome outcome = outlineParser.parse(extracted);
    MaterializedTree tree = outcome.tree();

    ImportReport.ImportReportBuilder report =
        ImportReport.builder()
            .subject(request.key().toString())
            .levelCounts(tree.levelCounts())
            .nodeCount(tree.size())
            .tablesSkipped(outcome.statistics().getTablesSkipped())
            .lowConfidenceColumns(outcome.statistics().isLowConfidenceColumns());

    if (request.dryRun()) {
      log.info("Dry run for {}: {} node(s) parsed, store not touched", request.key(), tree.size());
      return report.status(ImportStatus.DRY_RUN).message("Dry run, nothing stored").build();
    }

    SyncResult result =
        topicTreeSynchronizer.sync(
            request.key(),
            new SubjectDetails(request.displayName(), request.sourceUri()),
            tree.nodes());
    return report
        .subjectId(result.subjectId())
        .status(result.isSynced() ? ImportStatus.SYNCED : ImportStatus.GUARD_ABORTED)
        .persisted(result.persisted())
        .deleted(result.deleted())
        .message(result.message())
        .build();
  }
}
