package com.flamingo.ai.curriculum.service.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.curriculum.config.OutlineConfig;
import com.flamingo.ai.curriculum.exception.SourceDocumentException;
import com.flamingo.ai.curriculum.service.outline.OutlineParser;
import com.flamingo.ai.curriculum.service.outline.model.OutlineNode;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import com.flamingo.ai.curriculum.service.source.PlainTextSourceExtractor;
import com.flamingo.ai.curriculum.service.source.SourceDocument;
import com.flamingo.ai.curriculum.service.source.SourceDocumentFetcher;
import com.flamingo.ai.curriculum.service.source.SourceExtractorRouter;
import com.flamingo.ai.curriculum.service.subject.SubjectDetails;
import com.flamingo.ai.curriculum.service.sync.SyncResult;
import com.flamingo.ai.curriculum.service.sync.SyncStatus;
import com.flamingo.ai.curriculum.service.sync.TopicTreeSynchronizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CurriculumImportServiceTest {

  private static final SubjectKey KEY = new SubjectKey("AQA", "GCSE", "8461");
  private static final String SOURCE = "file:/specs/biology.txt";
  private static final String TEXT =
      String.join(
          "\n",
          "1.1 Cells",
          "1.1.1 Structure",
          "• nucleus",
          "• mitochondria, including:",
          "o produces ATP");

  @Mock private SourceDocumentFetcher sourceDocumentFetcher;
  @Mock private TopicTreeSynchronizer topicTreeSynchronizer;

  private CurriculumImportService importService;

  @BeforeEach
  void setUp() {
    importService =
        new CurriculumImportService(
            sourceDocumentFetcher,
            new SourceExtractorRouter(List.of(new PlainTextSourceExtractor())),
            new OutlineParser(new OutlineConfig(), new SimpleMeterRegistry()),
            topicTreeSynchronizer);
  }

  private void givenSource() {
    when(sourceDocumentFetcher.fetch(SOURCE))
        .thenReturn(
            new SourceDocument(SOURCE, TEXT.getBytes(StandardCharsets.UTF_8), "text/plain"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldParseAndSynchronize() {
    givenSource();
    UUID subjectId = UUID.randomUUID();
    when(topicTreeSynchronizer.sync(eq(KEY), any(SubjectDetails.class), anyList()))
        .thenReturn(new SyncResult(SyncStatus.SYNCED, subjectId, 5, 0, 4, "Replaced 0 node(s)"));

    ImportReport report =
        importService.importSubject(new ImportRequest(KEY, "Biology", SOURCE, false));

    ArgumentCaptor<List<OutlineNode>> nodes = ArgumentCaptor.forClass(List.class);
    verify(topicTreeSynchronizer)
        .sync(eq(KEY), eq(new SubjectDetails("Biology", SOURCE)), nodes.capture());
    assertThat(nodes.getValue()).extracting(OutlineNode::code).startsWith("1_1", "1_1_1");
    assertThat(report.getStatus()).isEqualTo(ImportStatus.SYNCED);
    assertThat(report.getSubjectId()).isEqualTo(subjectId);
    assertThat(report.getNodeCount()).isEqualTo(5);
    assertThat(report.getLevelCounts()).containsEntry(2, 2L);
    assertThat(report.isSuccessful()).isTrue();
  }

  @Test
  void shouldNotTouchStore_onDryRun() {
    givenSource();

    ImportReport report =
        importService.importSubject(new ImportRequest(KEY, null, SOURCE, true));

    assertThat(report.getStatus()).isEqualTo(ImportStatus.DRY_RUN);
    assertThat(report.getNodeCount()).isEqualTo(5);
    verify(topicTreeSynchronizer, never()).sync(any(), any(), any());
  }

  @Test
  void shouldReportGuardAbort() {
    givenSource();
    when(topicTreeSynchronizer.sync(eq(KEY), any(SubjectDetails.class), anyList()))
        .thenReturn(
            new SyncResult(
                SyncStatus.GUARD_ABORTED, UUID.randomUUID(), 0, 0, 0, "minimum is 10"));

    ImportReport report =
        importService.importSubject(new ImportRequest(KEY, null, SOURCE, false));

    assertThat(report.getStatus()).isEqualTo(ImportStatus.GUARD_ABORTED);
    assertThat(report.getMessage()).isEqualTo("minimum is 10");
    assertThat(report.isSuccessful()).isFalse();
  }

  @Test
  void shouldPropagateSourceFailure_beforeSync() {
    when(sourceDocumentFetcher.fetch(SOURCE))
        .thenThrow(new SourceDocumentException(SOURCE, "No such file", "Not found"));

    assertThatThrownBy(
            () -> importService.importSubject(new ImportRequest(KEY, null, SOURCE, false)))
        .isInstanceOf(SourceDocumentException.class);
    verify(topicTreeSynchronizer, never()).sync(any(), any(), any());
  }
}
