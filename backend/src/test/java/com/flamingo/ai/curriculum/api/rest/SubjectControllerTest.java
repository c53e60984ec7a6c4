package com.flamingo.ai.curriculum.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.curriculum.domain.entity.Subject;
import com.flamingo.ai.curriculum.domain.entity.TopicNode;
import com.flamingo.ai.curriculum.exception.ApiError;
import com.flamingo.ai.curriculum.exception.GlobalExceptionHandler;
import com.flamingo.ai.curriculum.exception.StructuralParseException;
import com.flamingo.ai.curriculum.exception.SubjectNotFoundException;
import com.flamingo.ai.curriculum.exception.TopicNotFoundException;
import com.flamingo.ai.curriculum.service.importer.CurriculumImportService;
import com.flamingo.ai.curriculum.service.importer.ImportReport;
import com.flamingo.ai.curriculum.service.importer.ImportStatus;
import com.flamingo.ai.curriculum.service.subject.SubjectService;
import com.flamingo.ai.curriculum.service.subject.TopicService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.TreeMap;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SubjectControllerTest {

  private static final String IMPORT_BODY =
      """
      {"examBoard": "AQA", "qualification": "GCSE", "subjectCode": "8461",
       "displayName": "Biology", "sourceUri": "file:/specs/biology.pdf"}
      """;

  @Mock private SubjectService subjectService;
  @Mock private TopicService topicService;
  @Mock private CurriculumImportService curriculumImportService;

  private MockMvc mockMvc;
  private UUID subjectId;
  private Subject subject;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SubjectController(subjectService, topicService, curriculumImportService),
                new TopicController(topicService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    subjectId = UUID.randomUUID();
    subject =
        Subject.builder()
            .id(subjectId)
            .examBoard("AQA")
            .qualification("GCSE")
            .subjectCode("8461")
            .displayName("Biology")
            .nodeCount(2)
            .build();
  }

  private static TopicNode node(UUID id, String code, int level, UUID parentId) {
    return TopicNode.builder()
        .id(id)
        .code(code)
        .title("Title " + code)
        .level(level)
        .parentId(parentId)
        .build();
  }

  private static ImportReport report(ImportStatus status, String message) {
    return ImportReport.builder()
        .subject("AQA/GCSE/8461")
        .status(status)
        .levelCounts(new TreeMap<>())
        .nodeCount(5)
        .message(message)
        .build();
  }

  @Nested
  class Reading {

    @Test
    void shouldListSubjects() throws Exception {
      when(subjectService.listSubjects()).thenReturn(List.of(subject));

      mockMvc
          .perform(get("/api/subjects"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].subjectCode").value("8461"))
          .andExpect(jsonPath("$[0].nodeCount").value(2));
    }

    @Test
    void shouldAnswer404_forUnknownSubject() throws Exception {
      when(subjectService.getSubject(subjectId))
          .thenThrow(new SubjectNotFoundException(subjectId));

      mockMvc
          .perform(get("/api/subjects/{id}", subjectId))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value(ApiError.SUBJECT_NOT_FOUND));
    }

    @Test
    void shouldResolveParentCodes_inFlatTree() throws Exception {
      UUID rootId = UUID.randomUUID();
      when(topicService.getTopics(subjectId))
          .thenReturn(
              List.of(node(rootId, "1_1", 0, null), node(UUID.randomUUID(), "1_1_1", 1, rootId)));

      mockMvc
          .perform(get("/api/subjects/{id}/topics", subjectId))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].parentCode").doesNotExist())
          .andExpect(jsonPath("$[1].code").value("1_1_1"))
          .andExpect(jsonPath("$[1].parentCode").value("1_1"))
          .andExpect(jsonPath("$[1].level").value(1));
    }

    @Test
    void shouldListChildrenOfTopic() throws Exception {
      UUID parentId = UUID.randomUUID();
      when(topicService.getChildren(parentId))
          .thenReturn(List.of(node(UUID.randomUUID(), "1_1_b01", 1, parentId)));

      mockMvc
          .perform(get("/api/topics/{id}/children", parentId))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].code").value("1_1_b01"))
          .andExpect(jsonPath("$[0].parentId").value(parentId.toString()));
    }

    @Test
    void shouldAnswer404_forUnknownTopic() throws Exception {
      UUID topicId = UUID.randomUUID();
      when(topicService.getChildren(topicId)).thenThrow(new TopicNotFoundException(topicId));

      mockMvc
          .perform(get("/api/topics/{id}/children", topicId))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value(ApiError.TOPIC_NOT_FOUND));
    }
  }

  @Nested
  class Importing {

    @Test
    void shouldReturnReport_onSuccess() throws Exception {
      when(curriculumImportService.importSubject(any()))
          .thenReturn(report(ImportStatus.SYNCED, "Replaced 0 node(s) with 5"));

      mockMvc
          .perform(
              post("/api/subjects/import")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(IMPORT_BODY))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("SYNCED"))
          .andExpect(jsonPath("$.nodeCount").value(5))
          .andExpect(jsonPath("$.failure").doesNotExist());
    }

    @Test
    void shouldAnswer409_onGuardAbort() throws Exception {
      when(curriculumImportService.importSubject(any()))
          .thenReturn(report(ImportStatus.GUARD_ABORTED, "parsed tree is empty"));

      mockMvc
          .perform(
              post("/api/subjects/import")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(IMPORT_BODY))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.message").value("parsed tree is empty"));
    }

    @Test
    void shouldAnswer422_onStructuralFailure() throws Exception {
      when(curriculumImportService.importSubject(any()))
          .thenThrow(new StructuralParseException(List.of("duplicate code 1_1")));

      mockMvc
          .perform(
              post("/api/subjects/import")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(IMPORT_BODY))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value(ApiError.OUTLINE_INVALID))
          .andExpect(jsonPath("$.details").value("duplicate code 1_1"));
    }

    @Test
    void shouldAnswer400_whenKeyIsMissing() throws Exception {
      mockMvc
          .perform(
              post("/api/subjects/import")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"examBoard\": \"AQA\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
      verify(curriculumImportService, never()).importSubject(any());
    }
  }
}
