package com.flamingo.ai.curriculum.api.rest;

import com.flamingo.ai.curriculum.api.dto.request.ImportSubjectRequest;
import com.flamingo.ai.curriculum.api.dto.response.SubjectResponse;
import com.flamingo.ai.curriculum.api.dto.response.TopicResponse;
import com.flamingo.ai.curriculum.service.importer.CurriculumImportService;
import com.flamingo.ai.curriculum.service.importer.ImportReport;
import com.flamingo.ai.curriculum.service.importer.ImportStatus;
import com.flamingo.ai.curriculum.service.subject.SubjectService;
import com.flamingo.ai.curriculum.service.subject.TopicService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.SortedMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for subjects and their topic trees. */
@RestController
@RequestMapping("/api/subjects")
@RequiredArgsConstructor
public class SubjectController {

  private final SubjectService subjectService;
  private final TopicService topicService;
  private final CurriculumImportService curriculumImportService;

  /** Lists all subjects. */
  @GetMapping
  public ResponseEntity<List<SubjectResponse>> listSubjects() {
    return ResponseEntity.ok(
        subjectService.listSubjects().stream().map(SubjectResponse::fromEntity).toList());
  }

  /** Gets a subject by ID. */
  @GetMapping("/{subjectId}")
  public ResponseEntity<SubjectResponse> getSubject(@PathVariable UUID subjectId) {
    return ResponseEntity.ok(SubjectResponse.fromEntity(subjectService.getSubject(subjectId)));
  }

  /** Gets a subject's whole tree in document order. */
  @GetMapping("/{subjectId}/topics")
  public ResponseEntity<List<TopicResponse>> getTopics(@PathVariable UUID subjectId) {
    return ResponseEntity.ok(TopicResponse.fromTree(topicService.getTopics(subjectId)));
  }

  /** Gets a subject's root topics. */
  @GetMapping("/{subjectId}/topics/roots")
  public ResponseEntity<List<TopicResponse>> getRootTopics(@PathVariable UUID subjectId) {
    return ResponseEntity.ok(
        topicService.getRootTopics(subjectId).stream().map(TopicResponse::fromEntity).toList());
  }

  /** Gets the stored node count per level. */
  @GetMapping("/{subjectId}/topics/levels")
  public ResponseEntity<SortedMap<Integer, Long>> getLevelCounts(@PathVariable UUID subjectId) {
    return ResponseEntity.ok(topicService.getLevelCounts(subjectId));
  }

  /** Imports one subject; a guard abort answers 409 with the report. */
  @PostMapping("/import")
  public ResponseEntity<ImportReport> importSubject(
      @Valid @RequestBody ImportSubjectRequest request) {
    ImportReport report = curriculumImportService.importSubject(request.toImportRequest());
    HttpStatus status =
        report.getStatus() == ImportStatus.GUARD_ABORTED ? HttpStatus.CONFLICT : HttpStatus.OK;
    return ResponseEntity.status(status).body(report);
  }
}
