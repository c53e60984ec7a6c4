package com.flamingo.ai.curriculum.cli;

import com.flamingo.ai.curriculum.service.importer.ImportRequest;
import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON batch file for {@code --manifest}.
 *
 * <pre>
 * {"dryRun": false,
 *  "subjects": [{"examBoard": "AQA", "qualification": "GCSE", "subjectCode": "8461",
 *                "displayName": "Biology", "sourceUri": "https://…/specification.pdf"}]}
 * </pre>
 */
@Data
@NoArgsConstructor
public class ImportManifest {

  private boolean dryRun;
  private List<Entry> subjects = new ArrayList<>();

  /** Converts every entry; the command line {@code --dry-run} flag forces a dry run. */
  public List<ImportRequest> toRequests(boolean forceDryRun) {
    return subjects.stream()
        .map(
            e ->
                new ImportRequest(
                    new SubjectKey(e.getExamBoard(), e.getQualification(), e.getSubjectCode()),
                    e.getDisplayName(),
                    e.getSourceUri(),
                    dryRun || forceDryRun))
        .toList();
  }

  /** One subject of the batch. */
  @Data
  @NoArgsConstructor
  public static class Entry {
    private String examBoard;
    private String qualification;
    private String subjectCode;
    private String displayName;
    private String sourceUri;
  }
}
