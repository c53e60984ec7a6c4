package com.flamingo.ai.curriculum.service.importer;

import com.flamingo.ai.curriculum.service.outline.model.SubjectKey;

/**
 * One subject to import.
 *
 * @param displayName optional; the subject code is used when blank and the subject is new
 * @param sourceUri {@code http(s)} URL, {@code file:} URI or local path of the specification
 * @param dryRun parse and report without touching the store
 */
public record ImportRequest(SubjectKey key, String displayName, String sourceUri, boolean dryRun) {}
