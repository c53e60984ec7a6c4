package com.flamingo.ai.curriculum.service.subject;

/** Descriptive subject fields that are refreshed on every upsert. */
public record SubjectDetails(String displayName, String sourceUri) {}
