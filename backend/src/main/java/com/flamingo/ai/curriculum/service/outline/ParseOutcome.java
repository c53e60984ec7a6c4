package com.flamingo.ai.curriculum.service.outline;

import com.flamingo.ai.curriculum.service.outline.model.MaterializedTree;

/** Result of parsing one document. */
public record ParseOutcome(MaterializedTree tree, ParseStatistics statistics) {}
