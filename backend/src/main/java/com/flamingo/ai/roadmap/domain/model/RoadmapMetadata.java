package com.flamingo.ai.roadmap.domain.model;

import java.util.List;

/** Aggregate numbers computed once a roadmap is assembled. */
public record RoadmapMetadata(
    int batchCount,
    int degradedBatchCount,
    int generatedWeeks,
    int fallbackWeeks,
    int totalTasks,
    int totalEstimatedMinutes,
    int providerAttempts,
    List<String> warnings) {

  public RoadmapMetadata {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
