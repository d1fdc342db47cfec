package com.flamingo.ai.roadmap.domain.model;

import com.flamingo.ai.roadmap.domain.enums.RoadmapStatus;
import java.util.List;

/**
 * A finished, read-only learning roadmap. Instances are only created once assembly has left the
 * {@link RoadmapStatus#ASSEMBLING} state.
 */
public record Roadmap(
    String title,
    String description,
    String targetRole,
    int totalWeeks,
    List<RoadmapWeek> weeks,
    List<Milestone> milestones,
    RoadmapStatus status,
    double completionFraction,
    List<BatchReport> batchReports,
    RoadmapMetadata metadata) {

  public Roadmap {
    weeks = List.copyOf(weeks);
    milestones = milestones == null ? List.of() : List.copyOf(milestones);
    batchReports = batchReports == null ? List.of() : List.copyOf(batchReports);
  }

  public boolean isDegraded() {
    return status == RoadmapStatus.PARTIALLY_DEGRADED;
  }
}
