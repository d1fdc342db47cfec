package com.flamingo.ai.roadmap.domain.model;

import java.util.List;

/** Checkpoint deliverable attached to a specific week. */
public record Milestone(
    int weekNumber,
    String title,
    String description,
    List<String> skillsDemonstrated,
    String deliverable) {

  public Milestone {
    skillsDemonstrated = skillsDemonstrated == null ? List.of() : List.copyOf(skillsDemonstrated);
  }
}
