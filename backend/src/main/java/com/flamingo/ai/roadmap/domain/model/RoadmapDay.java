package com.flamingo.ai.roadmap.domain.model;

import java.util.List;

/** One study day within a week. */
public record RoadmapDay(int dayNumber, List<RoadmapTask> tasks) {

  public RoadmapDay {
    tasks = tasks == null ? List.of() : List.copyOf(tasks);
  }

  public int totalMinutes() {
    return tasks.stream().mapToInt(RoadmapTask::estimatedMinutes).sum();
  }
}
