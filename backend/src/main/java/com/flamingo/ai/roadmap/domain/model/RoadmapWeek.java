package com.flamingo.ai.roadmap.domain.model;

import com.flamingo.ai.roadmap.domain.enums.WeekOrigin;
import java.util.List;

/** One week of the roadmap. Week numbers are 1-based and unique within a roadmap. */
public record RoadmapWeek(
    int weekNumber,
    String focusArea,
    List<String> learningObjectives,
    List<RoadmapDay> days,
    WeekOrigin origin) {

  public RoadmapWeek {
    learningObjectives = learningObjectives == null ? List.of() : List.copyOf(learningObjectives);
    days = days == null ? List.of() : List.copyOf(days);
  }

  public int taskCount() {
    return days.stream().mapToInt(day -> day.tasks().size()).sum();
  }

  public int totalMinutes() {
    return days.stream().mapToInt(RoadmapDay::totalMinutes).sum();
  }

  public boolean isGenerated() {
    return origin == WeekOrigin.GENERATED;
  }
}
