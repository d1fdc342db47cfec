package com.flamingo.ai.roadmap.service.generation.context;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapTask;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the sliding context window from the weeks of the previous batch.
 *
 * <p>Only the last week is looked at, and within it only the last {@code tailDays} days. Task
 * titles and descriptions are dropped down to a truncated title so the window stays small no
 * matter how long the roadmap grows.
 */
@Component
@RequiredArgsConstructor
public class ContextWindowExtractor {

  private static final String ELLIPSIS = "...";

  private final RoadmapConfig roadmapConfig;

  public ContextWindow extract(List<RoadmapWeek> previousWeeks) {
    if (previousWeeks == null || previousWeeks.isEmpty()) {
      return ContextWindow.empty();
    }

    RoadmapConfig.Context settings = roadmapConfig.getContext();
    RoadmapWeek lastWeek = previousWeeks.get(previousWeeks.size() - 1);
    List<RoadmapDay> days = lastWeek.days();
    int from = Math.max(0, days.size() - Math.max(0, settings.getTailDays()));

    List<RoadmapDay> tail =
        days.subList(from, days.size()).stream()
            .map(day -> compact(day, settings))
            .toList();

    return new ContextWindow(
        lastWeek.weekNumber(), truncate(lastWeek.focusArea(), settings.getMaxTitleChars()), tail);
  }

  private RoadmapDay compact(RoadmapDay day, RoadmapConfig.Context settings) {
    List<RoadmapTask> tasks =
        day.tasks().stream()
            .limit(Math.max(0, settings.getMaxTasksPerDay()))
            .map(task -> summarize(task, settings.getMaxTitleChars()))
            .toList();
    return new RoadmapDay(day.dayNumber(), tasks);
  }

  private RoadmapTask summarize(RoadmapTask task, int maxTitleChars) {
    return new RoadmapTask(
        truncate(task.title(), maxTitleChars),
        "",
        task.type(),
        task.estimatedMinutes(),
        task.difficulty(),
        List.of(),
        "",
        null,
        List.of());
  }

  private String truncate(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    if (text.length() <= maxLength) {
      return text;
    }
    if (maxLength <= ELLIPSIS.length()) {
      return text.substring(0, Math.max(0, maxLength));
    }
    return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
  }
}
