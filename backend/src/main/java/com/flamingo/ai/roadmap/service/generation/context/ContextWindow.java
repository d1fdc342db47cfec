package com.flamingo.ai.roadmap.service.generation.context;

import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapTask;
import java.util.List;

/**
 * Read-only excerpt of the end of the previous batch, used to prime the next prompt.
 *
 * <p>Its size is bounded by the extractor settings for days, tasks per day and title length, never
 * by the size of the roadmap built so far.
 *
 * @param sourceBatchEndWeek last week of the batch the excerpt was taken from, 0 when empty
 * @param lastFocusArea focus area of that week
 * @param tailDays trailing days of that week, tasks already truncated
 */
public record ContextWindow(
    int sourceBatchEndWeek, String lastFocusArea, List<RoadmapDay> tailDays) {

  private static final ContextWindow EMPTY = new ContextWindow(0, "", List.of());

  public ContextWindow {
    lastFocusArea = lastFocusArea == null ? "" : lastFocusArea;
    tailDays = tailDays == null ? List.of() : List.copyOf(tailDays);
  }

  public static ContextWindow empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return sourceBatchEndWeek == 0 || tailDays.isEmpty();
  }

  /** Number of task entries carried by the window. */
  public int taskCount() {
    return tailDays.stream().mapToInt(day -> day.tasks().size()).sum();
  }

  /** Compact text form embedded in continuation prompts. */
  public String render() {
    if (isEmpty()) {
      return "(this is the first batch, there is no previous content)";
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Week ")
        .append(sourceBatchEndWeek)
        .append(" (")
        .append(lastFocusArea)
        .append(") ended with:\n");
    for (RoadmapDay day : tailDays) {
      sb.append("- Day ").append(day.dayNumber()).append(": ");
      List<RoadmapTask> tasks = day.tasks();
      for (int i = 0; i < tasks.size(); i++) {
        RoadmapTask task = tasks.get(i);
        if (i > 0) {
          sb.append("; ");
        }
        sb.append(task.title())
            .append(" [")
            .append(task.type().label())
            .append(", difficulty ")
            .append(task.difficulty())
            .append("]");
      }
      sb.append("\n");
    }
    return sb.toString().trim();
  }
}
