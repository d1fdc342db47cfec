package com.flamingo.ai.roadmap.domain.model;

import com.flamingo.ai.roadmap.domain.enums.TaskType;
import java.util.List;
import java.util.Set;

/**
 * A single task inside a roadmap day.
 *
 * @param title short task title, never blank
 * @param description what to do and why
 * @param type kind of work
 * @param estimatedMinutes positive time estimate
 * @param difficulty 1 (easiest) to 5
 * @param learningObjectives what the learner should be able to do afterwards
 * @param successCriteria how the learner knows the task is done
 * @param prerequisites titles of tasks or skills required first
 * @param resources at most three references
 */
public record RoadmapTask(
    String title,
    String description,
    TaskType type,
    int estimatedMinutes,
    int difficulty,
    List<String> learningObjectives,
    String successCriteria,
    Set<String> prerequisites,
    List<LearningResource> resources) {

  public static final int MIN_DIFFICULTY = 1;
  public static final int MAX_DIFFICULTY = 5;
  public static final int MAX_RESOURCES = 3;

  public RoadmapTask {
    learningObjectives = learningObjectives == null ? List.of() : List.copyOf(learningObjectives);
    prerequisites = prerequisites == null ? Set.of() : Set.copyOf(prerequisites);
    resources = resources == null ? List.of() : List.copyOf(resources);
  }

  /** True when every field-level constraint holds. */
  public boolean isValid() {
    return title != null
        && !title.isBlank()
        && type != null
        && estimatedMinutes > 0
        && difficulty >= MIN_DIFFICULTY
        && difficulty <= MAX_DIFFICULTY
        && resources.size() <= MAX_RESOURCES;
  }
}
