package com.flamingo.ai.roadmap.service.generation.fallback;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.enums.TaskType;
import com.flamingo.ai.roadmap.domain.enums.WeekOrigin;
import com.flamingo.ai.roadmap.domain.model.LearningResource;
import com.flamingo.ai.roadmap.domain.model.Milestone;
import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapTask;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Template-driven week generator used when the provider cannot produce a batch.
 *
 * <p>Output depends only on the week number and the role context, never on the provider, and every
 * task it emits passes {@link RoadmapTask#isValid()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackRoadmapBuilder {

  private static final String[][] PHASES = {
    {"Foundation & Setup", "Set up your development environment and learn the basics"},
    {"Core Concepts", "Deep dive into fundamental concepts and patterns"},
    {"Intermediate Skills", "Build on foundations with more complex topics"},
    {"Applied Learning", "Apply your skills in a practical project"}
  };

  private static final TaskType[] DAY_TYPES = {
    TaskType.READING, TaskType.READING, TaskType.PRACTICE, TaskType.PRACTICE, TaskType.PROJECT
  };

  private static final int MIN_TASK_MINUTES = 15;

  private final RoadmapConfig roadmapConfig;
  private final RoleSkillCatalog roleSkillCatalog;

  /** Builds one week per position of {@code batch}, in ascending order. */
  public List<RoadmapWeek> build(WeekBatch batch, RoleContext roleContext) {
    log.debug("Building fallback weeks for {}", batch);
    List<RoadmapWeek> weeks = new ArrayList<>(batch.requestedWeekCount());
    for (int week = batch.startWeek(); week <= batch.endWeek(); week++) {
      weeks.add(buildWeek(week, roleContext));
    }
    return weeks;
  }

  /** Builds a single templated week. */
  public RoadmapWeek buildWeek(int weekNumber, RoleContext roleContext) {
    String role = roleName(roleContext);
    List<String> weekSkills = skillsForWeek(weekNumber, roleContext);
    String[] phase = PHASES[(weekNumber - 1) % PHASES.length];
    int minutes = Math.max(MIN_TASK_MINUTES, roleContext.dailyMinutes() / 2);
    int daysPerWeek = Math.max(1, roadmapConfig.getFallback().getDaysPerWeek());

    List<RoadmapDay> days = new ArrayList<>(daysPerWeek);
    for (int day = 1; day <= daysPerWeek; day++) {
      days.add(buildDay(weekNumber, day, daysPerWeek, weekSkills, role, minutes));
    }

    return new RoadmapWeek(
        weekNumber,
        phase[0] + ": " + String.join(", ", weekSkills),
        List.of("Master " + weekSkills.get(0), phase[1]),
        days,
        WeekOrigin.FALLBACK);
  }

  /** Checkpoint placed at the last week of a fallback batch. */
  public Milestone milestoneFor(WeekBatch batch, RoleContext roleContext) {
    Set<String> skills = new LinkedHashSet<>();
    for (int week = batch.startWeek(); week <= batch.endWeek(); week++) {
      skills.addAll(skillsForWeek(week, roleContext));
    }
    return new Milestone(
        batch.endWeek(),
        "Checkpoint Project: Weeks " + batch.startWeek() + "-" + batch.endWeek(),
        "Build a small project as a " + roleName(roleContext) + " using what you practiced",
        List.copyOf(skills),
        "A working project demonstrating " + String.join(", ", skills));
  }

  private RoadmapDay buildDay(
      int week, int day, int daysPerWeek, List<String> weekSkills, String role, int minutes) {
    TaskType type = DAY_TYPES[(day - 1) % DAY_TYPES.length];
    String primary = weekSkills.get(0);
    boolean studyDay = type == TaskType.READING;
    RoadmapConfig.Fallback settings = roadmapConfig.getFallback();

    List<RoadmapTask> tasks = new ArrayList<>();
    RoadmapTask first =
        new RoadmapTask(
            (studyDay ? "Learn " : "Practice ") + primary,
            (studyDay ? "Study the fundamentals of " : "Apply your knowledge of ")
                + primary
                + " for "
                + role
                + " development",
            type,
            minutes,
            clampDifficulty(1 + week),
            List.of("Understand " + primary + " basics", "Apply " + primary + " concepts"),
            "Complete the " + primary + " exercises and understand the core concepts",
            week == 1 ? Set.of() : Set.of("Week " + (week - 1) + " completed"),
            List.of(
                new LearningResource(
                    primary + " Documentation", settings.getDocumentationUrl(), "documentation")));
    tasks.add(first);

    if (!studyDay && weekSkills.size() > 1) {
      String secondary = weekSkills.get(1);
      boolean project = type == TaskType.PROJECT;
      tasks.add(
          new RoadmapTask(
              (project ? "Mini Project: " : "Hands-on ") + secondary,
              "Build practical experience with " + secondary,
              project ? TaskType.PROJECT : TaskType.PRACTICE,
              minutes,
              clampDifficulty(2 + week / 2),
              List.of("Practice " + secondary, "Build something useful"),
              "Complete a working example using " + secondary,
              Set.of(first.title()),
              List.of(
                  new LearningResource(
                      secondary + " Tutorial", settings.getTutorialUrl(), "tutorial"))));
    }

    if (day == daysPerWeek && daysPerWeek > 1) {
      tasks.add(
          new RoadmapTask(
              "Weekly Review: " + String.join(" & ", weekSkills),
              "Revisit this week's notes and exercises, and write down open questions",
              TaskType.REVIEW,
              MIN_TASK_MINUTES,
              clampDifficulty(week),
              List.of("Consolidate week " + week),
              "You can summarize the week's topics in your own words",
              Set.of(),
              List.of()));
    }
    return new RoadmapDay(day, tasks);
  }

  private List<String> skillsForWeek(int weekNumber, RoleContext roleContext) {
    List<String> skills = roleSkillCatalog.skillsFor(roleContext);
    if (skills.size() == 1) {
      return skills;
    }
    int first = ((weekNumber - 1) * 2) % skills.size();
    int second = (first + 1) % skills.size();
    return List.of(skills.get(first), skills.get(second));
  }

  private static String roleName(RoleContext roleContext) {
    return roleContext.hasTargetRole() ? roleContext.targetRole() : "software professional";
  }

  private static int clampDifficulty(int value) {
    return Math.max(RoadmapTask.MIN_DIFFICULTY, Math.min(RoadmapTask.MAX_DIFFICULTY, value));
  }
}
