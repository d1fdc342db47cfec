package com.flamingo.ai.roadmap.testsupport;

import com.flamingo.ai.roadmap.domain.enums.TaskType;
import com.flamingo.ai.roadmap.domain.enums.WeekOrigin;
import com.flamingo.ai.roadmap.domain.model.LearningResource;
import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapTask;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Shared builders for roadmap tests. */
public final class RoadmapFixtures {

  private RoadmapFixtures() {}

  public static RoleContext backendDeveloper() {
    return RoleContext.builder()
        .targetRole("Backend Developer")
        .experienceLevel("beginner")
        .learningStyle("hands-on")
        .dailyMinutes(60)
        .missingSkills(List.of("Java", "SQL", "REST APIs", "Docker"))
        .skillsToImprove(List.of("Git"))
        .readinessPercent(35)
        .build();
  }

  public static RoadmapTask task(String title, TaskType type, int difficulty) {
    return new RoadmapTask(
        title,
        "Description of " + title,
        type,
        30,
        difficulty,
        List.of("Understand " + title),
        "You can explain " + title,
        Set.of(),
        List.of(new LearningResource("Docs", "https://example.org/docs", "documentation")));
  }

  public static RoadmapWeek week(int weekNumber, int days, int tasksPerDay) {
    List<RoadmapDay> dayList = new ArrayList<>();
    for (int d = 1; d <= days; d++) {
      List<RoadmapTask> tasks = new ArrayList<>();
      for (int t = 1; t <= tasksPerDay; t++) {
        tasks.add(task("W" + weekNumber + "D" + d + "T" + t, TaskType.PRACTICE, 2));
      }
      dayList.add(new RoadmapDay(d, tasks));
    }
    return new RoadmapWeek(
        weekNumber,
        "Focus " + weekNumber,
        List.of("Objective " + weekNumber),
        dayList,
        WeekOrigin.GENERATED);
  }

  /** Valid provider reply for the given weeks, two days with two tasks each. */
  public static String batchJson(int startWeek, int endWeek) {
    StringBuilder weeks = new StringBuilder();
    for (int w = startWeek; w <= endWeek; w++) {
      if (w > startWeek) {
        weeks.append(",");
      }
      weeks.append(weekJson(w));
    }
    return "{\"roadmap_title\":\"Backend Journey\",\"description\":\"Learn the backend\","
        + "\"weeks\":["
        + weeks
        + "],\"milestones\":[{\"week_number\":"
        + endWeek
        + ",\"title\":\"API project\",\"description\":\"Build an API\","
        + "\"skills_demonstrated\":[\"Java\"],\"deliverable\":\"Repository\"}]}";
  }

  public static String weekJson(int weekNumber) {
    return "{\"week_number\":"
        + weekNumber
        + ",\"focus_area\":\"Topic "
        + weekNumber
        + "\",\"learning_objectives\":[\"Objective\"],\"days\":["
        + dayJson(1, weekNumber)
        + ","
        + dayJson(2, weekNumber)
        + "]}";
  }

  private static String dayJson(int dayNumber, int weekNumber) {
    return "{\"day_number\":"
        + dayNumber
        + ",\"tasks\":["
        + taskJson("Read chapter " + weekNumber + "." + dayNumber, "reading", 2)
        + ","
        + taskJson("Exercise " + weekNumber + "." + dayNumber, "practice", 3)
        + "]}";
  }

  private static String taskJson(String title, String type, int difficulty) {
    return "{\"title\":\""
        + title
        + "\",\"description\":\"Do it\",\"task_type\":\""
        + type
        + "\",\"estimated_duration\":30,\"difficulty\":"
        + difficulty
        + ",\"learning_objectives\":[\"Learn\"],\"success_criteria\":\"Done\","
        + "\"prerequisites\":[],\"resources\":[{\"title\":\"Docs\","
        + "\"url\":\"https://example.org\",\"type\":\"documentation\"}]}";
  }
}
