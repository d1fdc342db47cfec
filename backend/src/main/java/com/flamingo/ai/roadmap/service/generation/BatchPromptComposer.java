package com.flamingo.ai.roadmap.service.generation;

import com.flamingo.ai.roadmap.agent.RoadmapPromptTemplates;
import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import com.flamingo.ai.roadmap.service.generation.context.ContextWindow;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Fills {@link RoadmapPromptTemplates} for a role, a batch and the incoming context window. */
@Component
@RequiredArgsConstructor
public class BatchPromptComposer {

  private static final int MAX_LISTED_MISSING_SKILLS = 8;
  private static final int MAX_LISTED_SKILLS_TO_IMPROVE = 4;
  private static final int MAX_PROBLEM_CHARS = 300;

  private final RoadmapConfig roadmapConfig;

  public String systemPrompt(RoleContext roleContext) {
    return RoadmapPromptTemplates.SYSTEM
        .apply(Map.of("targetRole", roleContext.targetRole()))
        .text();
  }

  public String batchPrompt(
      RoleContext roleContext, WeekBatch batch, int totalWeeks, ContextWindow window) {
    RoadmapConfig.Batching batching = roadmapConfig.getBatching();
    Map<String, Object> variables = new HashMap<>();
    variables.put("targetRole", roleContext.targetRole());
    variables.put("experienceLevel", roleContext.experienceLevel());
    variables.put("learningStyle", roleContext.learningStyle());
    variables.put("dailyMinutes", roleContext.dailyMinutes());
    variables.put("minTaskMinutes", Math.max(15, roleContext.dailyMinutes() / 2));
    variables.put("readiness", roleContext.readinessPercent());
    variables.put(
        "missingSkills",
        listOrDefault(
            roleContext.missingSkills(),
            MAX_LISTED_MISSING_SKILLS,
            "Core skills for " + roleContext.targetRole()));
    variables.put(
        "skillsToImprove",
        listOrDefault(
            roleContext.skillsToImprove(), MAX_LISTED_SKILLS_TO_IMPROVE, "Foundational skills"));
    variables.put("context", window.render());
    variables.put("startWeek", batch.startWeek());
    variables.put("endWeek", batch.endWeek());
    variables.put("weekCount", batch.requestedWeekCount());
    variables.put("totalWeeks", totalWeeks);
    variables.put("daysPerWeek", batching.getDaysPerWeek());
    variables.put("minTasks", batching.getMinTasksPerDay());
    variables.put("maxTasks", batching.getMaxTasksPerDay());
    variables.put("phaseGuidance", phaseGuidance(batch, totalWeeks));
    if (batch.isFirst()) {
      variables.put(
          "headerInstruction",
          "- Also give the whole roadmap a roadmap_title and a one sentence description");
      variables.put("headerFields", "\"roadmap_title\": \"...\", \"description\": \"...\", ");
    } else {
      variables.put("headerInstruction", "- Continue directly from where the previous part ended");
      variables.put("headerFields", "");
    }
    return RoadmapPromptTemplates.BATCH.apply(variables).text();
  }

  public String repairPrompt(WeekBatch batch, String problem) {
    String detail = problem == null || problem.isBlank() ? "the JSON was not valid" : problem;
    if (detail.length() > MAX_PROBLEM_CHARS) {
      detail = detail.substring(0, MAX_PROBLEM_CHARS) + "...";
    }
    return RoadmapPromptTemplates.REPAIR
        .apply(
            Map.of(
                "startWeek", batch.startWeek(),
                "endWeek", batch.endWeek(),
                "problem", detail,
                "maxTasks", roadmapConfig.getBatching().getMaxTasksPerDay()))
        .text();
  }

  /** Position of the batch within the roadmap, mapped to the foundation-to-applied progression. */
  String phaseGuidance(WeekBatch batch, int totalWeeks) {
    double position = (double) batch.endWeek() / totalWeeks;
    if (batch.isFirst()) {
      return "Start with foundations: basic concepts, environment setup, first small exercises";
    }
    if (position <= 0.5) {
      return "Build core skills: go deeper into the fundamental technologies";
    }
    if (position < 1.0) {
      return "Intermediate level: more complex topics and small projects";
    }
    return "Applied learning: a larger project and real-world practice to finish the roadmap";
  }

  private static String listOrDefault(List<String> values, int limit, String fallback) {
    List<String> listed =
        values.stream().filter(v -> v != null && !v.isBlank()).limit(limit).toList();
    return listed.isEmpty() ? fallback : String.join(", ", listed);
  }
}
