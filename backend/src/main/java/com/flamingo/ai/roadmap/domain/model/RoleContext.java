package com.flamingo.ai.roadmap.domain.model;

import com.flamingo.ai.roadmap.domain.enums.Intensity;
import java.util.List;
import lombok.Builder;

/**
 * Profile and skill-gap summary the roadmap is generated for. Built by the caller from the user
 * profile and the skill analysis.
 *
 * @param targetRole career goal, e.g. "Backend Developer"
 * @param experienceLevel beginner / intermediate / advanced
 * @param learningStyle preferred style, e.g. "hands-on" or "mixed"
 * @param dailyMinutes time budget per study day, derived from {@code intensity} when not positive
 * @param intensity low / medium / high, only consulted when the profile sets no daily budget
 * @param missingSkills skills the user does not have yet, most important first
 * @param skillsToImprove skills the user has at a low level
 * @param readinessPercent overall readiness for the role, 0-100
 */
@Builder(toBuilder = true)
public record RoleContext(
    String targetRole,
    String experienceLevel,
    String learningStyle,
    int dailyMinutes,
    String intensity,
    List<String> missingSkills,
    List<String> skillsToImprove,
    int readinessPercent) {

  public static final int DEFAULT_DAILY_MINUTES = Intensity.MEDIUM.dailyMinutes();

  public RoleContext {
    experienceLevel =
        experienceLevel == null || experienceLevel.isBlank() ? "beginner" : experienceLevel;
    learningStyle = learningStyle == null || learningStyle.isBlank() ? "mixed" : learningStyle;
    dailyMinutes = dailyMinutes > 0 ? dailyMinutes : Intensity.fromString(intensity).dailyMinutes();
    missingSkills = missingSkills == null ? List.of() : List.copyOf(missingSkills);
    skillsToImprove = skillsToImprove == null ? List.of() : List.copyOf(skillsToImprove);
    readinessPercent = Math.max(0, Math.min(100, readinessPercent));
  }

  public boolean hasTargetRole() {
    return targetRole != null && !targetRole.isBlank() && !"none".equalsIgnoreCase(targetRole);
  }
}
