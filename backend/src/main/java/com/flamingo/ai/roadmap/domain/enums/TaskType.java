package com.flamingo.ai.roadmap.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Kind of work a roadmap task asks for. */
public enum TaskType {
  READING,
  PRACTICE,
  PROJECT,
  REVIEW;

  /**
   * Resolves a provider-supplied task type, accepting the legacy labels ("coding", "video",
   * "quiz") used by earlier prompt versions.
   *
   * @param raw label as written by the model, may be null
   * @return the matching type, or empty when the label is unknown
   */
  public static Optional<TaskType> fromLabel(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String label = raw.trim().toLowerCase(Locale.ROOT);
    return switch (label) {
      case "reading", "read", "video", "documentation", "article" -> Optional.of(READING);
      case "practice", "coding", "exercise", "hands-on" -> Optional.of(PRACTICE);
      case "project", "mini-project" -> Optional.of(PROJECT);
      case "review", "quiz", "recap" -> Optional.of(REVIEW);
      default -> Optional.empty();
    };
  }

  /** Lower-case label used on the wire. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
