package com.flamingo.ai.roadmap.exception;

import java.util.List;

/** Exception thrown when an assembled roadmap breaks a structural invariant. */
public class RoadmapValidationException extends RuntimeException {

  private final List<String> violations;

  public RoadmapValidationException(List<String> violations) {
    super("Roadmap failed validation: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
