package com.flamingo.ai.roadmap.exception;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;

/**
 * Exception thrown when a roadmap is abandoned before any week could be generated, e.g. the
 * provider rejects the very first batch with an authentication error.
 */
public class RoadmapGenerationException extends RuntimeException {

  private final String targetRole;
  private final ProviderFailureKind failureKind;
  private final String userMessage;

  public RoadmapGenerationException(
      String targetRole, ProviderFailureKind failureKind, String message, String userMessage) {
    super(message);
    this.targetRole = targetRole;
    this.failureKind = failureKind;
    this.userMessage = userMessage;
  }

  public String getTargetRole() {
    return targetRole;
  }

  public ProviderFailureKind getFailureKind() {
    return failureKind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
