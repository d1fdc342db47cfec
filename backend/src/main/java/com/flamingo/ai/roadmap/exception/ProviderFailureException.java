package com.flamingo.ai.roadmap.exception;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;

/** Exception thrown when a call to the generative provider fails. */
public class ProviderFailureException extends RuntimeException {

  private final ProviderFailureKind kind;
  private final String userMessage;

  public ProviderFailureException(ProviderFailureKind kind, String message) {
    super(message);
    this.kind = kind;
    this.userMessage = userMessageFor(kind);
  }

  public ProviderFailureException(ProviderFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = userMessageFor(kind);
  }

  public ProviderFailureKind getKind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String userMessageFor(ProviderFailureKind kind) {
    return switch (kind) {
      case RATE_LIMITED -> "Service is temporarily busy. Please try again in a moment.";
      case QUOTA_EXHAUSTED -> "AI service quota is exhausted. Please contact support.";
      case AUTH_FAILURE -> "AI service is not configured correctly.";
      case TRANSIENT -> "AI service is temporarily unavailable. Please try again later.";
    };
  }
}
