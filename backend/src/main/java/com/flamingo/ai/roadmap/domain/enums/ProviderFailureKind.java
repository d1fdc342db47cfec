package com.flamingo.ai.roadmap.domain.enums;

/** Classification of a failed call to the generative provider. */
public enum ProviderFailureKind {
  /** Timeouts, connection resets, 5xx responses. */
  TRANSIENT(true, false),

  /** HTTP 429 without a quota marker. */
  RATE_LIMITED(true, false),

  /** Account has no remaining credit. */
  QUOTA_EXHAUSTED(false, true),

  /** Missing, invalid or revoked API key. */
  AUTH_FAILURE(false, true),

  /**
   * Other 4xx responses, e.g. an unknown model or a prompt over the context limit. Repeating the
   * same request cannot succeed, but the next batch sends a different one.
   */
  REQUEST_REJECTED(false, false);

  private final boolean retryable;
  private final boolean disablesSession;

  ProviderFailureKind(boolean retryable, boolean disablesSession) {
    this.retryable = retryable;
    this.disablesSession = disablesSession;
  }

  public boolean isRetryable() {
    return retryable;
  }

  /** Whether every later call on the same session would fail the same way. */
  public boolean disablesSession() {
    return disablesSession;
  }
}
