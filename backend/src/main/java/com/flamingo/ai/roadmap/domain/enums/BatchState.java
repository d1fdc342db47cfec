package com.flamingo.ai.roadmap.domain.enums;

/** Per-batch generation state. */
public enum BatchState {
  PENDING,
  PROMPTING,
  PARSING,
  RETRYING,
  /** Provider output parsed and covers the batch. */
  RESOLVED,
  /** Some or all weeks of the batch came from the fallback builder. */
  DEGRADED
}
