package com.flamingo.ai.roadmap.domain.enums;

/** Lifecycle status of a roadmap under construction. */
public enum RoadmapStatus {
  /** Batches are still being generated; the roadmap is owned by the assembler. */
  ASSEMBLING,

  /** Every week came from the provider. */
  COMPLETE,

  /** At least one week was produced by the fallback builder. */
  PARTIALLY_DEGRADED
}
