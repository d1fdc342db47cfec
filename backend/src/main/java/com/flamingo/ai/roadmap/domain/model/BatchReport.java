package com.flamingo.ai.roadmap.domain.model;

import com.flamingo.ai.roadmap.domain.enums.BatchState;
import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;

/**
 * How one batch was resolved.
 *
 * @param batch week range
 * @param finalState RESOLVED or DEGRADED
 * @param generatedWeeks weeks that came from the provider
 * @param failureKind provider failure that forced the fallback, null otherwise
 * @param providerAttempts number of calls sent to the provider for this batch
 */
public record BatchReport(
    WeekBatch batch,
    BatchState finalState,
    int generatedWeeks,
    ProviderFailureKind failureKind,
    int providerAttempts) {

  public boolean degraded() {
    return finalState == BatchState.DEGRADED;
  }
}
