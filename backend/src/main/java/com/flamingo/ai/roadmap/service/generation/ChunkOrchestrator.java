package com.flamingo.ai.roadmap.service.generation;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.enums.BatchState;
import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import com.flamingo.ai.roadmap.domain.model.Milestone;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import com.flamingo.ai.roadmap.exception.GenerationCancelledException;
import com.flamingo.ai.roadmap.exception.ProviderFailureException;
import com.flamingo.ai.roadmap.service.generation.context.ContextWindow;
import com.flamingo.ai.roadmap.service.generation.fallback.FallbackRoadmapBuilder;
import com.flamingo.ai.roadmap.service.generation.parse.GenerationOutcome;
import com.flamingo.ai.roadmap.service.generation.parse.RoadmapResponseParser;
import com.flamingo.ai.roadmap.service.generation.session.GenerationSession;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drives one batch from prompt to weeks.
 *
 * <p>States: {@code PENDING -> PROMPTING -> (PARSING | RETRYING) -> (RESOLVED | DEGRADED)}.
 * Provider calls go through a Resilience4j {@link Retry}; transient failures are retried with
 * backoff, authentication and quota failures are not. An unparseable reply gets a corrective
 * re-prompt in the same session. Whatever the provider does not deliver is filled with fallback
 * weeks, so every result covers its whole batch range.
 */
@Component
@Slf4j
public class ChunkOrchestrator {

  private final BatchPromptComposer promptComposer;
  private final RoadmapResponseParser responseParser;
  private final FallbackRoadmapBuilder fallbackBuilder;
  private final RoadmapConfig roadmapConfig;
  private final MeterRegistry meterRegistry;
  private final Retry providerRetry;

  public ChunkOrchestrator(
      BatchPromptComposer promptComposer,
      RoadmapResponseParser responseParser,
      FallbackRoadmapBuilder fallbackBuilder,
      RoadmapConfig roadmapConfig,
      RetryPolicy retryPolicy,
      MeterRegistry meterRegistry) {
    this.promptComposer = promptComposer;
    this.responseParser = responseParser;
    this.fallbackBuilder = fallbackBuilder;
    this.roadmapConfig = roadmapConfig;
    this.meterRegistry = meterRegistry;
    this.providerRetry = Retry.of("roadmap-provider", retryPolicy.toRetryConfig());
    this.providerRetry
        .getEventPublisher()
        .onRetry(
            event -> {
              meterRegistry.counter("roadmap.provider.retries").increment();
              log.warn(
                  "Provider call failed (attempt {}), retrying in {} ms: {}",
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable() != null
                      ? event.getLastThrowable().getMessage()
                      : "unknown");
            });
  }

  /**
   * Produces the weeks of one batch.
   *
   * @param session conversation shared by all batches of the roadmap
   * @param batch week range to produce
   * @param totalWeeks length of the whole roadmap
   * @param roleContext learner profile
   * @param window excerpt of the previous batch, empty for the first one
   * @return weeks covering exactly the batch range
   * @throws GenerationCancelledException if the calling thread is interrupted
   */
  public BatchResult resolve(
      GenerationSession session,
      WeekBatch batch,
      int totalWeeks,
      RoleContext roleContext,
      ContextWindow window) {
    AtomicInteger attempts = new AtomicInteger();
    List<String> warnings = new ArrayList<>();
    BatchState state = BatchState.PENDING;

    String prompt = promptComposer.batchPrompt(roleContext, batch, totalWeeks, window);
    int repairAttempts = Math.max(0, roadmapConfig.getParsing().getRepairAttempts());

    for (int round = 0; round <= repairAttempts; round++) {
      state = transition(batch, state, BatchState.PROMPTING);
      GenerationOutcome outcome = request(session, prompt, batch, attempts);

      if (outcome instanceof GenerationOutcome.ProviderFailure failure) {
        warnings.add("Provider failure for " + batch + ": " + failure.kind());
        transition(batch, state, BatchState.DEGRADED);
        return degraded(batch, roleContext, failure.kind(), attempts.get(), warnings, "provider");
      }
      state = transition(batch, state, BatchState.PARSING);
      if (outcome instanceof GenerationOutcome.Success success) {
        return resolved(batch, roleContext, success, attempts.get(), warnings, state);
      }
      if (outcome instanceof GenerationOutcome.ParseFailure failure) {
        log.warn("Unparseable reply for {}: {}", batch, failure.detail());
        meterRegistry.counter("roadmap.batch.parse_failures").increment();
        warnings.add("Parse failure for " + batch + ": " + failure.detail());
        if (round < repairAttempts) {
          state = transition(batch, state, BatchState.RETRYING);
          prompt = promptComposer.repairPrompt(batch, failure.detail());
        }
      }
    }

    transition(batch, state, BatchState.DEGRADED);
    return degraded(batch, roleContext, null, attempts.get(), warnings, "parse");
  }

  /** Sends one prompt under the retry policy and parses the reply. */
  private GenerationOutcome request(
      GenerationSession session, String prompt, WeekBatch batch, AtomicInteger attempts) {
    String rawText;
    try {
      rawText = sendWithRetry(session, prompt, batch, attempts);
    } catch (ProviderFailureException e) {
      throwIfCancelled(batch);
      log.warn("Provider failed for {} ({}): {}", batch, e.getKind(), e.getMessage());
      return new GenerationOutcome.ProviderFailure(e.getKind(), e.getMessage());
    }
    return responseParser.parse(rawText, batch);
  }

  private String sendWithRetry(
      GenerationSession session, String prompt, WeekBatch batch, AtomicInteger attempts) {
    Supplier<String> call =
        () -> {
          throwIfCancelled(batch);
          attempts.incrementAndGet();
          return session.send(prompt);
        };
    return Retry.decorateSupplier(providerRetry, call).get();
  }

  private BatchResult resolved(
      WeekBatch batch,
      RoleContext roleContext,
      GenerationOutcome.Success success,
      int attempts,
      List<String> warnings,
      BatchState state) {
    warnings.addAll(success.warnings());

    Map<Integer, RoadmapWeek> byNumber = new TreeMap<>();
    success.weeks().forEach(week -> byNumber.put(week.weekNumber(), week));
    int missing = 0;
    for (int weekNumber = batch.startWeek(); weekNumber <= batch.endWeek(); weekNumber++) {
      if (!byNumber.containsKey(weekNumber)) {
        byNumber.put(weekNumber, fallbackBuilder.buildWeek(weekNumber, roleContext));
        missing++;
      }
    }

    List<Milestone> milestones = new ArrayList<>(success.milestones());
    BatchState finalState;
    if (missing == 0) {
      finalState = transition(batch, state, BatchState.RESOLVED);
      meterRegistry.counter("roadmap.batch.resolved").increment();
    } else {
      warnings.add("Filled " + missing + " missing week(s) of " + batch + " with fallback content");
      log.warn(
          "Provider returned {} of {} weeks for {}",
          success.weeks().size(),
          batch.requestedWeekCount(),
          batch);
      finalState = transition(batch, state, BatchState.DEGRADED);
      meterRegistry.counter("roadmap.batch.degraded", "reason", "partial").increment();
      if (milestones.isEmpty()) {
        milestones.add(fallbackBuilder.milestoneFor(batch, roleContext));
      }
    }
    milestones.sort(Comparator.comparingInt(Milestone::weekNumber));

    return new BatchResult(
        batch,
        List.copyOf(byNumber.values()),
        milestones,
        finalState,
        null,
        attempts,
        warnings,
        success.title(),
        success.description());
  }

  private BatchResult degraded(
      WeekBatch batch,
      RoleContext roleContext,
      ProviderFailureKind failureKind,
      int attempts,
      List<String> warnings,
      String reason) {
    meterRegistry.counter("roadmap.batch.degraded", "reason", reason).increment();
    if (failureKind != null) {
      meterRegistry
          .counter("roadmap.provider.failures", "kind", failureKind.name().toLowerCase(Locale.ROOT))
          .increment();
    }
    return new BatchResult(
        batch,
        fallbackBuilder.build(batch, roleContext),
        List.of(fallbackBuilder.milestoneFor(batch, roleContext)),
        BatchState.DEGRADED,
        failureKind,
        attempts,
        warnings,
        null,
        null);
  }

  private BatchState transition(WeekBatch batch, BatchState from, BatchState to) {
    log.debug("Batch {}: {} -> {}", batch, from, to);
    return to;
  }

  private static void throwIfCancelled(WeekBatch batch) {
    if (Thread.currentThread().isInterrupted()) {
      throw new GenerationCancelledException("Generation cancelled before " + batch);
    }
  }
}
