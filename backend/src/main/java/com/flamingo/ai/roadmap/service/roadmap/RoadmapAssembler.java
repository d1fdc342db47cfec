package com.flamingo.ai.roadmap.service.roadmap;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.model.Roadmap;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import com.flamingo.ai.roadmap.exception.GenerationCancelledException;
import com.flamingo.ai.roadmap.exception.PlanningException;
import com.flamingo.ai.roadmap.exception.RoadmapGenerationException;
import com.flamingo.ai.roadmap.service.generation.BatchPromptComposer;
import com.flamingo.ai.roadmap.service.generation.BatchResult;
import com.flamingo.ai.roadmap.service.generation.ChunkOrchestrator;
import com.flamingo.ai.roadmap.service.generation.batch.BatchPlanner;
import com.flamingo.ai.roadmap.service.generation.context.ContextWindow;
import com.flamingo.ai.roadmap.service.generation.context.ContextWindowExtractor;
import com.flamingo.ai.roadmap.service.generation.session.GenerationSession;
import com.flamingo.ai.roadmap.service.generation.session.GenerationSessionFactory;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assembles a complete roadmap from sequential batches sharing one provider session.
 *
 * <p>Batches are processed strictly in ascending order; each one is primed with the tail of the
 * previous one. A degraded batch never stops assembly, its weeks come from the fallback builder.
 * The only provider failure that aborts is an authentication or quota error on the first batch
 * under {@link RoadmapConfig.FirstBatchFailurePolicy#ABORT}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoadmapAssembler {

  private final BatchPlanner batchPlanner;
  private final ContextWindowExtractor contextExtractor;
  private final ChunkOrchestrator chunkOrchestrator;
  private final BatchPromptComposer promptComposer;
  private final GenerationSessionFactory sessionFactory;
  private final RoadmapValidator roadmapValidator;
  private final RoadmapConfig roadmapConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Builds a roadmap of {@code totalWeeks} weeks.
   *
   * @param totalWeeks roadmap length, positive
   * @param roleContext learner profile, target role required
   * @param weeksPerBatch maximum weeks requested per provider call, positive
   * @return a COMPLETE or PARTIALLY_DEGRADED roadmap
   * @throws PlanningException if sizes are not positive or the target role is missing
   * @throws RoadmapGenerationException if the first batch is refused and the policy is ABORT
   * @throws GenerationCancelledException if the calling thread is interrupted
   */
  @Timed(value = "roadmap.assembly.duration", description = "Time to assemble a full roadmap")
  public Roadmap assemble(int totalWeeks, RoleContext roleContext, int weeksPerBatch) {
    if (roleContext == null || !roleContext.hasTargetRole()) {
      throw new PlanningException(
          "Roadmap requested without a target role",
          "Please set a target role in your profile first.");
    }
    List<WeekBatch> batches = batchPlanner.plan(totalWeeks, weeksPerBatch);
    String role = roleContext.targetRole();
    log.info(
        "Assembling {}-week roadmap for '{}' in {} batch(es)", totalWeeks, role, batches.size());

    RoadmapDraft draft = new RoadmapDraft(totalWeeks);
    String systemPrompt = promptComposer.systemPrompt(roleContext);
    try (GenerationSession session = sessionFactory.open(systemPrompt)) {
      ContextWindow window = ContextWindow.empty();
      for (WeekBatch batch : batches) {
        throwIfCancelled(role, batch);
        BatchResult result =
            chunkOrchestrator.resolve(session, batch, totalWeeks, roleContext, window);
        abortIfFirstBatchRefused(role, result);

        draft.append(result);
        window = contextExtractor.extract(result.weeks());
        log.info(
            "Roadmap for '{}' {}: {} resolved as {}, {}/{} weeks, completion {}",
            role,
            draft.status(),
            batch,
            result.finalState(),
            draft.weekCount(),
            totalWeeks,
            String.format("%.2f", draft.completionFraction()));
      }
    } catch (GenerationCancelledException e) {
      meterRegistry.counter("roadmap.assembly.cancelled").increment();
      log.info("Roadmap assembly for '{}' cancelled: {}", role, e.getMessage());
      throw e;
    } catch (RoadmapGenerationException e) {
      meterRegistry.counter("roadmap.assembly.aborted").increment();
      throw e;
    }

    Roadmap roadmap =
        draft.finish(role, defaultTitle(role), defaultDescription(roleContext, totalWeeks));
    roadmapValidator.validate(roadmap);

    meterRegistry
        .counter(
            "roadmap.assembly.completed",
            "status",
            roadmap.status().name().toLowerCase(Locale.ROOT))
        .increment();
    log.info(
        "Roadmap for '{}' {}: {} weeks, {} generated, {} degraded batch(es), {} provider call(s)",
        role,
        roadmap.status(),
        roadmap.totalWeeks(),
        roadmap.metadata().generatedWeeks(),
        roadmap.metadata().degradedBatchCount(),
        roadmap.metadata().providerAttempts());
    return roadmap;
  }

  private void abortIfFirstBatchRefused(String role, BatchResult result) {
    if (result.batch().isFirst()
        && result.failedNonTransiently()
        && roadmapConfig.getGeneration().getFirstBatchFailure()
            == RoadmapConfig.FirstBatchFailurePolicy.ABORT) {
      log.error(
          "Provider refused the first batch for '{}' with {}, aborting",
          role,
          result.failureKind());
      throw new RoadmapGenerationException(
          role,
          result.failureKind(),
          "First batch failed with " + result.failureKind(),
          "Failed to generate roadmap. Please try again later.");
    }
  }

  private static void throwIfCancelled(String role, WeekBatch batch) {
    if (Thread.currentThread().isInterrupted()) {
      throw new GenerationCancelledException(
          "Roadmap for '" + role + "' cancelled before " + batch);
    }
  }

  static String defaultTitle(String role) {
    return "Your Path to Becoming a " + role;
  }

  static String defaultDescription(RoleContext roleContext, int totalWeeks) {
    return "A personalized "
        + totalWeeks
        + "-week learning path tailored for "
        + roleContext.experienceLevel()
        + " level learners";
  }
}
