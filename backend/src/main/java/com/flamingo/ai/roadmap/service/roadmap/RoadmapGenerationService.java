package com.flamingo.ai.roadmap.service.roadmap;

import com.flamingo.ai.roadmap.domain.model.Roadmap;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import java.util.concurrent.Future;

/** Entry point for generating learning roadmaps. */
public interface RoadmapGenerationService {

  /**
   * Generates a roadmap on the calling thread.
   *
   * @param totalWeeks roadmap length
   * @param roleContext learner profile
   * @param weeksPerBatch maximum weeks per provider call
   * @return the assembled roadmap
   */
  Roadmap generate(int totalWeeks, RoleContext roleContext, int weeksPerBatch);

  /** Same as {@link #generate(int, RoleContext, int)} with the configured batch size. */
  Roadmap generate(int totalWeeks, RoleContext roleContext);

  /**
   * Generates a roadmap on the generation executor. Cancelling the returned future with {@code
   * mayInterruptIfRunning} stops the assembly before its next provider call; no partial roadmap is
   * produced.
   */
  Future<Roadmap> submit(int totalWeeks, RoleContext roleContext);
}
