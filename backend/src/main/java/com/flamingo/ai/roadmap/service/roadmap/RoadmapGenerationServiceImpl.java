package com.flamingo.ai.roadmap.service.roadmap;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.domain.model.Roadmap;
import com.flamingo.ai.roadmap.domain.model.RoleContext;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/** Runs {@link RoadmapAssembler} directly or on the dedicated generation executor. */
@Service
@Slf4j
public class RoadmapGenerationServiceImpl implements RoadmapGenerationService {

  private final RoadmapAssembler roadmapAssembler;
  private final RoadmapConfig roadmapConfig;
  private final AsyncTaskExecutor generationExecutor;

  public RoadmapGenerationServiceImpl(
      RoadmapAssembler roadmapAssembler,
      RoadmapConfig roadmapConfig,
      @Qualifier("roadmapGenerationExecutor") AsyncTaskExecutor generationExecutor) {
    this.roadmapAssembler = roadmapAssembler;
    this.roadmapConfig = roadmapConfig;
    this.generationExecutor = generationExecutor;
  }

  @Override
  public Roadmap generate(int totalWeeks, RoleContext roleContext, int weeksPerBatch) {
    return roadmapAssembler.assemble(totalWeeks, roleContext, weeksPerBatch);
  }

  @Override
  public Roadmap generate(int totalWeeks, RoleContext roleContext) {
    return generate(totalWeeks, roleContext, roadmapConfig.getBatching().getMaxWeeksPerBatch());
  }

  @Override
  public Future<Roadmap> submit(int totalWeeks, RoleContext roleContext) {
    log.debug("Submitting {}-week roadmap generation", totalWeeks);
    return generationExecutor.submit(() -> generate(totalWeeks, roleContext));
  }
}
