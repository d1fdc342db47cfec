package com.flamingo.ai.roadmap.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for batched roadmap generation. */
@Configuration
@ConfigurationProperties(prefix = "roadmap")
@Getter
@Setter
public class RoadmapConfig {

  private Batching batching = new Batching();
  private Context context = new Context();
  private Retry retry = new Retry();
  private Parsing parsing = new Parsing();
  private Session session = new Session();
  private Fallback fallback = new Fallback();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Batching {
    /**
     * Weeks requested per provider call. Three weeks of five days with a few tasks each stays well
     * under a 4k completion-token ceiling.
     */
    private int maxWeeksPerBatch = 3;

    private int daysPerWeek = 5;
    private int minTasksPerDay = 2;
    private int maxTasksPerDay = 3;
  }

  @Getter
  @Setter
  public static class Context {
    /** Trailing days of the previous batch included in the next prompt. */
    private int tailDays = 2;

    private int maxTasksPerDay = 5;
    private int maxTitleChars = 120;
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private Duration baseDelay = Duration.ofSeconds(2);
    private Duration maxDelay = Duration.ofSeconds(10);
    private double multiplier = 2.0;

    /** Random spread applied to each delay, as a fraction of the delay. */
    private double jitter = 0.2;
  }

  @Getter
  @Setter
  public static class Parsing {
    /** Corrective re-prompts sent when a response cannot be parsed. */
    private int repairAttempts = 1;
  }

  @Getter
  @Setter
  public static class Session {
    /** Messages kept in the provider conversation (system message always retained). */
    private int maxMessages = 20;
  }

  @Getter
  @Setter
  public static class Fallback {
    private int daysPerWeek = 5;
    private String documentationUrl = "https://developer.mozilla.org/en-US/docs/Learn";
    private String tutorialUrl = "https://www.freecodecamp.org/learn";
  }

  @Getter
  @Setter
  public static class Generation {
    private FirstBatchFailurePolicy firstBatchFailure = FirstBatchFailurePolicy.ABORT;
  }

  /** What to do when the first batch fails with an authentication or quota error. */
  public enum FirstBatchFailurePolicy {
    /** Fail the whole call; nothing was ever generated. */
    ABORT,

    /** Build every batch from the fallback templates. */
    FALLBACK
  }
}
