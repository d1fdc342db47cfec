package com.flamingo.ai.roadmap.service.generation;

import com.flamingo.ai.roadmap.config.RoadmapConfig;
import com.flamingo.ai.roadmap.exception.ProviderFailureException;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry settings for provider calls: exponential backoff from {@code baseDelay}, multiplied by
 * {@code multiplier} per attempt, capped at {@code maxDelay} and spread by {@code jitter}.
 *
 * @param maxAttempts total attempts per prompt, including the first
 * @param baseDelay delay before the second attempt
 * @param maxDelay upper bound for any delay, jitter included
 * @param multiplier growth factor between consecutive delays
 * @param jitter random spread as a fraction of the delay, 0 disables it
 */
public record RetryPolicy(
    int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier, double jitter) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
    }
    if (jitter < 0.0 || jitter > 1.0) {
      throw new IllegalArgumentException("jitter must be within [0, 1], got " + jitter);
    }
  }

  public static RetryPolicy from(RoadmapConfig.Retry config) {
    return new RetryPolicy(
        config.getMaxAttempts(),
        config.getBaseDelay(),
        config.getMaxDelay(),
        config.getMultiplier(),
        config.getJitter());
  }

  /** Policy retrying immediately, for tests and local runs. */
  public static RetryPolicy noDelay(int maxAttempts) {
    return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
  }

  /**
   * Delay before the attempt following failed attempt {@code attempt}, without jitter.
   *
   * @param attempt 1-based number of the attempt that just failed
   */
  public Duration backoffFor(int attempt) {
    double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
    double millis = baseDelay.toMillis() * factor;
    if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
      return maxDelay;
    }
    return Duration.ofMillis((long) millis);
  }

  /** {@link #backoffFor} with jitter applied, never above {@code maxDelay}. */
  public Duration delayForAttempt(int attempt) {
    long millis = backoffFor(attempt).toMillis();
    if (jitter > 0.0 && millis > 0) {
      double spread = millis * jitter;
      millis = Math.round(millis + ThreadLocalRandom.current().nextDouble(-spread, spread));
    }
    return Duration.ofMillis(Math.max(0, Math.min(millis, maxDelay.toMillis())));
  }

  /**
   * Resilience4j configuration retrying {@link ProviderFailureException}s of a retryable kind.
   * Everything else, cancellation included, propagates on the first attempt.
   */
  public RetryConfig toRetryConfig() {
    return RetryConfig.<String>custom()
        .maxAttempts(maxAttempts)
        .intervalBiFunction((attempt, result) -> delayForAttempt(attempt).toMillis())
        .retryOnException(
            e -> e instanceof ProviderFailureException failure && failure.isRetryable())
        .build();
  }
}
