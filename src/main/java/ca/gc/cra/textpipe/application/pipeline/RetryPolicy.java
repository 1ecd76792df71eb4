package ca.gc.cra.textpipe.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff policy for resubmitting transiently failed submissions.
 *
 * @param maxAttempts total attempts including the first; {@code 1} disables retries
 * @param initialBackoff pause before the second attempt
 * @param multiplier growth factor applied to each further pause; at least {@code 1.0}
 * @param maxBackoff cap for a single pause
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
  private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    Objects.requireNonNull(initialBackoff, "initialBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff must not be negative");
    }
    if (!(multiplier >= 1.0)) {
      throw new IllegalArgumentException("multiplier must be at least 1.0");
    }
  }

  /**
   * Creates a doubling policy capped at thirty seconds.
   *
   * @param maxAttempts total attempts
   * @param initialBackoff first pause
   * @return policy
   */
  public static RetryPolicy exponential(int maxAttempts, Duration initialBackoff) {
    return new RetryPolicy(maxAttempts, initialBackoff, 2.0, DEFAULT_MAX_BACKOFF);
  }

  /**
   * Returns a policy that never retries.
   *
   * @return single-attempt policy
   */
  public static RetryPolicy none() {
    return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
  }

  /**
   * Returns the pause after a failed attempt.
   *
   * @param failedAttempt one-based number of the attempt that just failed
   * @return pause before the next attempt, never above {@link #maxBackoff()}
   */
  public Duration backoffAfter(int failedAttempt) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be at least 1");
    }
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
    if (millis >= maxBackoff.toMillis()) {
      return maxBackoff;
    }
    return Duration.ofMillis((long) millis);
  }
}
