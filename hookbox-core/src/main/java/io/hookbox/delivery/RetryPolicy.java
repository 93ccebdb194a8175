package io.hookbox.delivery;

import java.time.Duration;

/**
 * Strategy for the delay before the next attempt of a failed delivery.
 *
 * @see BackoffSchedule
 */
public interface RetryPolicy {

  /**
   * Computes the delay before the next attempt.
   *
   * @param attempts the number of failed attempts so far (1-based)
   * @return a non-negative delay
   */
  Duration delayFor(int attempts);
}
