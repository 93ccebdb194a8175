package io.hookbox.delivery;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fixed backoff table. The delay after the n-th failure is
 * {@code schedule[min(n, length) - 1]}, so attempts beyond the table reuse its
 * last entry. No jitter.
 */
public final class BackoffSchedule implements RetryPolicy {
  private static final BackoffSchedule DEFAULT = new BackoffSchedule(List.of(
      Duration.ofSeconds(1),
      Duration.ofSeconds(2),
      Duration.ofSeconds(4),
      Duration.ofSeconds(8),
      Duration.ofSeconds(16)));

  private final List<Duration> delays;

  public BackoffSchedule(List<Duration> delays) {
    Objects.requireNonNull(delays, "delays");
    if (delays.isEmpty()) {
      throw new IllegalArgumentException("delays must not be empty");
    }
    for (Duration delay : delays) {
      Objects.requireNonNull(delay, "delay");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
      }
    }
    this.delays = List.copyOf(delays);
  }

  /**
   * The standard table: 1s, 2s, 4s, 8s, 16s.
   */
  public static BackoffSchedule defaults() {
    return DEFAULT;
  }

  @Override
  public Duration delayFor(int attempts) {
    if (attempts <= 0) {
      return Duration.ZERO;
    }
    return delays.get(Math.min(attempts, delays.size()) - 1);
  }

  public List<Duration> delays() {
    return delays;
  }

  @Override
  public String toString() {
    return delays.stream().map(Duration::toString).collect(Collectors.joining(",", "BackoffSchedule[", "]"));
  }
}
