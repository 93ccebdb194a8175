package io.hookbox.delivery;

import io.hookbox.model.DeadLetterEntry;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one {@link DeliveryExecutor#execute} call.
 */
public sealed interface DeliveryOutcome {

  /** The endpoint answered 2xx; the record is DELIVERED. */
  record Delivered(int responseStatus, int attempts) implements DeliveryOutcome {
  }

  /** The attempt failed and the next one is scheduled after {@code delay}. */
  record RetryScheduled(int attempts, Duration delay, Instant nextAttemptAt, String failure)
      implements DeliveryOutcome {
  }

  /** The retry budget is exhausted; the record is DEAD and {@code entry} was written. */
  record DeadLettered(DeadLetterEntry entry) implements DeliveryOutcome {
  }

  /** No attempt was made, or its result could not be recorded. */
  record Dropped(String reason) implements DeliveryOutcome {
  }
}
