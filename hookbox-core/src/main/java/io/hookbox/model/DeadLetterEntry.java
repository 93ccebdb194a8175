package io.hookbox.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal-failure record for a delivery that exhausted its retry budget.
 *
 * <p>{@code subscriptionId} and {@code deliveryId} are plain snapshot values, so
 * entries outlive the subscription and its delivery records.
 */
public record DeadLetterEntry(
    String id,
    String jobType,
    String subscriptionId,
    String deliveryId,
    String payload,
    String failureReason,
    int retryCount,
    Instant firstFailedAt,
    Instant lastFailedAt) {

  /** Job type of every entry written by webhook delivery. */
  public static final String WEBHOOK_DELIVERY = "webhook_delivery";

  public DeadLetterEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(failureReason, "failureReason");
    Objects.requireNonNull(firstFailedAt, "firstFailedAt");
    Objects.requireNonNull(lastFailedAt, "lastFailedAt");
  }
}
