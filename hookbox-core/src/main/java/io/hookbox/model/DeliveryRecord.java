package io.hookbox.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record of one event's delivery to one subscription.
 *
 * <p>The payload is the canonical JSON text rendered at dispatch time; every
 * attempt sends exactly these bytes. {@code attempts} counts completed HTTP
 * attempts and is the optimistic-lock value for status updates.
 *
 * @param id               unique record identifier
 * @param subscriptionId   owning subscription
 * @param eventName        domain event name, e.g. {@code content.created}
 * @param payload          immutable canonical JSON payload
 * @param idempotencyKey   {@code subscriptionId:eventName:entityId}
 * @param status           current lifecycle state
 * @param attempts         completed attempts (starts at 0)
 * @param responseStatus   HTTP status of the last attempt, or {@code null}
 * @param lastError        description of the last failure, or {@code null}
 * @param availableAt      not-before time of the next attempt
 * @param deliveredAt      time of the successful attempt, or {@code null}
 * @param createdAt        creation time
 */
public record DeliveryRecord(
    String id,
    String subscriptionId,
    String eventName,
    String payload,
    String idempotencyKey,
    DeliveryStatus status,
    int attempts,
    Integer responseStatus,
    String lastError,
    Instant availableAt,
    Instant deliveredAt,
    Instant createdAt) {

  public DeliveryRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(subscriptionId, "subscriptionId");
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(idempotencyKey, "idempotencyKey");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(availableAt, "availableAt");
    Objects.requireNonNull(createdAt, "createdAt");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  /**
   * Creates a fresh record with zero attempts, due immediately.
   */
  public static DeliveryRecord pending(String id, String subscriptionId, String eventName,
      String payload, String idempotencyKey, Instant now) {
    return new DeliveryRecord(id, subscriptionId, eventName, payload, idempotencyKey,
        DeliveryStatus.PENDING, 0, null, null, now, null, now);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
