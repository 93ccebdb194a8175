package io.hookbox.queue;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of delivery work: attempt {@code deliveryId} for {@code subscriptionId}
 * no earlier than {@code notBefore}.
 */
public record DeliveryTask(String deliveryId, String subscriptionId, Instant notBefore) {

  public DeliveryTask {
    Objects.requireNonNull(deliveryId, "deliveryId");
    Objects.requireNonNull(subscriptionId, "subscriptionId");
    Objects.requireNonNull(notBefore, "notBefore");
  }
}
