package io.hookbox.dispatch;

import io.hookbox.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Time-windowed duplicate check for dispatches.
 *
 * <p>A dispatch is a duplicate when a delivery record with the same idempotency
 * key was created within the window. This is a query over recent records, not a
 * unique constraint: the same key dispatches again once the window has passed.
 */
public final class DedupLedger {
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

  private final DeliveryStore deliveryStore;
  private final Duration window;
  private final Clock clock;

  public DedupLedger(DeliveryStore deliveryStore, Duration window, Clock clock) {
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.window = Objects.requireNonNull(window, "window");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (window.isNegative()) {
      throw new IllegalArgumentException("window must be >= 0");
    }
  }

  public static String idempotencyKey(String subscriptionId, String eventName, String entityId) {
    return subscriptionId + ":" + eventName + ":" + entityId;
  }

  public boolean isDuplicate(Connection conn, String idempotencyKey) {
    if (window.isZero()) {
      return false;
    }
    return deliveryStore.existsCreatedSince(conn, idempotencyKey, clock.instant().minus(window));
  }

  public Duration window() {
    return window;
  }
}
