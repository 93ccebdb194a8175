package io.hookbox.queue;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero, a delivery stays tracked until released. When
 * positive, an entry older than the TTL can be re-acquired, which frees records
 * held by a stuck worker.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inflight = new ConcurrentHashMap<>();
  private final long ttlMs;

  public DefaultInFlightTracker() {
    this(0L);
  }

  /**
   * @param ttlMs time-to-live in milliseconds; zero disables expiry
   */
  public DefaultInFlightTracker(long ttlMs) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0");
    }
    this.ttlMs = ttlMs;
  }

  @Override
  public boolean tryAcquire(String deliveryId) {
    long now = System.currentTimeMillis();
    Long existing = inflight.putIfAbsent(deliveryId, now);
    if (existing == null) {
      return true;
    }
    return ttlMs > 0 && now - existing > ttlMs && inflight.replace(deliveryId, existing, now);
  }

  @Override
  public void release(String deliveryId) {
    inflight.remove(deliveryId);
  }

  int size() {
    return inflight.size();
  }
}
