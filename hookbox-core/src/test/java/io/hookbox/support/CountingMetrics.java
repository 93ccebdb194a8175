package io.hookbox.support;

import io.hookbox.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

public final class CountingMetrics implements MetricsExporter {
  public final AtomicInteger dispatchCreated = new AtomicInteger();
  public final AtomicInteger dispatchDeduplicated = new AtomicInteger();
  public final AtomicInteger dispatchFailed = new AtomicInteger();
  public final AtomicInteger deliverySuccess = new AtomicInteger();
  public final AtomicInteger deliveryRetry = new AtomicInteger();
  public final AtomicInteger deliveryDead = new AtomicInteger();
  public final AtomicInteger deliveryDropped = new AtomicInteger();
  public volatile int lastQueueDepth = -1;

  @Override
  public void incrementDispatchCreated() {
    dispatchCreated.incrementAndGet();
  }

  @Override
  public void incrementDispatchDeduplicated() {
    dispatchDeduplicated.incrementAndGet();
  }

  @Override
  public void incrementDispatchFailed() {
    dispatchFailed.incrementAndGet();
  }

  @Override
  public void incrementDeliverySuccess() {
    deliverySuccess.incrementAndGet();
  }

  @Override
  public void incrementDeliveryRetry() {
    deliveryRetry.incrementAndGet();
  }

  @Override
  public void incrementDeliveryDead() {
    deliveryDead.incrementAndGet();
  }

  @Override
  public void incrementDeliveryDropped() {
    deliveryDropped.incrementAndGet();
  }

  @Override
  public void recordQueueDepth(int depth) {
    lastQueueDepth = depth;
  }
}
