package io.hookbox.spi;

/**
 * Observability hook for exporting dispatch and delivery counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see io.hookbox.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of delivery records created by the dispatcher.
   */
  void incrementDispatchCreated();

  /**
   * Increments the count of dispatches skipped by the dedup window.
   */
  void incrementDispatchDeduplicated();

  /**
   * Increments the count of per-subscription dispatch failures.
   */
  void incrementDispatchFailed();

  /**
   * Increments the count of 2xx deliveries.
   */
  void incrementDeliverySuccess();

  /**
   * Increments the count of failed attempts scheduled for retry.
   */
  void incrementDeliveryRetry();

  /**
   * Increments the count of deliveries moved to the dead letter store.
   */
  void incrementDeliveryDead();

  /**
   * Increments the count of work items dropped without an attempt. A task that wakes
   * before its record is due is not counted.
   */
  default void incrementDeliveryDropped() {
  }

  /**
   * Records the number of work items waiting in the in-memory queue.
   */
  void recordQueueDepth(int depth);

  /**
   * Records the duration of the last HTTP attempt.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordDeliveryDurationMs(long durationMs) {
  }

  /**
   * Records the lag of the oldest due record seen by the poller.
   *
   * @param lagMs lag in milliseconds (always non-negative)
   */
  default void recordOldestLagMs(long lagMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementDispatchCreated() {
    }

    @Override
    public void incrementDispatchDeduplicated() {
    }

    @Override
    public void incrementDispatchFailed() {
    }

    @Override
    public void incrementDeliverySuccess() {
    }

    @Override
    public void incrementDeliveryRetry() {
    }

    @Override
    public void incrementDeliveryDead() {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }
  }
}
