package io.hookbox.micrometer;

import io.hookbox.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code hookbox.dispatch.created}: delivery records created</li>
 *   <li>{@code hookbox.dispatch.deduplicated}: dispatches skipped inside the dedup window</li>
 *   <li>{@code hookbox.dispatch.failed}: per-subscription dispatch failures</li>
 *   <li>{@code hookbox.delivery.success}: 2xx deliveries</li>
 *   <li>{@code hookbox.delivery.retry}: failed attempts scheduled for retry</li>
 *   <li>{@code hookbox.delivery.dead}: deliveries moved to the dead letter store</li>
 *   <li>{@code hookbox.delivery.dropped}: work items dropped without an attempt</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code hookbox.queue.depth}: tasks waiting in the in-memory queue</li>
 *   <li>{@code hookbox.delivery.last.duration.ms}: duration of the last HTTP attempt</li>
 *   <li>{@code hookbox.lag.oldest.ms}: lag of the oldest due record seen by the poller</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatchCreated;
  private final Counter dispatchDeduplicated;
  private final Counter dispatchFailed;
  private final Counter deliverySuccess;
  private final Counter deliveryRetry;
  private final Counter deliveryDead;
  private final Counter deliveryDropped;
  private final Gauge queueDepthGauge;
  private final Gauge durationGauge;
  private final Gauge lagGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicLong lastDurationMs = new AtomicLong();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "hookbox"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "hookbox");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "cms.webhooks"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatchCreated = counter(namePrefix + ".dispatch.created", "Delivery records created");
    this.dispatchDeduplicated = counter(namePrefix + ".dispatch.deduplicated",
        "Dispatches skipped inside the dedup window");
    this.dispatchFailed = counter(namePrefix + ".dispatch.failed", "Per-subscription dispatch failures");
    this.deliverySuccess = counter(namePrefix + ".delivery.success", "Deliveries acknowledged with 2xx");
    this.deliveryRetry = counter(namePrefix + ".delivery.retry", "Failed attempts scheduled for retry");
    this.deliveryDead = counter(namePrefix + ".delivery.dead", "Deliveries moved to the dead letter store");
    this.deliveryDropped = counter(namePrefix + ".delivery.dropped", "Work items dropped without an attempt");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.durationGauge = Gauge.builder(namePrefix + ".delivery.last.duration.ms", lastDurationMs, AtomicLong::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementDispatchCreated() {
    if (closed) return;
    dispatchCreated.increment();
  }

  @Override
  public void incrementDispatchDeduplicated() {
    if (closed) return;
    dispatchDeduplicated.increment();
  }

  @Override
  public void incrementDispatchFailed() {
    if (closed) return;
    dispatchFailed.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryRetry() {
    if (closed) return;
    deliveryRetry.increment();
  }

  @Override
  public void incrementDeliveryDead() {
    if (closed) return;
    deliveryDead.increment();
  }

  @Override
  public void incrementDeliveryDropped() {
    if (closed) return;
    deliveryDropped.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    lastDurationMs.set(durationMs);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.hookbox.WebhookRelay#close()} calls this so stale gauges do not linger.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatchCreated, dispatchDeduplicated, dispatchFailed,
        deliverySuccess, deliveryRetry, deliveryDead, deliveryDropped,
        queueDepthGauge, durationGauge, lagGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
