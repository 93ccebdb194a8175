package io.hookbox.queue;

import io.hookbox.spi.MetricsExporter;
import io.hookbox.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-memory {@link DeliveryQueue} drained by a fixed pool of daemon workers.
 *
 * <p>Tasks sit in a {@link DelayQueue} until their not-before time, so a worker
 * never receives one early. A delivery id already waiting in the queue is not
 * queued twice, and an {@link InFlightTracker} keeps two workers off the same
 * record.
 *
 * <p>Create instances via {@link #builder()}, then call {@link #start(TaskHandler)}.
 * On {@link #close()} the queue stops accepting work and workers finish the tasks
 * that are already due within the drain timeout. Tasks still waiting for their
 * delay are abandoned; their records remain due in the database.
 */
public final class InMemoryDeliveryQueue implements DeliveryQueue, AutoCloseable {
  private static final Logger logger = Logger.getLogger(InMemoryDeliveryQueue.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final DelayQueue<DelayedTask> queue = new DelayQueue<>();
  private final Set<String> queuedIds = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private final int capacity;
  private final int workerCount;
  private final long drainTimeoutMs;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final Clock clock;

  private ExecutorService workers;
  private volatile TaskHandler handler;

  private InMemoryDeliveryQueue(Builder builder) {
    if (builder.capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.capacity = builder.capacity;
    this.workerCount = builder.workerCount;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker pool. Tasks enqueued earlier are processed once due.
   *
   * @throws IllegalStateException if already started or closed
   */
  public synchronized void start(TaskHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (!running.get()) {
      throw new IllegalStateException("InMemoryDeliveryQueue has been closed");
    }
    if (workers != null) {
      throw new IllegalStateException("InMemoryDeliveryQueue already started");
    }
    this.handler = handler;
    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("hookbox-worker-"));
    for (int i = 0; i < workerCount; i++) {
      workers.submit(this::workerLoop);
    }
  }

  @Override
  public boolean enqueue(DeliveryTask task) {
    Objects.requireNonNull(task, "task");
    if (!accepting.get()) {
      return false;
    }
    if (queue.size() >= capacity) {
      return false;
    }
    if (!queuedIds.add(task.deliveryId())) {
      // Already waiting; the earlier entry will run it
      return true;
    }
    queue.offer(new DelayedTask(task, clock));
    metrics.recordQueueDepth(queue.size());
    return true;
  }

  @Override
  public int remainingCapacity() {
    return accepting.get() ? Math.max(0, capacity - queue.size()) : 0;
  }

  public int size() {
    return queue.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        DelayedTask next = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (next == null) {
          if (!running.get()) break;
          continue;
        }
        queuedIds.remove(next.task().deliveryId());
        metrics.recordQueueDepth(queue.size());
        process(next.task());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Delivery worker loop error", t);
      }
    }
  }

  private void process(DeliveryTask task) {
    if (!inFlightTracker.tryAcquire(task.deliveryId())) {
      logger.fine("Delivery already in flight, skipping: " + task.deliveryId());
      return;
    }
    try {
      handler.handle(task);
    } finally {
      inFlightTracker.release(task.deliveryId());
    }
  }

  /**
   * Stops accepting tasks and drains due work within the drain timeout.
   */
  @Override
  public synchronized void close() {
    accepting.set(false);
    running.set(false);
    if (workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class DelayedTask implements Delayed {
    private final DeliveryTask task;
    private final Clock clock;
    private final long dueMillis;

    DelayedTask(DeliveryTask task, Clock clock) {
      this.task = task;
      this.clock = clock;
      // Round up so a task never fires before a sub-millisecond notBefore
      long millis = task.notBefore().toEpochMilli();
      this.dueMillis = task.notBefore().getNano() % 1_000_000 == 0 ? millis : millis + 1;
    }

    DeliveryTask task() {
      return task;
    }

    @Override
    public long getDelay(TimeUnit unit) {
      return unit.convert(dueMillis - clock.millis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
      if (other instanceof DelayedTask) {
        return Long.compare(dueMillis, ((DelayedTask) other).dueMillis);
      }
      return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
    }
  }

  /** Builder for {@link InMemoryDeliveryQueue}. */
  public static final class Builder {
    private int capacity = 1000;
    private int workerCount = 4;
    private long drainTimeoutMs = 5000;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the maximum number of waiting tasks.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for due work to finish.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Clock used to decide when a task is due. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public InMemoryDeliveryQueue build() {
      return new InMemoryDeliveryQueue(this);
    }
  }
}
