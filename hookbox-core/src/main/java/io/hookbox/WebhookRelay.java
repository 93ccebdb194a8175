package io.hookbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hookbox.bus.EventBus;
import io.hookbox.dead.DeadLetterManager;
import io.hookbox.delivery.DeliveryExecutor;
import io.hookbox.delivery.RetryPolicy;
import io.hookbox.delivery.WebhookTransport;
import io.hookbox.dispatch.WebhookDispatcher;
import io.hookbox.poller.DeliveryPoller;
import io.hookbox.queue.InMemoryDeliveryQueue;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.DeadLetterStore;
import io.hookbox.spi.DeliveryStore;
import io.hookbox.spi.MetricsExporter;
import io.hookbox.spi.SubscriptionStore;
import io.hookbox.subscription.SubscriptionManager;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link WebhookDispatcher}, an
 * {@link InMemoryDeliveryQueue} drained by a {@link DeliveryExecutor}, and a
 * {@link DeliveryPoller} into a single {@link AutoCloseable} unit.
 *
 * <p>Two builders cover the deployment topologies:
 * <ul>
 *   <li>{@link #singleNode()}: hot queue + poller fallback (default)</li>
 *   <li>{@link #multiNode()}: hot queue + poller with claim-based locking</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (WebhookRelay relay = WebhookRelay.singleNode()
 *     .connectionProvider(connectionProvider)
 *     .subscriptionStore(subscriptionStore)
 *     .deliveryStore(deliveryStore)
 *     .deadLetterStore(deadLetterStore)
 *     .build()) {
 *   relay.register(eventBus);
 *   relay.subscriptions().register(subscription);
 * }
 * }</pre>
 */
public final class WebhookRelay implements AutoCloseable {

  private final WebhookDispatcher dispatcher;
  private final DeliveryExecutor executor;
  private final InMemoryDeliveryQueue queue;
  private final DeliveryPoller poller;
  private final SubscriptionManager subscriptions;
  private final DeadLetterManager deadLetters;
  private final MetricsExporter metrics;

  private WebhookRelay(WebhookDispatcher dispatcher, DeliveryExecutor executor,
      InMemoryDeliveryQueue queue, DeliveryPoller poller, SubscriptionManager subscriptions,
      DeadLetterManager deadLetters, MetricsExporter metrics) {
    this.dispatcher = dispatcher;
    this.executor = executor;
    this.queue = queue;
    this.poller = poller;
    this.subscriptions = subscriptions;
    this.deadLetters = deadLetters;
    this.metrics = metrics;
  }

  public static SingleNodeBuilder singleNode() {
    return new SingleNodeBuilder();
  }

  public static MultiNodeBuilder multiNode() {
    return new MultiNodeBuilder();
  }

  /**
   * Subscribes the dispatcher to every content event on the bus.
   *
   * @return the bus registration ids
   */
  public List<String> register(EventBus bus) {
    return dispatcher.register(bus);
  }

  public WebhookDispatcher dispatcher() {
    return dispatcher;
  }

  public DeliveryExecutor executor() {
    return executor;
  }

  public InMemoryDeliveryQueue queue() {
    return queue;
  }

  /**
   * @return the poller, or {@code null} when polling is disabled
   */
  public DeliveryPoller poller() {
    return poller;
  }

  public SubscriptionManager subscriptions() {
    return subscriptions;
  }

  public DeadLetterManager deadLetters() {
    return deadLetters;
  }

  /**
   * Shuts down components in order: poller, queue, metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (poller != null) {
      try {
        poller.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      queue.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  // ── Abstract builder ─────────────────────────────────────────────

  /**
   * Base builder with shared required and optional parameters.
   *
   * @param <B> the concrete builder type
   */
  public abstract static sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits SingleNodeBuilder, MultiNodeBuilder {

    ConnectionProvider connectionProvider;
    SubscriptionStore subscriptionStore;
    DeliveryStore deliveryStore;
    DeadLetterStore deadLetterStore;
    WebhookTransport transport;
    RetryPolicy retryPolicy;
    Duration dedupWindow;
    MetricsExporter metrics;
    Clock clock;
    ObjectMapper objectMapper;
    int workerCount = 4;
    int queueCapacity = 1000;
    long drainTimeoutMs = 5000;
    boolean pollerEnabled = true;
    long intervalMs = 5000;
    int batchSize = 50;
    Duration skipRecent = Duration.ofSeconds(2);
    private final AtomicBoolean built = new AtomicBoolean(false);

    AbstractBuilder() {
    }

    void markBuilt() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
    }

    @SuppressWarnings("unchecked")
    private B self() {
      return (B) this;
    }

    /** <b>Required.</b> */
    public B connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return self();
    }

    /** <b>Required.</b> */
    public B subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return self();
    }

    /** <b>Required.</b> */
    public B deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return self();
    }

    /** <b>Required.</b> */
    public B deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return self();
    }

    /** Optional. Defaults to an {@code HttpClient} transport with a 10 s request timeout. */
    public B transport(WebhookTransport transport) {
      this.transport = transport;
      return self();
    }

    /** Optional. Defaults to 1s, 2s, 4s, 8s, 16s. */
    public B retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return self();
    }

    /** Optional. Defaults to 60 seconds. */
    public B dedupWindow(Duration dedupWindow) {
      this.dedupWindow = dedupWindow;
      return self();
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the relay when it
     * implements {@link AutoCloseable}.
     */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }

    public B clock(Clock clock) {
      this.clock = clock;
      return self();
    }

    public B objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return self();
    }

    /** Optional. Defaults to {@code 4}. */
    public B workerCount(int workerCount) {
      this.workerCount = workerCount;
      return self();
    }

    /** Optional. Defaults to {@code 1000}. */
    public B queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return self();
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public B drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return self();
    }

    /** Optional. Defaults to {@code true}. */
    public B pollerEnabled(boolean pollerEnabled) {
      this.pollerEnabled = pollerEnabled;
      return self();
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public B intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return self();
    }

    /** Optional. Defaults to {@code 50}. */
    public B batchSize(int batchSize) {
      this.batchSize = batchSize;
      return self();
    }

    /** Optional. Defaults to 2 seconds. */
    public B skipRecent(Duration skipRecent) {
      this.skipRecent = skipRecent;
      return self();
    }

    void validateRequired() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(subscriptionStore, "subscriptionStore");
      Objects.requireNonNull(deliveryStore, "deliveryStore");
      Objects.requireNonNull(deadLetterStore, "deadLetterStore");
    }

    /**
     * Builds queue, executor, dispatcher and poller. If a later component fails to
     * build or start, the ones already running are closed before rethrowing.
     */
    WebhookRelay buildComposite(String ownerId, Duration lockTimeout) {
      validateRequired();
      markBuilt();
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
      String effectiveOwner = ownerId != null || lockTimeout == null
          ? ownerId : "node-" + UUID.randomUUID().toString().substring(0, 8);

      InMemoryDeliveryQueue queue = InMemoryDeliveryQueue.builder()
          .workerCount(workerCount)
          .capacity(queueCapacity)
          .drainTimeoutMs(drainTimeoutMs)
          .metrics(effectiveMetrics)
          .clock(effectiveClock)
          .build();

      DeliveryExecutor.Builder eb = DeliveryExecutor.builder()
          .connectionProvider(connectionProvider)
          .subscriptionStore(subscriptionStore)
          .deliveryStore(deliveryStore)
          .deadLetterStore(deadLetterStore)
          .queue(queue)
          .transport(transport)
          .retryPolicy(retryPolicy)
          .metrics(effectiveMetrics)
          .clock(effectiveClock);
      if (effectiveOwner != null) {
        eb.claimLocking(effectiveOwner, lockTimeout);
      }
      DeliveryExecutor executor = eb.build();

      WebhookDispatcher dispatcher = WebhookDispatcher.builder()
          .connectionProvider(connectionProvider)
          .subscriptionStore(subscriptionStore)
          .deliveryStore(deliveryStore)
          .queue(queue)
          .dedupWindow(dedupWindow)
          .metrics(effectiveMetrics)
          .clock(effectiveClock)
          .objectMapper(objectMapper)
          .build();

      queue.start(executor::execute);

      DeliveryPoller poller = null;
      if (pollerEnabled) {
        try {
          DeliveryPoller.Builder pb = DeliveryPoller.builder()
              .connectionProvider(connectionProvider)
              .deliveryStore(deliveryStore)
              .queue(queue)
              .batchSize(batchSize)
              .intervalMs(intervalMs)
              .skipRecent(skipRecent)
              .metrics(effectiveMetrics)
              .clock(effectiveClock);
          if (effectiveOwner != null) {
            pb.claimLocking(effectiveOwner, lockTimeout);
          }
          poller = pb.build();
          poller.start();
        } catch (RuntimeException e) {
          if (poller != null) {
            poller.close();
          }
          queue.close();
          throw e;
        }
      }

      return new WebhookRelay(dispatcher, executor, queue, poller,
          new SubscriptionManager(connectionProvider, subscriptionStore),
          new DeadLetterManager(connectionProvider, deadLetterStore),
          effectiveMetrics);
    }

    /**
     * Builds and starts the relay.
     *
     * @return a new {@link WebhookRelay} instance
     */
    public abstract WebhookRelay build();
  }

  // ── Single-node builder ──────────────────────────────────────────

  /**
   * Builder for single-node deployments: the poller reads due rows without locking.
   */
  public static final class SingleNodeBuilder extends AbstractBuilder<SingleNodeBuilder> {

    SingleNodeBuilder() {
    }

    @Override
    public WebhookRelay build() {
      return buildComposite(null, null);
    }
  }

  // ── Multi-node builder ───────────────────────────────────────────

  /**
   * Builder for multi-node deployments: the poller claims rows so each due record is
   * picked up by one node at a time.
   */
  public static final class MultiNodeBuilder extends AbstractBuilder<MultiNodeBuilder> {
    private String ownerId;
    private Duration lockTimeout = Duration.ofMinutes(5);

    MultiNodeBuilder() {
    }

    /**
     * Optional. Unique id of this node; a random one is generated when absent.
     */
    public MultiNodeBuilder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * Optional. How long a claim holds before another node may take the row.
     * Defaults to 5 minutes.
     */
    public MultiNodeBuilder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    @Override
    public WebhookRelay build() {
      Objects.requireNonNull(lockTimeout, "lockTimeout");
      return buildComposite(ownerId, lockTimeout);
    }
  }
}
