package io.hookbox.delivery;

import io.hookbox.model.DeadLetterEntry;
import io.hookbox.model.DeliveryRecord;
import io.hookbox.model.WebhookSubscription;
import io.hookbox.queue.DeliveryQueue;
import io.hookbox.queue.DeliveryTask;
import io.hookbox.signature.WebhookSignatures;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.DeadLetterStore;
import io.hookbox.spi.DeliveryStore;
import io.hookbox.spi.MetricsExporter;
import io.hookbox.spi.SubscriptionStore;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs one delivery attempt and moves the record to its next state.
 *
 * <p>Each call re-reads the record and its subscription, so a deleted
 * subscription stops before the next attempt. Disabling a subscription only
 * stops new dispatches; records already created still run to DELIVERED or DEAD.
 * With {@link Builder#claimLocking} set, the record is claimed for this node
 * before the HTTP call, and a record held by another node is dropped. The body is the stored payload
 * text, byte for byte, signed with the subscription secret. The outcome is
 * written with a single conditional update keyed on the attempt count read at
 * the start; if another worker got there first the outcome is
 * {@link DeliveryOutcome.Dropped} and nothing is scheduled. Exhausting the retry
 * budget marks the record DEAD and writes a {@link DeadLetterEntry} in one
 * transaction.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class DeliveryExecutor {
  private static final Logger logger = Logger.getLogger(DeliveryExecutor.class.getName());

  static final String CONTENT_TYPE = "Content-Type";
  static final String APPLICATION_JSON = "application/json";

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore subscriptionStore;
  private final DeliveryStore deliveryStore;
  private final DeadLetterStore deadLetterStore;
  private final DeliveryQueue queue;
  private final WebhookTransport transport;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final String ownerId;
  private final Duration lockTimeout;

  private DeliveryExecutor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.deadLetterStore = Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.transport = builder.transport != null ? builder.transport : new HttpClientTransport();
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : BackoffSchedule.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.ownerId = builder.ownerId;
    this.lockTimeout = builder.lockTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public DeliveryOutcome execute(DeliveryTask task) {
    return execute(task.deliveryId(), task.subscriptionId());
  }

  /**
   * Attempts delivery of one record.
   *
   * @param deliveryId     the delivery record id
   * @param subscriptionId the subscription the record belongs to
   * @return what happened; never {@code null}
   */
  public DeliveryOutcome execute(String deliveryId, String subscriptionId) {
    DeliveryRecord record;
    WebhookSubscription subscription;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<DeliveryRecord> loaded = deliveryStore.findById(conn, deliveryId);
      if (loaded.isEmpty()) {
        logger.warning("Delivery record not found, dropping: " + deliveryId);
        return drop("delivery record not found");
      }
      record = loaded.get();
      Optional<WebhookSubscription> owner = subscriptionStore.findById(conn, subscriptionId);
      if (owner.isEmpty()) {
        logger.warning("Subscription " + subscriptionId + " not found, dropping delivery " + deliveryId);
        return drop("subscription not found");
      }
      subscription = owner.get();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to load delivery " + deliveryId, e);
      return drop("load failed: " + describe(e));
    }

    if (!record.subscriptionId().equals(subscription.id())) {
      logger.warning("Delivery " + deliveryId + " belongs to " + record.subscriptionId()
          + ", not " + subscriptionId + "; dropping");
      return drop("subscription mismatch");
    }
    if (record.isTerminal()) {
      logger.fine("Delivery " + deliveryId + " already " + record.status() + ", dropping");
      return drop("already " + record.status());
    }
    if (record.availableAt().isAfter(clock.instant())) {
      // Early wakeup; the queued retry or the poller runs it later
      logger.fine("Delivery " + deliveryId + " not due until " + record.availableAt());
      return new DeliveryOutcome.Dropped("not due");
    }
    if (ownerId != null && !claim(record)) {
      logger.fine("Delivery " + deliveryId + " is claimed by another node, dropping");
      return drop("claimed elsewhere");
    }

    return attempt(record, subscription);
  }

  private boolean claim(DeliveryRecord record) {
    Instant now = clock.instant();
    Optional<Integer> claimed = withConnection("claim", record.id(),
        conn -> deliveryStore.claim(conn, record.id(), record.attempts(), ownerId, now, now.minus(lockTimeout)));
    return claimed.isPresent() && claimed.get() > 0;
  }

  private DeliveryOutcome attempt(DeliveryRecord record, WebhookSubscription subscription) {
    byte[] body = record.payload().getBytes(StandardCharsets.UTF_8);
    Integer responseStatus = null;
    String failure;
    long start = System.nanoTime();
    try {
      WebhookRequest request = new WebhookRequest(
          URI.create(subscription.targetUrl()), headersFor(subscription, body), body);
      responseStatus = transport.send(request);
      failure = responseStatus >= 200 && responseStatus < 300 ? null : "HTTP " + responseStatus;
    } catch (HttpTimeoutException e) {
      failure = "Timeout after " + elapsedMs(start) + " ms";
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return drop("interrupted");
    } catch (IOException | RuntimeException e) {
      failure = describe(e);
    }
    metrics.recordDeliveryDurationMs(elapsedMs(start));

    Instant completedAt = clock.instant();
    if (failure == null) {
      return recordSuccess(record, subscription, responseStatus, completedAt);
    }
    int attempts = record.attempts() + 1;
    if (attempts >= subscription.retryBudget()) {
      return deadLetter(record, responseStatus, failure, completedAt);
    }
    return scheduleRetry(record, responseStatus, failure, completedAt);
  }

  private DeliveryOutcome recordSuccess(DeliveryRecord record, WebhookSubscription subscription,
      int responseStatus, Instant completedAt) {
    int attempts = record.attempts() + 1;
    Optional<Integer> updated = withConnection("mark DELIVERED", record.id(),
        conn -> deliveryStore.markDelivered(conn, record.id(), record.attempts(), responseStatus, completedAt));
    if (updated.isEmpty()) {
      return drop("persistence failure");
    }
    if (updated.get() == 0) {
      return drop("concurrent update");
    }
    metrics.incrementDeliverySuccess();
    logger.info("Delivered " + record.id() + " (" + record.eventName() + ") to "
        + subscription.targetUrl() + ": HTTP " + responseStatus + ", attempt " + attempts);
    return new DeliveryOutcome.Delivered(responseStatus, attempts);
  }

  private DeliveryOutcome scheduleRetry(DeliveryRecord record, Integer responseStatus,
      String failure, Instant completedAt) {
    int attempts = record.attempts() + 1;
    Duration delay = retryPolicy.delayFor(attempts);
    Instant nextAt = completedAt.plus(delay).truncatedTo(ChronoUnit.MILLIS);
    Optional<Integer> updated = withConnection("mark RETRY", record.id(),
        conn -> deliveryStore.markRetry(conn, record.id(), record.attempts(), responseStatus, failure, nextAt));
    if (updated.isEmpty()) {
      return drop("persistence failure");
    }
    if (updated.get() == 0) {
      return drop("concurrent update");
    }
    metrics.incrementDeliveryRetry();
    logger.warning("Delivery " + record.id() + " attempt " + attempts + " failed (" + failure
        + "); retrying in " + delay.toMillis() + " ms");
    if (!queue.enqueue(new DeliveryTask(record.id(), record.subscriptionId(), nextAt))) {
      logger.fine("Queue rejected retry of " + record.id() + "; left for the poller");
    }
    return new DeliveryOutcome.RetryScheduled(attempts, delay, nextAt, failure);
  }

  private DeliveryOutcome deadLetter(DeliveryRecord record, Integer responseStatus,
      String failure, Instant completedAt) {
    int attempts = record.attempts() + 1;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        int updated = deliveryStore.markDead(conn, record.id(), record.attempts(), responseStatus, failure);
        if (updated == 0) {
          conn.rollback();
          return drop("concurrent update");
        }
        DeadLetterEntry entry = new DeadLetterEntry(
            UUID.randomUUID().toString(),
            DeadLetterEntry.WEBHOOK_DELIVERY,
            record.subscriptionId(),
            record.id(),
            record.payload(),
            failure,
            attempts,
            record.createdAt(),
            completedAt);
        deadLetterStore.insert(conn, entry);
        conn.commit();
        metrics.incrementDeliveryDead();
        logger.severe("Delivery " + record.id() + " dead-lettered after " + attempts
            + " attempts: " + failure);
        return new DeliveryOutcome.DeadLettered(entry);
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to dead-letter delivery " + record.id(), e);
      return drop("persistence failure");
    }
  }

  private Map<String, String> headersFor(WebhookSubscription subscription, byte[] body) {
    Map<String, String> headers = new LinkedHashMap<>();
    subscription.headers().forEach((name, value) -> {
      if (isReserved(name)) {
        logger.fine("Ignoring custom header " + name + " on subscription " + subscription.id());
      } else {
        headers.put(name, value);
      }
    });
    headers.put(CONTENT_TYPE, APPLICATION_JSON);
    headers.put(WebhookSignatures.HEADER, WebhookSignatures.headerValue(body, subscription.secret()));
    return headers;
  }

  private static boolean isReserved(String headerName) {
    return CONTENT_TYPE.equalsIgnoreCase(headerName)
        || WebhookSignatures.HEADER.equalsIgnoreCase(headerName);
  }

  private DeliveryOutcome drop(String reason) {
    metrics.incrementDeliveryDropped();
    return new DeliveryOutcome.Dropped(reason);
  }

  private <T> Optional<T> withConnection(String action, String deliveryId, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return Optional.of(op.apply(conn));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for delivery " + deliveryId, e);
      return Optional.empty();
    }
  }

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    String name = failure.getClass().getSimpleName();
    return message == null || message.isBlank() ? name : name + ": " + message;
  }

  private static long elapsedMs(long startNanos) {
    return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Builder for {@link DeliveryExecutor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore subscriptionStore;
    private DeliveryStore deliveryStore;
    private DeadLetterStore deadLetterStore;
    private DeliveryQueue queue;
    private WebhookTransport transport;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private String ownerId;
    private Duration lockTimeout;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /**
     * Sets the queue that receives scheduled retries.
     *
     * <p><b>Required.</b>
     */
    public Builder queue(DeliveryQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Optional. Defaults to {@link HttpClientTransport} with a 5 s connect and 10 s
     * request timeout.
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to {@link BackoffSchedule#defaults()}. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Claims each record for {@code ownerId} before sending, so a node's poller and
     * another node's hot path never post the same record at once. Use the same owner
     * and timeout as the {@link io.hookbox.poller.DeliveryPoller}.
     *
     * <p>Optional. Off by default.
     */
    public Builder claimLocking(String ownerId, Duration lockTimeout) {
      this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      if (lockTimeout.isNegative() || lockTimeout.isZero()) {
        throw new IllegalArgumentException("lockTimeout must be positive");
      }
      return this;
    }

    public DeliveryExecutor build() {
      return new DeliveryExecutor(this);
    }
  }
}
