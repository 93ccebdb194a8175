package io.hookbox.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hookbox.bus.EventBus;
import io.hookbox.bus.EventHandler;
import io.hookbox.event.DomainEvent;
import io.hookbox.event.EventContext;
import io.hookbox.model.DeliveryRecord;
import io.hookbox.model.WebhookSubscription;
import io.hookbox.queue.DeliveryQueue;
import io.hookbox.queue.DeliveryTask;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.DeliveryStore;
import io.hookbox.spi.MetricsExporter;
import io.hookbox.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns domain events into delivery records, one per matching enabled subscription.
 *
 * <p>For each subscription listening for the event, the dispatcher builds the
 * idempotency key {@code subscriptionId:eventName:entityId}, skips it if the
 * {@link DedupLedger} has seen it within the window, and otherwise persists a
 * PENDING {@link DeliveryRecord} carrying the canonical payload and offers it to
 * the {@link DeliveryQueue}. A failure for one subscription is logged and the
 * rest still proceed. If the queue rejects a record, the poller picks it up.
 *
 * <p>Register on an {@link EventBus} with {@link #register(EventBus)}. Create
 * instances via {@link #builder()}. This class is thread-safe.
 */
public final class WebhookDispatcher implements EventHandler {
  private static final Logger logger = Logger.getLogger(WebhookDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore subscriptionStore;
  private final DeliveryStore deliveryStore;
  private final DeliveryQueue queue;
  private final DedupLedger dedupLedger;
  private final PayloadEnvelope envelope;
  private final MetricsExporter metrics;
  private final Clock clock;

  private WebhookDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    Duration window = builder.dedupWindow != null ? builder.dedupWindow : DedupLedger.DEFAULT_WINDOW;
    this.dedupLedger = new DedupLedger(deliveryStore, window, clock);
    this.envelope = new PayloadEnvelope(builder.objectMapper != null ? builder.objectMapper : new ObjectMapper());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes this dispatcher to every content event name.
   *
   * @return the registration ids, one per event name
   */
  public List<String> register(EventBus bus) {
    List<String> registrations = new ArrayList<>();
    for (String eventName : DomainEvent.eventNames()) {
      registrations.add(bus.subscribe(eventName, this));
    }
    return registrations;
  }

  @Override
  public void onEvent(String eventName, String entityId, Map<String, Object> payload, EventContext context) {
    onEvent(eventName, entityId, payload);
  }

  public DispatchResult dispatch(DomainEvent event) {
    return onEvent(event.eventName(), event.entityId(), event.payload());
  }

  /**
   * Fans one event out to matching subscriptions.
   *
   * <p>If the subscriptions cannot be loaded the result reports
   * {@code matched=0, failed=1}.
   *
   * @param eventName the event name, e.g. {@code content.created}
   * @param entityId  id of the entity the event is about
   * @param payload   extra fields for the {@code data} object; may be {@code null}
   * @return counts of what happened
   */
  public DispatchResult onEvent(String eventName, String entityId, Map<String, Object> payload) {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(entityId, "entityId");
    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<WebhookSubscription> matching = new ArrayList<>();
      for (WebhookSubscription subscription : subscriptionStore.findEnabledFor(conn, eventName)) {
        if (subscription.enabled() && subscription.subscribesTo(eventName)) {
          matching.add(subscription);
        }
      }
      if (matching.isEmpty()) {
        logger.fine("No subscriptions for " + eventName);
        return DispatchResult.NONE;
      }

      String body = envelope.render(eventName, now, entityId, payload);
      int created = 0;
      int deduplicated = 0;
      int failed = 0;
      for (WebhookSubscription subscription : matching) {
        String key = DedupLedger.idempotencyKey(subscription.id(), eventName, entityId);
        try {
          if (dedupLedger.isDuplicate(conn, key)) {
            deduplicated++;
            metrics.incrementDispatchDeduplicated();
            logger.fine("Skipping duplicate delivery " + key + " within " + dedupLedger.window());
            continue;
          }
          DeliveryRecord record = DeliveryRecord.pending(UUID.randomUUID().toString(),
              subscription.id(), eventName, body, key, now);
          deliveryStore.insertNew(conn, record);
          created++;
          metrics.incrementDispatchCreated();
          if (!queue.enqueue(new DeliveryTask(record.id(), subscription.id(), now))) {
            logger.fine("Queue rejected delivery " + record.id() + "; left for the poller");
          }
        } catch (RuntimeException e) {
          failed++;
          metrics.incrementDispatchFailed();
          logger.log(Level.SEVERE, "Failed to create delivery for subscription "
              + subscription.id() + ", event " + eventName + ", entityId=" + entityId, e);
        }
      }
      return new DispatchResult(matching.size(), created, deduplicated, failed);
    } catch (SQLException | RuntimeException e) {
      metrics.incrementDispatchFailed();
      logger.log(Level.SEVERE, "Failed to dispatch " + eventName + " entityId=" + entityId, e);
      return new DispatchResult(0, 0, 0, 1);
    }
  }

  /** Builder for {@link WebhookDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore subscriptionStore;
    private DeliveryStore deliveryStore;
    private DeliveryQueue queue;
    private Duration dedupWindow;
    private MetricsExporter metrics;
    private Clock clock;
    private ObjectMapper objectMapper;

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

    /** <b>Required.</b> Receives new delivery work. */
    public Builder queue(DeliveryQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets how long an idempotency key suppresses repeats.
     *
     * <p>Optional. Defaults to 60 seconds. {@link Duration#ZERO} disables deduplication.
     */
    public Builder dedupWindow(Duration dedupWindow) {
      this.dedupWindow = dedupWindow;
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

    /** Optional. Mapper used to convert payload values to JSON. */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    public WebhookDispatcher build() {
      return new WebhookDispatcher(this);
    }
  }
}
