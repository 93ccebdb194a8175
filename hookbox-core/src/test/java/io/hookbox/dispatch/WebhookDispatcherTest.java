package io.hookbox.dispatch;

import io.hookbox.bus.InProcessEventBus;
import io.hookbox.event.ContentCreated;
import io.hookbox.event.ContentDeleted;
import io.hookbox.event.ContentPublished;
import io.hookbox.event.EventContext;
import io.hookbox.model.DeliveryRecord;
import io.hookbox.model.DeliveryStatus;
import io.hookbox.model.WebhookSubscription;
import io.hookbox.queue.DeliveryTask;
import io.hookbox.support.CountingMetrics;
import io.hookbox.support.InMemoryDeliveryStore;
import io.hookbox.support.InMemorySubscriptionStore;
import io.hookbox.support.MutableClock;
import io.hookbox.support.RecordingQueue;
import io.hookbox.support.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookDispatcherTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private MutableClock clock;
  private InMemorySubscriptionStore subscriptions;
  private InMemoryDeliveryStore deliveries;
  private RecordingQueue queue;
  private CountingMetrics metrics;
  private WebhookDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    subscriptions = new InMemorySubscriptionStore();
    deliveries = new InMemoryDeliveryStore();
    queue = new RecordingQueue();
    metrics = new CountingMetrics();
    dispatcher = builder().build();
  }

  @Test
  void createsOnePendingRecordPerMatchingSubscription() {
    WebhookSubscription a = subscribe("content.created");
    WebhookSubscription b = subscribe("content.created", "content.deleted");
    subscribe("content.deleted");

    DispatchResult result = dispatcher.dispatch(
        new ContentCreated("a-1", "article", Map.of("title", "Hello"), EventContext.empty()));

    assertEquals(new DispatchResult(2, 2, 0, 0), result);
    assertEquals(2, deliveries.all().size());
    for (DeliveryRecord record : deliveries.all()) {
      assertEquals(DeliveryStatus.PENDING, record.status());
      assertEquals(0, record.attempts());
      assertEquals(T0, record.availableAt());
      assertEquals("content.created", record.eventName());
      assertEquals(record.subscriptionId() + ":content.created:a-1", record.idempotencyKey());
      assertEquals("{\"event\":\"content.created\",\"timestamp\":\"2024-05-01T10:00:00Z\","
          + "\"data\":{\"entityId\":\"a-1\",\"contentType\":\"article\",\"title\":\"Hello\"}}", record.payload());
    }
    assertEquals(2, queue.tasks.size());
    for (DeliveryTask task : queue.tasks) {
      assertTrue(task.subscriptionId().equals(a.id()) || task.subscriptionId().equals(b.id()));
      assertEquals(T0, task.notBefore());
    }
    assertEquals(2, metrics.dispatchCreated.get());
  }

  @Test
  void repeatWithinWindowIsDeduplicated() {
    subscribe("content.published");
    ContentPublished event = new ContentPublished("a-1", "article", null);

    assertEquals(new DispatchResult(1, 1, 0, 0), dispatcher.dispatch(event));
    clock.advance(Duration.ofSeconds(59));
    assertEquals(new DispatchResult(1, 0, 1, 0), dispatcher.dispatch(event));
    clock.set(T0.plusSeconds(61));
    assertEquals(new DispatchResult(1, 1, 0, 0), dispatcher.dispatch(event));

    assertEquals(2, deliveries.all().size());
    assertEquals(1, metrics.dispatchDeduplicated.get());
  }

  @Test
  void differentEntityIsNotADuplicate() {
    subscribe("content.deleted");

    dispatcher.dispatch(new ContentDeleted("a-1", "article", null));
    DispatchResult second = dispatcher.dispatch(new ContentDeleted("a-2", "article", null));

    assertEquals(1, second.created());
  }

  @Test
  void disabledAndUnsubscribedAreSkipped() {
    WebhookSubscription disabled = WebhookSubscription.builder()
        .targetUrl("https://hooks.example.com/off")
        .secret("s")
        .event("content.created")
        .enabled(false)
        .build();
    subscriptions.insert(null, disabled);
    subscribe("content.updated");

    DispatchResult result = dispatcher.onEvent("content.created", "a-1", Map.of());

    assertEquals(new DispatchResult(0, 0, 0, 0), result);
    assertTrue(deliveries.all().isEmpty());
    assertTrue(queue.tasks.isEmpty());
  }

  @Test
  void oneFailingSubscriptionDoesNotBlockOthers() {
    WebhookSubscription broken = subscribe("content.created");
    WebhookSubscription healthy = subscribe("content.created");
    deliveries.failingKeys.add(DedupLedger.idempotencyKey(broken.id(), "content.created", "a-1"));

    DispatchResult result = dispatcher.onEvent("content.created", "a-1", null);

    assertEquals(new DispatchResult(2, 1, 0, 1), result);
    assertEquals(1, deliveries.all().size());
    assertEquals(healthy.id(), deliveries.all().get(0).subscriptionId());
    assertEquals(1, metrics.dispatchFailed.get());
  }

  @Test
  void subscriptionLookupFailureIsReported() {
    subscribe("content.created");
    subscriptions.failOnFind = true;

    DispatchResult result = dispatcher.onEvent("content.created", "a-1", Map.of());

    assertEquals(new DispatchResult(0, 0, 0, 1), result);
  }

  @Test
  void connectionFailureIsReported() {
    WebhookDispatcher failing = builder().connectionProvider(StubConnections.failingProvider()).build();

    assertEquals(new DispatchResult(0, 0, 0, 1), failing.onEvent("content.created", "a-1", Map.of()));
  }

  @Test
  void rejectedEnqueueKeepsRecordForPoller() {
    subscribe("content.created");
    queue.reject();

    DispatchResult result = dispatcher.onEvent("content.created", "a-1", Map.of());

    assertEquals(1, result.created());
    assertEquals(1, deliveries.all().size());
  }

  @Test
  void registersOnBusForEveryContentEvent() {
    InProcessEventBus bus = new InProcessEventBus();
    subscribe("content.deleted");

    assertEquals(4, dispatcher.register(bus).size());
    bus.publish(new ContentDeleted("a-9", "page", null));

    assertEquals(1, deliveries.all().size());
    assertEquals("content.deleted", deliveries.all().get(0).eventName());
  }

  @Test
  void builderRequiresCollaborators() {
    assertThrows(NullPointerException.class, () -> WebhookDispatcher.builder()
        .subscriptionStore(subscriptions)
        .deliveryStore(deliveries)
        .queue(queue)
        .build());
    assertThrows(NullPointerException.class, () -> WebhookDispatcher.builder()
        .connectionProvider(StubConnections.dummyProvider())
        .subscriptionStore(subscriptions)
        .deliveryStore(deliveries)
        .build());
  }

  private WebhookDispatcher.Builder builder() {
    return WebhookDispatcher.builder()
        .connectionProvider(StubConnections.dummyProvider())
        .subscriptionStore(subscriptions)
        .deliveryStore(deliveries)
        .queue(queue)
        .metrics(metrics)
        .clock(clock);
  }

  private WebhookSubscription subscribe(String... events) {
    WebhookSubscription.Builder b = WebhookSubscription.builder()
        .targetUrl("https://hooks.example.com/in")
        .secret("s3cret");
    for (String event : events) {
      b.event(event);
    }
    WebhookSubscription sub = b.build();
    subscriptions.insert(null, sub);
    return sub;
  }
}
