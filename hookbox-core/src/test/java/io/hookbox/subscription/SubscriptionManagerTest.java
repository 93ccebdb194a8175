package io.hookbox.subscription;

import io.hookbox.model.WebhookSubscription;
import io.hookbox.support.InMemorySubscriptionStore;
import io.hookbox.support.StubConnections;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionManagerTest {
  private final InMemorySubscriptionStore store = new InMemorySubscriptionStore();
  private final SubscriptionManager manager = new SubscriptionManager(StubConnections.dummyProvider(), store);

  @Test
  void registerFindAndList() {
    WebhookSubscription sub = subscription();

    assertTrue(manager.register(sub));
    assertEquals(sub, manager.find(sub.id()).orElseThrow());
    assertEquals(1, manager.list().size());
  }

  @Test
  void duplicateRegisterReturnsFalse() {
    WebhookSubscription sub = subscription();
    manager.register(sub);

    assertFalse(manager.register(sub));
  }

  @Test
  void updateAndToggle() {
    WebhookSubscription sub = subscription();
    manager.register(sub);

    assertTrue(manager.update(sub.toBuilder().targetUrl("https://hooks.example.com/v2").build()));
    assertEquals("https://hooks.example.com/v2", manager.find(sub.id()).orElseThrow().targetUrl());
    assertTrue(manager.setEnabled(sub.id(), false));
    assertFalse(manager.find(sub.id()).orElseThrow().enabled());
    assertFalse(manager.setEnabled("missing", true));
    assertFalse(manager.update(subscription()));
  }

  @Test
  void deleteRemoves() {
    WebhookSubscription sub = subscription();
    manager.register(sub);

    assertTrue(manager.delete(sub.id()));
    assertFalse(manager.delete(sub.id()));
    assertTrue(manager.find(sub.id()).isEmpty());
  }

  @Test
  void connectionFailureIsReportedNotThrown() {
    SubscriptionManager failing = new SubscriptionManager(StubConnections.failingProvider(), store);

    assertFalse(failing.register(subscription()));
    assertFalse(failing.delete("x"));
    assertTrue(failing.find("x").isEmpty());
    assertTrue(failing.list().isEmpty());
  }

  private static WebhookSubscription subscription() {
    return WebhookSubscription.builder()
        .targetUrl("https://hooks.example.com/in")
        .secret("s3cret")
        .event("content.created")
        .build();
  }
}
