package io.hookbox.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSubscriptionTest {

  @Test
  void defaults() {
    WebhookSubscription sub = base().build();

    assertNotNull(sub.id());
    assertTrue(sub.enabled());
    assertEquals(WebhookSubscription.DEFAULT_RETRY_BUDGET, sub.retryBudget());
    assertTrue(sub.headers().isEmpty());
    assertNotNull(sub.createdAt());
  }

  @Test
  void eventsAreDeduplicatedInOrder() {
    WebhookSubscription sub = WebhookSubscription.builder()
        .targetUrl("https://hooks.example.com/in")
        .secret("s3cret")
        .event("content.published")
        .event("content.created")
        .event("content.published")
        .build();

    assertEquals(List.of("content.created", "content.published"),
        base().events(List.of("content.created", "content.published", "content.created")).build().events());
    assertEquals(List.of("content.published", "content.created"), sub.events());
    assertTrue(sub.subscribesTo("content.created"));
    assertFalse(sub.subscribesTo("content.deleted"));
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(NullPointerException.class, () -> base().targetUrl(null).build());
    assertThrows(NullPointerException.class, () -> base().secret(null).build());
    assertThrows(IllegalArgumentException.class, () -> base().secret("  ").build());
    assertThrows(IllegalArgumentException.class, () -> base().targetUrl("ftp://example.com/x").build());
    assertThrows(IllegalArgumentException.class, () -> base().targetUrl("not a url").build());
    assertThrows(IllegalArgumentException.class, () -> base().retryBudget(0).build());
    assertThrows(IllegalArgumentException.class, () -> base().event(" ").build());
  }

  @Test
  void toBuilderCopiesEverything() {
    WebhookSubscription original = base()
        .id("sub-1")
        .name("crm")
        .retryBudget(3)
        .header("Authorization", "Bearer x")
        .tenantId("acme")
        .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
        .build();

    WebhookSubscription copy = original.toBuilder().build();
    WebhookSubscription disabled = original.toBuilder().enabled(false).build();

    assertEquals(original, copy);
    assertEquals(Map.of("Authorization", "Bearer x"), copy.headers());
    assertEquals("acme", copy.tenantId());
    assertEquals(original.secret(), copy.secret());
    assertFalse(disabled.enabled());
    assertEquals("sub-1", disabled.id());
  }

  @Test
  void toStringHidesSecret() {
    WebhookSubscription sub = base().secret("very-secret-value").build();

    assertFalse(sub.toString().contains("very-secret-value"));
  }

  @Test
  void headersAreImmutable() {
    WebhookSubscription sub = base().header("X-A", "1").build();

    assertThrows(UnsupportedOperationException.class, () -> sub.headers().put("X-B", "2"));
    assertThrows(UnsupportedOperationException.class, () -> sub.events().add("content.deleted"));
  }

  private static WebhookSubscription.Builder base() {
    return WebhookSubscription.builder()
        .targetUrl("https://hooks.example.com/in")
        .secret("s3cret")
        .event("content.created");
  }
}
