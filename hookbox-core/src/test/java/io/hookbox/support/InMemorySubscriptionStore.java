package io.hookbox.support;

import io.hookbox.model.WebhookSubscription;
import io.hookbox.spi.SubscriptionStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed {@link SubscriptionStore}. Set {@link #failOnFind} to simulate an outage. */
public final class InMemorySubscriptionStore implements SubscriptionStore {
  private final Map<String, WebhookSubscription> byId = new ConcurrentHashMap<>();
  public volatile boolean failOnFind;

  @Override
  public void insert(Connection conn, WebhookSubscription subscription) {
    if (byId.putIfAbsent(subscription.id(), subscription) != null) {
      throw new IllegalStateException("duplicate subscription " + subscription.id());
    }
  }

  @Override
  public int update(Connection conn, WebhookSubscription subscription) {
    return byId.replace(subscription.id(), subscription) != null ? 1 : 0;
  }

  @Override
  public int setEnabled(Connection conn, String id, boolean enabled) {
    WebhookSubscription current = byId.get(id);
    if (current == null) {
      return 0;
    }
    byId.put(id, current.toBuilder().enabled(enabled).build());
    return 1;
  }

  @Override
  public int delete(Connection conn, String id) {
    return byId.remove(id) != null ? 1 : 0;
  }

  @Override
  public Optional<WebhookSubscription> findById(Connection conn, String id) {
    checkAvailable();
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public List<WebhookSubscription> findEnabledFor(Connection conn, String eventName) {
    checkAvailable();
    List<WebhookSubscription> result = new ArrayList<>();
    for (WebhookSubscription s : byId.values()) {
      if (s.enabled() && s.subscribesTo(eventName)) {
        result.add(s);
      }
    }
    return result;
  }

  @Override
  public List<WebhookSubscription> findAll(Connection conn) {
    return new ArrayList<>(byId.values());
  }

  private void checkAvailable() {
    if (failOnFind) {
      throw new IllegalStateException("subscription store unavailable");
    }
  }
}
