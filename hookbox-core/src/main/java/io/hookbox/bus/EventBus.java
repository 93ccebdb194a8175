package io.hookbox.bus;

import io.hookbox.event.DomainEvent;
import io.hookbox.event.EventContext;

import java.util.Map;

/**
 * Publish/subscribe contract between event producers and the webhook dispatcher.
 *
 * <p>Handlers subscribed to the same event run independently: a handler failure
 * never blocks its siblings or the publisher.
 */
public interface EventBus {

  /**
   * Registers a handler for one event name.
   *
   * @return a registration id accepted by {@link #unsubscribe}
   */
  String subscribe(String eventName, EventHandler handler);

  void unsubscribe(String registrationId);

  void publish(String eventName, String entityId, Map<String, Object> payload, EventContext context);

  default void publish(DomainEvent event) {
    publish(event.eventName(), event.entityId(), event.payload(), event.context());
  }
}
