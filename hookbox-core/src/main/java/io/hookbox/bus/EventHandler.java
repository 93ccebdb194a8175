package io.hookbox.bus;

import io.hookbox.event.EventContext;

import java.util.Map;

/**
 * Receives published events for the names it was subscribed to.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * @param eventName the published event name
   * @param entityId  id of the entity the event is about
   * @param payload   extra event fields, never {@code null}
   * @param context   originating user and tenant, never {@code null}
   */
  void onEvent(String eventName, String entityId, Map<String, Object> payload, EventContext context);
}
