package io.hookbox.event;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed family of content events that can trigger webhooks.
 *
 * <p>Each kind has a fixed event name; subscriptions match on that name.
 */
public sealed interface DomainEvent
    permits ContentCreated, ContentUpdated, ContentDeleted, ContentPublished {

  String eventName();

  String entityId();

  String contentType();

  EventContext context();

  /**
   * Extra fields merged into the webhook {@code data} object next to {@code entityId}.
   */
  default Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (contentType() != null) {
      payload.put("contentType", contentType());
    }
    return payload;
  }

  /**
   * All event names in the family, in declaration order.
   */
  static List<String> eventNames() {
    return List.of(ContentCreated.EVENT_NAME, ContentUpdated.EVENT_NAME,
        ContentDeleted.EVENT_NAME, ContentPublished.EVENT_NAME);
  }
}
