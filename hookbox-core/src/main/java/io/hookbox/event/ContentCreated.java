package io.hookbox.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A content entry was created. {@code data} carries the entry fields to expose.
 */
public record ContentCreated(String entityId, String contentType, Map<String, Object> data,
    EventContext context) implements DomainEvent {

  public static final String EVENT_NAME = "content.created";

  public ContentCreated {
    Objects.requireNonNull(entityId, "entityId");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    context = context == null ? EventContext.empty() : context;
  }

  @Override
  public String eventName() {
    return EVENT_NAME;
  }

  @Override
  public Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>(DomainEvent.super.payload());
    payload.putAll(data);
    return payload;
  }
}
