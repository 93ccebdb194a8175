package io.hookbox.event;

import java.util.Objects;

public record ContentPublished(String entityId, String contentType, EventContext context)
    implements DomainEvent {

  public static final String EVENT_NAME = "content.published";

  public ContentPublished {
    Objects.requireNonNull(entityId, "entityId");
    context = context == null ? EventContext.empty() : context;
  }

  @Override
  public String eventName() {
    return EVENT_NAME;
  }
}
