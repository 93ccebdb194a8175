package io.hookbox.event;

import java.util.Objects;

public record ContentDeleted(String entityId, String contentType, EventContext context)
    implements DomainEvent {

  public static final String EVENT_NAME = "content.deleted";

  public ContentDeleted {
    Objects.requireNonNull(entityId, "entityId");
    context = context == null ? EventContext.empty() : context;
  }

  @Override
  public String eventName() {
    return EVENT_NAME;
  }
}
