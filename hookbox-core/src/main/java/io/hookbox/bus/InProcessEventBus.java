package io.hookbox.bus;

import io.hookbox.event.EventContext;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process {@link EventBus}.
 *
 * <p>Handlers run on the publishing thread in registration order. Exceptions
 * thrown by a handler are logged and do not reach the publisher.
 *
 * <p>This class is thread-safe.
 */
public final class InProcessEventBus implements EventBus {
  private static final Logger logger = Logger.getLogger(InProcessEventBus.class.getName());

  private final Map<String, CopyOnWriteArrayList<Registration>> handlers = new ConcurrentHashMap<>();

  @Override
  public String subscribe(String eventName, EventHandler handler) {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(handler, "handler");
    String id = UUID.randomUUID().toString();
    handlers.computeIfAbsent(eventName, ignored -> new CopyOnWriteArrayList<>())
        .add(new Registration(id, handler));
    return id;
  }

  @Override
  public void unsubscribe(String registrationId) {
    handlers.values().forEach(list -> list.removeIf(r -> r.id().equals(registrationId)));
  }

  @Override
  public void publish(String eventName, String entityId, Map<String, Object> payload, EventContext context) {
    List<Registration> registrations = handlers.get(eventName);
    if (registrations == null) {
      return;
    }
    Map<String, Object> safePayload = payload == null ? Map.of() : payload;
    EventContext safeContext = context == null ? EventContext.empty() : context;
    for (Registration registration : registrations) {
      try {
        registration.handler().onEvent(eventName, entityId, safePayload, safeContext);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Event handler failed for " + eventName + " entityId=" + entityId, e);
      }
    }
  }

  public int handlerCount(String eventName) {
    List<Registration> registrations = handlers.get(eventName);
    return registrations == null ? 0 : registrations.size();
  }

  private record Registration(String id, EventHandler handler) {
  }
}
