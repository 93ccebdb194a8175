package io.hookbox.event;

/**
 * Who caused an event and in which tenant. Both fields are optional.
 */
public record EventContext(String userId, String tenantId) {

  private static final EventContext EMPTY = new EventContext(null, null);

  public static EventContext empty() {
    return EMPTY;
  }
}
