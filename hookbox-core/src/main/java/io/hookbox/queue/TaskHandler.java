package io.hookbox.queue;

/**
 * Callback invoked by queue workers for each due task.
 */
@FunctionalInterface
public interface TaskHandler {
  void handle(DeliveryTask task);
}
