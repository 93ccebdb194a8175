package io.hookbox.queue;

/**
 * Work queue between the dispatcher, the poller and the delivery executor.
 *
 * <p>Implementations must not hand a task to a worker before its
 * {@link DeliveryTask#notBefore()} time. A rejected task is not lost: its record
 * stays due in the database and the poller offers it again.
 */
public interface DeliveryQueue {

  /**
   * @return {@code true} if accepted, {@code false} if the queue is full or closed
   */
  boolean enqueue(DeliveryTask task);

  /**
   * Number of further tasks the queue would accept right now.
   */
  default int remainingCapacity() {
    return Integer.MAX_VALUE;
  }
}
