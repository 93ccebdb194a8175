package io.hookbox.queue;

/**
 * Per-process guard ensuring one delivery record is executed by at most one worker at a time.
 */
public interface InFlightTracker {
  boolean tryAcquire(String deliveryId);

  void release(String deliveryId);
}
