/**
 * Delivery work queue: the {@link io.hookbox.queue.DeliveryQueue} contract, the
 * delay-aware in-memory implementation and the in-flight guard.
 */
package io.hookbox.queue;
