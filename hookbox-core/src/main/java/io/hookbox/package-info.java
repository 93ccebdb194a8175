/**
 * Reliable outbound webhook delivery.
 *
 * <p>Domain events are fanned out by {@link io.hookbox.dispatch.WebhookDispatcher}
 * into delivery records, attempted by {@link io.hookbox.delivery.DeliveryExecutor}
 * with HMAC-signed POSTs, retried on a fixed backoff table, and moved to the dead
 * letter store once a subscription's retry budget is spent.
 * {@link io.hookbox.WebhookRelay} wires the pieces together.
 */
package io.hookbox;
