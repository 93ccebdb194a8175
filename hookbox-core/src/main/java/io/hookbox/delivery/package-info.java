/**
 * Delivery attempts: HTTP transport, backoff and the executor state machine.
 *
 * <p>A record moves {@code PENDING -> DELIVERED | RETRY | DEAD} and
 * {@code RETRY -> DELIVERED | RETRY | DEAD}; nothing leaves DELIVERED or DEAD.
 */
package io.hookbox.delivery;
