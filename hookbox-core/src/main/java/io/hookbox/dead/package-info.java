/**
 * Dead letter inspection.
 *
 * <p>{@link io.hookbox.dead.DeadLetterManager} provides a connection-managed facade over
 * {@link io.hookbox.spi.DeadLetterStore}. Entries are append-only: there is no requeue
 * or deletion.
 */
package io.hookbox.dead;
