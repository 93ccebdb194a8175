/**
 * Service Provider Interfaces (SPI) for plugging hookbox into a persistence and metrics stack.
 *
 * <p>Stores take an explicit {@link java.sql.Connection}; the caller owns its transaction.
 *
 * @see io.hookbox.spi.ConnectionProvider
 * @see io.hookbox.spi.SubscriptionStore
 * @see io.hookbox.spi.DeliveryStore
 * @see io.hookbox.spi.DeadLetterStore
 * @see io.hookbox.spi.MetricsExporter
 */
package io.hookbox.spi;
