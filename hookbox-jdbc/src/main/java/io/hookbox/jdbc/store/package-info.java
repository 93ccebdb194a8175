/**
 * JDBC store implementations.
 *
 * <p>{@link io.hookbox.jdbc.store.AbstractJdbcDeliveryStore} has one subclass per
 * database, chosen by {@link io.hookbox.jdbc.store.JdbcDeliveryStores#detect};
 * subscription and dead letter stores use portable SQL.
 */
package io.hookbox.jdbc.store;
