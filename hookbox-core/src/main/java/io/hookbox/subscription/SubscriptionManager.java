package io.hookbox.subscription;

import io.hookbox.model.WebhookSubscription;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection-managed facade for maintaining subscriptions.
 *
 * <p>Changes apply to the next dispatch and to the next attempt of deliveries
 * already scheduled: the executor re-reads the subscription each time, so a
 * disabled or deleted subscription receives no further calls. Deleting a
 * subscription removes its delivery records; dead letter entries are kept.
 *
 * <p>Failures are logged and reported through the return value.
 */
public final class SubscriptionManager {
  private static final Logger logger = Logger.getLogger(SubscriptionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SubscriptionStore subscriptionStore;

  public SubscriptionManager(ConnectionProvider connectionProvider, SubscriptionStore subscriptionStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.subscriptionStore = Objects.requireNonNull(subscriptionStore, "subscriptionStore");
  }

  /**
   * @return {@code true} if the subscription was stored
   */
  public boolean register(WebhookSubscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      subscriptionStore.insert(conn, subscription);
      logger.info("Registered webhook subscription " + subscription.id() + " -> " + subscription.targetUrl());
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to register subscription " + subscription.id(), e);
      return false;
    }
  }

  /**
   * @return {@code true} if an existing subscription was updated
   */
  public boolean update(WebhookSubscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return subscriptionStore.update(conn, subscription) > 0;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to update subscription " + subscription.id(), e);
      return false;
    }
  }

  public boolean setEnabled(String id, boolean enabled) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean changed = subscriptionStore.setEnabled(conn, id, enabled) > 0;
      if (changed) {
        logger.info("Subscription " + id + (enabled ? " enabled" : " disabled"));
      }
      return changed;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to change enabled flag of subscription " + id, e);
      return false;
    }
  }

  /**
   * Deletes a subscription and, by cascade, its delivery records.
   *
   * @return {@code true} if a subscription was deleted
   */
  public boolean delete(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      boolean deleted = subscriptionStore.delete(conn, id) > 0;
      if (deleted) {
        logger.info("Deleted webhook subscription " + id);
      }
      return deleted;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to delete subscription " + id, e);
      return false;
    }
  }

  public Optional<WebhookSubscription> find(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      return subscriptionStore.findById(conn, id);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to load subscription " + id, e);
      return Optional.empty();
    }
  }

  public List<WebhookSubscription> list() {
    try (Connection conn = connectionProvider.getConnection()) {
      return subscriptionStore.findAll(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to list subscriptions", e);
      return List.of();
    }
  }
}
