package io.hookbox.dead;

import io.hookbox.model.DeadLetterEntry;
import io.hookbox.model.DeadLetterQuery;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.DeadLetterStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only facade for inspecting webhook deliveries that exhausted their retries.
 *
 * <p>Only entries with job type {@value DeadLetterEntry#WEBHOOK_DELIVERY} are visible.
 * Lists are ordered by {@code lastFailedAt}, newest first.
 *
 * @see DeadLetterStore
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeadLetterStore deadLetterStore;

  public DeadLetterManager(ConnectionProvider connectionProvider, DeadLetterStore deadLetterStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deadLetterStore = Objects.requireNonNull(deadLetterStore, "deadLetterStore");
  }

  public List<DeadLetterEntry> recent(int limit) {
    return query(DeadLetterQuery.all().withLimit(limit));
  }

  /**
   * Queries entries by failure reason substring and retry count range.
   *
   * @return matching entries, newest first; empty on failure
   */
  public List<DeadLetterEntry> query(DeadLetterQuery query) {
    Objects.requireNonNull(query, "query");
    try (Connection conn = connectionProvider.getConnection()) {
      return deadLetterStore.query(conn, DeadLetterEntry.WEBHOOK_DELIVERY, query);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query dead letters", e);
      return List.of();
    }
  }

  public Optional<DeadLetterEntry> find(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deadLetterStore.findById(conn, id)
          .filter(entry -> DeadLetterEntry.WEBHOOK_DELIVERY.equals(entry.jobType()));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to load dead letter " + id, e);
      return Optional.empty();
    }
  }

  public int count() {
    try (Connection conn = connectionProvider.getConnection()) {
      return deadLetterStore.count(conn, DeadLetterEntry.WEBHOOK_DELIVERY);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to count dead letters", e);
      return 0;
    }
  }
}
