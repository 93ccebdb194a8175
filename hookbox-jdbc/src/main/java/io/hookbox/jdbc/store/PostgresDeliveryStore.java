package io.hookbox.jdbc.store;

import io.hookbox.jdbc.JdbcTemplate;
import io.hookbox.model.DeliveryRecord;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL delivery store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a
 * single-round-trip claim.
 */
public final class PostgresDeliveryStore extends AbstractJdbcDeliveryStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<DeliveryRecord> claimDue(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, Duration skipRecent, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status IN " + DUE_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " ORDER BY available_at LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    return JdbcTemplate.updateReturning(conn, sql, RECORD_ROW_MAPPER,
        ownerId, nowMs, dueCutoff(now, skipRecent), lockExpiry, limit);
  }
}
