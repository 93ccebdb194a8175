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
 * MySQL delivery store. Also compatible with TiDB.
 *
 * <p>Claims with {@code UPDATE...ORDER BY...LIMIT} followed by a {@code SELECT}.
 * The two phases are not atomic under concurrent access; for multi-node
 * deployments with heavy contention prefer {@link PostgresDeliveryStore}.
 */
public final class MySqlDeliveryStore extends AbstractJdbcDeliveryStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public List<DeliveryRecord> claimDue(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, Duration skipRecent, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // MySQL rejects LIMIT inside IN subqueries; UPDATE...ORDER BY...LIMIT needs none
    String claimSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
        "WHERE status IN " + DUE_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " ORDER BY available_at LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, nowMs, dueCutoff(now, skipRecent), lockExpiry, limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, ownerId, nowMs);
  }
}
