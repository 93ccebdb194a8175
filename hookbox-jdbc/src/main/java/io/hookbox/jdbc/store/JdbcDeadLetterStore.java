package io.hookbox.jdbc.store;

import io.hookbox.jdbc.JdbcTemplate;
import io.hookbox.model.DeadLetterEntry;
import io.hookbox.model.DeadLetterQuery;
import io.hookbox.spi.DeadLetterStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Portable JDBC store for {@code dead_letter_entries}. Insert and read only.
 */
public final class JdbcDeadLetterStore implements DeadLetterStore {
  static final String TABLE = "dead_letter_entries";

  private static final String COLUMNS = "id, job_type, subscription_id, delivery_id, payload, " +
      "failure_reason, retry_count, first_failed_at, last_failed_at";

  private static final JdbcTemplate.RowMapper<DeadLetterEntry> ROW_MAPPER = rs -> new DeadLetterEntry(
      rs.getString("id"),
      rs.getString("job_type"),
      rs.getString("subscription_id"),
      rs.getString("delivery_id"),
      rs.getString("payload"),
      rs.getString("failure_reason"),
      rs.getInt("retry_count"),
      rs.getTimestamp("first_failed_at").toInstant(),
      rs.getTimestamp("last_failed_at").toInstant());

  @Override
  public void insert(Connection conn, DeadLetterEntry entry) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        entry.id(), entry.jobType(), entry.subscriptionId(), entry.deliveryId(),
        entry.payload(), AbstractJdbcDeliveryStore.truncateError(entry.failureReason()),
        entry.retryCount(), entry.firstFailedAt(), entry.lastFailedAt());
  }

  @Override
  public Optional<DeadLetterEntry> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, id).stream().findFirst();
  }

  @Override
  public List<DeadLetterEntry> query(Connection conn, String jobType, DeadLetterQuery query) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE job_type=?");
    List<Object> params = new ArrayList<>();
    params.add(jobType);
    if (query.reasonContains() != null) {
      sql.append(" AND LOWER(failure_reason) LIKE ? ESCAPE '!'");
      params.add("%" + JdbcSubscriptionStore.escapeLike(query.reasonContains().toLowerCase(Locale.ROOT)) + "%");
    }
    if (query.minRetryCount() != null) {
      sql.append(" AND retry_count >= ?");
      params.add(query.minRetryCount());
    }
    if (query.maxRetryCount() != null) {
      sql.append(" AND retry_count <= ?");
      params.add(query.maxRetryCount());
    }
    sql.append(" ORDER BY last_failed_at DESC, id LIMIT ?");
    params.add(query.limit());
    return JdbcTemplate.query(conn, sql.toString(), ROW_MAPPER, params.toArray());
  }

  @Override
  public int count(Connection conn, String jobType) {
    String sql = "SELECT COUNT(*) FROM " + TABLE + " WHERE job_type=?";
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), jobType);
    return counts.isEmpty() ? 0 : counts.get(0);
  }
}
