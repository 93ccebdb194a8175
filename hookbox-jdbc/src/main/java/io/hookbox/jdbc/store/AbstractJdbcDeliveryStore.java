package io.hookbox.jdbc.store;

import io.hookbox.jdbc.JdbcTemplate;
import io.hookbox.model.DeliveryRecord;
import io.hookbox.model.DeliveryStatus;
import io.hookbox.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC delivery store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim
 * strategies. Register custom implementations via
 * {@code META-INF/services/io.hookbox.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * @see JdbcDeliveryStores
 */
public abstract class AbstractJdbcDeliveryStore implements DeliveryStore {
  protected static final String DEFAULT_TABLE = "delivery_records";
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String DUE_STATUS_IN =
      "(" + DeliveryStatus.PENDING.code() + "," + DeliveryStatus.RETRY.code() + ")";

  protected static final String COLUMNS = "id, subscription_id, event_name, payload, idempotency_key, " +
      "status, attempts, response_status, last_error, available_at, delivered_at, created_at";

  protected static final JdbcTemplate.RowMapper<DeliveryRecord> RECORD_ROW_MAPPER = rs -> new DeliveryRecord(
      rs.getString("id"),
      rs.getString("subscription_id"),
      rs.getString("event_name"),
      rs.getString("payload"),
      rs.getString("idempotency_key"),
      DeliveryStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      JdbcTemplate.getNullableInt(rs, "response_status"),
      rs.getString("last_error"),
      rs.getTimestamp("available_at").toInstant(),
      JdbcTemplate.getNullableInstant(rs, "delivered_at"),
      rs.getTimestamp("created_at").toInstant());

  private final String tableName;

  protected AbstractJdbcDeliveryStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcDeliveryStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  protected String tableName() {
    return tableName;
  }

  @Override
  public void insertNew(Connection conn, DeliveryRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", locked_by, locked_at) " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        record.id(), record.subscriptionId(), record.eventName(), record.payload(),
        record.idempotencyKey(), record.status().code(), record.attempts(),
        record.responseStatus(), truncateError(record.lastError()),
        record.availableAt(), record.deliveredAt(), record.createdAt());
  }

  @Override
  public Optional<DeliveryRecord> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, id).stream().findFirst();
  }

  @Override
  public boolean existsCreatedSince(Connection conn, String idempotencyKey, Instant since) {
    String sql = "SELECT id FROM " + tableName() +
        " WHERE idempotency_key=? AND created_at > ? LIMIT 1";
    return !JdbcTemplate.query(conn, sql, rs -> rs.getString(1), idempotencyKey, since).isEmpty();
  }

  @Override
  public int markDelivered(Connection conn, String id, int expectedAttempts, int responseStatus,
      Instant deliveredAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + DeliveryStatus.DELIVERED.code() +
        ", attempts=?, response_status=?, delivered_at=?, last_error=NULL, locked_by=NULL, locked_at=NULL" +
        " WHERE id=? AND attempts=? AND status IN " + DUE_STATUS_IN;
    return JdbcTemplate.update(conn, sql,
        expectedAttempts + 1, responseStatus, deliveredAt, id, expectedAttempts);
  }

  @Override
  public int markRetry(Connection conn, String id, int expectedAttempts, Integer responseStatus,
      String error, Instant nextAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + DeliveryStatus.RETRY.code() +
        ", attempts=?, response_status=?, last_error=?, available_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE id=? AND attempts=? AND status IN " + DUE_STATUS_IN;
    return JdbcTemplate.update(conn, sql,
        expectedAttempts + 1, responseStatus, truncateError(error), nextAt, id, expectedAttempts);
  }

  @Override
  public int markDead(Connection conn, String id, int expectedAttempts, Integer responseStatus,
      String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + DeliveryStatus.DEAD.code() +
        ", attempts=?, response_status=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE id=? AND attempts=? AND status IN " + DUE_STATUS_IN;
    return JdbcTemplate.update(conn, sql,
        expectedAttempts + 1, responseStatus, truncateError(error), id, expectedAttempts);
  }

  @Override
  public List<DeliveryRecord> findBySubscription(Connection conn, String subscriptionId, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE subscription_id=? ORDER BY created_at DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, subscriptionId, limit);
  }

  @Override
  public List<DeliveryRecord> pollDue(Connection conn, Instant now, Duration skipRecent, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status IN " + DUE_STATUS_IN + " AND available_at <= ?" +
        " ORDER BY available_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, dueCutoff(now, skipRecent), limit);
  }

  @Override
  public List<DeliveryRecord> claimDue(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, Duration skipRecent, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
        "WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status IN " + DUE_STATUS_IN + " AND available_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?)" +
        " ORDER BY available_at LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        ownerId, nowMs, dueCutoff(now, skipRecent), lockExpiry, limit);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows claimed in this cycle
    return selectClaimed(conn, ownerId, nowMs);
  }

  @Override
  public int claim(Connection conn, String id, int expectedAttempts, String ownerId,
      Instant now, Instant lockExpiry) {
    Objects.requireNonNull(ownerId, "ownerId");
    String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=?" +
        " WHERE id=? AND attempts=? AND status IN " + DUE_STATUS_IN +
        " AND (locked_by IS NULL OR locked_by=? OR locked_at < ?)";
    return JdbcTemplate.update(conn, sql,
        ownerId, now.truncatedTo(ChronoUnit.MILLIS), id, expectedAttempts, ownerId, lockExpiry);
  }

  /**
   * Selects rows claimed by the given owner at the given lock timestamp.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<DeliveryRecord> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE locked_by=? AND locked_at=? ORDER BY available_at";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, ownerId, lockedAt);
  }

  protected Instant dueCutoff(Instant now, Duration skipRecent) {
    return skipRecent == null ? now : now.minus(skipRecent);
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
