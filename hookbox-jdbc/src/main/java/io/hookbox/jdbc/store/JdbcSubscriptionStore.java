package io.hookbox.jdbc.store;

import io.hookbox.jdbc.JdbcTemplate;
import io.hookbox.model.WebhookSubscription;
import io.hookbox.spi.SubscriptionStore;
import io.hookbox.util.JsonCodec;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Portable JDBC store for {@code webhook_subscriptions}.
 *
 * <p>Event names and custom headers are stored as JSON text. {@link #findEnabledFor}
 * narrows candidates in SQL on the enabled flag and a quoted-name match over the
 * events column, then checks exact membership on the decoded list.
 */
public final class JdbcSubscriptionStore implements SubscriptionStore {
  static final String TABLE = "webhook_subscriptions";

  private static final String COLUMNS = "id, name, target_url, secret, events, headers, " +
      "enabled, retry_budget, tenant_id, created_at";

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<WebhookSubscription> rowMapper;

  public JdbcSubscriptionStore() {
    this(JsonCodec.getDefault());
  }

  public JdbcSubscriptionStore(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> WebhookSubscription.builder()
        .id(rs.getString("id"))
        .name(rs.getString("name"))
        .targetUrl(rs.getString("target_url"))
        .secret(rs.getString("secret"))
        .events(this.jsonCodec.parseArray(rs.getString("events")))
        .headers(this.jsonCodec.parseObject(rs.getString("headers")))
        .enabled(rs.getBoolean("enabled"))
        .retryBudget(rs.getInt("retry_budget"))
        .tenantId(rs.getString("tenant_id"))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .build();
  }

  @Override
  public void insert(Connection conn, WebhookSubscription s) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        s.id(), s.name(), s.targetUrl(), s.secret(),
        jsonCodec.toJsonArray(s.events()), jsonCodec.toJson(s.headers()),
        s.enabled(), s.retryBudget(), s.tenantId(), s.createdAt());
  }

  @Override
  public int update(Connection conn, WebhookSubscription s) {
    String sql = "UPDATE " + TABLE + " SET name=?, target_url=?, secret=?, events=?, headers=?, " +
        "enabled=?, retry_budget=?, tenant_id=? WHERE id=?";
    return JdbcTemplate.update(conn, sql,
        s.name(), s.targetUrl(), s.secret(),
        jsonCodec.toJsonArray(s.events()), jsonCodec.toJson(s.headers()),
        s.enabled(), s.retryBudget(), s.tenantId(), s.id());
  }

  @Override
  public int setEnabled(Connection conn, String id, boolean enabled) {
    return JdbcTemplate.update(conn, "UPDATE " + TABLE + " SET enabled=? WHERE id=?", enabled, id);
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE id=?", id);
  }

  @Override
  public Optional<WebhookSubscription> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, rowMapper, id).stream().findFirst();
  }

  @Override
  public List<WebhookSubscription> findEnabledFor(Connection conn, String eventName) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE enabled=? AND events LIKE ? ESCAPE '!' ORDER BY created_at, id";
    String array = jsonCodec.toJsonArray(List.of(eventName));
    // The JSON-quoted name, as it appears inside the stored array
    String pattern = "%" + escapeLike(array.substring(1, array.length() - 1)) + "%";
    return JdbcTemplate.query(conn, sql, rowMapper, true, pattern).stream()
        .filter(s -> s.subscribesTo(eventName))
        .collect(Collectors.toList());
  }

  @Override
  public List<WebhookSubscription> findAll(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, rowMapper);
  }

  static String escapeLike(String value) {
    return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
  }
}
