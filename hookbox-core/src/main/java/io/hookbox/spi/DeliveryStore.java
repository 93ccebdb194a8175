package io.hookbox.spi;

import io.hookbox.model.DeliveryRecord;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link DeliveryRecord}s.
 *
 * <p>The {@code mark*} methods are conditional updates: they apply only while the
 * record is non-terminal and its stored {@code attempts} equals
 * {@code expectedAttempts}, and they set {@code attempts = expectedAttempts + 1}.
 * A return value of 0 means another worker already advanced the record.
 *
 * @see io.hookbox.jdbc.store.AbstractJdbcDeliveryStore
 */
public interface DeliveryStore {

  void insertNew(Connection conn, DeliveryRecord record);

  Optional<DeliveryRecord> findById(Connection conn, String id);

  /**
   * Whether a record with the given idempotency key was created strictly after {@code since}.
   */
  boolean existsCreatedSince(Connection conn, String idempotencyKey, Instant since);

  int markDelivered(Connection conn, String id, int expectedAttempts, int responseStatus,
      Instant deliveredAt);

  int markRetry(Connection conn, String id, int expectedAttempts, Integer responseStatus,
      String error, Instant nextAt);

  int markDead(Connection conn, String id, int expectedAttempts, Integer responseStatus,
      String error);

  List<DeliveryRecord> findBySubscription(Connection conn, String subscriptionId, int limit);

  /**
   * Returns PENDING/RETRY records with {@code available_at <= now - skipRecent},
   * oldest due first.
   */
  List<DeliveryRecord> pollDue(Connection conn, Instant now, Duration skipRecent, int limit);

  /**
   * Claims due records for {@code ownerId} so concurrent pollers on other nodes skip
   * them until {@code lockExpiry}. Must run inside a transaction.
   *
   * <p>The default falls back to {@link #pollDue} without locking.
   */
  default List<DeliveryRecord> claimDue(Connection conn, String ownerId, Instant now,
      Instant lockExpiry, Duration skipRecent, int limit) {
    return pollDue(conn, now, skipRecent, limit);
  }

  /**
   * Claims one record for {@code ownerId} ahead of a delivery attempt. Succeeds while
   * the record is non-terminal at {@code expectedAttempts} and is unclaimed, already
   * claimed by the same owner, or claimed before {@code lockExpiry}.
   *
   * <p>The default performs no locking and always returns 1.
   *
   * @return 1 if the claim is held, 0 otherwise
   */
  default int claim(Connection conn, String id, int expectedAttempts, String ownerId,
      Instant now, Instant lockExpiry) {
    return 1;
  }
}
