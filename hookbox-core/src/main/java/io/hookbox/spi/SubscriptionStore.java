package io.hookbox.spi;

import io.hookbox.model.WebhookSubscription;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link WebhookSubscription}s.
 *
 * <p>All methods use the caller-supplied connection and never commit or close it.
 * Implementations surface database errors as unchecked exceptions.
 */
public interface SubscriptionStore {

  void insert(Connection conn, WebhookSubscription subscription);

  /**
   * Replaces all mutable fields of an existing subscription.
   *
   * @return rows updated (0 if the id is unknown)
   */
  int update(Connection conn, WebhookSubscription subscription);

  int setEnabled(Connection conn, String id, boolean enabled);

  /**
   * Deletes the subscription; its delivery records are removed by cascade.
   *
   * @return rows deleted
   */
  int delete(Connection conn, String id);

  Optional<WebhookSubscription> findById(Connection conn, String id);

  /**
   * Returns enabled subscriptions whose event list contains {@code eventName}.
   * The enabled filter is applied in the query.
   */
  List<WebhookSubscription> findEnabledFor(Connection conn, String eventName);

  List<WebhookSubscription> findAll(Connection conn);
}
