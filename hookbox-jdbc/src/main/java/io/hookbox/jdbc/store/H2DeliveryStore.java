package io.hookbox.jdbc.store;

import java.util.List;

/**
 * Delivery store for H2, used by tests and single-process demos.
 *
 * <p>H2 accepts {@code LIMIT} inside an {@code IN} subquery, so the inherited
 * two-phase claim applies unchanged.
 */
public final class H2DeliveryStore extends AbstractJdbcDeliveryStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
