package io.hookbox.spi;

import io.hookbox.model.DeadLetterEntry;
import io.hookbox.model.DeadLetterQuery;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence for {@link DeadLetterEntry}s.
 */
public interface DeadLetterStore {

  void insert(Connection conn, DeadLetterEntry entry);

  Optional<DeadLetterEntry> findById(Connection conn, String id);

  /**
   * Returns entries of the given job type matching the query, newest
   * {@code lastFailedAt} first.
   */
  List<DeadLetterEntry> query(Connection conn, String jobType, DeadLetterQuery query);

  int count(Connection conn, String jobType);
}
