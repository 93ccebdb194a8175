package io.hookbox.model;

/**
 * Filter for dead letter inspection. {@code null} fields are not applied.
 *
 * @param reasonContains case-insensitive substring of the failure reason
 * @param minRetryCount  inclusive lower bound on retry count
 * @param maxRetryCount  inclusive upper bound on retry count
 * @param limit          maximum rows returned
 */
public record DeadLetterQuery(String reasonContains, Integer minRetryCount,
    Integer maxRetryCount, int limit) {

  public static final int DEFAULT_LIMIT = 100;

  public DeadLetterQuery {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (minRetryCount != null && maxRetryCount != null && minRetryCount > maxRetryCount) {
      throw new IllegalArgumentException("minRetryCount must be <= maxRetryCount");
    }
    if (reasonContains != null && reasonContains.isBlank()) {
      reasonContains = null;
    }
  }

  public static DeadLetterQuery all() {
    return new DeadLetterQuery(null, null, null, DEFAULT_LIMIT);
  }

  public DeadLetterQuery withReasonContains(String text) {
    return new DeadLetterQuery(text, minRetryCount, maxRetryCount, limit);
  }

  public DeadLetterQuery withRetryCountBetween(Integer min, Integer max) {
    return new DeadLetterQuery(reasonContains, min, max, limit);
  }

  public DeadLetterQuery withLimit(int limit) {
    return new DeadLetterQuery(reasonContains, minRetryCount, maxRetryCount, limit);
  }
}
