package io.hookbox.model;

/**
 * Lifecycle state of a {@link DeliveryRecord}, persisted as a small integer code.
 *
 * <p>{@link #DELIVERED} and {@link #DEAD} are terminal.
 */
public enum DeliveryStatus {
  PENDING(0),
  DELIVERED(1),
  RETRY(2),
  DEAD(3);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == DELIVERED || this == DEAD;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
