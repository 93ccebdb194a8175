package io.hookbox.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the hookbox JDBC stores.
 */
public final class HookboxStoreException extends RuntimeException {
  public HookboxStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
