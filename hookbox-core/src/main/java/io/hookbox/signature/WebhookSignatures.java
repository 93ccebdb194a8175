package io.hookbox.signature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Header format of webhook signatures, plus verification for receivers.
 *
 * <p>Requests carry {@code X-Signature: sha256=<hex>} where {@code <hex>} is
 * {@link SignatureEngine#sign} over the raw request body.
 */
public final class WebhookSignatures {
  public static final String HEADER = "X-Signature";
  public static final String PREFIX = "sha256=";

  private WebhookSignatures() {
  }

  public static String headerValue(byte[] body, String secret) {
    return PREFIX + SignatureEngine.sign(body, secret);
  }

  /**
   * Checks a received signature header against the body using a constant-time comparison.
   *
   * @return {@code false} when the header is missing, malformed or does not match
   */
  public static boolean verify(byte[] body, String secret, String header) {
    if (header == null || !header.startsWith(PREFIX)) {
      return false;
    }
    String expected = headerValue(body, secret);
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        header.trim().getBytes(StandardCharsets.US_ASCII));
  }
}
