package io.hookbox.signature;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signer for outbound webhook bodies.
 *
 * <p>The key is the UTF-8 encoding of the subscription secret; the output is
 * 64 lowercase hex characters. Signing is pure and thread-safe.
 */
public final class SignatureEngine {
  static final String ALGORITHM = "HmacSHA256";

  private SignatureEngine() {
  }

  /**
   * Signs the exact bytes that will be sent as the request body.
   *
   * @param payload raw body bytes
   * @param secret  shared secret
   * @return lowercase hex HMAC-SHA256
   */
  public static String sign(byte[] payload, String secret) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secret, "secret");
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return toHex(mac.doFinal(payload));
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("Unable to compute " + ALGORITHM, e);
    }
  }

  private static String toHex(byte[] bytes) {
    StringBuilder sb = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      sb.append(String.format("%02x", b));
    }
    return sb.toString();
  }
}
