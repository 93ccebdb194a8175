package io.hookbox.signature;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignaturesTest {
  private static final byte[] FOX = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);

  @Test
  void matchesKnownHmacSha256Vector() {
    assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
        SignatureEngine.sign(FOX, "key"));
  }

  @Test
  void headerValueIsPrefixedLowercaseHex() {
    String header = WebhookSignatures.headerValue(FOX, "key");

    assertEquals("sha256=f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8", header);
    assertTrue(header.substring(WebhookSignatures.PREFIX.length()).matches("[0-9a-f]{64}"));
  }

  @Test
  void sameInputsGiveSameSignature() {
    byte[] body = "{\"event\":\"content.created\"}".getBytes(StandardCharsets.UTF_8);

    assertEquals(SignatureEngine.sign(body, "s3cret"), SignatureEngine.sign(body.clone(), "s3cret"));
  }

  @Test
  void changingOneByteChangesSignature() {
    byte[] body = "{\"event\":\"content.created\"}".getBytes(StandardCharsets.UTF_8);
    byte[] tampered = body.clone();
    tampered[tampered.length - 2] ^= 1;

    assertNotEquals(SignatureEngine.sign(body, "s3cret"), SignatureEngine.sign(tampered, "s3cret"));
    assertNotEquals(SignatureEngine.sign(body, "s3cret"), SignatureEngine.sign(body, "s3cret2"));
  }

  @Test
  void verifyAcceptsOnlyMatchingHeader() {
    String header = WebhookSignatures.headerValue(FOX, "key");

    assertTrue(WebhookSignatures.verify(FOX, "key", header));
    assertFalse(WebhookSignatures.verify(FOX, "other", header));
    assertFalse(WebhookSignatures.verify(FOX, "key", header.substring(WebhookSignatures.PREFIX.length())));
    assertFalse(WebhookSignatures.verify(FOX, "key", null));
    assertFalse(WebhookSignatures.verify(FOX, "key", "sha256=deadbeef"));
  }

  @Test
  void nullArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> SignatureEngine.sign(null, "key"));
    assertThrows(NullPointerException.class, () -> SignatureEngine.sign(FOX, null));
  }
}
