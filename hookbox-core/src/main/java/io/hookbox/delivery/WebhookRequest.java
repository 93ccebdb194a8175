package io.hookbox.delivery;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * A fully prepared outbound POST: target, final header set and signed body bytes.
 */
public record WebhookRequest(URI target, Map<String, String> headers, byte[] body) {

  public WebhookRequest {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(body, "body");
    headers = headers == null ? Map.of() : headers;
  }
}
