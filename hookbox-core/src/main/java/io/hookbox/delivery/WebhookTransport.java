package io.hookbox.delivery;

import java.io.IOException;

/**
 * Sends a prepared webhook request and reports the HTTP status.
 *
 * <p>Implementations must bound the call with a request timeout and signal it with
 * {@link java.net.http.HttpTimeoutException}.
 *
 * @see HttpClientTransport
 */
@FunctionalInterface
public interface WebhookTransport {

  /**
   * @return the HTTP response status code
   * @throws IOException          on connection failure or timeout
   * @throws InterruptedException if the calling thread is interrupted
   */
  int send(WebhookRequest request) throws IOException, InterruptedException;
}
