package io.hookbox.delivery;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link WebhookTransport} on top of {@link java.net.http.HttpClient}.
 *
 * <p>Redirects are not followed and response bodies are discarded.
 */
public final class HttpClientTransport implements WebhookTransport {
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final Duration requestTimeout;

  public HttpClientTransport() {
    this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
  }

  public HttpClientTransport(Duration connectTimeout, Duration requestTimeout) {
    this(HttpClient.newBuilder()
        .connectTimeout(requirePositive(connectTimeout, "connectTimeout"))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build(), requestTimeout);
  }

  public HttpClientTransport(HttpClient httpClient, Duration requestTimeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.requestTimeout = requirePositive(requestTimeout, "requestTimeout");
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  @Override
  public int send(WebhookRequest request) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.target())
        .timeout(requestTimeout)
        .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
    request.headers().forEach(builder::header);
    HttpResponse<Void> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
    return response.statusCode();
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }
}
