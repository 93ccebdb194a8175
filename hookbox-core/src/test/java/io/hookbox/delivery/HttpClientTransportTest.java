package io.hookbox.delivery;

import com.sun.net.httpserver.HttpServer;
import io.hookbox.util.DaemonThreadFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpClientTransportTest {
  private HttpServer server;
  private final AtomicReference<String> receivedBody = new AtomicReference<>();
  private final AtomicReference<String> receivedHeader = new AtomicReference<>();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/ok", exchange -> {
      receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      receivedHeader.set(exchange.getRequestHeaders().getFirst("X-Signature"));
      exchange.sendResponseHeaders(202, -1);
      exchange.close();
    });
    server.createContext("/moved", exchange -> {
      exchange.getResponseHeaders().add("Location", "/ok");
      exchange.sendResponseHeaders(301, -1);
      exchange.close();
    });
    server.createContext("/slow", exchange -> {
      try {
        Thread.sleep(2000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      exchange.sendResponseHeaders(200, -1);
      exchange.close();
    });
    server.setExecutor(Executors.newCachedThreadPool(new DaemonThreadFactory("test-receiver-")));
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void postsBodyAndHeaders() throws Exception {
    HttpClientTransport transport = new HttpClientTransport();
    byte[] body = "{\"event\":\"content.created\"}".getBytes(StandardCharsets.UTF_8);

    int status = transport.send(new WebhookRequest(uri("/ok"),
        Map.of("Content-Type", "application/json", "X-Signature", "sha256=abc"), body));

    assertEquals(202, status);
    assertEquals("{\"event\":\"content.created\"}", receivedBody.get());
    assertEquals("sha256=abc", receivedHeader.get());
  }

  @Test
  void doesNotFollowRedirects() throws Exception {
    HttpClientTransport transport = new HttpClientTransport();

    int status = transport.send(new WebhookRequest(uri("/moved"), Map.of(), new byte[0]));

    assertEquals(301, status);
    assertNull(receivedBody.get());
  }

  @Test
  void slowReceiverTimesOut() {
    HttpClientTransport transport = new HttpClientTransport(Duration.ofSeconds(1), Duration.ofMillis(200));

    assertThrows(HttpTimeoutException.class, () ->
        transport.send(new WebhookRequest(uri("/slow"), Map.of(), new byte[0])));
  }

  @Test
  void rejectsNonPositiveTimeouts() {
    assertThrows(IllegalArgumentException.class, () -> new HttpClientTransport(Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> new HttpClientTransport(Duration.ofSeconds(1), Duration.ofSeconds(-1)));
    assertEquals(HttpClientTransport.DEFAULT_REQUEST_TIMEOUT, new HttpClientTransport().requestTimeout());
  }

  private URI uri(String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }
}
