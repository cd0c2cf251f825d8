package com.flamingo.ai.regdocs.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.regdocs.config.RegDocsConfig;
import com.flamingo.ai.regdocs.exception.ResourceFetchException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WebFetcher")
class WebFetcherTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private final AtomicReference<String> lastUserAgent = new AtomicReference<>();

  private HttpServer server;
  private WebFetcher fetcher;
  private String baseUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/page", exchange -> respond(exchange, 200, "text/html", "<a href=\"/doc.pdf\">EPAR</a>"));
    server.createContext(
        "/doc.pdf", exchange -> respond(exchange, 200, "application/pdf", "%PDF-1.4"));
    server.createContext(
        "/missing", exchange -> respond(exchange, 404, "text/plain", "not found"));
    server.createContext(
        "/moved",
        exchange -> {
          exchange.getResponseHeaders().add("Location", "/doc.pdf");
          respond(exchange, 302, "text/plain", "");
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    fetcher = new WebFetcher(new RegDocsConfig());
  }

  @AfterEach
  void tearDown() {
    fetcher.close();
    server.stop(0);
  }

  @Test
  void shouldReturnBodyAndContentType_withBrowserUserAgent() {
    FetchResponse response = fetcher.get(baseUrl + "/page", TIMEOUT);

    assertThat(response.isOk()).isTrue();
    assertThat(response.isPdf()).isFalse();
    assertThat(response.bodyAsString()).contains("EPAR");
    assertThat(lastUserAgent.get()).contains("Mozilla/5.0");
  }

  @Test
  void shouldFollowRedirects() {
    FetchResponse response = fetcher.get(baseUrl + "/moved", TIMEOUT);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.isPdf()).isTrue();
    assertThat(response.bodyAsString()).isEqualTo("%PDF-1.4");
  }

  @Test
  void shouldReturnErrorStatuses_fromGet_butThrowFromGetOk() {
    assertThat(fetcher.get(baseUrl + "/missing", TIMEOUT).statusCode()).isEqualTo(404);

    assertThatThrownBy(() -> fetcher.getOk(baseUrl + "/missing", TIMEOUT))
        .isInstanceOf(ResourceFetchException.class)
        .extracting(e -> ((ResourceFetchException) e).getStatusCode())
        .isEqualTo(404);
  }

  @Test
  void shouldWrapTransportFailures() throws IOException {
    int freePort;
    try (ServerSocket socket = new ServerSocket(0)) {
      freePort = socket.getLocalPort();
    }
    String unreachable = "http://127.0.0.1:" + freePort + "/page";

    assertThatThrownBy(() -> fetcher.get(unreachable, TIMEOUT))
        .isInstanceOf(ResourceFetchException.class);
  }

  private void respond(HttpExchange exchange, int status, String contentType, String body)
      throws IOException {
    lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", contentType);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
