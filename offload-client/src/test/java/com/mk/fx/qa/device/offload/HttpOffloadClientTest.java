package com.mk.fx.qa.device.offload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpOffloadClientTest {

  private HttpServer server;
  private String baseUrl;
  private final List<String> bodies = new CopyOnWriteArrayList<>();
  private final CountDownLatch slowCallArrived = new CountDownLatch(1);
  private final ExecutorService handlers = Executors.newCachedThreadPool();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext(
        "/v1/devices",
        exchange -> {
          var path = exchange.getRequestURI().getPath();
          bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          if (path.equals("/v1/devices")) {
            respond(exchange, 201, "{}");
          } else if (path.startsWith("/v1/devices/device-ok")) {
            respond(exchange, 200, "42");
          } else if (path.startsWith("/v1/devices/device-slow")) {
            slowCallArrived.countDown();
            try {
              TimeUnit.SECONDS.sleep(20);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          } else {
            respond(exchange, 500, "node crashed");
          }
        });
    server.setExecutor(handlers);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
    handlers.shutdownNow();
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @Test
  void call_successfulOffload_returnsSuccessWithResult() throws Exception {
    var client = new HttpOffloadClient(baseUrl, 2, Map.of("X-Token", "t"));

    try (var session = client.open(Map.of("ID", "device-ok", "FLAVOUR", "GlobalOptimizer"))) {
      var response = session.call(OffloadRequest.of("stress", Map.of("duration", 1)));

      assertThat(response.isSuccess()).isTrue();
      assertThat(response.result()).isEqualTo("42");
      assertThat(response.numericResult()).contains(42.0);
      assertThat(response.latency().isNegative()).isFalse();
    }

    assertThat(bodies.get(0)).contains("\"FLAVOUR\":\"GlobalOptimizer\"");
    assertThat(bodies.get(1)).contains("\"function\":\"stress\"");
  }

  @Test
  void call_serverError_returnsFailureWithStatusAndBody() throws Exception {
    var client = new HttpOffloadClient(baseUrl, 2, Map.of());

    try (var session = client.open(Map.of("ID", "device-bad"))) {
      var response = session.call(OffloadRequest.of("stress", Map.of()));

      assertThat(response.status()).isEqualTo(OffloadStatus.FAILURE);
      assertThat(response.errorMessage()).contains("500").contains("node crashed");
    }
  }

  @Test
  void call_interrupted_throwsInterruptedException() throws Exception {
    var client = new HttpOffloadClient(baseUrl, 2, 60, Map.of());
    var caller = Executors.newSingleThreadExecutor();
    try (var session = client.open(Map.of("ID", "device-slow"))) {
      Future<OffloadResponse> pending =
          caller.submit(() -> session.call(OffloadRequest.of("stress", Map.of("duration", 1))));
      assertThat(slowCallArrived.await(10, TimeUnit.SECONDS)).isTrue();

      caller.shutdownNow();

      assertThatThrownBy(() -> pending.get(10, TimeUnit.SECONDS))
          .hasCauseInstanceOf(InterruptedException.class);
    } finally {
      caller.shutdownNow();
    }
  }

  @Test
  void open_unreachableFrontend_throwsOffloadException() {
    var client = new HttpOffloadClient("http://127.0.0.1:1", 1, Map.of());

    assertThatThrownBy(() -> client.open(Map.of("ID", "device-x")))
        .isInstanceOf(OffloadException.class)
        .hasMessageContaining("/v1/devices");
  }

  @Test
  void open_requirementsWithoutId_rejected() {
    var client = new HttpOffloadClient(baseUrl, 1, Map.of());

    assertThatThrownBy(() -> client.open(Map.of("FLAVOUR", "x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_blankBaseUrl_rejected() {
    assertThatThrownBy(() -> new HttpOffloadClient("  ", 1, Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
