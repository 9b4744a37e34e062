package ca.gc.cra.relay.infrastructure.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.ExportTransientException;
import ca.gc.cra.relay.testutil.StubHttpServer;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HttpTransportTest {

  @Test
  void successIsNotAnError() {
    assertNull(HttpTransport.classify(200, "POST /v1/traces", ""));
    assertNull(HttpTransport.classify(204, "POST /v1/traces", null));
  }

  @ParameterizedTest
  @ValueSource(ints = {408, 429, 500, 502, 503, 504})
  void retryableStatusesAreTransient(int status) {
    assertInstanceOf(ExportTransientException.class, HttpTransport.classify(status, "POST x", "busy"));
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 401, 403, 404, 413})
  void clientErrorsAreTerminal(int status) {
    assertInstanceOf(ExportTerminalException.class, HttpTransport.classify(status, "POST x", "bad"));
  }

  @Test
  void messageCarriesStatusAndBody() {
    String message = HttpTransport.classify(400, "POST http://h/v1/logs", "field missing").getMessage();

    assertTrue(message.contains("HTTP 400"), message);
    assertTrue(message.contains("field missing"), message);
  }

  @Test
  void endpointNormalization() {
    assertEquals(URI.create("http://collector:4318"), HttpTransport.endpointUri("collector:4318", true));
    assertEquals(URI.create("https://collector:4318"), HttpTransport.endpointUri("collector:4318", false));
    assertEquals(URI.create("http://jaeger:9411"), HttpTransport.endpointUri(" http://jaeger:9411 ", false));
    assertThrows(IllegalArgumentException.class, () -> HttpTransport.endpointUri("ftp://host", true));
  }

  @Test
  void postsWithConfiguredHeadersAndGzip() throws Exception {
    try (StubHttpServer server = new StubHttpServer()) {
      HttpTransport transport = new HttpTransport("otlp", new HttpTransport.Settings(
          URI.create(server.baseUrl() + "/"), Map.of("x-api-key", "secret"), Duration.ofSeconds(2), true, false,
          null));
      transport.start();

      transport.post(transport.resolve("/v1/traces"), "application/json", Map.of("x-extra", "1"),
          "{\"a\":1}".getBytes(StandardCharsets.UTF_8));

      StubHttpServer.Request request = server.requests().get(0);
      assertEquals("/v1/traces", request.path());
      assertEquals("secret", request.headers().getFirst("x-api-key"));
      assertEquals("1", request.headers().getFirst("x-extra"));
      assertEquals("gzip", request.headers().getFirst("Content-Encoding"));
      assertEquals("{\"a\":1}", request.body());
    }
  }

  @Test
  void serverErrorSurfacesAsTransient() throws Exception {
    try (StubHttpServer server = new StubHttpServer().respond(503)) {
      HttpTransport transport = new HttpTransport("otlp", HttpTransport.Settings.of(URI.create(server.baseUrl())));
      transport.start();

      assertThrows(ExportTransientException.class, () -> transport.post(
          transport.resolve("/v1/logs"), "application/json", Map.of(), new byte[0]));
    }
  }

  @Test
  void refusedConnectionIsTransient() throws Exception {
    URI closed = URI.create("http://127.0.0.1:" + StubHttpServer.closedPort());
    HttpTransport transport = new HttpTransport("otlp", new HttpTransport.Settings(
        closed, Map.of(), Duration.ofSeconds(1), false, false, null));
    transport.start();

    assertThrows(ExportTransientException.class, transport::checkReachable);
    assertThrows(ExportTransientException.class,
        () -> transport.post(closed, "application/json", Map.of(), new byte[0]));
  }

  @Test
  void postBeforeStartIsTerminal() {
    HttpTransport transport = new HttpTransport("otlp", HttpTransport.Settings.of(URI.create("http://localhost:1")));

    assertThrows(ExportTerminalException.class,
        () -> transport.post(URI.create("http://localhost:1"), "application/json", Map.of(), new byte[0]));
  }
}
