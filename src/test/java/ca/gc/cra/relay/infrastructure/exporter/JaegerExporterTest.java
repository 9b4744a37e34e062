package ca.gc.cra.relay.infrastructure.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import ca.gc.cra.relay.infrastructure.codec.ZipkinJsonEncoder;
import ca.gc.cra.relay.testutil.StubHttpServer;
import ca.gc.cra.relay.testutil.TestSignals;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JaegerExporterTest {

  @Test
  void encodesZipkinV2Spans() throws IOException {
    SpanSignal child = new SpanSignal(TestSignals.TRACE_ID, TestSignals.spanId(2), TestSignals.spanId(1),
        "SELECT orders", SpanSignal.Kind.CLIENT, 2_000_000L, 3_500_000L, SpanSignal.Status.ERROR, "timeout",
        "jdbc", Map.of("service.name", "checkout", "host.name", "web-1"), Map.of("db.system", "postgresql"));

    String json = new String(new ZipkinJsonEncoder().encode(List.of(child)), StandardCharsets.UTF_8);
    Map<String, String> fields = topLevelFields(json);

    assertTrue(json.startsWith("[{"), json);
    assertEquals(TestSignals.TRACE_ID, fields.get("traceId"));
    assertEquals(TestSignals.spanId(2), fields.get("id"));
    assertEquals(TestSignals.spanId(1), fields.get("parentId"));
    assertEquals("CLIENT", fields.get("kind"));
    assertEquals("2000", fields.get("timestamp"));
    assertEquals("1500", fields.get("duration"));
    assertTrue(json.contains("\"localEndpoint\":{\"serviceName\":\"checkout\"}"), json);
    assertTrue(json.contains("\"db.system\":\"postgresql\""), json);
    assertTrue(json.contains("\"host.name\":\"web-1\""), json);
    assertTrue(json.contains("\"error\":\"timeout\""), json);
  }

  @Test
  void rootSpansOmitParentAndInternalKind() throws IOException {
    SpanSignal root = new SpanSignal(TestSignals.TRACE_ID, TestSignals.spanId(1), "", "job",
        SpanSignal.Kind.INTERNAL, 10_000L, 10_000L, SpanSignal.Status.UNSET, "", "", Map.of(), Map.of());

    String json = new String(new ZipkinJsonEncoder().encode(List.of(root)), StandardCharsets.UTF_8);
    Map<String, String> fields = topLevelFields(json);

    assertFalse(fields.containsKey("parentId"));
    assertFalse(fields.containsKey("kind"));
    assertEquals("1", fields.get("duration"), "zero durations are clamped");
    assertTrue(json.contains("\"serviceName\":\"unknown_service\""), json);
  }

  @Test
  void postsToZipkinSpansPath() throws Exception {
    try (StubHttpServer server = new StubHttpServer()) {
      JaegerExporter exporter = new JaegerExporter("jaeger",
          new HttpTransport("jaeger", HttpTransport.Settings.of(URI.create(server.baseUrl()))),
          new ZipkinJsonEncoder());
      exporter.start();

      exporter.export(TestSignals.traceBatch(2));

      assertEquals(Set.of(SignalType.TRACES), exporter.supportedTypes());
      assertEquals(JaegerExporter.SPANS_PATH, server.requests().get(0).path());
      assertTrue(server.requests().get(0).body().startsWith("[{\"traceId\""));
    }
  }

  private static Map<String, String> topLevelFields(String json) throws IOException {
    Map<String, String> fields = new LinkedHashMap<>();
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      parser.nextToken();
      parser.nextToken();
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String name = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (value.isStructStart()) {
          parser.skipChildren();
        } else {
          fields.put(name, parser.getText());
        }
      }
    }
    return fields;
  }
}
