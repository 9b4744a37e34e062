package ca.gc.cra.relay.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.signal.LogSignal;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import ca.gc.cra.relay.testutil.OtlpPayloads;
import ca.gc.cra.relay.testutil.TestSignals;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class OtlpJsonCodecTest {
  private final OtlpJsonCodec codec = new OtlpJsonCodec();

  @Test
  void decodesSpansWithResourceAndScope() throws DecodeException {
    List<Signal> signals = codec.decode(SignalType.TRACES, bytes(OtlpPayloads.traces(2)));

    assertEquals(2, signals.size());
    SpanSignal span = (SpanSignal) signals.get(0);
    assertEquals(TestSignals.TRACE_ID, span.traceId());
    assertEquals(TestSignals.spanId(0), span.spanId());
    assertEquals("span-0", span.name());
    assertEquals(SpanSignal.Kind.SERVER, span.kind());
    assertEquals(SpanSignal.Status.OK, span.status());
    assertEquals(5_000_000L, span.durationNanos());
    assertEquals("checkout", span.resource().get("service.name"));
    assertEquals("GET", span.attributes().get("http.method"));
    assertEquals("io.opentelemetry.test", span.scope());
  }

  @Test
  void decodesNumericEnumCodes() throws DecodeException {
    String json = OtlpPayloads.traces(1)
        .replace("\"SPAN_KIND_SERVER\"", "3")
        .replace("\"STATUS_CODE_OK\"", "2");

    SpanSignal span = (SpanSignal) codec.decode(SignalType.TRACES, bytes(json)).get(0);

    assertEquals(SpanSignal.Kind.CLIENT, span.kind());
    assertEquals(SpanSignal.Status.ERROR, span.status());
  }

  @Test
  void decodesGaugesAndLogs() throws DecodeException {
    MetricSignal gauge =
        (MetricSignal) codec.decode(SignalType.METRICS, bytes(OtlpPayloads.gauge("queue.depth", 7.5))).get(0);
    LogSignal log = (LogSignal) codec.decode(SignalType.LOGS, bytes(OtlpPayloads.logs("started"))).get(0);

    assertEquals("queue.depth", gauge.name());
    assertEquals(MetricSignal.Kind.GAUGE, gauge.kind());
    assertEquals(7.5d, gauge.value());
    assertEquals("started", log.body());
    assertEquals(9, log.severityNumber());
  }

  @Test
  void rejectsMalformedDocuments() {
    assertThrows(DecodeException.class, () -> codec.decode(SignalType.TRACES, bytes("{not json")));
    assertThrows(DecodeException.class, () -> codec.decode(SignalType.TRACES, bytes("[1,2]")));
    assertThrows(DecodeException.class,
        () -> codec.decode(SignalType.TRACES, bytes(OtlpPayloads.traces(1).replace(TestSignals.TRACE_ID, "xyz"))));
  }

  @Test
  void syntaxErrorsAndTrailingContentAreReported() {
    DecodeException syntax =
        assertThrows(DecodeException.class, () -> codec.decode(SignalType.LOGS, bytes("{\"resourceLogs\": [")));
    assertTrue(syntax.getMessage().startsWith("Invalid JSON payload: "), syntax.getMessage());
    assertThrows(DecodeException.class, () -> codec.decode(SignalType.LOGS, bytes("{} {}")));
    assertThrows(DecodeException.class, () -> codec.decode(SignalType.LOGS, new byte[0]));
    assertThrows(DecodeException.class, () -> codec.parse("   "));
  }

  @Test
  void timestampsOutsideLongRangeAreRejected() {
    String numeric = OtlpPayloads.logs("late").replace("\"1700000000000000000\"", "92233720368547758070");
    String text = OtlpPayloads.logs("late").replace("1700000000000000000", "92233720368547758070");

    DecodeException fromNumber =
        assertThrows(DecodeException.class, () -> codec.decode(SignalType.LOGS, bytes(numeric)));
    assertTrue(fromNumber.getMessage().contains("timeUnixNano is outside the 64-bit range"), fromNumber.getMessage());
    assertThrows(DecodeException.class, () -> codec.decode(SignalType.LOGS, bytes(text)));
  }

  @Test
  void encodedRequestDecodesToSameSignals() throws DecodeException {
    List<Signal> spans = TestSignals.spans(3);

    List<Signal> decoded = codec.decode(SignalType.TRACES, codec.encode(SignalType.TRACES, spans));

    assertEquals(spans, decoded);
  }

  @Test
  void encodesOtlpFieldNames() {
    String json = new String(codec.encode(SignalType.METRICS, List.of(TestSignals.gauge("cpu", 0.25))),
        StandardCharsets.UTF_8);

    assertTrue(json.startsWith("{\"resourceMetrics\":["), json);
    assertTrue(json.contains("\"asDouble\":0.25"), json);
  }

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }
}
