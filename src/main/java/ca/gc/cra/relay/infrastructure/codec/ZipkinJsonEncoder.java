package ca.gc.cra.relay.infrastructure.codec;

import ca.gc.cra.relay.domain.signal.AttributeMaps;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Encodes spans as a Zipkin v2 JSON array, the format accepted by the Jaeger collector's Zipkin-compatible
 * intake.
 * <p>Timestamps and durations are written in microseconds. The service name comes from the {@code service.name}
 * resource attribute; resource and span attributes both become tags, span attributes winning on conflict. A span
 * in {@code ERROR} status carries an {@code error} tag.</p>
 */
public final class ZipkinJsonEncoder {
  static final String UNKNOWN_SERVICE = "unknown_service";

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Encodes spans.
   *
   * @param spans spans in batch order
   * @return UTF-8 JSON array
   */
  public byte[] encode(List<SpanSignal> spans) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(64 + spans.size() * 256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartArray();
      for (SpanSignal span : spans) {
        writeSpan(gen, span);
      }
      gen.writeEndArray();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode Zipkin spans", ex);
    }
    return out.toByteArray();
  }

  private static void writeSpan(JsonGenerator gen, SpanSignal span) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("traceId", span.traceId());
    gen.writeStringField("id", span.spanId());
    if (!span.isRoot()) {
      gen.writeStringField("parentId", span.parentSpanId());
    }
    gen.writeStringField("name", span.name());
    String kind = zipkinKind(span.kind());
    if (kind != null) {
      gen.writeStringField("kind", kind);
    }
    gen.writeNumberField("timestamp", span.startNanos() / 1_000L);
    // zipkin rejects zero durations
    gen.writeNumberField("duration", Math.max(1L, span.durationNanos() / 1_000L));
    gen.writeObjectFieldStart("localEndpoint");
    gen.writeStringField("serviceName", AttributeMaps.stringValue(span.resource(), "service.name", UNKNOWN_SERVICE));
    gen.writeEndObject();
    gen.writeObjectFieldStart("tags");
    for (Map.Entry<String, Object> entry : span.resource().entrySet()) {
      if (!span.attributes().containsKey(entry.getKey()) && !"service.name".equals(entry.getKey())) {
        gen.writeStringField(entry.getKey(), String.valueOf(entry.getValue()));
      }
    }
    for (Map.Entry<String, Object> entry : span.attributes().entrySet()) {
      gen.writeStringField(entry.getKey(), String.valueOf(entry.getValue()));
    }
    if (!span.scope().isEmpty()) {
      gen.writeStringField("otel.scope.name", span.scope());
    }
    if (span.status() == SpanSignal.Status.ERROR) {
      gen.writeStringField("error", span.statusMessage().isEmpty() ? "true" : span.statusMessage());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static String zipkinKind(SpanSignal.Kind kind) {
    return switch (kind) {
      case SERVER -> "SERVER";
      case CLIENT -> "CLIENT";
      case PRODUCER -> "PRODUCER";
      case CONSUMER -> "CONSUMER";
      case UNSPECIFIED, INTERNAL -> null;
    };
  }
}
