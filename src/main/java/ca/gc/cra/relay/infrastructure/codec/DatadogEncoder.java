package ca.gc.cra.relay.infrastructure.codec;

import ca.gc.cra.relay.domain.signal.AttributeMaps;
import ca.gc.cra.relay.domain.signal.LogSignal;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Encodes signals for the Datadog intake APIs: metric series (v2), log events and agent traces (v0.3).
 * <p>Attributes become {@code key:value} tags. Trace and span ids are the low 64 bits of the OTLP ids, written as
 * unsigned decimal numbers.</p>
 */
public final class DatadogEncoder {
  // series v2 metric type codes
  static final int TYPE_COUNT = 1;
  static final int TYPE_GAUGE = 3;

  private static final Pattern HEX_ID = Pattern.compile("^[0-9a-fA-F]{16,32}$");

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Encodes metric points as a {@code /api/v2/series} payload. Histograms become a {@code .count} counter and a
   * {@code .sum} gauge.
   *
   * @param metrics metric points
   * @return UTF-8 JSON document
   */
  public byte[] encodeSeries(List<MetricSignal> metrics) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeArrayFieldStart("series");
      for (MetricSignal metric : metrics) {
        long seconds = metric.timestampNanos() / 1_000_000_000L;
        switch (metric.kind()) {
          case GAUGE -> writeSeries(gen, metric.name(), TYPE_GAUGE, seconds, metric.value(), metric);
          case SUM -> writeSeries(
              gen, metric.name(), metric.monotonic() ? TYPE_COUNT : TYPE_GAUGE, seconds, metric.value(), metric);
          case HISTOGRAM -> {
            writeSeries(gen, metric.name() + ".count", TYPE_COUNT, seconds, metric.count(), metric);
            writeSeries(gen, metric.name() + ".sum", TYPE_GAUGE, seconds, metric.sum(), metric);
          }
        }
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  /**
   * Encodes log records as a {@code /api/v2/logs} payload.
   *
   * @param logs log records
   * @return UTF-8 JSON array
   */
  public byte[] encodeLogs(List<LogSignal> logs) {
    return write(gen -> {
      gen.writeStartArray();
      for (LogSignal record : logs) {
        gen.writeStartObject();
        gen.writeStringField("ddsource", "relay");
        gen.writeStringField("ddtags", String.join(",", tags(record.resource(), record.attributes())));
        gen.writeStringField("hostname", AttributeMaps.stringValue(record.resource(), "host.name", ""));
        gen.writeStringField("service", service(record.resource()));
        gen.writeStringField("message", record.body());
        gen.writeStringField("status", record.severityText().isEmpty() ? status(record.severityNumber())
            : record.severityText());
        gen.writeNumberField("timestamp", record.timestampNanos() / 1_000_000L);
        if (HEX_ID.matcher(record.traceId()).matches()) {
          gen.writeStringField("dd.trace_id", lowBits(record.traceId()));
        }
        if (HEX_ID.matcher(record.spanId()).matches()) {
          gen.writeStringField("dd.span_id", lowBits(record.spanId()));
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
    });
  }

  /**
   * Encodes spans as a {@code /v0.3/traces} payload: an array of traces, each an array of spans.
   *
   * @param spans spans in batch order
   * @return UTF-8 JSON array
   */
  public byte[] encodeTraces(List<SpanSignal> spans) {
    Map<String, List<SpanSignal>> traces = new LinkedHashMap<>();
    for (SpanSignal span : spans) {
      traces.computeIfAbsent(span.traceId(), k -> new ArrayList<>()).add(span);
    }
    return write(gen -> {
      gen.writeStartArray();
      for (List<SpanSignal> trace : traces.values()) {
        gen.writeStartArray();
        for (SpanSignal span : trace) {
          writeSpan(gen, span);
        }
        gen.writeEndArray();
      }
      gen.writeEndArray();
    });
  }

  private static void writeSeries(
      JsonGenerator gen, String name, int type, long seconds, double value, MetricSignal metric) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("metric", name);
    gen.writeNumberField("type", type);
    gen.writeArrayFieldStart("points");
    gen.writeStartObject();
    gen.writeNumberField("timestamp", seconds);
    gen.writeNumberField("value", value);
    gen.writeEndObject();
    gen.writeEndArray();
    if (!metric.unit().isEmpty()) {
      gen.writeStringField("unit", metric.unit());
    }
    gen.writeArrayFieldStart("tags");
    for (String tag : tags(metric.resource(), metric.attributes())) {
      gen.writeString(tag);
    }
    gen.writeEndArray();
    String host = AttributeMaps.stringValue(metric.resource(), "host.name", "");
    if (!host.isEmpty()) {
      gen.writeArrayFieldStart("resources");
      gen.writeStartObject();
      gen.writeStringField("name", host);
      gen.writeStringField("type", "host");
      gen.writeEndObject();
      gen.writeEndArray();
    }
    gen.writeEndObject();
  }

  private static void writeSpan(JsonGenerator gen, SpanSignal span) throws IOException {
    gen.writeStartObject();
    gen.writeFieldName("trace_id");
    gen.writeNumber(lowBits(span.traceId()));
    gen.writeFieldName("span_id");
    gen.writeNumber(lowBits(span.spanId()));
    if (!span.isRoot()) {
      gen.writeFieldName("parent_id");
      gen.writeNumber(lowBits(span.parentSpanId()));
    }
    gen.writeStringField("name", span.scope().isEmpty() ? "relay.span" : span.scope());
    gen.writeStringField("resource", span.name());
    gen.writeStringField("service", service(span.resource()));
    gen.writeStringField("type", "custom");
    gen.writeNumberField("start", span.startNanos());
    gen.writeNumberField("duration", span.durationNanos());
    gen.writeNumberField("error", span.status() == SpanSignal.Status.ERROR ? 1 : 0);
    gen.writeObjectFieldStart("meta");
    for (Map.Entry<String, Object> entry : span.resource().entrySet()) {
      gen.writeStringField(entry.getKey(), String.valueOf(entry.getValue()));
    }
    for (Map.Entry<String, Object> entry : span.attributes().entrySet()) {
      gen.writeStringField(entry.getKey(), String.valueOf(entry.getValue()));
    }
    gen.writeStringField("span.kind", span.kind().name().toLowerCase(Locale.ROOT));
    if (span.status() == SpanSignal.Status.ERROR && !span.statusMessage().isEmpty()) {
      gen.writeStringField("error.message", span.statusMessage());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  static String lowBits(String hexId) {
    String low = hexId.length() > 16 ? hexId.substring(hexId.length() - 16) : hexId;
    return Long.toUnsignedString(Long.parseUnsignedLong(low, 16));
  }

  private static String service(Map<String, Object> resource) {
    return AttributeMaps.stringValue(resource, "service.name", ZipkinJsonEncoder.UNKNOWN_SERVICE);
  }

  private static List<String> tags(Map<String, Object> resource, Map<String, Object> attributes) {
    List<String> tags = new ArrayList<>(resource.size() + attributes.size());
    for (Map.Entry<String, Object> entry : resource.entrySet()) {
      tags.add(entry.getKey() + ":" + entry.getValue());
    }
    for (Map.Entry<String, Object> entry : attributes.entrySet()) {
      tags.add(entry.getKey() + ":" + entry.getValue());
    }
    return tags;
  }

  private static String status(int severityNumber) {
    if (severityNumber >= 21) {
      return "critical";
    }
    if (severityNumber >= 17) {
      return "error";
    }
    if (severityNumber >= 13) {
      return "warn";
    }
    if (severityNumber >= 9) {
      return "info";
    }
    return severityNumber == 0 ? "info" : "debug";
  }

  private byte[] write(Body body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(512);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode Datadog payload", ex);
    }
    return out.toByteArray();
  }

  @FunctionalInterface
  private interface Body {
    void write(JsonGenerator gen) throws IOException;
  }
}
