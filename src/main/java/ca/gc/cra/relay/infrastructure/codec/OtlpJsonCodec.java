package ca.gc.cra.relay.infrastructure.codec;

import ca.gc.cra.relay.domain.signal.LogSignal;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the OTLP/JSON encoding of traces, metrics and logs.
 * <p>Decoding accepts 64-bit integers and nanosecond timestamps either as JSON numbers or decimal strings, and
 * enum fields either as numbers or as their proto names ({@code SPAN_KIND_SERVER}). Encoding writes the canonical
 * form: decimal strings for 64-bit values, lowercase hex ids, signals grouped per distinct resource.</p>
 * <p>Parsing uses a Jackson {@link ObjectMapper} tree; encoding streams through a {@link JsonGenerator}. Stateless and
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class OtlpJsonCodec {
  private final ObjectMapper mapper = JsonMapper.builder()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();
  private final JsonFactory jsonFactory = mapper.getFactory();

  /**
   * Decodes one OTLP/JSON export request.
   *
   * @param type signal type the request carries
   * @param payload UTF-8 JSON document
   * @return decoded signals in document order
   * @throws DecodeException if the payload is not valid OTLP/JSON for {@code type}
   */
  public List<Signal> decode(SignalType type, byte[] payload) throws DecodeException {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
    JsonNode document;
    try {
      document = mapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new DecodeException("Invalid JSON payload: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new DecodeException("Invalid JSON payload: " + ex.getMessage(), ex);
    }
    return decodeTree(type, document);
  }

  /**
   * Parses a JSON document held in a string, such as one line of a stream.
   *
   * @param json document text
   * @return parsed tree
   * @throws DecodeException when the text is not a single well-formed JSON value
   */
  public JsonNode parse(String json) throws DecodeException {
    Objects.requireNonNull(json, "json");
    JsonNode document;
    try {
      document = mapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new DecodeException("Invalid JSON payload: " + ex.getOriginalMessage(), ex);
    }
    if (document == null || document.isMissingNode()) {
      throw new DecodeException("Empty JSON payload");
    }
    return document;
  }

  /**
   * Decodes an already parsed OTLP/JSON document.
   *
   * @param type signal type the document carries
   * @param document parsed JSON tree
   * @return decoded signals in document order
   * @throws DecodeException if the document is not valid OTLP/JSON for {@code type}
   */
  public List<Signal> decodeTree(SignalType type, JsonNode document) throws DecodeException {
    if (document == null || document.isMissingNode()) {
      throw new DecodeException("Empty JSON payload");
    }
    JsonNode root = object(document, "request");
    try {
      return switch (type) {
        case TRACES -> decodeTraces(root);
        case METRICS -> decodeMetrics(root);
        case LOGS -> decodeLogs(root);
      };
    } catch (IllegalArgumentException ex) {
      throw new DecodeException("Invalid " + type.path() + " payload: " + ex.getMessage(), ex);
    }
  }

  /**
   * Encodes signals as one OTLP/JSON export request.
   *
   * @param type signal type of every element
   * @param signals signals to encode
   * @return UTF-8 JSON document
   */
  public byte[] encode(SignalType type, List<? extends Signal> signals) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256 + signals.size() * 192);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      write(gen, type, signals);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode OTLP/JSON", ex);
    }
    return out.toByteArray();
  }

  /**
   * Writes signals as one OTLP/JSON export request object to an open generator.
   *
   * @param gen generator positioned where a value may be written
   * @param type signal type of every element
   * @param signals signals to encode
   * @throws IOException if the generator fails
   */
  public void write(JsonGenerator gen, SignalType type, List<? extends Signal> signals) throws IOException {
    gen.writeStartObject();
    switch (type) {
      case TRACES -> writeTraces(gen, signals);
      case METRICS -> writeMetrics(gen, signals);
      case LOGS -> writeLogs(gen, signals);
    }
    gen.writeEndObject();
  }

  // ---- decoding ------------------------------------------------------------------------------

  private List<Signal> decodeTraces(JsonNode root) throws DecodeException {
    List<Signal> result = new ArrayList<>();
    JsonNode resources = array(root, "resourceSpans", "request");
    for (int r = 0; r < resources.size(); r++) {
      String rctx = "resourceSpans[" + r + "]";
      JsonNode resourceSpans = object(resources.get(r), rctx);
      Map<String, Object> resource = resourceAttributes(resourceSpans, rctx);
      JsonNode scopes = array(resourceSpans, "scopeSpans", rctx);
      for (int s = 0; s < scopes.size(); s++) {
        String sctx = rctx + ".scopeSpans[" + s + "]";
        JsonNode scopeSpans = object(scopes.get(s), sctx);
        String scope = text(child(scopeSpans, "scope", sctx), "name");
        JsonNode spans = array(scopeSpans, "spans", sctx);
        for (int i = 0; i < spans.size(); i++) {
          String ctx = sctx + ".spans[" + i + "]";
          result.add(decodeSpan(object(spans.get(i), ctx), ctx, scope, resource));
        }
      }
    }
    return result;
  }

  private SpanSignal decodeSpan(JsonNode span, String ctx, String scope, Map<String, Object> resource)
      throws DecodeException {
    JsonNode status = child(span, "status", ctx);
    long start = longValue(span, "startTimeUnixNano", 0L, ctx);
    long end = longValue(span, "endTimeUnixNano", start, ctx);
    return new SpanSignal(
        text(span, "traceId"),
        text(span, "spanId"),
        text(span, "parentSpanId"),
        text(span, "name"),
        SpanSignal.Kind.fromCode(enumCode(span.get("kind"), "SPAN_KIND_", SpanSignal.Kind.values(), ctx + ".kind")),
        start,
        end,
        SpanSignal.Status.fromCode(
            enumCode(status.get("code"), "STATUS_CODE_", SpanSignal.Status.values(), ctx + ".status.code")),
        text(status, "message"),
        scope,
        resource,
        attributes(span, ctx));
  }

  private List<Signal> decodeMetrics(JsonNode root) throws DecodeException {
    List<Signal> result = new ArrayList<>();
    JsonNode resources = array(root, "resourceMetrics", "request");
    for (int r = 0; r < resources.size(); r++) {
      String rctx = "resourceMetrics[" + r + "]";
      JsonNode resourceMetrics = object(resources.get(r), rctx);
      Map<String, Object> resource = resourceAttributes(resourceMetrics, rctx);
      JsonNode scopes = array(resourceMetrics, "scopeMetrics", rctx);
      for (int s = 0; s < scopes.size(); s++) {
        String sctx = rctx + ".scopeMetrics[" + s + "]";
        JsonNode metrics = array(object(scopes.get(s), sctx), "metrics", sctx);
        for (int m = 0; m < metrics.size(); m++) {
          String mctx = sctx + ".metrics[" + m + "]";
          decodeMetric(object(metrics.get(m), mctx), mctx, resource, result);
        }
      }
    }
    return result;
  }

  private void decodeMetric(JsonNode metric, String ctx, Map<String, Object> resource, List<Signal> out)
      throws DecodeException {
    String name = text(metric, "name");
    String description = text(metric, "description");
    String unit = text(metric, "unit");
    MetricSignal.Kind kind;
    JsonNode data;
    boolean monotonic = false;
    if (metric.has("gauge")) {
      kind = MetricSignal.Kind.GAUGE;
      data = child(metric, "gauge", ctx);
    } else if (metric.has("sum")) {
      kind = MetricSignal.Kind.SUM;
      data = child(metric, "sum", ctx);
      monotonic = data.path("isMonotonic").asBoolean(false);
    } else if (metric.has("histogram")) {
      kind = MetricSignal.Kind.HISTOGRAM;
      data = child(metric, "histogram", ctx);
    } else {
      throw new DecodeException(ctx + " has no gauge, sum or histogram data");
    }
    JsonNode points = array(data, "dataPoints", ctx);
    for (int p = 0; p < points.size(); p++) {
      String pctx = ctx + ".dataPoints[" + p + "]";
      JsonNode point = object(points.get(p), pctx);
      long time = longValue(point, "timeUnixNano", 0L, pctx);
      Map<String, Object> attributes = attributes(point, pctx);
      if (kind == MetricSignal.Kind.HISTOGRAM) {
        long count = longValue(point, "count", 0L, pctx);
        double sum = point.has("sum") ? doubleValue(point, "sum", pctx) : 0d;
        double mean = count == 0 ? 0d : sum / count;
        out.add(new MetricSignal(name, description, unit, kind, false, mean, count, sum, time, resource, attributes));
      } else {
        double value;
        if (point.has("asDouble")) {
          value = doubleValue(point, "asDouble", pctx);
        } else if (point.has("asInt")) {
          value = longValue(point, "asInt", 0L, pctx);
        } else {
          throw new DecodeException(pctx + " has neither asDouble nor asInt");
        }
        out.add(new MetricSignal(name, description, unit, kind, monotonic, value, 0, 0d, time, resource, attributes));
      }
    }
  }

  private List<Signal> decodeLogs(JsonNode root) throws DecodeException {
    List<Signal> result = new ArrayList<>();
    JsonNode resources = array(root, "resourceLogs", "request");
    for (int r = 0; r < resources.size(); r++) {
      String rctx = "resourceLogs[" + r + "]";
      JsonNode resourceLogs = object(resources.get(r), rctx);
      Map<String, Object> resource = resourceAttributes(resourceLogs, rctx);
      JsonNode scopes = array(resourceLogs, "scopeLogs", rctx);
      for (int s = 0; s < scopes.size(); s++) {
        String sctx = rctx + ".scopeLogs[" + s + "]";
        JsonNode records = array(object(scopes.get(s), sctx), "logRecords", sctx);
        for (int i = 0; i < records.size(); i++) {
          String ctx = sctx + ".logRecords[" + i + "]";
          JsonNode record = object(records.get(i), ctx);
          long time = longValue(record, "timeUnixNano", 0L, ctx);
          if (time == 0L) {
            time = longValue(record, "observedTimeUnixNano", 0L, ctx);
          }
          Object body = anyValue(child(record, "body", ctx), ctx + ".body");
          result.add(new LogSignal(
              time,
              enumCode(record.get("severityNumber"), "SEVERITY_NUMBER_", null, ctx + ".severityNumber"),
              text(record, "severityText"),
              body == null ? "" : body.toString(),
              text(record, "traceId").toLowerCase(Locale.ROOT),
              text(record, "spanId").toLowerCase(Locale.ROOT),
              resource,
              attributes(record, ctx)));
        }
      }
    }
    return result;
  }

  private Map<String, Object> resourceAttributes(JsonNode parent, String ctx) throws DecodeException {
    return attributes(child(parent, "resource", ctx), ctx + ".resource");
  }

  private Map<String, Object> attributes(JsonNode parent, String ctx) throws DecodeException {
    JsonNode entries = array(parent, "attributes", ctx);
    if (entries.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> result = new LinkedHashMap<>();
    for (int i = 0; i < entries.size(); i++) {
      String actx = ctx + ".attributes[" + i + "]";
      JsonNode entry = object(entries.get(i), actx);
      String key = text(entry, "key");
      if (key.isBlank()) {
        throw new DecodeException(actx + " has no key");
      }
      Object value = anyValue(child(entry, "value", actx), actx + ".value");
      if (value != null) {
        result.put(key, value);
      }
    }
    return result;
  }

  private Object anyValue(JsonNode value, String ctx) throws DecodeException {
    if (value.isEmpty()) {
      return null;
    }
    if (value.has("stringValue")) {
      return text(value, "stringValue");
    }
    if (value.has("boolValue")) {
      JsonNode raw = value.get("boolValue");
      return raw.isBoolean() ? raw.booleanValue() : Boolean.parseBoolean(raw.asText());
    }
    if (value.has("intValue")) {
      return longValue(value, "intValue", 0L, ctx);
    }
    if (value.has("doubleValue")) {
      return doubleValue(value, "doubleValue", ctx);
    }
    if (value.has("arrayValue") || value.has("kvlistValue") || value.has("bytesValue")) {
      // composite values are flattened to text
      JsonNode composite = value.elements().next();
      return composite.isTextual() ? composite.textValue() : composite.toString();
    }
    return null;
  }

  private static JsonNode object(JsonNode node, String ctx) throws DecodeException {
    if (node == null || !node.isObject()) {
      throw new DecodeException(ctx + " must be a JSON object");
    }
    return node;
  }

  private static JsonNode child(JsonNode parent, String field, String ctx) throws DecodeException {
    JsonNode value = parent.get(field);
    if (value == null || value.isNull()) {
      return MissingNode.getInstance();
    }
    return object(value, ctx + "." + field);
  }

  private static JsonNode array(JsonNode parent, String field, String ctx) throws DecodeException {
    JsonNode value = parent.get(field);
    if (value == null || value.isNull()) {
      return MissingNode.getInstance();
    }
    if (!value.isArray()) {
      throw new DecodeException(ctx + "." + field + " must be a JSON array");
    }
    return value;
  }

  private static String text(JsonNode parent, String field) {
    JsonNode value = parent.get(field);
    if (value == null || value.isNull()) {
      return "";
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }

  // 64-bit integers arrive as JSON numbers or as decimal strings.
  private static long longValue(JsonNode parent, String field, long fallback, String ctx) throws DecodeException {
    JsonNode value = parent.get(field);
    if (value == null || value.isNull()) {
      return fallback;
    }
    if (value.isIntegralNumber()) {
      if (!value.canConvertToLong()) {
        throw new DecodeException(ctx + "." + field + " is outside the 64-bit range (was " + value + ")");
      }
      return value.longValue();
    }
    if (value.isTextual()) {
      try {
        return Long.parseLong(value.textValue().trim());
      } catch (NumberFormatException ex) {
        throw new DecodeException(ctx + "." + field + " must be a 64-bit integer (was " + value + ")", ex);
      }
    }
    throw new DecodeException(ctx + "." + field + " must be an integer (was " + value + ")");
  }

  private static double doubleValue(JsonNode parent, String field, String ctx) throws DecodeException {
    JsonNode value = parent.get(field);
    if (value != null && value.isNumber()) {
      return value.doubleValue();
    }
    if (value != null && value.isTextual()) {
      try {
        return Double.parseDouble(value.textValue().trim());
      } catch (NumberFormatException ex) {
        throw new DecodeException(ctx + "." + field + " must be a number (was " + value + ")", ex);
      }
    }
    throw new DecodeException(ctx + "." + field + " must be a number (was " + value + ")");
  }

  private static int enumCode(JsonNode raw, String prefix, Enum<?>[] names, String ctx) throws DecodeException {
    if (raw == null || raw.isNull()) {
      return 0;
    }
    if (raw.isNumber()) {
      return raw.intValue();
    }
    String text = raw.asText().trim();
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException ignored) {
      // fall through to the symbolic form
    }
    String symbol = text.toUpperCase(Locale.ROOT);
    if (symbol.startsWith(prefix)) {
      symbol = symbol.substring(prefix.length());
    }
    if (names != null) {
      for (Enum<?> candidate : names) {
        if (candidate.name().equals(symbol)) {
          return candidate.ordinal();
        }
      }
    } else {
      Integer severity = SEVERITIES.get(symbol);
      if (severity != null) {
        return severity;
      }
    }
    throw new DecodeException(ctx + " has unknown value " + text);
  }

  private static final Map<String, Integer> SEVERITIES = severities();

  private static Map<String, Integer> severities() {
    Map<String, Integer> map = new LinkedHashMap<>();
    map.put("UNSPECIFIED", 0);
    String[] levels = {"TRACE", "DEBUG", "INFO", "WARN", "ERROR", "FATAL"};
    for (int level = 0; level < levels.length; level++) {
      for (int step = 1; step <= 4; step++) {
        int number = level * 4 + step;
        map.put(step == 1 ? levels[level] : levels[level] + step, number);
      }
    }
    return Map.copyOf(map);
  }

  // ---- encoding ------------------------------------------------------------------------------

  private void writeTraces(JsonGenerator gen, List<? extends Signal> signals) throws IOException {
    gen.writeArrayFieldStart("resourceSpans");
    for (Map.Entry<Map<String, Object>, List<Signal>> group : byResource(signals).entrySet()) {
      gen.writeStartObject();
      writeResource(gen, group.getKey());
      gen.writeArrayFieldStart("scopeSpans");
      Map<String, List<SpanSignal>> byScope = new LinkedHashMap<>();
      for (Signal signal : group.getValue()) {
        SpanSignal span = (SpanSignal) signal;
        byScope.computeIfAbsent(span.scope(), k -> new ArrayList<>()).add(span);
      }
      for (Map.Entry<String, List<SpanSignal>> scope : byScope.entrySet()) {
        gen.writeStartObject();
        gen.writeObjectFieldStart("scope");
        gen.writeStringField("name", scope.getKey());
        gen.writeEndObject();
        gen.writeArrayFieldStart("spans");
        for (SpanSignal span : scope.getValue()) {
          writeSpan(gen, span);
        }
        gen.writeEndArray();
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private void writeSpan(JsonGenerator gen, SpanSignal span) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("traceId", span.traceId());
    gen.writeStringField("spanId", span.spanId());
    if (!span.parentSpanId().isEmpty()) {
      gen.writeStringField("parentSpanId", span.parentSpanId());
    }
    gen.writeStringField("name", span.name());
    gen.writeNumberField("kind", span.kind().ordinal());
    gen.writeStringField("startTimeUnixNano", Long.toString(span.startNanos()));
    gen.writeStringField("endTimeUnixNano", Long.toString(span.endNanos()));
    writeAttributes(gen, span.attributes());
    gen.writeObjectFieldStart("status");
    gen.writeNumberField("code", span.status().ordinal());
    if (!span.statusMessage().isEmpty()) {
      gen.writeStringField("message", span.statusMessage());
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private void writeMetrics(JsonGenerator gen, List<? extends Signal> signals) throws IOException {
    gen.writeArrayFieldStart("resourceMetrics");
    for (Map.Entry<Map<String, Object>, List<Signal>> group : byResource(signals).entrySet()) {
      gen.writeStartObject();
      writeResource(gen, group.getKey());
      gen.writeArrayFieldStart("scopeMetrics");
      gen.writeStartObject();
      gen.writeArrayFieldStart("metrics");
      for (Signal signal : group.getValue()) {
        writeMetric(gen, (MetricSignal) signal);
      }
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private void writeMetric(JsonGenerator gen, MetricSignal metric) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("name", metric.name());
    if (!metric.description().isEmpty()) {
      gen.writeStringField("description", metric.description());
    }
    if (!metric.unit().isEmpty()) {
      gen.writeStringField("unit", metric.unit());
    }
    switch (metric.kind()) {
      case GAUGE -> gen.writeObjectFieldStart("gauge");
      case SUM -> {
        gen.writeObjectFieldStart("sum");
        gen.writeBooleanField("isMonotonic", metric.monotonic());
        // 2 = AGGREGATION_TEMPORALITY_CUMULATIVE
        gen.writeNumberField("aggregationTemporality", 2);
      }
      case HISTOGRAM -> {
        gen.writeObjectFieldStart("histogram");
        gen.writeNumberField("aggregationTemporality", 2);
      }
    }
    gen.writeArrayFieldStart("dataPoints");
    gen.writeStartObject();
    gen.writeStringField("timeUnixNano", Long.toString(metric.timestampNanos()));
    if (metric.kind() == MetricSignal.Kind.HISTOGRAM) {
      gen.writeStringField("count", Long.toString(metric.count()));
      gen.writeNumberField("sum", metric.sum());
    } else {
      gen.writeNumberField("asDouble", metric.value());
    }
    writeAttributes(gen, metric.attributes());
    gen.writeEndObject();
    gen.writeEndArray();
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private void writeLogs(JsonGenerator gen, List<? extends Signal> signals) throws IOException {
    gen.writeArrayFieldStart("resourceLogs");
    for (Map.Entry<Map<String, Object>, List<Signal>> group : byResource(signals).entrySet()) {
      gen.writeStartObject();
      writeResource(gen, group.getKey());
      gen.writeArrayFieldStart("scopeLogs");
      gen.writeStartObject();
      gen.writeArrayFieldStart("logRecords");
      for (Signal signal : group.getValue()) {
        LogSignal log = (LogSignal) signal;
        gen.writeStartObject();
        gen.writeStringField("timeUnixNano", Long.toString(log.timestampNanos()));
        gen.writeNumberField("severityNumber", log.severityNumber());
        if (!log.severityText().isEmpty()) {
          gen.writeStringField("severityText", log.severityText());
        }
        gen.writeObjectFieldStart("body");
        gen.writeStringField("stringValue", log.body());
        gen.writeEndObject();
        writeAttributes(gen, log.attributes());
        if (!log.traceId().isEmpty()) {
          gen.writeStringField("traceId", log.traceId());
        }
        if (!log.spanId().isEmpty()) {
          gen.writeStringField("spanId", log.spanId());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static Map<Map<String, Object>, List<Signal>> byResource(List<? extends Signal> signals) {
    Map<Map<String, Object>, List<Signal>> groups = new LinkedHashMap<>();
    for (Signal signal : signals) {
      groups.computeIfAbsent(signal.resource(), k -> new ArrayList<>()).add(signal);
    }
    return groups;
  }

  private void writeResource(JsonGenerator gen, Map<String, Object> resource) throws IOException {
    gen.writeObjectFieldStart("resource");
    writeAttributes(gen, resource);
    gen.writeEndObject();
  }

  private void writeAttributes(JsonGenerator gen, Map<String, Object> attributes) throws IOException {
    gen.writeArrayFieldStart("attributes");
    for (Map.Entry<String, Object> entry : attributes.entrySet()) {
      gen.writeStartObject();
      gen.writeStringField("key", entry.getKey());
      gen.writeObjectFieldStart("value");
      Object value = entry.getValue();
      if (value instanceof Boolean b) {
        gen.writeBooleanField("boolValue", b);
      } else if (value instanceof Long l) {
        gen.writeStringField("intValue", Long.toString(l));
      } else if (value instanceof Double d) {
        gen.writeNumberField("doubleValue", d);
      } else {
        gen.writeStringField("stringValue", String.valueOf(value));
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }
}
