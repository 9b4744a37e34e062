package ca.gc.cra.relay.domain.signal;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Trace span received from an instrumented service.
 *
 * @param traceId 32 lowercase hex characters
 * @param spanId 16 lowercase hex characters
 * @param parentSpanId parent span id, or empty for root spans
 * @param name operation name
 * @param kind span kind
 * @param startNanos start time in epoch nanoseconds
 * @param endNanos end time in epoch nanoseconds; never before {@code startNanos}
 * @param status completion status
 * @param statusMessage optional status description; empty when absent
 * @param scope instrumentation scope name; empty when absent
 * @param resource resource attributes
 * @param attributes span attributes
 * @since 0.1.0
 */
public record SpanSignal(
    String traceId,
    String spanId,
    String parentSpanId,
    String name,
    Kind kind,
    long startNanos,
    long endNanos,
    Status status,
    String statusMessage,
    String scope,
    Map<String, Object> resource,
    Map<String, Object> attributes) implements Signal {

  private static final Pattern TRACE_ID = Pattern.compile("^[0-9a-f]{32}$");
  private static final Pattern SPAN_ID = Pattern.compile("^[0-9a-f]{16}$");

  /**
   * Validates identifiers and timing, normalizing ids to lowercase.
   */
  public SpanSignal {
    traceId = requireId("traceId", traceId, TRACE_ID);
    spanId = requireId("spanId", spanId, SPAN_ID);
    parentSpanId = parentSpanId == null || parentSpanId.isBlank()
        ? ""
        : requireId("parentSpanId", parentSpanId, SPAN_ID);
    name = Objects.requireNonNull(name, "name");
    kind = Objects.requireNonNullElse(kind, Kind.UNSPECIFIED);
    status = Objects.requireNonNullElse(status, Status.UNSET);
    statusMessage = Objects.requireNonNullElse(statusMessage, "");
    scope = Objects.requireNonNullElse(scope, "");
    if (endNanos < startNanos) {
      throw new IllegalArgumentException("span end precedes start for span " + spanId);
    }
    resource = AttributeMaps.copyOf(resource);
    attributes = AttributeMaps.copyOf(attributes);
  }

  @Override
  public SignalType type() {
    return SignalType.TRACES;
  }

  @Override
  public long timestampNanos() {
    return startNanos;
  }

  /**
   * Returns the span duration.
   *
   * @return elapsed nanoseconds between start and end
   */
  public long durationNanos() {
    return endNanos - startNanos;
  }

  /**
   * Indicates whether this span has no parent.
   *
   * @return {@code true} for root spans
   */
  public boolean isRoot() {
    return parentSpanId.isEmpty();
  }

  @Override
  public SpanSignal withAttributes(Map<String, Object> replacement) {
    return new SpanSignal(
        traceId, spanId, parentSpanId, name, kind, startNanos, endNanos, status, statusMessage,
        scope, resource, replacement);
  }

  private static String requireId(String field, String value, Pattern pattern) {
    if (value == null) {
      throw new IllegalArgumentException(field + " must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!pattern.matcher(normalized).matches()) {
      throw new IllegalArgumentException(field + " is not a valid hex identifier: " + value);
    }
    return normalized;
  }

  /** Span kinds as defined by OTLP. */
  public enum Kind {
    UNSPECIFIED,
    INTERNAL,
    SERVER,
    CLIENT,
    PRODUCER,
    CONSUMER;

    /**
     * Maps the OTLP numeric kind to an enum constant.
     *
     * @param code OTLP {@code SpanKind} number
     * @return matching kind, or {@link #UNSPECIFIED} when out of range
     */
    public static Kind fromCode(int code) {
      Kind[] values = values();
      return code >= 0 && code < values.length ? values[code] : UNSPECIFIED;
    }
  }

  /** Span completion status codes as defined by OTLP. */
  public enum Status {
    UNSET,
    OK,
    ERROR;

    /**
     * Maps the OTLP numeric status to an enum constant.
     *
     * @param code OTLP {@code StatusCode} number
     * @return matching status, or {@link #UNSET} when out of range
     */
    public static Status fromCode(int code) {
      Status[] values = values();
      return code >= 0 && code < values.length ? values[code] : UNSET;
    }
  }
}
