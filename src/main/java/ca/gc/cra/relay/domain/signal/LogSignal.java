package ca.gc.cra.relay.domain.signal;

import java.util.Map;
import java.util.Objects;

/**
 * Log record, optionally correlated with a trace.
 *
 * @param timestampNanos event time in epoch nanoseconds
 * @param severityNumber OTLP severity number in {@code [0, 24]}; zero when unspecified
 * @param severityText severity label such as {@code INFO}; empty when absent
 * @param body rendered log message
 * @param traceId correlated trace id, or empty
 * @param spanId correlated span id, or empty
 * @param resource resource attributes
 * @param attributes record attributes
 * @since 0.1.0
 */
public record LogSignal(
    long timestampNanos,
    int severityNumber,
    String severityText,
    String body,
    String traceId,
    String spanId,
    Map<String, Object> resource,
    Map<String, Object> attributes) implements Signal {

  /**
   * Validates severity bounds and normalizes optional fields.
   */
  public LogSignal {
    if (severityNumber < 0 || severityNumber > 24) {
      throw new IllegalArgumentException("severityNumber must be between 0 and 24 (was " + severityNumber + ")");
    }
    severityText = Objects.requireNonNullElse(severityText, "");
    body = Objects.requireNonNullElse(body, "");
    traceId = Objects.requireNonNullElse(traceId, "");
    spanId = Objects.requireNonNullElse(spanId, "");
    resource = AttributeMaps.copyOf(resource);
    attributes = AttributeMaps.copyOf(attributes);
  }

  @Override
  public SignalType type() {
    return SignalType.LOGS;
  }

  @Override
  public LogSignal withAttributes(Map<String, Object> replacement) {
    return new LogSignal(timestampNanos, severityNumber, severityText, body, traceId, spanId, resource, replacement);
  }
}
