package ca.gc.cra.relay.domain.signal;

import java.util.Locale;

/**
 * Observability signal families routed by Relay pipelines.
 *
 * @since 0.1.0
 */
public enum SignalType {
  /** Trace spans. */
  TRACES("traces"),
  /** Metric data points. */
  METRICS("metrics"),
  /** Log records. */
  LOGS("logs");

  private final String path;

  SignalType(String path) {
    this.path = path;
  }

  /**
   * Returns the lowercase name used in configuration keys and ingestion paths (e.g., {@code /v1/traces}).
   *
   * @return lowercase signal name
   */
  public String path() {
    return path;
  }

  /**
   * Parses a signal name, accepting the singular and plural forms case-insensitively.
   *
   * @param raw candidate name such as {@code traces}, {@code metric} or {@code LOGS}
   * @return matching signal type
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static SignalType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("signal type must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "traces", "trace", "spans" -> TRACES;
      case "metrics", "metric" -> METRICS;
      case "logs", "log" -> LOGS;
      default -> throw new IllegalArgumentException("unknown signal type: " + raw);
    };
  }
}
