package ca.gc.cra.relay.domain.signal;

import java.util.Map;
import java.util.Objects;

/**
 * Single metric data point.
 * <p>Gauges and sums carry {@code value}; histograms carry {@code count} and {@code sum} with
 * {@code value} holding the mean for convenience.</p>
 *
 * @param name metric name
 * @param description optional description; empty when absent
 * @param unit optional unit; empty when absent
 * @param kind point kind
 * @param monotonic {@code true} for monotonic sums; ignored for other kinds
 * @param value gauge/sum value or histogram mean
 * @param count histogram observation count; zero for other kinds
 * @param sum histogram sum; zero for other kinds
 * @param timestampNanos observation time in epoch nanoseconds
 * @param resource resource attributes
 * @param attributes point attributes (labels)
 * @since 0.1.0
 */
public record MetricSignal(
    String name,
    String description,
    String unit,
    Kind kind,
    boolean monotonic,
    double value,
    long count,
    double sum,
    long timestampNanos,
    Map<String, Object> resource,
    Map<String, Object> attributes) implements Signal {

  /**
   * Validates the metric name and normalizes optional fields.
   */
  public MetricSignal {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("metric name must not be blank");
    }
    description = Objects.requireNonNullElse(description, "");
    unit = Objects.requireNonNullElse(unit, "");
    kind = Objects.requireNonNull(kind, "kind");
    if (count < 0) {
      throw new IllegalArgumentException("histogram count must not be negative");
    }
    resource = AttributeMaps.copyOf(resource);
    attributes = AttributeMaps.copyOf(attributes);
  }

  /**
   * Creates a gauge point.
   *
   * @param name metric name
   * @param value observed value
   * @param timestampNanos observation time in epoch nanoseconds
   * @param resource resource attributes
   * @param attributes point attributes
   * @return gauge point
   */
  public static MetricSignal gauge(
      String name, double value, long timestampNanos, Map<String, Object> resource,
      Map<String, Object> attributes) {
    return new MetricSignal(name, "", "", Kind.GAUGE, false, value, 0, 0, timestampNanos, resource, attributes);
  }

  /**
   * Creates a monotonic sum point.
   *
   * @param name metric name
   * @param value cumulative or delta value
   * @param timestampNanos observation time in epoch nanoseconds
   * @param resource resource attributes
   * @param attributes point attributes
   * @return sum point
   */
  public static MetricSignal counter(
      String name, double value, long timestampNanos, Map<String, Object> resource,
      Map<String, Object> attributes) {
    return new MetricSignal(name, "", "", Kind.SUM, true, value, 0, 0, timestampNanos, resource, attributes);
  }

  /**
   * Creates a histogram summary point.
   *
   * @param name metric name
   * @param unit unit of the observations
   * @param count number of observations
   * @param sum sum of the observations
   * @param timestampNanos observation time in epoch nanoseconds
   * @param resource resource attributes
   * @param attributes point attributes
   * @return histogram point
   */
  public static MetricSignal histogram(
      String name, String unit, long count, double sum, long timestampNanos,
      Map<String, Object> resource, Map<String, Object> attributes) {
    double mean = count == 0 ? 0d : sum / count;
    return new MetricSignal(name, "", unit, Kind.HISTOGRAM, false, mean, count, sum, timestampNanos, resource, attributes);
  }

  @Override
  public SignalType type() {
    return SignalType.METRICS;
  }

  @Override
  public MetricSignal withAttributes(Map<String, Object> replacement) {
    return new MetricSignal(
        name, description, unit, kind, monotonic, value, count, sum, timestampNanos, resource, replacement);
  }

  /** Metric point kinds. */
  public enum Kind {
    GAUGE,
    SUM,
    HISTOGRAM
  }
}
