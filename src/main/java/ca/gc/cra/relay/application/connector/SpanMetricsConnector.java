package ca.gc.cra.relay.application.connector;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.domain.signal.AttributeMaps;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Derives request metrics from trace batches.
 * <p>For each batch, spans are grouped by service name, span name, span kind, status code and the configured
 * extra dimensions. Each group yields a monotonic {@code <namespace>.calls} counter point carrying the span count
 * and a {@code <namespace>.duration} histogram point in milliseconds.</p>
 *
 * @since 0.1.0
 */
public final class SpanMetricsConnector extends Connector {
  public static final String DEFAULT_NAMESPACE = "traces.span.metrics";
  static final String UNKNOWN_SERVICE = "unknown_service";

  private final String namespace;
  private final List<String> dimensions;
  private final ClockPort clock;

  /**
   * Creates a connector.
   *
   * @param id connector id
   * @param namespace metric name prefix; blank means no prefix
   * @param dimensions span attribute keys copied onto the metric points when present
   * @param clock timestamp source for emitted points
   */
  public SpanMetricsConnector(String id, String namespace, List<String> dimensions, ClockPort clock) {
    super(id);
    this.namespace = namespace == null ? "" : namespace.trim();
    this.dimensions = List.copyOf(Objects.requireNonNull(dimensions, "dimensions"));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.of(SignalType.TRACES);
  }

  @Override
  public SignalType outputType(SignalType input) {
    if (input != SignalType.TRACES) {
      throw new IllegalArgumentException("connector " + id() + " only consumes traces");
    }
    return SignalType.METRICS;
  }

  @Override
  public Set<SignalType> outputTypes() {
    return EnumSet.of(SignalType.METRICS);
  }

  @Override
  protected List<Signal> transform(Batch batch) {
    Map<Map<String, Object>, Group> groups = new LinkedHashMap<>();
    for (SpanSignal span : batch.signalsAs(SpanSignal.class)) {
      Map<String, Object> key = dimensionsOf(span);
      Group group = groups.computeIfAbsent(key, k -> new Group(serviceOf(span)));
      group.count++;
      group.durationMillis += span.durationNanos() / 1_000_000d;
    }
    long now = clock.nowNanos();
    List<Signal> points = new ArrayList<>(groups.size() * 2);
    groups.forEach((attributes, group) -> {
      Map<String, Object> resource = Map.of("service.name", group.service);
      points.add(MetricSignal.counter(metricName("calls"), group.count, now, resource, attributes));
      points.add(MetricSignal.histogram(
          metricName("duration"), "ms", group.count, group.durationMillis, now, resource, attributes));
    });
    return points;
  }

  private Map<String, Object> dimensionsOf(SpanSignal span) {
    Map<String, Object> key = new LinkedHashMap<>();
    key.put("service.name", serviceOf(span));
    key.put("span.name", span.name());
    key.put("span.kind", "SPAN_KIND_" + span.kind().name());
    key.put("status.code", "STATUS_CODE_" + span.status().name());
    for (String dimension : dimensions) {
      Object value = span.attributes().get(dimension);
      if (value == null) {
        value = span.resource().get(dimension);
      }
      if (value != null) {
        key.put(dimension, value);
      }
    }
    return key;
  }

  private static String serviceOf(SpanSignal span) {
    return AttributeMaps.stringValue(span.resource(), "service.name", UNKNOWN_SERVICE);
  }

  private String metricName(String suffix) {
    return namespace.isEmpty() ? suffix : namespace + "." + suffix;
  }

  private static final class Group {
    final String service;
    long count;
    double durationMillis;

    Group(String service) {
      this.service = service;
    }
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "SpanMetricsConnector[%s, namespace=%s, dimensions=%s]",
        id(), namespace, dimensions);
  }
}
