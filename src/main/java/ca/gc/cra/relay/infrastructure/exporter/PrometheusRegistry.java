package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.domain.signal.MetricSignal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates metric points for the Prometheus pull endpoint.
 * <p>Monotonic sums are added up into counters, histograms into {@code _count}/{@code _sum} summaries, and gauges
 * and non-monotonic sums keep the last value. A name first seen with one type ignores points of another type.</p>
 * <p>All methods are synchronized; scrapes take a consistent snapshot.</p>
 */
final class PrometheusRegistry {
  private static final Logger log = LoggerFactory.getLogger(PrometheusRegistry.class);

  private final String namespace;
  private final boolean resourceLabels;
  private final Map<String, FamilyState> families = new TreeMap<>();

  PrometheusRegistry(String namespace, boolean resourceLabels) {
    this.namespace = namespace == null ? "" : namespace;
    this.resourceLabels = resourceLabels;
  }

  /**
   * Folds one point into the registry.
   *
   * @param metric metric point
   * @return {@code false} when the point was ignored because of a type conflict
   */
  synchronized boolean record(MetricSignal metric) {
    Type type = switch (metric.kind()) {
      case GAUGE -> Type.GAUGE;
      case SUM -> metric.monotonic() ? Type.COUNTER : Type.GAUGE;
      case HISTOGRAM -> Type.SUMMARY;
    };
    String name = PrometheusTextFormat.metricName(namespace, metric.name(), type == Type.COUNTER);
    FamilyState family = families.computeIfAbsent(name, k -> new FamilyState(type, metric.description()));
    if (family.type != type) {
      log.warn("Prometheus metric {} already registered as {}; ignoring {} point", name, family.type, type);
      return false;
    }
    Map<String, String> labels = labels(metric);
    long timestampMillis = metric.timestampNanos() / 1_000_000L;
    family.series.merge(labels, new Series(labels, metric.value(), metric.count(), metric.sum(), timestampMillis),
        (previous, next) -> switch (type) {
          case COUNTER -> new Series(labels, previous.value() + next.value(), 0, 0d, next.timestampMillis());
          case SUMMARY -> new Series(labels, 0d, previous.count() + next.count(), previous.sum() + next.sum(),
              next.timestampMillis());
          case GAUGE -> next;
        });
    return true;
  }

  synchronized List<Family> snapshot() {
    List<Family> result = new ArrayList<>(families.size());
    families.forEach((name, state) ->
        result.add(new Family(name, state.type, state.help, List.copyOf(state.series.values()))));
    return result;
  }

  private Map<String, String> labels(MetricSignal metric) {
    Map<String, String> labels = new TreeMap<>();
    if (resourceLabels) {
      metric.resource().forEach((key, value) -> labels.put(PrometheusTextFormat.labelName(key), value.toString()));
    } else {
      Object service = metric.resource().get("service.name");
      if (service != null) {
        labels.put("job", service.toString());
      }
      Object instance = metric.resource().get("service.instance.id");
      if (instance != null) {
        labels.put("instance", instance.toString());
      }
    }
    metric.attributes().forEach((key, value) -> labels.put(PrometheusTextFormat.labelName(key), value.toString()));
    return labels;
  }

  enum Type {
    COUNTER,
    GAUGE,
    SUMMARY
  }

  record Series(Map<String, String> labels, double value, long count, double sum, long timestampMillis) {}

  record Family(String name, Type type, String help, List<Series> series) {}

  private static final class FamilyState {
    final Type type;
    final String help;
    final Map<Map<String, String>, Series> series = new LinkedHashMap<>();

    FamilyState(Type type, String help) {
      this.type = type;
      this.help = help == null ? "" : help;
    }
  }
}
