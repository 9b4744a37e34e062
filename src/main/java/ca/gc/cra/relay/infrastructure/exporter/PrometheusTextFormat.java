package ca.gc.cra.relay.infrastructure.exporter;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders metric families in the Prometheus text exposition format (version 0.0.4).
 */
final class PrometheusTextFormat {
  static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private PrometheusTextFormat() {}

  static String render(List<PrometheusRegistry.Family> families, Map<String, String> constLabels) {
    StringBuilder out = new StringBuilder(256 * Math.max(1, families.size()));
    for (PrometheusRegistry.Family family : families) {
      if (!family.help().isEmpty()) {
        out.append("# HELP ").append(family.name()).append(' ').append(escapeHelp(family.help())).append('\n');
      }
      out.append("# TYPE ").append(family.name()).append(' ')
          .append(family.type().name().toLowerCase(Locale.ROOT)).append('\n');
      for (PrometheusRegistry.Series series : family.series()) {
        Map<String, String> labels = new TreeMap<>(series.labels());
        constLabels.forEach(labels::putIfAbsent);
        if (family.type() == PrometheusRegistry.Type.SUMMARY) {
          sample(out, family.name() + "_count", labels, Long.toString(series.count()));
          sample(out, family.name() + "_sum", labels, number(series.sum()));
        } else {
          sample(out, family.name(), labels, number(series.value()));
        }
      }
    }
    return out.toString();
  }

  /**
   * Converts an OTel metric name to a Prometheus one: invalid characters become {@code _}, the namespace is
   * prefixed and counters get a {@code _total} suffix.
   */
  static String metricName(String namespace, String name, boolean counter) {
    String base = sanitize(name, true);
    if (namespace != null && !namespace.isBlank()) {
      base = sanitize(namespace, true) + "_" + base;
    }
    if (counter && !base.endsWith("_total")) {
      base = base + "_total";
    }
    return base;
  }

  static String labelName(String key) {
    String name = sanitize(key, false);
    return name.startsWith("__") ? "key" + name : name;
  }

  private static String sanitize(String raw, boolean allowColon) {
    StringBuilder sb = new StringBuilder(raw.length() + 1);
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
          || (allowColon && c == ':') || (i > 0 && c >= '0' && c <= '9');
      if (valid) {
        sb.append(c);
      } else if (i == 0 && c >= '0' && c <= '9') {
        sb.append('_').append(c);
      } else {
        sb.append('_');
      }
    }
    return sb.length() == 0 ? "_" : sb.toString();
  }

  private static void sample(StringBuilder out, String name, Map<String, String> labels, String value) {
    out.append(name);
    if (!labels.isEmpty()) {
      out.append('{');
      boolean first = true;
      for (Map.Entry<String, String> label : labels.entrySet()) {
        if (!first) {
          out.append(',');
        }
        first = false;
        out.append(label.getKey()).append("=\"").append(escapeLabel(label.getValue())).append('"');
      }
      out.append('}');
    }
    out.append(' ').append(value).append('\n');
  }

  static String number(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static String escapeLabel(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
  }

  private static String escapeHelp(String value) {
    return value.replace("\\", "\\\\").replace("\n", "\\n");
  }
}
