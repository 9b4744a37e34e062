package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.SignalType;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pull-based exporter serving accumulated metric points at {@code GET /metrics} in the
 * Prometheus text format.
 * <p><strong>Why:</strong> Lets a Prometheus server scrape the relay instead of the relay pushing.</p>
 * <p><strong>Thread-safety:</strong> Export and scrape share a synchronized registry.</p>
 * <p>{@link #export(Batch)} never fails: accepting a point into the registry is the delivery.</p>
 *
 * @since 0.1.0
 */
public final class PrometheusExporter implements SignalExporter {
  private static final Logger log = LoggerFactory.getLogger(PrometheusExporter.class);

  private final String id;
  private final InetSocketAddress address;
  private final Map<String, String> constLabels;
  private final PrometheusRegistry registry;
  private final MetricsPort metrics;
  private HttpServer server;

  /**
   * Creates an unstarted exporter.
   *
   * @param id exporter id
   * @param address scrape listen address
   * @param namespace optional metric name prefix
   * @param constLabels labels added to every series
   * @param resourceLabels whether resource attributes become labels
   * @param metrics metrics sink
   */
  public PrometheusExporter(
      String id,
      InetSocketAddress address,
      String namespace,
      Map<String, String> constLabels,
      boolean resourceLabels,
      MetricsPort metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.address = Objects.requireNonNull(address, "address");
    Map<String, String> labels = new TreeMap<>();
    Objects.requireNonNullElse(constLabels, Map.<String, String>of())
        .forEach((key, value) -> labels.put(PrometheusTextFormat.labelName(key), value));
    this.constLabels = labels;
    this.registry = new PrometheusRegistry(namespace, resourceLabels);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.of(SignalType.METRICS);
  }

  @Override
  public synchronized void start() throws IOException {
    if (server != null) {
      return;
    }
    HttpServer created = HttpServer.create(address, 0);
    created.createContext("/metrics", this::scrape);
    created.setExecutor(null);
    created.start();
    server = created;
    log.info("Exporter {} serving Prometheus metrics on http://{}/metrics", id, created.getAddress());
  }

  /**
   * Returns the bound scrape address.
   *
   * @return bound address
   * @throws IllegalStateException if the exporter has not been started
   */
  public synchronized InetSocketAddress boundAddress() {
    if (server == null) {
      throw new IllegalStateException("Exporter " + id + " is not started");
    }
    return server.getAddress();
  }

  @Override
  public void export(Batch batch) {
    int ignored = 0;
    for (MetricSignal metric : batch.signalsAs(MetricSignal.class)) {
      if (!registry.record(metric)) {
        ignored++;
      }
    }
    if (ignored > 0) {
      metrics.observe("exporter." + id + ".conflicts", ignored);
    }
  }

  /**
   * Renders the current exposition text.
   *
   * @return Prometheus text format body
   */
  public String render() {
    return PrometheusTextFormat.render(registry.snapshot(), constLabels);
  }

  @Override
  public synchronized void close() {
    if (server != null) {
      server.stop(0);
      server = null;
      log.info("Exporter {} stopped serving metrics", id);
    }
  }

  private void scrape(HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().set("Allow", "GET");
        exchange.sendResponseHeaders(405, -1);
        return;
      }
      byte[] body = render().getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().set("Content-Type", PrometheusTextFormat.CONTENT_TYPE);
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    } finally {
      exchange.close();
    }
  }
}
