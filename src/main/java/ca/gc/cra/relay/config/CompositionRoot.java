package ca.gc.cra.relay.config;

import ca.gc.cra.relay.adapter.kafka.KafkaSignalExporter;
import ca.gc.cra.relay.adapter.kafka.KafkaSignalReceiver;
import ca.gc.cra.relay.application.connector.Connector;
import ca.gc.cra.relay.application.connector.ForwardConnector;
import ca.gc.cra.relay.application.connector.SpanMetricsConnector;
import ca.gc.cra.relay.application.pipeline.BatchSettings;
import ca.gc.cra.relay.application.pipeline.CollectorService;
import ca.gc.cra.relay.application.pipeline.ExporterBinding;
import ca.gc.cra.relay.application.pipeline.PipelineCoordinator;
import ca.gc.cra.relay.application.pipeline.RetryPolicy;
import ca.gc.cra.relay.application.pipeline.SendingQueue;
import ca.gc.cra.relay.application.pipeline.SignalRouter;
import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.application.port.SignalProcessor;
import ca.gc.cra.relay.application.port.SignalReceiver;
import ca.gc.cra.relay.application.processor.AttributesProcessor;
import ca.gc.cra.relay.domain.pipeline.DeliveryOutcome;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.DatadogEncoder;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import ca.gc.cra.relay.infrastructure.codec.ZipkinJsonEncoder;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.relay.infrastructure.exporter.DatadogExporter;
import ca.gc.cra.relay.infrastructure.exporter.HttpTransport;
import ca.gc.cra.relay.infrastructure.exporter.JaegerExporter;
import ca.gc.cra.relay.infrastructure.exporter.LoggingExporter;
import ca.gc.cra.relay.infrastructure.exporter.OtlpHttpExporter;
import ca.gc.cra.relay.infrastructure.exporter.PrometheusExporter;
import ca.gc.cra.relay.infrastructure.receiver.OtlpHttpReceiver;
import ca.gc.cra.relay.infrastructure.receiver.OtlpStreamReceiver;
import ca.gc.cra.relay.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.relay.logging.Logs;
import ca.gc.cra.relay.validation.Net;
import ca.gc.cra.relay.validation.Strings;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns a parsed {@link CollectorConfig} into a {@link PipelineGraph}
 * and the graph into a runnable {@link CollectorService}.
 * <p><strong>Why:</strong> Keeps every component-type switch and every configuration key in one place; the
 * pipeline machinery only sees ports.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning receivers -> processors -> exporters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fail with {@link ConfigException} on undefined references, unknown types, unsupported signal types,
 *   empty pipelines, misused connectors and connector cycles.</li>
 *   <li>Instantiate components without opening sockets or clients; that happens on start.</li>
 *   <li>Order pipelines so connector producers start first and drain first.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used once on the startup thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  static final String DEFAULT_HTTP_ENDPOINT = "0.0.0.0:4318";
  static final int DEFAULT_HTTP_WORKERS = 8;
  static final int DEFAULT_STREAM_CONNECTIONS = 32;
  static final String DEFAULT_DATADOG_SITE = "datadoghq.com";
  static final String DEFAULT_DATADOG_AGENT = "http://localhost:8126";

  private final MetricsPort metrics;
  private final ClockPort clock;
  private final OtlpJsonCodec codec = new OtlpJsonCodec();

  /**
   * Creates a composition root using the system clock.
   *
   * @param metrics metrics sink handed to every component
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new SystemClockAdapter());
  }

  /**
   * Creates a composition root.
   *
   * @param metrics metrics sink handed to every component
   * @param clock clock used for batch timestamps and derived metrics
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Validates the configuration and instantiates every referenced component without starting it.
   *
   * @param config parsed configuration
   * @return resolved graph
   * @throws ConfigException if the configuration cannot be wired
   */
  public PipelineGraph resolve(CollectorConfig config) {
    Objects.requireNonNull(config, "config");
    for (ComponentId id : config.connectors().keySet()) {
      if (config.receivers().containsKey(id) || config.exporters().containsKey(id)) {
        throw new ConfigException("connector " + id + " shares its id with a receiver or exporter");
      }
    }
    Map<String, PipelineConfig> pipelines = config.service().pipelines();
    Map<ComponentId, Connector> connectors = new LinkedHashMap<>();
    Map<ComponentId, List<PipelineConfig>> connectorProducers = new LinkedHashMap<>();
    Map<ComponentId, List<PipelineConfig>> connectorConsumers = new LinkedHashMap<>();
    Map<ComponentId, List<PipelineConfig>> receiverUsage = new LinkedHashMap<>();
    Map<ComponentId, String> prometheusOwner = new LinkedHashMap<>();
    Map<ComponentId, SignalProcessor> processorCache = new LinkedHashMap<>();
    Map<String, PipelineGraph.PipelineNode> nodes = new LinkedHashMap<>();

    for (PipelineConfig pipeline : pipelines.values()) {
      if (pipeline.receivers().isEmpty()) {
        throw new ConfigException("pipeline " + pipeline.id() + " must list at least one receiver");
      }
      if (pipeline.exporters().isEmpty()) {
        throw new ConfigException("pipeline " + pipeline.id() + " must list at least one exporter");
      }
      for (ComponentId receiverId : pipeline.receivers()) {
        if (config.connectors().containsKey(receiverId)) {
          connectorConsumers.computeIfAbsent(receiverId, k -> new ArrayList<>()).add(pipeline);
        } else if (config.receivers().containsKey(receiverId)) {
          receiverUsage.computeIfAbsent(receiverId, k -> new ArrayList<>()).add(pipeline);
        } else {
          throw new ConfigException(
              "pipeline " + pipeline.id() + " references undefined receiver " + receiverId);
        }
      }

      List<SignalProcessor> processors = new ArrayList<>();
      BatchSettings batching = null;
      for (ComponentId processorId : pipeline.processors()) {
        ConfigSection section = config.processors().get(processorId);
        if (section == null) {
          throw new ConfigException(
              "pipeline " + pipeline.id() + " references undefined processor " + processorId);
        }
        if (processorId.type().equals("batch")) {
          if (batching != null) {
            throw new ConfigException("pipeline " + pipeline.id() + " lists more than one batch processor");
          }
          batching = batchSettings(section);
        } else {
          if (batching != null) {
            log.warn("Pipeline {}: processor {} listed after batch runs before batching", pipeline.id(), processorId);
          }
          processors.add(processorCache.computeIfAbsent(processorId, id -> processor(id, section)));
        }
      }

      List<PipelineGraph.ExporterNode> exporters = new ArrayList<>();
      for (ComponentId exporterId : pipeline.exporters()) {
        PipelineGraph.ExporterNode node;
        if (config.connectors().containsKey(exporterId)) {
          Connector connector = connectors.computeIfAbsent(
              exporterId, id -> connector(id, config.connectors().get(id)));
          connectorProducers.computeIfAbsent(exporterId, k -> new ArrayList<>()).add(pipeline);
          node = new PipelineGraph.ExporterNode(
              new ExporterBinding(connector, RetryPolicy.disabled(), false), "connector " + exporterId);
        } else {
          ConfigSection section = config.exporters().get(exporterId);
          if (section == null) {
            throw new ConfigException(
                "pipeline " + pipeline.id() + " references undefined exporter " + exporterId);
          }
          if (exporterId.type().equals("prometheus")) {
            String owner = prometheusOwner.putIfAbsent(exporterId, pipeline.id());
            if (owner != null) {
              throw new ConfigException("exporter " + exporterId + " binds a listening port and is already used by "
                  + "pipeline " + owner + "; define a second prometheus exporter for " + pipeline.id());
            }
          }
          node = exporter(exporterId, section);
        }
        SignalExporter exporter = node.binding().exporter();
        if (!exporter.supportedTypes().contains(pipeline.signalType())) {
          throw new ConfigException("exporter " + exporterId + " does not support "
              + pipeline.signalType().path() + " (pipeline " + pipeline.id() + ")");
        }
        exporters.add(node);
      }

      nodes.put(pipeline.id(), new PipelineGraph.PipelineNode(
          pipeline.id(),
          pipeline.signalType(),
          pipeline.receivers().stream().map(ComponentId::toString).toList(),
          processors,
          Optional.ofNullable(batching),
          exporters,
          pipeline.deliveryPolicy().orElse(config.service().deliveryPolicy())));
    }

    for (ComponentId id : config.connectors().keySet()) {
      List<PipelineConfig> producers = connectorProducers.getOrDefault(id, List.of());
      List<PipelineConfig> consumers = connectorConsumers.getOrDefault(id, List.of());
      if (producers.isEmpty() && consumers.isEmpty()) {
        log.warn("Connector {} is defined but not used by any pipeline", id);
        continue;
      }
      if (producers.isEmpty() || consumers.isEmpty()) {
        throw new ConfigException("connector " + id
            + " must be used as an exporter in one pipeline and as a receiver in another");
      }
      Connector connector = connectors.get(id);
      Set<SignalType> produced = EnumSet.noneOf(SignalType.class);
      for (PipelineConfig producer : producers) {
        produced.add(connector.outputType(producer.signalType()));
      }
      for (PipelineConfig consumer : consumers) {
        if (!produced.contains(consumer.signalType())) {
          throw new ConfigException("connector " + id + " emits " + describeTypes(produced)
              + " but pipeline " + consumer.id() + " carries " + consumer.signalType().path());
        }
      }
    }

    warnUnused("receiver", config.receivers().keySet(), receiverUsage.keySet());
    warnUnused("processor", config.processors().keySet(), usedProcessors(pipelines.values()));
    warnUnused("exporter", config.exporters().keySet(), usedExporters(pipelines.values()));

    List<PipelineGraph.ReceiverNode> receivers = new ArrayList<>();
    receiverUsage.forEach((id, usage) ->
        receivers.addAll(receiver(id, config.receivers().get(id), usage)));
    connectors.forEach((id, connector) -> receivers.add(new PipelineGraph.ReceiverNode(
        connector,
        connectorConsumers.get(id).stream().map(PipelineConfig::id).toList(),
        "connector " + id)));

    List<PipelineGraph.PipelineNode> ordered = order(nodes, connectorProducers, connectorConsumers);
    log.info("Resolved {} pipeline(s), {} receiver(s), {} connector(s)",
        ordered.size(), receiverUsage.size(), connectors.size());
    return new PipelineGraph(
        ordered, receivers, config.service().drainTimeout(), config.service().exportWorkers());
  }

  /**
   * Wires executors, coordinators and the router for a resolved graph.
   *
   * @param graph resolved graph
   * @param resources extra resources the service closes last (e.g. the metrics adapter)
   * @return unstarted collector service
   */
  public CollectorService build(PipelineGraph graph, List<? extends AutoCloseable> resources) {
    Objects.requireNonNull(graph, "graph");
    ExecutorService exportPool = ExecutorFactories.newExportPool(
        graph.exportWorkers(), "relay-export", ExecutorFactories.loggingHandler());
    ScheduledExecutorService scheduler = ExecutorFactories.newBatchScheduler("relay-batch");
    List<PipelineCoordinator> coordinators = new ArrayList<>();
    Map<String, PipelineCoordinator> byId = new LinkedHashMap<>();
    for (PipelineGraph.PipelineNode node : graph.pipelines()) {
      PipelineCoordinator.Builder builder = PipelineCoordinator.builder()
          .id(node.id())
          .signalType(node.signalType())
          .deliveryPolicy(node.deliveryPolicy())
          .drainTimeout(graph.drainTimeout())
          .exportExecutor(exportPool)
          .scheduler(scheduler)
          .metrics(metrics)
          .clock(clock)
          .batching(node.batching().orElse(null))
          .outcomeListener(CompositionRoot::logOutcome);
      node.processors().forEach(builder::processor);
      node.exporters().forEach(exporter -> builder.exporter(exporter.binding()));
      PipelineCoordinator coordinator = builder.build();
      coordinators.add(coordinator);
      byId.put(node.id(), coordinator);
    }
    SignalRouter.Builder router = SignalRouter.builder();
    List<SignalReceiver> receivers = new ArrayList<>();
    for (PipelineGraph.ReceiverNode node : graph.receivers()) {
      receivers.add(node.receiver());
      for (String pipelineId : node.pipelines()) {
        router.bind(node.receiver().id(), byId.get(pipelineId));
      }
    }
    return new CollectorService(
        coordinators, receivers, router.build(), List.of(scheduler, exportPool), resources);
  }

  private static void logOutcome(DeliveryOutcome outcome) {
    if (!outcome.delivered()) {
      log.warn("Batch {}#{} was not delivered: {}", outcome.pipelineId(), outcome.sequence(), outcome.results());
    } else if (log.isDebugEnabled()) {
      log.debug("Batch {}#{} delivered: {}", outcome.pipelineId(), outcome.sequence(), outcome.results());
    }
  }

  private static List<PipelineGraph.PipelineNode> order(
      Map<String, PipelineGraph.PipelineNode> nodes,
      Map<ComponentId, List<PipelineConfig>> producers,
      Map<ComponentId, List<PipelineConfig>> consumers) {
    Map<String, Set<String>> downstream = new LinkedHashMap<>();
    Map<String, Integer> indegree = new LinkedHashMap<>();
    nodes.keySet().forEach(id -> {
      downstream.put(id, new LinkedHashSet<>());
      indegree.put(id, 0);
    });
    producers.forEach((connector, from) -> {
      for (PipelineConfig producer : from) {
        for (PipelineConfig consumer : consumers.getOrDefault(connector, List.of())) {
          if (downstream.get(producer.id()).add(consumer.id())) {
            indegree.merge(consumer.id(), 1, Integer::sum);
          }
        }
      }
    });
    Deque<String> ready = new ArrayDeque<>();
    indegree.forEach((id, degree) -> {
      if (degree == 0) {
        ready.add(id);
      }
    });
    List<PipelineGraph.PipelineNode> ordered = new ArrayList<>(nodes.size());
    while (!ready.isEmpty()) {
      String id = ready.poll();
      ordered.add(nodes.get(id));
      for (String next : downstream.get(id)) {
        if (indegree.merge(next, -1, Integer::sum) == 0) {
          ready.add(next);
        }
      }
    }
    if (ordered.size() != nodes.size()) {
      List<String> cyclic = new ArrayList<>(nodes.keySet());
      ordered.forEach(node -> cyclic.remove(node.id()));
      throw new ConfigException("connectors form a cycle between pipelines " + cyclic);
    }
    return ordered;
  }

  private List<PipelineGraph.ReceiverNode> receiver(
      ComponentId id, ConfigSection section, List<PipelineConfig> usage) {
    List<String> pipelineIds = usage.stream().map(PipelineConfig::id).toList();
    String name = id.toString();
    switch (id.type()) {
      case "otlp" -> {
        ConfigSection protocols = section.section("protocols");
        List<PipelineGraph.ReceiverNode> result = new ArrayList<>();
        if (protocols.keys().contains("grpc")) {
          log.warn("Receiver {}: gRPC protocol is not supported and will be ignored; use protocols.http", id);
        }
        if (protocols.isEmpty() || protocols.keys().contains("http")) {
          ConfigSection httpSection = protocols.section("http");
          InetSocketAddress address = listen(httpSection, "endpoint", DEFAULT_HTTP_ENDPOINT);
          int workers = positive(httpSection, "workers", DEFAULT_HTTP_WORKERS);
          int maxBody = positive(httpSection, "max_request_body_size", OtlpHttpReceiver.DEFAULT_MAX_BODY_BYTES);
          result.add(new PipelineGraph.ReceiverNode(
              new OtlpHttpReceiver(name, address, workers, maxBody, codec, metrics),
              pipelineIds, name + " (otlp/http " + render(address) + ")"));
        }
        if (protocols.keys().contains("stream")) {
          ConfigSection streamSection = protocols.section("stream");
          InetSocketAddress address = listen(streamSection, "endpoint", null);
          int connections = positive(streamSection, "max_connections", DEFAULT_STREAM_CONNECTIONS);
          int maxLine = positive(streamSection, "max_line_size", OtlpHttpReceiver.DEFAULT_MAX_BODY_BYTES);
          result.add(new PipelineGraph.ReceiverNode(
              new OtlpStreamReceiver(name, address, connections, maxLine, codec, metrics),
              pipelineIds, name + " (otlp/stream " + render(address) + ")"));
        }
        if (result.isEmpty()) {
          throw new ConfigException("receiver " + id + " enables no supported protocol (http, stream)");
        }
        return result;
      }
      case "kafka" -> {
        SignalType type = signalType(section, "signal_type");
        for (PipelineConfig pipeline : usage) {
          if (pipeline.signalType() != type) {
            throw new ConfigException("receiver " + id + " carries " + type.path()
                + " but is listed by pipeline " + pipeline.id());
          }
        }
        String brokers = section.requireString("brokers");
        String topic = section.requireString("topic");
        String group = section.string("group_id", "relay");
        KafkaSignalReceiver receiver = guard(section.path(),
            () -> new KafkaSignalReceiver(name, brokers, topic, type, group, codec, metrics));
        return List.of(new PipelineGraph.ReceiverNode(
            receiver, pipelineIds, name + " (kafka " + topic + " @ " + brokers + ")"));
      }
      default -> throw new ConfigException("receiver " + id + " has unknown type '" + id.type() + "'");
    }
  }

  private SignalProcessor processor(ComponentId id, ConfigSection section) {
    if (id.type().equals("attributes")) {
      List<AttributesProcessor.Action> actions = new ArrayList<>();
      for (ConfigSection action : section.sectionList("actions")) {
        actions.add(guard(action.path(), () -> new AttributesProcessor.Action(
            action.requireString("key"),
            AttributesProcessor.ActionType.fromString(action.requireString("action")),
            action.raw("value"),
            action.optionalString("from_attribute").orElse(null))));
      }
      if (actions.isEmpty()) {
        throw new ConfigException(section.child("actions") + " must define at least one action");
      }
      return new AttributesProcessor(id.toString(), actions);
    }
    throw new ConfigException("processor " + id + " has unknown type '" + id.type() + "'");
  }

  private static BatchSettings batchSettings(ConfigSection section) {
    return guard(section.path(), () -> new BatchSettings(
        section.integer("send_batch_size", BatchSettings.DEFAULT_SEND_BATCH_SIZE),
        section.duration("timeout", BatchSettings.DEFAULT_TIMEOUT),
        section.integer("send_batch_max_size", 0)));
  }

  private PipelineGraph.ExporterNode exporter(ComponentId id, ConfigSection section) {
    String name = id.toString();
    SignalExporter exporter;
    String description;
    switch (id.type()) {
      case "logging", "debug" -> {
        LoggingExporter.Verbosity verbosity =
            guard(section.child("verbosity"), () -> LoggingExporter.Verbosity.fromString(
                section.string("verbosity", "basic")));
        exporter = new LoggingExporter(name, verbosity);
        description = name + " (logging " + verbosity.name().toLowerCase(Locale.ROOT) + ")";
      }
      case "otlp", "otlphttp" -> {
        HttpTransport.Settings settings = httpSettings(section, true);
        exporter = new OtlpHttpExporter(name, new HttpTransport(name, settings), codec);
        description = name + " (otlp/http " + settings.endpoint() + describeHeaders(settings.headers()) + ")";
      }
      case "jaeger" -> {
        HttpTransport.Settings settings = httpSettings(section, false);
        exporter = new JaegerExporter(name, new HttpTransport(name, settings), new ZipkinJsonEncoder());
        description = name + " (zipkin json " + settings.endpoint() + JaegerExporter.SPANS_PATH + ")";
      }
      case "prometheus" -> {
        InetSocketAddress address = listen(section, "endpoint", null);
        String namespace = section.string("namespace", "");
        Map<String, String> constLabels = section.stringMap("const_labels");
        boolean resourceLabels = section.section("resource_to_telemetry_conversion").bool("enabled", false);
        exporter = new PrometheusExporter(name, address, namespace, constLabels, resourceLabels, metrics);
        description = name + " (prometheus http://" + render(address) + "/metrics)";
      }
      case "datadog" -> {
        ConfigSection api = section.section("api");
        String apiKey = api.requireString("key");
        String site = api.string("site", DEFAULT_DATADOG_SITE);
        Duration timeout = section.duration("timeout", HttpTransport.Settings.DEFAULT_TIMEOUT);
        URI apiUri = endpoint(api.child("site"), DatadogExporter.apiEndpoint(site), false);
        URI logsUri = endpoint(api.child("site"), DatadogExporter.logsEndpoint(site), false);
        URI agentUri = endpoint(section.section("traces").child("endpoint"),
            section.section("traces").string("endpoint", DEFAULT_DATADOG_AGENT), true);
        exporter = new DatadogExporter(name, apiKey,
            new HttpTransport(name, new HttpTransport.Settings(apiUri, Map.of(), timeout, false, false, null)),
            new HttpTransport(name, new HttpTransport.Settings(logsUri, Map.of(), timeout, false, false, null)),
            new HttpTransport(name, new HttpTransport.Settings(agentUri, Map.of(), timeout, false, false, null)),
            new DatadogEncoder());
        description = name + " (datadog site=" + site + ", agent=" + agentUri + ", key=" + Logs.redact(apiKey) + ")";
      }
      case "kafka" -> {
        String brokers = section.requireString("brokers");
        String topic = section.requireString("topic");
        exporter = guard(section.path(), () -> new KafkaSignalExporter(name, brokers, topic, codec));
        description = name + " (kafka " + topic + " @ " + brokers + ")";
      }
      default -> throw new ConfigException("exporter " + id + " has unknown type '" + id.type() + "'");
    }
    ExporterBinding binding = new ExporterBinding(
        exporter,
        retryPolicy(section.section("retry_on_failure")),
        section.bool("required", false),
        sendingQueue(section.section("sending_queue")));
    return new PipelineGraph.ExporterNode(binding, description);
  }

  private Connector connector(ComponentId id, ConfigSection section) {
    String name = id.toString();
    return switch (id.type()) {
      case "spanmetrics", "datadog" -> new SpanMetricsConnector(
          name,
          section.string("namespace", SpanMetricsConnector.DEFAULT_NAMESPACE),
          dimensions(section),
          clock);
      case "forward" -> new ForwardConnector(name);
      default -> throw new ConfigException("connector " + id + " has unknown type '" + id.type() + "'");
    };
  }

  private static List<String> dimensions(ConfigSection section) {
    Object raw = section.raw("dimensions");
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> items)) {
      throw new ConfigException(section.child("dimensions") + " must be a list");
    }
    List<String> result = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      Object item = items.get(i);
      if (item instanceof Map<?, ?>) {
        result.add(ConfigSection.of(section.child("dimensions") + "[" + i + "]", item).requireString("name"));
      } else if (item != null && !item.toString().isBlank()) {
        result.add(item.toString().trim());
      } else {
        throw new ConfigException(section.child("dimensions") + "[" + i + "] must name an attribute");
      }
    }
    return result;
  }

  private static HttpTransport.Settings httpSettings(ConfigSection section, boolean compressionDefault) {
    ConfigSection tls = section.section("tls");
    boolean insecure = tls.bool("insecure", false);
    URI endpoint = endpoint(section.child("endpoint"), section.requireString("endpoint"), insecure);
    Map<String, String> headers = new LinkedHashMap<>();
    section.stringMap("headers").forEach((key, value) ->
        headers.put(guard(section.child("headers"), () -> Strings.requireHeader(key, value)), value));
    String compression = section.string("compression", compressionDefault ? "gzip" : "none")
        .toLowerCase(Locale.ROOT);
    if (!compression.equals("gzip") && !compression.equals("none")) {
      throw new ConfigException(section.child("compression") + " must be gzip or none (was " + compression + ")");
    }
    Path caFile = tls.optionalString("ca_file").map(Path::of).orElse(null);
    Duration timeout = section.duration("timeout", HttpTransport.Settings.DEFAULT_TIMEOUT);
    return guard(section.path(), () -> new HttpTransport.Settings(
        endpoint, headers, timeout, compression.equals("gzip"), tls.bool("insecure_skip_verify", false), caFile));
  }

  private static URI endpoint(String location, String raw, boolean insecure) {
    return guard(location, () -> HttpTransport.endpointUri(raw, insecure));
  }

  private static RetryPolicy retryPolicy(ConfigSection section) {
    return guard(section.path(), () -> new RetryPolicy(
        section.bool("enabled", true),
        section.duration("initial_interval", RetryPolicy.DEFAULT_INITIAL_INTERVAL),
        section.duration("max_interval", RetryPolicy.DEFAULT_MAX_INTERVAL),
        section.decimal("multiplier", RetryPolicy.DEFAULT_MULTIPLIER),
        section.integer("max_attempts", RetryPolicy.DEFAULT_MAX_ATTEMPTS)));
  }

  private static SendingQueue sendingQueue(ConfigSection section) {
    return guard(section.path(), () -> new SendingQueue(
        section.integer("num_consumers", SendingQueue.DEFAULT_CONSUMERS),
        section.integer("queue_size", SendingQueue.DEFAULT_QUEUE_SIZE)));
  }

  private static InetSocketAddress listen(ConfigSection section, String key, String fallback) {
    String raw = fallback == null ? section.requireString(key) : section.string(key, fallback);
    return guard(section.child(key), () -> Net.listenAddress(raw));
  }

  private static int positive(ConfigSection section, String key, int fallback) {
    int value = section.integer(key, fallback);
    if (value <= 0) {
      throw new ConfigException(section.child(key) + " must be positive (was " + value + ")");
    }
    return value;
  }

  private static SignalType signalType(ConfigSection section, String key) {
    String raw = section.requireString(key);
    return guard(section.child(key), () -> SignalType.fromString(raw));
  }

  private static String describeHeaders(Map<String, String> headers) {
    if (headers.isEmpty()) {
      return "";
    }
    return " headers=" + Logs.redactHeaders(headers);
  }

  private static String describeTypes(Set<SignalType> types) {
    return types.stream().map(SignalType::path).toList().toString();
  }

  private static String render(InetSocketAddress address) {
    return address.getHostString() + ":" + address.getPort();
  }

  private static void warnUnused(String kind, Set<ComponentId> defined, Set<ComponentId> used) {
    for (ComponentId id : defined) {
      if (!used.contains(id)) {
        log.warn("The {} {} is defined but not used by any pipeline", kind, id);
      }
    }
  }

  private static Set<ComponentId> usedProcessors(Iterable<PipelineConfig> pipelines) {
    Set<ComponentId> used = new LinkedHashSet<>();
    pipelines.forEach(p -> used.addAll(p.processors()));
    return used;
  }

  private static Set<ComponentId> usedExporters(Iterable<PipelineConfig> pipelines) {
    Set<ComponentId> used = new LinkedHashSet<>();
    pipelines.forEach(p -> used.addAll(p.exporters()));
    return used;
  }

  private static <T> T guard(String location, Supplier<T> factory) {
    try {
      return factory.get();
    } catch (ConfigException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      throw new ConfigException(location + ": " + ex.getMessage(), ex);
    }
  }
}
