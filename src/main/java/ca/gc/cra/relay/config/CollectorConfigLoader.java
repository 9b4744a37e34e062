package ca.gc.cra.relay.config;

import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a collector document ({@code receivers}, {@code processors}, {@code exporters}, {@code connectors},
 * {@code service}) from YAML.
 * <p>Environment placeholders are substituted in scalar values after parsing, so a variable can never change the
 * document structure. Only structural checks happen here; component references and types are resolved by
 * {@link CompositionRoot}.</p>
 */
public final class CollectorConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(CollectorConfigLoader.class);

  private CollectorConfigLoader() {}

  /**
   * Loads and parses a configuration file.
   *
   * @param path YAML file
   * @param environment environment snapshot used for placeholder substitution
   * @return parsed configuration
   * @throws IOException when the file cannot be read
   * @throws ConfigException when the document is invalid
   */
  public static CollectorConfig load(Path path, EnvironmentSnapshot environment) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString(), null, "configuration file not found");
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      CollectorConfig config = parse(reader, environment, path.toString());
      log.info("Loaded configuration {} ({} pipeline(s))", path, config.service().pipelines().size());
      return config;
    }
  }

  /**
   * Parses a configuration document held in memory.
   *
   * @param yaml YAML text
   * @param environment environment snapshot used for placeholder substitution
   * @return parsed configuration
   * @throws ConfigException when the document is invalid
   */
  public static CollectorConfig parse(String yaml, EnvironmentSnapshot environment) {
    return parse(new StringReader(Objects.requireNonNull(yaml, "yaml")), environment, "<inline>");
  }

  private static CollectorConfig parse(Reader reader, EnvironmentSnapshot environment, String source) {
    Objects.requireNonNull(environment, "environment");
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new ConfigException("Failed to parse YAML config at " + source + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      throw new ConfigException("Configuration " + source + " is empty");
    }
    ConfigSection root = ConfigSection.of("", substitute(document, "", environment));
    for (String key : root.keys()) {
      switch (key) {
        case "receivers", "processors", "exporters", "connectors", "service", "extensions" -> { }
        default -> log.warn("Ignoring unknown top-level configuration key '{}'", key);
      }
    }
    if (!root.section("extensions").isEmpty()) {
      log.warn("Extensions are not supported and will be ignored: {}", root.section("extensions").keys());
    }
    return new CollectorConfig(
        components(root.section("receivers")),
        components(root.section("processors")),
        components(root.section("exporters")),
        components(root.section("connectors")),
        service(root.section("service")));
  }

  private static Map<ComponentId, ConfigSection> components(ConfigSection section) {
    Map<ComponentId, ConfigSection> result = new LinkedHashMap<>();
    for (String key : section.keys()) {
      ComponentId id = ComponentId.parse(key);
      result.put(id, section.section(key));
    }
    return result;
  }

  private static ServiceConfig service(ConfigSection service) {
    if (service.isEmpty()) {
      throw new ConfigException("service section is required");
    }
    ConfigSection pipelinesSection = service.section("pipelines");
    if (pipelinesSection.isEmpty()) {
      throw new ConfigException("service.pipelines must define at least one pipeline");
    }
    Map<String, PipelineConfig> pipelines = new LinkedHashMap<>();
    for (String pipelineId : pipelinesSection.keys()) {
      pipelines.put(pipelineId, pipeline(pipelineId, pipelinesSection.section(pipelineId)));
    }
    DeliveryPolicy policy = deliveryPolicy(service, "delivery_policy").orElse(DeliveryPolicy.AT_LEAST_ONE);
    return new ServiceConfig(
        pipelines,
        policy,
        service.section("shutdown").duration("drain_timeout", ServiceConfig.DEFAULT_DRAIN_TIMEOUT),
        service.section("export").integer("workers", ServiceConfig.DEFAULT_EXPORT_WORKERS),
        service.section("telemetry").section("logs").optionalString("level"));
  }

  private static PipelineConfig pipeline(String pipelineId, ConfigSection section) {
    SignalType type;
    try {
      type = SignalType.fromString(ComponentId.parse(pipelineId).type());
    } catch (IllegalArgumentException ex) {
      throw new ConfigException(
          "Pipeline " + pipelineId + " must be named traces, metrics or logs (optionally with /name)", ex);
    }
    return new PipelineConfig(
        pipelineId,
        type,
        ids(section, "receivers"),
        ids(section, "processors"),
        ids(section, "exporters"),
        deliveryPolicy(section, "delivery_policy"));
  }

  private static List<ComponentId> ids(ConfigSection section, String key) {
    List<ComponentId> ids = new ArrayList<>();
    for (String raw : section.stringList(key)) {
      ComponentId id = ComponentId.parse(raw);
      if (ids.contains(id)) {
        throw new ConfigException(section.child(key) + " lists " + id + " more than once");
      }
      ids.add(id);
    }
    return ids;
  }

  private static Optional<DeliveryPolicy> deliveryPolicy(ConfigSection section, String key) {
    Optional<String> raw = section.optionalString(key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(DeliveryPolicy.fromString(raw.get()));
    } catch (IllegalArgumentException ex) {
      throw new ConfigException(section.child(key) + ": " + ex.getMessage(), ex);
    }
  }

  private static Object substitute(Object node, String path, EnvironmentSnapshot environment) {
    if (node instanceof String text) {
      return environment.substitute(text, path.isEmpty() ? "<root>" : path);
    }
    if (node instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        String child = path.isEmpty() ? String.valueOf(entry.getKey()) : path + "." + entry.getKey();
        copy.put(entry.getKey(), substitute(entry.getValue(), child, environment));
      }
      return copy;
    }
    if (node instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (int i = 0; i < list.size(); i++) {
        copy.add(substitute(list.get(i), path + "[" + i + "]", environment));
      }
      return copy;
    }
    return node;
  }
}
