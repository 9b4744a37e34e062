package ca.gc.cra.relay.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed collector document: component definitions plus the service section.
 * Component bodies stay as {@link ConfigSection}s and are interpreted by {@link CompositionRoot}.
 *
 * @param receivers receiver definitions
 * @param processors processor definitions
 * @param exporters exporter definitions
 * @param connectors connector definitions
 * @param service service section
 * @since 0.1.0
 */
public record CollectorConfig(
    Map<ComponentId, ConfigSection> receivers,
    Map<ComponentId, ConfigSection> processors,
    Map<ComponentId, ConfigSection> exporters,
    Map<ComponentId, ConfigSection> connectors,
    ServiceConfig service) {

  public CollectorConfig {
    receivers = copy(receivers);
    processors = copy(processors);
    exporters = copy(exporters);
    connectors = copy(connectors);
    Objects.requireNonNull(service, "service");
  }

  private static Map<ComponentId, ConfigSection> copy(Map<ComponentId, ConfigSection> source) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(source)));
  }
}
