package ca.gc.cra.relay.config;

import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code service} section.
 *
 * @param pipelines pipelines keyed by id, in document order
 * @param deliveryPolicy default policy for pipelines without an override
 * @param drainTimeout grace period for in-flight batches on shutdown
 * @param exportWorkers size of the shared export pool
 * @param logLevel optional root log level from {@code service.telemetry.logs.level}
 * @since 0.1.0
 */
public record ServiceConfig(
    Map<String, PipelineConfig> pipelines,
    DeliveryPolicy deliveryPolicy,
    Duration drainTimeout,
    int exportWorkers,
    Optional<String> logLevel) {

  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);
  public static final int DEFAULT_EXPORT_WORKERS = 16;

  public ServiceConfig {
    pipelines = Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
    Objects.requireNonNull(deliveryPolicy, "deliveryPolicy");
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (exportWorkers < 1) {
      throw new ConfigException("service.export.workers must be >= 1");
    }
    logLevel = Objects.requireNonNullElse(logLevel, Optional.empty());
  }
}
