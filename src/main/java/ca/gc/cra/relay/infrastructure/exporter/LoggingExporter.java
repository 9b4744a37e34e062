package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.LogSignal;
import ca.gc.cra.relay.domain.signal.MetricSignal;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes batches to the application log, serving the {@code logging} and {@code debug} exporter types.
 * <p>{@code basic} logs one summary line per batch, {@code normal} adds one line per signal and {@code detailed}
 * also prints resource and attribute maps.</p>
 */
public final class LoggingExporter implements SignalExporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingExporter.class);

  private final String id;
  private final Verbosity verbosity;

  public LoggingExporter(String id, Verbosity verbosity) {
    this.id = Objects.requireNonNull(id, "id");
    this.verbosity = Objects.requireNonNull(verbosity, "verbosity");
  }

  @Override
  public String id() {
    return id;
  }

  public Verbosity verbosity() {
    return verbosity;
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.allOf(SignalType.class);
  }

  @Override
  public void export(Batch batch) {
    log.info("{} batch #{} from pipeline {}: {} {}",
        id, batch.sequence(), batch.pipelineId(), batch.size(), batch.type().path());
    if (verbosity == Verbosity.BASIC) {
      return;
    }
    for (Signal signal : batch.signals()) {
      log.info("  {}", describe(signal));
      if (verbosity == Verbosity.DETAILED) {
        log.info("    resource={} attributes={}", signal.resource(), signal.attributes());
      }
    }
  }

  static String describe(Signal signal) {
    if (signal instanceof SpanSignal span) {
      return String.format(Locale.ROOT, "span %s trace=%s id=%s parent=%s kind=%s status=%s duration=%dus",
          span.name(), span.traceId(), span.spanId(), span.isRoot() ? "-" : span.parentSpanId(),
          span.kind(), span.status(), span.durationNanos() / 1_000L);
    }
    if (signal instanceof MetricSignal metric) {
      return metric.kind() == MetricSignal.Kind.HISTOGRAM
          ? String.format(Locale.ROOT, "histogram %s count=%d sum=%s %s",
              metric.name(), metric.count(), metric.sum(), metric.unit())
          : String.format(Locale.ROOT, "%s %s=%s %s",
              metric.kind().name().toLowerCase(Locale.ROOT), metric.name(), metric.value(), metric.unit());
    }
    LogSignal record = (LogSignal) signal;
    return String.format(Locale.ROOT, "log [%s] %s",
        record.severityText().isEmpty() ? Integer.toString(record.severityNumber()) : record.severityText(),
        record.body());
  }

  /** Output detail levels. */
  public enum Verbosity {
    BASIC,
    NORMAL,
    DETAILED;

    /**
     * Parses a verbosity name.
     *
     * @param raw {@code basic}, {@code normal} or {@code detailed}
     * @return verbosity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Verbosity fromString(String raw) {
      String normalized = Objects.requireNonNull(raw, "verbosity").trim().toUpperCase(Locale.ROOT);
      for (Verbosity candidate : values()) {
        if (candidate.name().equals(normalized)) {
          return candidate;
        }
      }
      throw new IllegalArgumentException("unknown verbosity '" + raw + "' (expected basic, normal or detailed)");
    }
  }
}
