package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.application.port.SignalProcessor;
import ca.gc.cra.relay.application.port.SignalRejectedException;
import ca.gc.cra.relay.domain.pipeline.DeliveryOutcome;
import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.pipeline.PipelineState;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Owns one pipeline's lifecycle: {@code STOPPED -> STARTING -> RUNNING -> DRAINING -> STOPPED}.
 * <p>While running, received signals pass through the processor chain into the batch accumulator (or straight
 * through as one batch per call when batching is disabled) and each flushed batch is handed to the exporter
 * fan-out. Draining rejects new signals, flushes the accumulator and waits up to the drain timeout for every
 * in-flight batch; anything still outstanding is abandoned and reported through a {@link DrainTimeoutException}.</p>
 * <p>Concurrent {@link #accept(List)} calls share a read lock; the transition to {@code DRAINING} takes the write
 * lock so no signal can enter the accumulator after the final flush.</p>
 *
 * @since 0.1.0
 */
public final class PipelineCoordinator {
  private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

  private final String id;
  private final SignalType signalType;
  private final List<SignalProcessor> processors;
  private final List<ExporterBinding> exporters;
  private final DeliveryPolicy deliveryPolicy;
  private final Duration drainTimeout;
  private final MetricsPort metrics;
  private final Consumer<DeliveryOutcome> outcomeListener;
  private final ExporterFanout fanout;
  private final BatchAccumulator accumulator;
  private final BatchSettings batchSettings;
  private final ClockPort clock;

  private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.STOPPED);
  private final ReentrantReadWriteLock intake = new ReentrantReadWriteLock();
  private final Set<ExporterFanout.InFlightBatch> inFlight = ConcurrentHashMap.newKeySet();
  private final AtomicLong passthroughSequence = new AtomicLong();

  private PipelineCoordinator(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.signalType = Objects.requireNonNull(builder.signalType, "signalType");
    this.processors = List.copyOf(builder.processors);
    this.exporters = List.copyOf(builder.exporters);
    if (exporters.isEmpty()) {
      throw new IllegalArgumentException("pipeline " + id + " has no exporters");
    }
    for (ExporterBinding binding : exporters) {
      if (!binding.exporter().supportedTypes().contains(signalType)) {
        throw new IllegalArgumentException(
            "exporter " + binding.id() + " does not support " + signalType.path() + " in pipeline " + id);
      }
    }
    this.deliveryPolicy = Objects.requireNonNull(builder.deliveryPolicy, "deliveryPolicy");
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.outcomeListener = builder.outcomeListener;
    this.batchSettings = builder.batchSettings;
    ExecutorService exportExecutor = Objects.requireNonNull(builder.exportExecutor, "exportExecutor");
    ScheduledExecutorService scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.fanout = new ExporterFanout(id, exporters, deliveryPolicy, exportExecutor, scheduler, metrics);
    if (batchSettings != null) {
      this.accumulator = new BatchAccumulator(id, signalType, batchSettings, scheduler, clock, this::dispatch);
    } else {
      this.accumulator = null;
    }
  }

  /**
   * Creates a builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public String id() {
    return id;
  }

  public SignalType signalType() {
    return signalType;
  }

  public PipelineState state() {
    return state.get();
  }

  public DeliveryPolicy deliveryPolicy() {
    return deliveryPolicy;
  }

  public List<ExporterBinding> exporters() {
    return exporters;
  }

  public Optional<BatchSettings> batchSettings() {
    return Optional.ofNullable(batchSettings);
  }

  /**
   * Returns the number of batches whose delivery has not finished.
   *
   * @return in-flight batch count
   */
  public int inFlightCount() {
    return inFlight.size();
  }

  /**
   * Starts every exporter and transitions to {@code RUNNING}.
   * <p>Exporters marked required are checked for reachability; an unreachable one aborts startup, closes what was started and returns
   * the pipeline to {@code STOPPED}.</p>
   *
   * @throws PipelineStartupException if an exporter fails to start (including unchecked failures such as a client
   *     library rejecting its settings) or a required endpoint is unreachable
   * @throws IllegalStateException if the pipeline is not {@code STOPPED}
   */
  public void start() throws PipelineStartupException {
    transition(PipelineState.STOPPED, PipelineState.STARTING);
    MDC.put("pipeline", id);
    List<ExporterBinding> started = new ArrayList<>(exporters.size());
    try {
      for (ExporterBinding binding : exporters) {
        SignalExporter exporter = binding.exporter();
        try {
          exporter.start();
          started.add(binding);
          if (binding.required()) {
            exporter.checkReachable();
          }
        } catch (IOException | ExportException | RuntimeException ex) {
          closeAll(started);
          state.set(PipelineState.STOPPED);
          metrics.increment("pipeline." + id + ".start.failed");
          throw new PipelineStartupException(
              "Pipeline " + id + " cannot start exporter " + binding.id() + ": " + ex.getMessage(), ex);
        }
      }
      state.set(PipelineState.RUNNING);
      log.info("Pipeline {} running ({} exporters, policy {}, batching {})",
          id, exporters.size(), deliveryPolicy, batchSettings == null ? "off" : batchSettings);
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Accepts signals for processing and batching.
   *
   * @param signals signals in receipt order; all must match the pipeline's signal type
   * @return number of signals accepted after processing
   * @throws SignalRejectedException if the pipeline is not {@code RUNNING}
   * @throws IllegalArgumentException if a signal of another type is supplied
   */
  public int accept(List<Signal> signals) throws SignalRejectedException {
    Objects.requireNonNull(signals, "signals");
    intake.readLock().lock();
    try {
      PipelineState current = state.get();
      if (!current.acceptsSignals()) {
        metrics.increment("pipeline." + id + ".rejected");
        throw new SignalRejectedException("Pipeline " + id + " is " + current + " and not accepting signals");
      }
      for (Signal signal : signals) {
        if (signal.type() != signalType) {
          throw new IllegalArgumentException(
              "pipeline " + id + " accepts " + signalType.path() + " but received " + signal.type().path());
        }
      }
      List<Signal> processed = signals;
      for (SignalProcessor processor : processors) {
        processed = processor.process(processed);
      }
      if (processed.isEmpty()) {
        return 0;
      }
      metrics.observe("pipeline." + id + ".accepted", processed.size());
      if (accumulator != null) {
        accumulator.add(processed);
      } else {
        dispatch(new Batch(id, signalType, passthroughSequence.getAndIncrement(),
            Instant.ofEpochMilli(clock.nowMillis()), processed));
      }
      return processed.size();
    } finally {
      intake.readLock().unlock();
    }
  }

  /**
   * Forces a flush of buffered signals.
   *
   * @return number of signals flushed
   */
  public int flush() {
    return accumulator == null ? 0 : accumulator.flush();
  }

  /**
   * Drains the pipeline and returns it to {@code STOPPED}.
   * <p>Calling drain on a pipeline that is not running returns an empty report.</p>
   *
   * @return drain summary, carrying a {@link DrainTimeoutException} when the grace period was exceeded
   */
  public DrainReport drain() {
    intake.writeLock().lock();
    try {
      if (!state.compareAndSet(PipelineState.RUNNING, PipelineState.DRAINING)) {
        return new DrainReport(id, 0, 0, Optional.empty());
      }
    } finally {
      intake.writeLock().unlock();
    }
    MDC.put("pipeline", id);
    try {
      long deadline = System.nanoTime() + drainTimeout.toNanos();
      if (accumulator != null) {
        int flushed = accumulator.flush();
        accumulator.cancelTimer();
        if (flushed > 0) {
          log.info("Pipeline {} flushed {} buffered signal(s) on drain", id, flushed);
        }
      }
      List<ExporterFanout.InFlightBatch> pending = new ArrayList<>(inFlight);
      int total = pending.size();
      Optional<DrainTimeoutException> timeout = Optional.empty();
      int abandoned = awaitAll(pending, deadline);
      if (abandoned > 0) {
        DrainTimeoutException ex = new DrainTimeoutException(id, drainTimeout, abandoned);
        metrics.increment("pipeline." + id + ".drain.timeout");
        log.error("Pipeline {} drain timed out", id, ex);
        timeout = Optional.of(ex);
      }
      closeAll(exporters);
      state.set(PipelineState.STOPPED);
      log.info("Pipeline {} stopped ({} of {} in-flight batch(es) completed)", id, total - abandoned, total);
      return new DrainReport(id, total - abandoned, abandoned, timeout);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private int awaitAll(List<ExporterFanout.InFlightBatch> pending, long deadline) {
    if (pending.isEmpty()) {
      return 0;
    }
    CompletableFuture<?>[] outcomes =
        pending.stream().map(ExporterFanout.InFlightBatch::outcome).toArray(CompletableFuture[]::new);
    try {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      CompletableFuture.allOf(outcomes).get(remaining, TimeUnit.NANOSECONDS);
      return 0;
    } catch (TimeoutException ex) {
      log.debug("Drain deadline reached with {} batch(es) outstanding", countOutstanding(pending));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Pipeline {} interrupted while draining; abandoning outstanding deliveries", id);
    } catch (ExecutionException ex) {
      log.error("Pipeline {} delivery aggregation failed", id, ex.getCause());
    }
    int abandoned = 0;
    Throwable reason = new DrainTimeoutException(id, drainTimeout, 0);
    for (ExporterFanout.InFlightBatch batch : pending) {
      if (!batch.outcome().isDone() && batch.abandon(reason) > 0) {
        abandoned++;
      }
    }
    return abandoned;
  }

  private static long countOutstanding(List<ExporterFanout.InFlightBatch> pending) {
    return pending.stream().filter(b -> !b.outcome().isDone()).count();
  }

  private void dispatch(Batch batch) {
    metrics.observe("pipeline." + id + ".batch.size", batch.size());
    ExporterFanout.InFlightBatch handle = fanout.dispatch(batch);
    inFlight.add(handle);
    handle.outcome().whenComplete((outcome, error) -> {
      inFlight.remove(handle);
      if (error != null) {
        log.error("Pipeline {} batch {} delivery failed unexpectedly", id, batch.sequence(), error);
        return;
      }
      if (outcomeListener != null) {
        try {
          outcomeListener.accept(outcome);
        } catch (RuntimeException ex) {
          log.warn("Outcome listener failed for pipeline {}", id, ex);
        }
      }
    });
  }

  private void closeAll(List<ExporterBinding> bindings) {
    for (ExporterBinding binding : bindings) {
      try {
        binding.exporter().close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close exporter {} in pipeline {}", binding.id(), id, ex);
      }
    }
  }

  private void transition(PipelineState from, PipelineState to) {
    if (!state.compareAndSet(from, to)) {
      throw new IllegalStateException(
          "Pipeline " + id + " cannot move to " + to + " from " + state.get());
    }
  }

  /**
   * Builder for {@link PipelineCoordinator}.
   */
  public static final class Builder {
    private String id;
    private SignalType signalType;
    private final List<SignalProcessor> processors = new ArrayList<>();
    private final List<ExporterBinding> exporters = new ArrayList<>();
    private BatchSettings batchSettings;
    private DeliveryPolicy deliveryPolicy = DeliveryPolicy.AT_LEAST_ONE;
    private Duration drainTimeout = Duration.ofSeconds(10);
    private ExecutorService exportExecutor;
    private ScheduledExecutorService scheduler;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ClockPort clock = ClockPort.SYSTEM;
    private Consumer<DeliveryOutcome> outcomeListener;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder signalType(SignalType signalType) {
      this.signalType = signalType;
      return this;
    }

    public Builder processor(SignalProcessor processor) {
      this.processors.add(Objects.requireNonNull(processor, "processor"));
      return this;
    }

    public Builder exporter(ExporterBinding binding) {
      this.exporters.add(Objects.requireNonNull(binding, "binding"));
      return this;
    }

    /**
     * Enables batching; without it every accepted list is dispatched as its own batch.
     *
     * @param settings batch settings, or {@code null} to disable batching
     * @return this builder
     */
    public Builder batching(BatchSettings settings) {
      this.batchSettings = settings;
      return this;
    }

    public Builder deliveryPolicy(DeliveryPolicy deliveryPolicy) {
      this.deliveryPolicy = deliveryPolicy;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public Builder exportExecutor(ExecutorService exportExecutor) {
      this.exportExecutor = exportExecutor;
      return this;
    }

    /**
     * Sets the scheduler firing batch timeouts and exporter retry timers.
     *
     * @param scheduler shared scheduler; required
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(ClockPort clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Registers a callback invoked with each batch's outcome once all exporters reached a terminal state.
     *
     * @param listener outcome callback, invoked on an export thread
     * @return this builder
     */
    public Builder outcomeListener(Consumer<DeliveryOutcome> listener) {
      this.outcomeListener = listener;
      return this;
    }

    /**
     * Builds the coordinator in the {@code STOPPED} state.
     *
     * @return coordinator
     * @throws IllegalArgumentException if no exporter is bound or an exporter cannot carry the signal type
     */
    public PipelineCoordinator build() {
      return new PipelineCoordinator(this);
    }
  }
}
