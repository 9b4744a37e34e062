package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.pipeline.DeliveryOutcome;
import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.pipeline.ExportResult;
import ca.gc.cra.relay.domain.signal.Batch;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Dispatches each batch to every exporter of a pipeline concurrently, one delivery attempt chain per exporter.
 * <p>Export calls run on the shared export pool (threads named {@code relay-export-}). A transient failure frees
 * the worker and the next attempt is scheduled on the retry scheduler after the backoff delay, so an exporter that
 * keeps failing holds no thread while it waits. Each exporter also has its own lane: at most
 * {@link SendingQueue#consumers()} of its attempts run at once and at most {@link SendingQueue#queueSize()} wait
 * behind them; attempts beyond that fail for that exporter only.</p>
 * <p>Per-exporter results complete individual futures that are aggregated into a {@link DeliveryOutcome} once all
 * of them are terminal. Both executors are owned by the caller.</p>
 *
 * @since 0.1.0
 */
public final class ExporterFanout {
  private static final Logger log = LoggerFactory.getLogger(ExporterFanout.class);

  private final String pipelineId;
  private final List<Lane> lanes;
  private final DeliveryPolicy policy;
  private final ExecutorService executor;
  private final ScheduledExecutorService retryScheduler;
  private final MetricsPort metrics;

  /**
   * Creates a fan-out for one pipeline.
   *
   * @param pipelineId owning pipeline id, used for logging and metrics
   * @param bindings exporters in declaration order; must not be empty
   * @param policy rule deciding whether a batch counts as delivered
   * @param executor pool running export calls
   * @param retryScheduler scheduler firing retry timers; it never runs an export itself
   * @param metrics metrics sink
   */
  public ExporterFanout(
      String pipelineId,
      List<ExporterBinding> bindings,
      DeliveryPolicy policy,
      ExecutorService executor,
      ScheduledExecutorService retryScheduler,
      MetricsPort metrics) {
    this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId");
    Objects.requireNonNull(bindings, "bindings");
    if (bindings.isEmpty()) {
      throw new IllegalArgumentException("pipeline " + pipelineId + " has no exporters");
    }
    this.lanes = bindings.stream().map(Lane::new).toList();
    this.policy = Objects.requireNonNull(policy, "policy");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Starts delivery of a batch to every exporter.
   *
   * @param batch batch to deliver; ownership passes to the fan-out
   * @return handle exposing the aggregated outcome and allowing cancellation
   */
  public InFlightBatch dispatch(Batch batch) {
    Objects.requireNonNull(batch, "batch");
    long dispatchNanos = System.nanoTime();
    List<Attempt> attempts = new ArrayList<>(lanes.size());
    for (Lane lane : lanes) {
      attempts.add(new Attempt(lane, batch, dispatchNanos));
    }
    CompletableFuture<?>[] results = attempts.stream().map(a -> a.result).toArray(CompletableFuture[]::new);
    CompletableFuture<DeliveryOutcome> outcome = CompletableFuture.allOf(results)
        .thenApply(ignored -> DeliveryOutcome.of(
            pipelineId, batch.sequence(), batch.size(),
            attempts.stream().map(a -> a.result.join()).toList(), policy));
    outcome.thenAccept(this::recordOutcome);
    attempts.forEach(this::enqueue);
    return new InFlightBatch(batch, attempts, outcome);
  }

  private void enqueue(Attempt attempt) {
    if (attempt.result.isDone()) {
      return;
    }
    if (!attempt.lane.offer(attempt)) {
      SendingQueue queue = attempt.lane.binding.queue();
      finish(attempt, failure(attempt, new ExportTerminalException(
          "sending queue full (" + queue.consumers() + " running, " + queue.queueSize() + " waiting)")));
    }
  }

  private void attemptOnce(Attempt attempt) {
    if (attempt.result.isDone()) {
      return;
    }
    ExporterBinding binding = attempt.lane.binding;
    String exporterId = binding.id();
    Batch batch = attempt.batch;
    MDC.put("pipeline", pipelineId);
    MDC.put("exporter", exporterId);
    int number = attempt.attempts.incrementAndGet();
    try {
      binding.exporter().export(batch);
      long latency = System.nanoTime() - attempt.dispatchNanos;
      metrics.increment("exporter." + exporterId + ".sent");
      metrics.observe("exporter." + exporterId + ".latencyNanos", latency);
      log.debug("Delivered batch {} ({} signals) on attempt {}", batch.sequence(), batch.size(), number);
      finish(attempt, ExportResult.success(exporterId, number, latency));
    } catch (ExportException ex) {
      if (attempt.result.isDone()) {
        log.debug("Batch {} failed after it was abandoned: {}", batch.sequence(), ex.getMessage());
        return;
      }
      int budget = binding.retry().attemptBudget();
      if (!ex.isRetryable()) {
        finish(attempt, failure(attempt, ex));
      } else if (number >= budget) {
        finish(attempt, failure(attempt, new ExportTerminalException(
            "retry budget exhausted after " + number + " attempt(s): " + ex.getMessage(), ex)));
      } else {
        scheduleRetry(attempt, number, budget, ex);
      }
    } catch (InterruptedException ex) {
      if (!attempt.result.isDone()) {
        metrics.increment("exporter." + exporterId + ".abandoned");
        log.warn("Delivery of batch {} interrupted after {} attempt(s)", batch.sequence(), number);
        finish(attempt, ExportResult.abandoned(exporterId, number, System.nanoTime() - attempt.dispatchNanos, ex));
      }
    } catch (RuntimeException ex) {
      finish(attempt, failure(attempt,
          new ExportTerminalException("exporter failed unexpectedly: " + ex.getMessage(), ex)));
    } finally {
      MDC.remove("exporter");
      MDC.remove("pipeline");
    }
  }

  private void scheduleRetry(Attempt attempt, int number, int budget, ExportException cause) {
    String exporterId = attempt.lane.binding.id();
    Duration delay = attempt.lane.binding.retry().backoff(number);
    metrics.increment("exporter." + exporterId + ".retried");
    log.warn("Transient failure delivering batch {} (attempt {}/{}); retrying in {}ms: {}",
        attempt.batch.sequence(), number, budget, delay.toMillis(), cause.getMessage());
    try {
      attempt.retryTimer = retryScheduler.schedule(() -> enqueue(attempt), delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException ex) {
      finish(attempt, failure(attempt, new ExportTerminalException("retry scheduler is shut down", cause)));
    }
  }

  private void finish(Attempt attempt, ExportResult result) {
    attempt.result.complete(result);
  }

  private ExportResult failure(Attempt attempt, ExportException error) {
    String exporterId = attempt.lane.binding.id();
    metrics.increment("exporter." + exporterId + ".failed");
    log.error("Failed to deliver batch {} ({} signals) to {} after {} attempt(s)",
        attempt.batch.sequence(), attempt.batch.size(), exporterId, attempt.attempts.get(), error);
    return ExportResult.failed(
        exporterId, attempt.attempts.get(), System.nanoTime() - attempt.dispatchNanos, error);
  }

  private void recordOutcome(DeliveryOutcome outcome) {
    if (outcome.delivered()) {
      metrics.increment("pipeline." + pipelineId + ".batch.delivered");
    } else {
      metrics.increment("pipeline." + pipelineId + ".batch.undelivered");
      log.warn("Pipeline {} batch {} not delivered under {} ({} failed, {} abandoned)",
          pipelineId, outcome.sequence(), policy,
          outcome.count(ExportResult.Status.FAILED), outcome.count(ExportResult.Status.ABANDONED));
    }
  }

  /**
   * Batch whose delivery is in progress.
   */
  public final class InFlightBatch {
    private final Batch batch;
    private final List<Attempt> attempts;
    private final CompletableFuture<DeliveryOutcome> outcome;

    private InFlightBatch(Batch batch, List<Attempt> attempts, CompletableFuture<DeliveryOutcome> outcome) {
      this.batch = batch;
      this.attempts = attempts;
      this.outcome = outcome;
    }

    public Batch batch() {
      return batch;
    }

    /**
     * Returns the aggregated outcome, completed once every exporter reached a terminal state.
     *
     * @return outcome future
     */
    public CompletableFuture<DeliveryOutcome> outcome() {
      return outcome;
    }

    /**
     * Cancels every attempt that has not finished, reporting it as abandoned. A running export is interrupted,
     * a pending retry timer is cancelled and a queued attempt is skipped when its turn comes.
     *
     * @param reason cause recorded on abandoned results
     * @return number of exporter attempts that were abandoned by this call
     */
    public int abandon(Throwable reason) {
      int abandoned = 0;
      for (Attempt attempt : attempts) {
        String exporterId = attempt.lane.binding.id();
        ExportResult result = ExportResult.abandoned(
            exporterId, attempt.attempts.get(), System.nanoTime() - attempt.dispatchNanos, reason);
        if (attempt.result.complete(result)) {
          abandoned++;
          metrics.increment("exporter." + exporterId + ".abandoned");
          log.warn("Delivery of batch {} to {} abandoned after {} attempt(s)",
              batch.sequence(), exporterId, attempt.attempts.get());
          Future<?> timer = attempt.retryTimer;
          if (timer != null) {
            timer.cancel(false);
          }
          attempt.interrupt();
        }
      }
      return abandoned;
    }
  }

  /** Admission and ordering of one exporter's attempts. */
  private final class Lane {
    private final ExporterBinding binding;
    private final Deque<Attempt> waiting = new ArrayDeque<>();
    private int running;

    private Lane(ExporterBinding binding) {
      this.binding = Objects.requireNonNull(binding, "binding");
    }

    boolean offer(Attempt attempt) {
      synchronized (this) {
        if (running >= binding.queue().consumers()) {
          if (waiting.size() >= binding.queue().queueSize()) {
            return false;
          }
          waiting.addLast(attempt);
          return true;
        }
        running++;
      }
      submit(attempt);
      return true;
    }

    private void submit(Attempt attempt) {
      try {
        executor.execute(() -> run(attempt));
      } catch (RejectedExecutionException ex) {
        log.error("Export pool rejected batch {} for exporter {}", attempt.batch.sequence(), binding.id(), ex);
        finish(attempt, failure(attempt, new ExportTerminalException("export pool rejected the batch", ex)));
        next();
      }
    }

    private void run(Attempt attempt) {
      attempt.bind(Thread.currentThread());
      try {
        attemptOnce(attempt);
      } finally {
        attempt.unbind();
        next();
      }
    }

    private void next() {
      Attempt following;
      synchronized (this) {
        following = waiting.pollFirst();
        if (following == null) {
          running--;
          return;
        }
      }
      submit(following);
    }
  }

  private static final class Attempt {
    private final Lane lane;
    private final Batch batch;
    private final long dispatchNanos;
    private final AtomicInteger attempts = new AtomicInteger();
    private final CompletableFuture<ExportResult> result = new CompletableFuture<>();
    private volatile Future<?> retryTimer;
    private Thread runner;

    private Attempt(Lane lane, Batch batch, long dispatchNanos) {
      this.lane = lane;
      this.batch = batch;
      this.dispatchNanos = dispatchNanos;
    }

    private synchronized void bind(Thread thread) {
      runner = thread;
    }

    // Clears any interrupt aimed at this attempt before the worker moves on to other work.
    private synchronized void unbind() {
      runner = null;
      Thread.interrupted();
    }

    private synchronized void interrupt() {
      if (runner != null) {
        runner.interrupt();
      }
    }
  }
}
