package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.port.SignalReceiver;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the resolved pipeline graph: starts every pipeline before any receiver, and on shutdown closes receivers
 * before draining pipelines.
 * <p>Pipelines are drained in the order supplied, which places connector producers ahead of their consumers so
 * signals forwarded during a drain still find a running pipeline.</p>
 *
 * @since 0.1.0
 */
public final class CollectorService {
  private static final Logger log = LoggerFactory.getLogger(CollectorService.class);
  private static final Duration EXECUTOR_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final List<PipelineCoordinator> pipelines;
  private final List<SignalReceiver> receivers;
  private final SignalRouter router;
  private final List<ExecutorService> executors;
  private final List<AutoCloseable> resources;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final List<SignalReceiver> startedReceivers = new ArrayList<>();
  private volatile List<DrainReport> drainReports = List.of();

  /**
   * Creates the service.
   *
   * @param pipelines pipelines in drain order
   * @param receivers receivers feeding the router
   * @param router receiver-to-pipeline routes
   * @param executors pools owned by the service and shut down last
   * @param resources additional resources closed after the executors (e.g., metrics adapters)
   */
  public CollectorService(
      List<PipelineCoordinator> pipelines,
      List<SignalReceiver> receivers,
      SignalRouter router,
      List<? extends ExecutorService> executors,
      List<? extends AutoCloseable> resources) {
    this.pipelines = List.copyOf(Objects.requireNonNull(pipelines, "pipelines"));
    this.receivers = List.copyOf(Objects.requireNonNull(receivers, "receivers"));
    this.router = Objects.requireNonNull(router, "router");
    this.executors = List.copyOf(Objects.requireNonNull(executors, "executors"));
    this.resources = List.copyOf(Objects.requireNonNull(resources, "resources"));
  }

  public List<PipelineCoordinator> pipelines() {
    return pipelines;
  }

  public List<SignalReceiver> receivers() {
    return receivers;
  }

  /**
   * Starts all pipelines, then all receivers. On any failure everything already started is shut down.
   *
   * @throws PipelineStartupException if a pipeline cannot start
   * @throws IOException if a receiver cannot bind its transport
   * @throws IllegalStateException if called more than once
   */
  public void start() throws PipelineStartupException, IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Collector already started");
    }
    try {
      for (PipelineCoordinator pipeline : pipelines) {
        pipeline.start();
      }
      for (SignalReceiver receiver : receivers) {
        receiver.start(router.consumerFor(receiver.id()));
        synchronized (startedReceivers) {
          startedReceivers.add(receiver);
        }
        log.info("Receiver {} started", receiver.id());
      }
    } catch (PipelineStartupException | IOException | RuntimeException ex) {
      log.error("Collector startup failed; shutting down started components", ex);
      shutdown();
      throw ex;
    }
    log.info("Collector started with {} pipeline(s) and {} receiver(s)", pipelines.size(), receivers.size());
  }

  /**
   * Stops receivers, drains pipelines and releases executors. Idempotent.
   *
   * @return per-pipeline drain reports in drain order
   */
  public List<DrainReport> shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      awaitTermination();
      return drainReports;
    }
    try {
      List<SignalReceiver> toClose;
      synchronized (startedReceivers) {
        toClose = new ArrayList<>(startedReceivers);
      }
      for (SignalReceiver receiver : toClose) {
        try {
          receiver.close();
          log.info("Receiver {} closed", receiver.id());
        } catch (RuntimeException ex) {
          log.warn("Failed to close receiver {}", receiver.id(), ex);
        }
      }
      List<DrainReport> reports = new ArrayList<>(pipelines.size());
      for (PipelineCoordinator pipeline : pipelines) {
        reports.add(pipeline.drain());
      }
      drainReports = List.copyOf(reports);
      for (ExecutorService executor : executors) {
        shutdownExecutor(executor);
      }
      for (AutoCloseable resource : resources) {
        try {
          resource.close();
        } catch (Exception ex) {
          log.warn("Failed to close resource {}", resource, ex);
        }
      }
      long timedOut = reports.stream().filter(r -> !r.clean()).count();
      log.info("Collector stopped; {} pipeline(s) drained, {} timed out", reports.size(), timedOut);
      return drainReports;
    } finally {
      terminated.countDown();
    }
  }

  /**
   * Blocks until {@link #shutdown()} has completed.
   */
  public void awaitTermination() {
    try {
      terminated.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Registers a JVM shutdown hook that drains the collector on SIGTERM/SIGINT.
   *
   * @return the registered hook thread
   */
  public Thread registerShutdownHook() {
    Thread hook = new Thread(this::shutdown, "relay-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }

  private static void shutdownExecutor(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Executor did not terminate within {}ms; forcing shutdown", EXECUTOR_SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
