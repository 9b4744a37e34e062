package ca.gc.cra.relay.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.ExportTransientException;
import ca.gc.cra.relay.domain.pipeline.DeliveryOutcome;
import ca.gc.cra.relay.domain.pipeline.DeliveryPolicy;
import ca.gc.cra.relay.domain.pipeline.ExportResult;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import ca.gc.cra.relay.testutil.ScriptedExporter;
import ca.gc.cra.relay.testutil.TestSignals;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExporterFanoutTest {
  private static final RetryPolicy FAST_RETRY =
      new RetryPolicy(true, Duration.ofMillis(1), Duration.ofMillis(5), 2.0d, 3);

  private ExecutorService pool;
  private ScheduledExecutorService scheduler;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(4);
    scheduler = Executors.newSingleThreadScheduledExecutor();
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    scheduler.shutdownNow();
    pool.shutdownNow();
    pool.awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  void atLeastOneDeliversWhenAnyExporterSucceeds() throws Exception {
    ScriptedExporter a = new ScriptedExporter("a");
    ScriptedExporter b = new ScriptedExporter("b").failAlways(new ExportTerminalException("rejected"));
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE,
        new ExporterBinding(a, FAST_RETRY, false), new ExporterBinding(b, FAST_RETRY, false));

    DeliveryOutcome outcome = fanout.dispatch(TestSignals.traceBatch(5)).outcome().get(5, TimeUnit.SECONDS);

    assertTrue(outcome.delivered());
    assertEquals(5, outcome.signalCount());
    assertEquals(ExportResult.Status.SUCCESS, outcome.resultFor("a").orElseThrow().status());
    ExportResult failed = outcome.resultFor("b").orElseThrow();
    assertEquals(ExportResult.Status.FAILED, failed.status());
    assertEquals(1, failed.attempts(), "terminal errors are not retried");
    assertEquals(1, a.delivered().size());
    assertEquals(1, metrics.count("pipeline.traces.batch.delivered"));
    assertEquals(1, metrics.count("exporter.b.failed"));
  }

  @Test
  void allRequiredFailsWhenOneExporterFails() throws Exception {
    ScriptedExporter a = new ScriptedExporter("a");
    ScriptedExporter b = new ScriptedExporter("b").failAlways(new ExportTerminalException("bad request"));
    ExporterFanout fanout = fanout(DeliveryPolicy.ALL_REQUIRED,
        new ExporterBinding(a, FAST_RETRY, false), new ExporterBinding(b, FAST_RETRY, false));

    DeliveryOutcome outcome = fanout.dispatch(TestSignals.traceBatch(2)).outcome().get(5, TimeUnit.SECONDS);

    assertFalse(outcome.delivered());
    assertEquals(1, outcome.count(ExportResult.Status.SUCCESS));
    assertEquals(1, outcome.count(ExportResult.Status.FAILED));
    assertEquals(1, metrics.count("pipeline.traces.batch.undelivered"));
  }

  @Test
  void atLeastOneFailsWhenEveryExporterFails() throws Exception {
    ScriptedExporter a = new ScriptedExporter("a").failAlways(new ExportTerminalException("no"));
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE, new ExporterBinding(a, FAST_RETRY, false));

    DeliveryOutcome outcome = fanout.dispatch(TestSignals.traceBatch(1)).outcome().get(5, TimeUnit.SECONDS);

    assertFalse(outcome.delivered());
  }

  @Test
  void transientFailuresAreRetriedUntilSuccess() throws Exception {
    ScriptedExporter flaky = new ScriptedExporter("flaky")
        .failNext(new ExportTransientException("503"))
        .failNext(new ExportTransientException("503"));
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE, new ExporterBinding(flaky, FAST_RETRY, false));

    DeliveryOutcome outcome = fanout.dispatch(TestSignals.traceBatch(3)).outcome().get(5, TimeUnit.SECONDS);

    ExportResult result = outcome.resultFor("flaky").orElseThrow();
    assertTrue(result.succeeded());
    assertEquals(3, result.attempts());
    assertEquals(2, metrics.count("exporter.flaky.retried"));
    assertEquals(1, metrics.count("exporter.flaky.sent"));
  }

  @Test
  void exhaustedRetryBudgetBecomesTerminal() throws Exception {
    ScriptedExporter down = new ScriptedExporter("down").failAlways(new ExportTransientException("refused"));
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE, new ExporterBinding(down, FAST_RETRY, false));

    DeliveryOutcome outcome = fanout.dispatch(TestSignals.traceBatch(1)).outcome().get(5, TimeUnit.SECONDS);

    ExportResult result = outcome.resultFor("down").orElseThrow();
    assertEquals(ExportResult.Status.FAILED, result.status());
    assertEquals(3, result.attempts());
    assertEquals(3, down.calls());
    ExportTerminalException error = assertInstanceOf(ExportTerminalException.class, result.error());
    assertTrue(error.getMessage().contains("retry budget exhausted"), error.getMessage());
  }

  @Test
  void disabledRetryMakesOneAttempt() throws Exception {
    ScriptedExporter down = new ScriptedExporter("down").failAlways(new ExportTransientException("timeout"));
    ExporterFanout fanout =
        fanout(DeliveryPolicy.AT_LEAST_ONE, new ExporterBinding(down, RetryPolicy.disabled(), false));

    DeliveryOutcome outcome = fanout.dispatch(TestSignals.traceBatch(1)).outcome().get(5, TimeUnit.SECONDS);

    assertEquals(1, outcome.resultFor("down").orElseThrow().attempts());
  }

  @Test
  void slowExporterDoesNotDelayFastOne() throws Exception {
    ScriptedExporter slow = new ScriptedExporter("slow").hold();
    ScriptedExporter fast = new ScriptedExporter("fast");
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE,
        new ExporterBinding(slow, FAST_RETRY, false), new ExporterBinding(fast, FAST_RETRY, false));

    ExporterFanout.InFlightBatch inFlight = fanout.dispatch(TestSignals.traceBatch(1));
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (fast.delivered().isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    assertEquals(1, fast.delivered().size());
    assertFalse(inFlight.outcome().isDone());
    slow.release();
    assertTrue(inFlight.outcome().get(5, TimeUnit.SECONDS).delivered());
  }

  @Test
  void abandonCompletesOutstandingAttempts() throws Exception {
    ScriptedExporter stuck = new ScriptedExporter("stuck").hold();
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE, new ExporterBinding(stuck, FAST_RETRY, false));

    ExporterFanout.InFlightBatch inFlight = fanout.dispatch(TestSignals.traceBatch(1));
    int abandoned = inFlight.abandon(new IllegalStateException("drain timeout"));

    assertEquals(1, abandoned);
    DeliveryOutcome outcome = inFlight.outcome().get(5, TimeUnit.SECONDS);
    assertFalse(outcome.delivered());
    assertEquals(ExportResult.Status.ABANDONED, outcome.resultFor("stuck").orElseThrow().status());
    assertEquals(0, inFlight.abandon(new IllegalStateException("again")));
  }

  @Test
  void retryingExporterLeavesPoolFreeForHealthySibling() throws Exception {
    RetryPolicy slowRetry = new RetryPolicy(true, Duration.ofSeconds(1), Duration.ofSeconds(2), 2.0d, 3);
    ScriptedExporter down = new ScriptedExporter("down").failAlways(new ExportTransientException("refused"));
    ScriptedExporter healthy = new ScriptedExporter("healthy");
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE,
        new ExporterBinding(down, slowRetry, false), new ExporterBinding(healthy, slowRetry, false));

    List<ExporterFanout.InFlightBatch> inFlight = new ArrayList<>();
    long started = System.nanoTime();
    for (int i = 0; i < 40; i++) {
      inFlight.add(fanout.dispatch(TestSignals.traceBatch(1)));
    }
    long deadline = started + TimeUnit.MILLISECONDS.toNanos(800);
    while (healthy.delivered().size() < 40 && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    assertEquals(40, healthy.delivered().size(), "healthy exporter waited behind retry backoff");
    inFlight.forEach(batch -> batch.abandon(new IllegalStateException("test finished")));
  }

  @Test
  void fullSendingQueueFailsOnlyThatExporter() throws Exception {
    ScriptedExporter stuck = new ScriptedExporter("stuck").hold();
    ScriptedExporter fast = new ScriptedExporter("fast");
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE,
        new ExporterBinding(stuck, FAST_RETRY, false, new SendingQueue(1, 1)),
        new ExporterBinding(fast, FAST_RETRY, false));

    ExporterFanout.InFlightBatch first = fanout.dispatch(TestSignals.traceBatch(1));
    ExporterFanout.InFlightBatch second = fanout.dispatch(TestSignals.traceBatch(1));
    ExporterFanout.InFlightBatch third = fanout.dispatch(TestSignals.traceBatch(1));

    DeliveryOutcome overflow = third.outcome().get(5, TimeUnit.SECONDS);
    ExportResult rejected = overflow.resultFor("stuck").orElseThrow();
    assertEquals(ExportResult.Status.FAILED, rejected.status());
    assertTrue(rejected.error().getMessage().contains("sending queue full"), rejected.error().getMessage());
    assertTrue(overflow.delivered(), "sibling exporter still delivered the batch");

    stuck.release();
    assertTrue(first.outcome().get(5, TimeUnit.SECONDS).resultFor("stuck").orElseThrow().succeeded());
    assertTrue(second.outcome().get(5, TimeUnit.SECONDS).resultFor("stuck").orElseThrow().succeeded());
    assertEquals(2, stuck.delivered().size());
  }

  @Test
  void abandonCancelsPendingRetry() throws Exception {
    RetryPolicy slowRetry = new RetryPolicy(true, Duration.ofSeconds(30), Duration.ofSeconds(30), 1.0d, 5);
    ScriptedExporter down = new ScriptedExporter("down").failAlways(new ExportTransientException("503"));
    ExporterFanout fanout = fanout(DeliveryPolicy.AT_LEAST_ONE, new ExporterBinding(down, slowRetry, false));

    ExporterFanout.InFlightBatch inFlight = fanout.dispatch(TestSignals.traceBatch(1));
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (metrics.count("exporter.down.retried") == 0 && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    assertEquals(1, inFlight.abandon(new IllegalStateException("drain timeout")));
    ExportResult result = inFlight.outcome().get(5, TimeUnit.SECONDS).resultFor("down").orElseThrow();
    assertEquals(ExportResult.Status.ABANDONED, result.status());
    assertEquals(1, down.calls());
    assertEquals(1, metrics.count("exporter.down.abandoned"));
  }

  private ExporterFanout fanout(DeliveryPolicy policy, ExporterBinding... bindings) {
    return new ExporterFanout("traces", List.of(bindings), policy, pool, scheduler, metrics);
  }
}
