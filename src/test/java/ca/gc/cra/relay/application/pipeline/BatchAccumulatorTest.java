package ca.gc.cra.relay.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.domain.signal.SpanSignal;
import ca.gc.cra.relay.testutil.TestSignals;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BatchAccumulatorTest {
  private ScheduledExecutorService scheduler;
  private List<Batch> emitted;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    emitted = new CopyOnWriteArrayList<>();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void flushWithNothingBufferedEmitsNoBatch() {
    BatchAccumulator accumulator = accumulator(new BatchSettings(10, Duration.ofSeconds(30), 0));

    assertEquals(0, accumulator.flush());
    accumulator.add(List.of());

    assertTrue(emitted.isEmpty());
  }

  @Test
  void sizeTriggerEmitsBatchesInReceiptOrder() {
    BatchAccumulator accumulator = accumulator(new BatchSettings(3, Duration.ofSeconds(30), 0));
    List<Signal> spans = TestSignals.spans(7);

    accumulator.add(spans.subList(0, 2));
    accumulator.add(spans.subList(2, 7));

    assertEquals(2, emitted.size());
    assertEquals(0, emitted.get(0).sequence());
    assertEquals(1, emitted.get(1).sequence());
    assertEquals(3, emitted.get(0).size());
    assertEquals(1, accumulator.pendingCount());
    assertEquals(spans.subList(0, 3), emitted.get(0).signals());
    assertEquals(spans.subList(3, 6), emitted.get(1).signals());

    accumulator.flush();
    assertEquals(spans.get(6), emitted.get(2).signals().get(0));
  }

  @Test
  void maxSizeSplitsOversizedInput() {
    BatchAccumulator accumulator = accumulator(new BatchSettings(2, Duration.ofSeconds(30), 3));

    accumulator.add(TestSignals.spans(7));

    assertEquals(List.of(3, 3), emitted.stream().map(Batch::size).toList());
    assertEquals(1, accumulator.pendingCount());
  }

  @Test
  void flushEmitsRemainderLeftBelowMaxSize() {
    BatchAccumulator accumulator = accumulator(new BatchSettings(3, Duration.ofSeconds(30), 4));
    List<Signal> spans = TestSignals.spans(10);
    accumulator.add(spans);

    assertEquals(List.of(4, 4), emitted.stream().map(Batch::size).toList());
    assertEquals(2, accumulator.pendingCount());

    assertEquals(2, accumulator.flush());

    assertEquals(List.of(4, 4, 2), emitted.stream().map(Batch::size).toList());
    assertEquals(spans.subList(8, 10), emitted.get(2).signals());
    assertEquals(0, accumulator.pendingCount());
  }

  @Test
  void timeoutFlushesPartialBatch() throws InterruptedException {
    CountDownLatch flushed = new CountDownLatch(1);
    BatchAccumulator accumulator = new BatchAccumulator("traces", SignalType.TRACES,
        new BatchSettings(100, Duration.ofMillis(50), 0), scheduler, ClockPort.SYSTEM,
        batch -> {
          emitted.add(batch);
          flushed.countDown();
        });

    accumulator.add(TestSignals.spans(3));

    assertTrue(flushed.await(5, TimeUnit.SECONDS), "timeout flush did not fire");
    assertEquals(1, emitted.size());
    assertEquals(3, emitted.get(0).size());
    assertEquals(0, accumulator.pendingCount());
  }

  @Test
  void timeoutCountsFromFirstBufferedSignal() throws InterruptedException {
    CountDownLatch flushed = new CountDownLatch(1);
    BatchAccumulator accumulator = new BatchAccumulator("traces", SignalType.TRACES,
        new BatchSettings(100, Duration.ofMillis(300), 0), scheduler, ClockPort.SYSTEM,
        batch -> {
          emitted.add(batch);
          flushed.countDown();
        });
    List<Signal> spans = TestSignals.spans(2);

    long first = System.nanoTime();
    accumulator.add(spans.subList(0, 1));
    Thread.sleep(150);
    accumulator.add(spans.subList(1, 2));

    assertTrue(flushed.await(5, TimeUnit.SECONDS), "timeout flush did not fire");
    long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - first);

    assertEquals(1, emitted.size());
    assertEquals(spans, emitted.get(0).signals());
    assertTrue(emitted.get(0).size() < 100);
    // A timer re-armed by the second add would not fire before 450ms.
    assertTrue(waitedMillis >= 290 && waitedMillis < 440, "flushed after " + waitedMillis + "ms");
  }

  @Test
  void cancelledTimerDoesNotFlush() throws InterruptedException {
    BatchAccumulator accumulator = accumulator(new BatchSettings(100, Duration.ofMillis(20), 0));
    accumulator.add(TestSignals.spans(2));

    accumulator.cancelTimer();
    Thread.sleep(100);

    assertTrue(emitted.isEmpty());
    assertEquals(2, accumulator.pendingCount());
  }

  @Test
  void batchesCarryPipelineAndType() {
    BatchAccumulator accumulator = accumulator(new BatchSettings(1, Duration.ofSeconds(30), 0));

    accumulator.add(List.of(TestSignals.span(1)));

    Batch batch = emitted.get(0);
    assertEquals("traces", batch.pipelineId());
    assertEquals(SignalType.TRACES, batch.type());
    assertEquals(TestSignals.spanId(1), batch.signalsAs(SpanSignal.class).get(0).spanId());
  }

  private BatchAccumulator accumulator(BatchSettings settings) {
    return new BatchAccumulator("traces", SignalType.TRACES, settings, scheduler, ClockPort.SYSTEM, emitted::add);
  }
}
