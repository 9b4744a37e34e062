package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups signals into batches that are flushed when either the size threshold is reached or the oldest buffered
 * signal has waited for the configured timeout.
 * <p>A single lock guards the buffer, the timer and the sequence counter. The sink is invoked while the lock is
 * held so batches reach it in trigger order; the sink must therefore hand work off quickly.</p>
 * <p>Each timer carries the generation that armed it. A size-triggered or manual flush bumps the generation so a
 * timer that fires late finds nothing of its own to flush.</p>
 *
 * @since 0.1.0
 */
final class BatchAccumulator {
  private static final Logger log = LoggerFactory.getLogger(BatchAccumulator.class);

  private final String pipelineId;
  private final SignalType type;
  private final BatchSettings settings;
  private final ScheduledExecutorService scheduler;
  private final ClockPort clock;
  private final Consumer<Batch> sink;
  private final ReentrantLock lock = new ReentrantLock();

  private List<Signal> pending = new ArrayList<>();
  private ScheduledFuture<?> timer;
  private long generation;
  private long nextSequence;

  BatchAccumulator(
      String pipelineId,
      SignalType type,
      BatchSettings settings,
      ScheduledExecutorService scheduler,
      ClockPort clock,
      Consumer<Batch> sink) {
    this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId");
    this.type = Objects.requireNonNull(type, "type");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Appends signals in order, flushing any batches whose size trigger fires.
   *
   * @param signals signals in receipt order
   */
  void add(List<Signal> signals) {
    if (signals.isEmpty()) {
      return;
    }
    lock.lock();
    try {
      boolean wasEmpty = pending.isEmpty();
      pending.addAll(signals);
      if (pending.size() >= settings.sendBatchSize()) {
        emitWhileFull();
      }
      if (!pending.isEmpty() && (wasEmpty || timer == null)) {
        armTimer();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flushes whatever is buffered. Does nothing when the buffer is empty.
   *
   * @return number of signals flushed
   */
  int flush() {
    lock.lock();
    try {
      int flushed = pending.size();
      if (flushed > 0) {
        emitAll();
      }
      return flushed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of buffered signals.
   *
   * @return pending count
   */
  int pendingCount() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cancels any armed timer without flushing.
   */
  void cancelTimer() {
    lock.lock();
    try {
      disarmTimer();
    } finally {
      lock.unlock();
    }
  }

  private void emitWhileFull() {
    int max = settings.effectiveMaxSize();
    while (pending.size() >= settings.sendBatchSize()) {
      int take = Math.min(pending.size(), max);
      emit(take);
    }
  }

  // The size trigger keeps the buffer below send_batch_size, which never exceeds the max size.
  private void emitAll() {
    emit(pending.size());
  }

  private void emit(int count) {
    disarmTimer();
    List<Signal> chunk;
    if (count == pending.size()) {
      chunk = pending;
      pending = new ArrayList<>();
    } else {
      chunk = new ArrayList<>(pending.subList(0, count));
      pending = new ArrayList<>(pending.subList(count, pending.size()));
    }
    Batch batch = new Batch(pipelineId, type, nextSequence++, Instant.ofEpochMilli(clock.nowMillis()), chunk);
    sink.accept(batch);
  }

  private void armTimer() {
    long armedGeneration = generation;
    try {
      timer = scheduler.schedule(
          () -> onTimeout(armedGeneration), settings.timeout().toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException ex) {
      log.warn("Pipeline {} batch timer rejected; signals flush on next size trigger or drain", pipelineId);
      timer = null;
    }
  }

  private void disarmTimer() {
    generation++;
    if (timer != null) {
      timer.cancel(false);
      timer = null;
    }
  }

  private void onTimeout(long armedGeneration) {
    lock.lock();
    try {
      if (armedGeneration != generation || pending.isEmpty()) {
        return;
      }
      log.debug("Pipeline {} timeout flush of {} signal(s)", pipelineId, pending.size());
      timer = null;
      emitAll();
    } catch (RuntimeException ex) {
      log.error("Pipeline {} failed to flush batch on timeout", pipelineId, ex);
    } finally {
      lock.unlock();
    }
  }
}
