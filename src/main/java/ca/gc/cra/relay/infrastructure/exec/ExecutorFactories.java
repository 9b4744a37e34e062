package ca.gc.cra.relay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the relay's named worker pools.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds the fixed-size pool that runs exporter delivery tasks.
   * <p>Backlog is bounded per exporter by its sending queue before tasks reach this pool, and retry delays wait
   * on the scheduler rather than on a worker.</p>
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; defaults to {@code relay-export}
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newExportPool(int size, String prefix, UncaughtExceptionHandler handler) {
    return newWorkerPool(size, prefix == null || prefix.isBlank() ? "relay-export" : prefix, handler);
  }

  /**
   * Builds a fixed-size pool with an unbounded queue, used where the submitter must never see a rejection
   * (e.g. the HTTP receiver's request dispatcher).
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; defaults to {@code relay-worker}
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "relay-worker", handler);
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a bounded pool for receiver connections. Submissions beyond {@code size} running plus
   * {@code queueCapacity} queued tasks are rejected.
   *
   * @param size number of worker threads
   * @param queueCapacity number of connections allowed to wait for a worker
   * @param prefix thread-name prefix; defaults to {@code relay-receiver}
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newReceiverPool(
      int size, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0 || queueCapacity <= 0) {
      throw new IllegalArgumentException("size and queueCapacity must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "relay-receiver", handler);
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(queueCapacity), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the scheduler firing batch time triggers and exporter retry timers.
   *
   * @param prefix thread-name prefix; defaults to {@code relay-batch}
   * @return single-threaded scheduler that drops cancelled timers
   */
  public static ScheduledExecutorService newBatchScheduler(String prefix) {
    ThreadFactory factory = threadFactory(prefix, "relay-batch", null);
    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, factory);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Returns an uncaught-exception handler that logs the failure against the thread name.
   *
   * @return logging handler
   */
  public static UncaughtExceptionHandler loggingHandler() {
    return (thread, ex) -> log.error("Uncaught failure on thread {}", thread.getName(), ex);
  }

  private static ThreadFactory threadFactory(
      String prefix, String defaultPrefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? defaultPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, loggingHandler());
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
