package ca.gc.cra.netmap.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the ingestion worker pool and the background sweep scheduler.
 */
public final class ExecutorFactories {
  private static final int QUEUE_PER_WORKER = 64;

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for ingestion batches. Submissions beyond the bounded queue are
   * rejected so a runaway producer cannot exhaust memory.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each worker
   * @return configured executor
   */
  public static ExecutorService newIngestPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(size * QUEUE_PER_WORKER),
        threads(prefix, "netmap-ingest", false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-thread daemon scheduler for periodic maintenance such as staleness sweeps.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler
   * @return scheduler
   */
  public static ScheduledExecutorService newSweepScheduler(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, threads(prefix, "netmap-sweep", true, handler));
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  private static ThreadFactory threads(
      String prefix, String fallbackPrefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
