package io.netguard.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating named executor services used by the NetGuard monitor.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for long-running lane workers; each submitted task owns one thread.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newLanePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedFactory(prefix, "netguard-lane", false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded scheduler for periodic ticks (sampling, reconciliation).
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler
   * @return scheduler whose queued ticks are discarded on shutdown
   */
  public static ScheduledExecutorService newTickScheduler(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, namedFactory(prefix, "netguard-tick", true, handler));
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  /**
   * Builds a cached pool for connection-per-task servers such as the intercepting proxy.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler
   * @return cached executor
   */
  public static ExecutorService newConnectionPool(String prefix, UncaughtExceptionHandler handler) {
    return Executors.newCachedThreadPool(namedFactory(prefix, "netguard-conn", true, handler));
  }

  /**
   * Builds a single worker thread for work that callers bound with a timeout.
   *
   * @param prefix thread-name prefix
   * @return single-thread executor
   */
  public static ExecutorService newSingleWorker(String prefix) {
    return Executors.newSingleThreadExecutor(namedFactory(prefix, "netguard-worker", true, null));
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallback, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
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
