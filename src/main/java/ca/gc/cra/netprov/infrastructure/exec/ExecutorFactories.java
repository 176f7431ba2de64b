package ca.gc.cra.netprov.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors used by NETPROV deployments.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor that runs one deployment attempt per task. Excess devices queue up.
   *
   * @param size number of worker threads, i.e. devices deployed concurrently
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newDeploymentPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(
        (prefix == null || prefix.isBlank()) ? "netprov-deploy" : prefix,
        false,
        Objects.requireNonNullElse(handler, LOGGING_HANDLER));
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory);
  }

  /**
   * Builds an unbounded cached executor of daemon threads used to run individual transport calls under a time
   * budget. Threads idle for a minute are reclaimed.
   *
   * @param prefix thread-name prefix
   * @return configured executor service
   */
  public static ExecutorService newTransportCallPool(String prefix) {
    ThreadFactory factory = threadFactory(
        (prefix == null || prefix.isBlank()) ? "netprov-transport" : prefix, true, LOGGING_HANDLER);
    return new ThreadPoolExecutor(
        0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(), factory);
  }

  /**
   * Builds a single daemon thread used to enforce attempt deadlines.
   *
   * @param prefix thread-name prefix
   * @return scheduled executor
   */
  public static ScheduledExecutorService newWatchdog(String prefix) {
    ScheduledThreadPoolExecutor watchdog = new ScheduledThreadPoolExecutor(1, threadFactory(
        (prefix == null || prefix.isBlank()) ? "netprov-watchdog" : prefix, true, LOGGING_HANDLER));
    watchdog.setRemoveOnCancelPolicy(true);
    return watchdog;
  }

  private static ThreadFactory threadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    };
  }
}
