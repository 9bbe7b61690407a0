package ca.gc.cra.bulk.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating executor services used by bulk dispatch.
 */
public final class ExecutorFactories {
  /** Thread-name prefix applied when the caller does not supply one. */
  public static final String DEFAULT_DISPATCH_PREFIX = "bulk-dispatch";

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for consumer fan-out.
   *
   * <p>The work queue is unbounded so a flush with more consumers than workers queues the surplus
   * tasks instead of rejecting them.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread; required
   * @return configured executor service
   */
  public static ExecutorService newDispatchPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_DISPATCH_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNull(handler, "handler");
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
