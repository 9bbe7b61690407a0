package ca.gc.cra.bulk.application.pipeline;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.application.port.MetricsPort;
import ca.gc.cra.bulk.domain.command.Bulk;
import ca.gc.cra.bulk.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fans a completed bulk out to every consumer and waits for all of them.
 * <p><strong>Why:</strong> Consumer output may block on I/O; running each consumer's
 * {@link BulkConsumer#process()} as its own task keeps one slow output from serializing the rest while
 * the join keeps successive bulks strictly ordered per consumer.</p>
 * <p><strong>Role:</strong> Application-layer helper owned by {@link BatchEngine}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver the snapshot to every consumer via {@link BulkConsumer#update(Bulk)} on the caller thread.</li>
 *   <li>Submit one processing task per consumer and block until every task has finished.</li>
 *   <li>Contain consumer failures: log, count, and continue with the remaining consumers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #dispatch(Bulk, List)} may be called from several ingesting
 * threads when the dispatcher wraps a shared executor.</p>
 * <p><strong>Limitation:</strong> the join has no timeout; a consumer that never returns from
 * {@code process} stalls its engine.</p>
 *
 * @since 0.1.0
 */
public final class BulkDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BulkDispatcher.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final MetricsPort metrics;

  private BulkDispatcher(ExecutorService executor, boolean ownsExecutor, MetricsPort metrics) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Creates a dispatcher backed by its own fixed-size worker pool, shut down by {@link #close()}.
   *
   * @param workers number of dispatch threads; must be positive
   * @param metrics metrics sink for failure counters
   * @return dispatcher owning its executor
   */
  public static BulkDispatcher pooled(int workers, MetricsPort metrics) {
    ExecutorService pool = ExecutorFactories.newDispatchPool(
        workers,
        ExecutorFactories.DEFAULT_DISPATCH_PREFIX,
        (thread, ex) -> log.error("Dispatch worker {} threw an uncaught exception", thread.getName(), ex));
    return new BulkDispatcher(pool, true, metrics);
  }

  /**
   * Creates a dispatcher over a caller-managed executor; {@link #close()} leaves it running.
   *
   * @param executor executor shared with other dispatchers
   * @param metrics metrics sink for failure counters
   * @return dispatcher borrowing the executor
   */
  public static BulkDispatcher using(ExecutorService executor, MetricsPort metrics) {
    return new BulkDispatcher(executor, false, metrics);
  }

  /**
   * Delivers {@code bulk} to every consumer and returns once all processing tasks completed.
   *
   * @param bulk immutable snapshot to deliver
   * @param consumers consumers registered when the flush started
   * @return per-flush delivery outcome
   * @throws IllegalStateException if the calling thread is interrupted while waiting or the executor
   *     has been shut down
   */
  public DispatchResult dispatch(Bulk bulk, List<BulkConsumer> consumers) {
    Objects.requireNonNull(bulk, "bulk");
    Objects.requireNonNull(consumers, "consumers");
    if (consumers.isEmpty()) {
      return DispatchResult.NONE;
    }

    List<BulkConsumer> updated = new ArrayList<>(consumers.size());
    int failed = 0;
    for (BulkConsumer consumer : consumers) {
      try {
        consumer.update(bulk);
        updated.add(consumer);
      } catch (RuntimeException ex) {
        failed++;
        metrics.increment("bulk.consumer.failure");
        log.error("Bulk consumer {} rejected update of {} commands", consumer.name(), bulk.size(), ex);
      }
    }
    if (updated.isEmpty()) {
      return new DispatchResult(0, failed);
    }

    Map<String, String> context = MDC.getCopyOfContextMap();
    List<Callable<Boolean>> tasks = new ArrayList<>(updated.size());
    for (BulkConsumer consumer : updated) {
      tasks.add(() -> processContained(consumer, bulk, context));
    }

    List<Future<Boolean>> futures;
    try {
      futures = executor.invokeAll(tasks);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("bulk.dispatch.interrupted");
      log.warn("Dispatch of {} commands interrupted; outstanding consumer tasks cancelled", bulk.size());
      throw new IllegalStateException("dispatch interrupted", ex);
    } catch (RejectedExecutionException ex) {
      throw new IllegalStateException("dispatch executor is shut down", ex);
    }

    int delivered = 0;
    for (int i = 0; i < futures.size(); i++) {
      if (awaitOutcome(futures.get(i), updated.get(i))) {
        delivered++;
      } else {
        failed++;
      }
    }
    return new DispatchResult(delivered, failed);
  }

  private boolean processContained(BulkConsumer consumer, Bulk bulk, Map<String, String> context) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (context != null) {
      MDC.setContextMap(context);
    }
    MDC.put("consumer", consumer.name());
    try {
      consumer.process();
      return true;
    } catch (Exception ex) {
      metrics.increment("bulk.consumer.failure");
      log.error("Bulk consumer {} failed to process {} commands", consumer.name(), bulk.size(), ex);
      return false;
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private boolean awaitOutcome(Future<Boolean> future, BulkConsumer consumer) {
    try {
      return Boolean.TRUE.equals(future.get());
    } catch (ExecutionException ex) {
      // Errors escape processContained; count them like any other consumer failure.
      metrics.increment("bulk.consumer.failure");
      log.error("Bulk consumer {} terminated abnormally", consumer.name(), ex.getCause());
      return false;
    } catch (CancellationException ex) {
      log.warn("Bulk consumer {} task was cancelled", consumer.name());
      return false;
    } catch (InterruptedException ex) {
      // invokeAll already waited for completion, so get() does not block here.
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Shuts down the worker pool when this dispatcher created it.
   */
  @Override
  public void close() {
    if (!ownsExecutor) {
      return;
    }
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Dispatch workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
        terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    if (!terminated) {
      log.error("Dispatch workers failed to terminate cleanly");
    }
  }

  /**
   * Outcome of one flush.
   *
   * @param delivered consumers whose {@code process} completed normally
   * @param failed consumers whose {@code update} or {@code process} failed
   */
  public record DispatchResult(int delivered, int failed) {
    static final DispatchResult NONE = new DispatchResult(0, 0);
  }
}
