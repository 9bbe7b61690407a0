package ca.gc.cra.bulk.application.pipeline;

import ca.gc.cra.bulk.application.pipeline.BulkDispatcher.DispatchResult;
import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.application.port.MetricsPort;
import ca.gc.cra.bulk.domain.command.Bulk;
import ca.gc.cra.bulk.domain.command.Command;
import ca.gc.cra.bulk.logging.Logs;
import ca.gc.cra.bulk.validation.Numbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Accumulates commands and decides where one bulk ends and the next begins.
 * <p><strong>Why:</strong> Outputs want commands grouped either by a fixed size or by explicit
 * begin/end blocks that must never be split, whatever their size.</p>
 * <p><strong>Role:</strong> Core application use case between ingestion and the output consumers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Flush when the buffer reaches the configured size, unless a block is open.</li>
 *   <li>Flush pre-block content when the outermost block opens and the block content when it closes;
 *       nested markers only move the depth counter.</li>
 *   <li>Hand each flushed bulk to {@link BulkDispatcher} and clear the buffer afterwards, whatever the
 *       consumers did.</li>
 *   <li>Perform the final flush on {@link #close()} unless a block is still open.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit(Command)}, {@link #enterBlock()},
 * {@link #exitBlock()}, and {@link #close()} must be called from one ingesting thread at a time;
 * callers with several producers serialize externally (see {@link BulkSessions}).
 * {@link #subscribe(BulkConsumer)} and {@link #unsubscribe(BulkConsumer)} are safe from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code bulk.command.submitted}, {@code bulk.flush.*},
 * {@code bulk.block.unbalanced}, and {@code bulk.close.discarded}.</p>
 *
 * @since 0.1.0
 */
public final class BatchEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BatchEngine.class);
  private static final int LOG_TEXT_MAX_BYTES = 256;

  /** Worker count used when the engine creates its own dispatch pool. */
  public static final int DEFAULT_DISPATCH_WORKERS = 4;

  private final int bulkSize;
  private final UnbalancedBlockPolicy unbalancedPolicy;
  private final BulkDispatcher dispatcher;
  private final MetricsPort metrics;
  private final SubscriberRegistry subscribers = new SubscriberRegistry();
  private final List<Command> buffer = new ArrayList<>();

  private int depth;
  private boolean closed;

  /**
   * Creates an engine with its own dispatch pool, ignoring unbalanced block ends.
   *
   * @param bulkSize number of commands that completes a bulk outside blocks; must be positive
   * @throws IllegalArgumentException if {@code bulkSize} is not positive
   */
  public BatchEngine(int bulkSize) {
    this(checkedBulkSize(bulkSize), UnbalancedBlockPolicy.IGNORE,
        BulkDispatcher.pooled(DEFAULT_DISPATCH_WORKERS, MetricsPort.NO_OP), MetricsPort.NO_OP);
  }

  /**
   * Creates an engine with explicit collaborators.
   *
   * @param bulkSize number of commands that completes a bulk outside blocks; must be positive
   * @param unbalancedPolicy handling of block ends without a matching begin
   * @param dispatcher fan-out helper; closed together with this engine
   * @param metrics metrics sink
   * @throws IllegalArgumentException if {@code bulkSize} is not positive
   */
  public BatchEngine(
      int bulkSize,
      UnbalancedBlockPolicy unbalancedPolicy,
      BulkDispatcher dispatcher,
      MetricsPort metrics) {
    this.bulkSize = checkedBulkSize(bulkSize);
    this.unbalancedPolicy = Objects.requireNonNullElse(unbalancedPolicy, UnbalancedBlockPolicy.IGNORE);
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Appends a command, shows the pending buffer to observers, and flushes when the size is reached.
   *
   * @param command command to buffer; must not be {@code null}
   * @throws IllegalStateException if the engine is closed
   */
  public void submit(Command command) {
    Objects.requireNonNull(command, "command");
    ensureOpen();
    buffer.add(command);
    metrics.increment("bulk.command.submitted");
    if (log.isDebugEnabled()) {
      log.debug("Buffered command '{}' (pending={}, depth={})",
          Logs.truncate(command.text(), LOG_TEXT_MAX_BYTES), buffer.size(), depth);
    }
    notifyPending();
    if (depth == 0 && buffer.size() >= bulkSize) {
      flush("size");
    }
  }

  /**
   * Opens a block. Only the outermost begin flushes what was buffered before it.
   *
   * @throws IllegalStateException if the engine is closed
   */
  public void enterBlock() {
    ensureOpen();
    if (depth++ == 0) {
      log.debug("Block opened; flushing {} pending commands", buffer.size());
      flush("block-open");
    }
  }

  /**
   * Closes a block. Only the outermost end flushes the block content.
   *
   * @throws UnbalancedBlockException if no block is open and the policy is
   *     {@link UnbalancedBlockPolicy#REJECT}
   * @throws IllegalStateException if the engine is closed
   */
  public void exitBlock() {
    ensureOpen();
    if (depth == 0) {
      metrics.increment("bulk.block.unbalanced");
      if (unbalancedPolicy == UnbalancedBlockPolicy.REJECT) {
        throw new UnbalancedBlockException("block end without matching block begin");
      }
      log.warn("Ignoring block end without matching block begin (pending={})", buffer.size());
      return;
    }
    if (--depth == 0) {
      log.debug("Block closed; flushing {} block commands", buffer.size());
      flush("block-close");
    }
  }

  /**
   * Registers a consumer for every bulk flushed after this call.
   *
   * @param consumer consumer to add; registering the same instance twice has no effect
   * @return {@code true} if the consumer was added
   */
  public boolean subscribe(BulkConsumer consumer) {
    boolean added = subscribers.add(consumer);
    if (added) {
      log.debug("Subscribed bulk consumer {}", consumer.name());
    }
    return added;
  }

  /**
   * Removes a consumer. Flushes that start after this call returns no longer reach it.
   *
   * @param consumer consumer to remove
   * @return {@code true} if the consumer had been registered
   */
  public boolean unsubscribe(BulkConsumer consumer) {
    boolean removed = subscribers.remove(consumer);
    if (removed) {
      log.debug("Unsubscribed bulk consumer {}", consumer.name());
    }
    return removed;
  }

  /**
   * Flushes the remaining buffer unless a block is still open, then releases the dispatcher.
   *
   * <p>An unterminated block is incomplete; its commands are discarded. Repeated calls are no-ops.</p>
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (depth > 0) {
        if (!buffer.isEmpty()) {
          metrics.increment("bulk.close.discarded");
          log.warn("Discarding {} commands of an unterminated block (depth={})", buffer.size(), depth);
        }
        buffer.clear();
      } else {
        flush("close");
      }
    } finally {
      dispatcher.close();
    }
  }

  public int bulkSize() {
    return bulkSize;
  }

  public int depth() {
    return depth;
  }

  public boolean inBlock() {
    return depth > 0;
  }

  public int pendingSize() {
    return buffer.size();
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  public boolean isClosed() {
    return closed;
  }

  private void notifyPending() {
    List<BulkConsumer> targets = subscribers.snapshot();
    if (targets.isEmpty()) {
      return;
    }
    Bulk pending = Bulk.of(buffer);
    for (BulkConsumer consumer : targets) {
      try {
        consumer.observe(pending);
      } catch (RuntimeException ex) {
        metrics.increment("bulk.consumer.observe.failure");
        log.warn("Bulk consumer {} failed to observe pending commands", consumer.name(), ex);
      }
    }
  }

  private void flush(String reason) {
    if (buffer.isEmpty()) {
      return;
    }
    Bulk bulk = Bulk.of(buffer);
    List<BulkConsumer> targets = subscribers.snapshot();
    long startNanos = System.nanoTime();
    try {
      DispatchResult result = dispatcher.dispatch(bulk, targets);
      log.debug("Flushed {} commands on {} to {} consumers ({} failed)",
          bulk.size(), reason, result.delivered(), result.failed());
    } finally {
      buffer.clear();
      metrics.increment("bulk.flush.count");
      metrics.observe("bulk.flush.size", bulk.size());
      metrics.observe("bulk.flush.latencyNanos", System.nanoTime() - startNanos);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("batch engine is closed");
    }
  }

  private static int checkedBulkSize(int bulkSize) {
    return (int) Numbers.requireRange("bulkSize", bulkSize, 1, Integer.MAX_VALUE);
  }
}
