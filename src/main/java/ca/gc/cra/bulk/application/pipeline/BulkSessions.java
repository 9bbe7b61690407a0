package ca.gc.cra.bulk.application.pipeline;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.application.port.ClockPort;
import ca.gc.cra.bulk.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Connection-style facade managing several independent batching sessions.
 * <p><strong>Why:</strong> Embedding applications open a session per input stream, push raw text into
 * it, and close it when the stream ends, without wiring engines and consumers themselves.</p>
 * <p><strong>Role:</strong> Application entry point used by the CLI and by library callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one {@link BatchEngine}, {@link CommandIngestor}, and consumer set per session.</li>
 *   <li>Serialize calls for the same session so each engine sees a single ingester.</li>
 *   <li>Close engines (final flush) and their consumers on {@link #disconnect(SessionHandle)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods are thread-safe. Different sessions ingest in parallel;
 * their flushes share one dispatch executor, which this facade does not shut down.</p>
 *
 * @since 0.1.0
 */
public final class BulkSessions implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BulkSessions.class);
  private static final String MDC_SESSION = "session";

  private final ConsumerFactory consumerFactory;
  private final ExecutorService dispatchExecutor;
  private final UnbalancedBlockPolicy unbalancedPolicy;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Map<Long, Session> sessions = new ConcurrentHashMap<>();
  private final AtomicLong nextId = new AtomicLong(1);
  private volatile boolean closed;

  /**
   * Creates the facade.
   *
   * @param consumerFactory supplies the consumers attached to each new session
   * @param dispatchExecutor executor running consumer tasks for every session; owned by the caller
   * @param unbalancedPolicy handling of unmatched block ends
   * @param clock clock stamping commands
   * @param metrics metrics sink shared by all sessions
   */
  public BulkSessions(
      ConsumerFactory consumerFactory,
      ExecutorService dispatchExecutor,
      UnbalancedBlockPolicy unbalancedPolicy,
      ClockPort clock,
      MetricsPort metrics) {
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    this.unbalancedPolicy = Objects.requireNonNullElse(unbalancedPolicy, UnbalancedBlockPolicy.IGNORE);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Opens a session batching commands in groups of {@code bulkSize}.
   *
   * @param bulkSize bulk threshold; must be positive
   * @return handle identifying the session
   * @throws IllegalArgumentException if {@code bulkSize} is not positive
   * @throws IllegalStateException if the facade is closed
   * @throws RuntimeException if the consumer factory fails; consumers it returned are closed first
   */
  public SessionHandle connect(int bulkSize) {
    if (closed) {
      throw new IllegalStateException("bulk sessions are closed");
    }
    SessionHandle handle = new SessionHandle(nextId.getAndIncrement());
    BatchEngine engine = new BatchEngine(
        bulkSize, unbalancedPolicy, BulkDispatcher.using(dispatchExecutor, metrics), metrics);
    List<BulkConsumer> created = consumerFactory.create(handle);
    List<BulkConsumer> consumers;
    try {
      consumers = List.copyOf(created);
      consumers.forEach(engine::subscribe);
    } catch (RuntimeException ex) {
      engine.close();
      closeAll(created, handle, ex);
      throw ex;
    }
    sessions.put(handle.id(), new Session(handle, engine, new CommandIngestor(engine, clock), consumers));
    log.info("Opened {} (bulkSize={}, consumers={})", handle.label(), bulkSize, consumers.size());
    return handle;
  }

  /**
   * Feeds raw text into a session.
   *
   * @param handle session handle returned by {@link #connect(int)}
   * @param data raw text, one command per line
   * @return number of lines routed
   * @throws IllegalArgumentException if the handle is unknown or already disconnected
   */
  public int receive(SessionHandle handle, String data) {
    Session session = require(handle);
    synchronized (session) {
      if (session.engine.isClosed()) {
        throw new IllegalArgumentException("session already disconnected: " + handle.label());
      }
      String previous = MDC.get(MDC_SESSION);
      MDC.put(MDC_SESSION, handle.label());
      try {
        return session.ingestor.receive(data);
      } finally {
        restoreMdc(previous);
      }
    }
  }

  /**
   * Closes a session: flushes its remaining commands (unless a block is open) and closes its consumers.
   *
   * @param handle session handle; unknown handles are logged and ignored
   */
  public void disconnect(SessionHandle handle) {
    Objects.requireNonNull(handle, "handle");
    Session session = sessions.remove(handle.id());
    if (session == null) {
      log.warn("Ignoring disconnect for unknown {}", handle.label());
      return;
    }
    synchronized (session) {
      String previous = MDC.get(MDC_SESSION);
      MDC.put(MDC_SESSION, handle.label());
      try {
        session.engine.close();
      } finally {
        closeConsumers(session);
        log.info("Closed {}", handle.label());
        restoreMdc(previous);
      }
    }
  }

  /**
   * Returns the number of sessions currently connected.
   *
   * @return active session count
   */
  public int activeSessions() {
    return sessions.size();
  }

  /**
   * Disconnects every open session. The shared dispatch executor stays with its owner.
   *
   * @throws RuntimeException the first disconnect failure, with later ones suppressed, once every
   *     session has been disconnected
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException failure = null;
    for (Long id : new ArrayList<>(sessions.keySet())) {
      SessionHandle handle = new SessionHandle(id);
      try {
        disconnect(handle);
      } catch (RuntimeException ex) {
        metrics.increment("bulk.session.close.failure");
        log.error("Failed to disconnect {} during shutdown", handle.label(), ex);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private Session require(SessionHandle handle) {
    Objects.requireNonNull(handle, "handle");
    Session session = sessions.get(handle.id());
    if (session == null) {
      throw new IllegalArgumentException("unknown session: " + handle.label());
    }
    return session;
  }

  private void closeAll(List<BulkConsumer> consumers, SessionHandle handle, RuntimeException cause) {
    if (consumers == null) {
      return;
    }
    for (BulkConsumer consumer : consumers) {
      if (consumer == null) {
        continue;
      }
      try {
        consumer.close();
      } catch (Exception ex) {
        cause.addSuppressed(ex);
      }
    }
    log.error("Failed to open {}; closed the consumers already created", handle.label(), cause);
  }

  private void closeConsumers(Session session) {
    for (BulkConsumer consumer : session.consumers) {
      session.engine.unsubscribe(consumer);
      try {
        consumer.close();
      } catch (Exception ex) {
        metrics.increment("bulk.consumer.close.failure");
        log.error("Failed to close bulk consumer {} of {}", consumer.name(), session.handle.label(), ex);
      }
    }
  }

  private static void restoreMdc(String previous) {
    if (previous == null) {
      MDC.remove(MDC_SESSION);
    } else {
      MDC.put(MDC_SESSION, previous);
    }
  }

  /**
   * Creates the consumers attached to a new session.
   */
  @FunctionalInterface
  public interface ConsumerFactory {
    /**
     * Builds the consumers for {@code handle}.
     *
     * @param handle session being opened
     * @return consumers to subscribe; closed when the session disconnects
     */
    List<BulkConsumer> create(SessionHandle handle);
  }

  private static final class Session {
    private final SessionHandle handle;
    private final BatchEngine engine;
    private final CommandIngestor ingestor;
    private final List<BulkConsumer> consumers;

    private Session(
        SessionHandle handle, BatchEngine engine, CommandIngestor ingestor, List<BulkConsumer> consumers) {
      this.handle = handle;
      this.engine = engine;
      this.ingestor = ingestor;
      this.consumers = consumers;
    }
  }
}
