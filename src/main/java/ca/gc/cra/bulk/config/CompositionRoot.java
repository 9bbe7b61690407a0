package ca.gc.cra.bulk.config;

import ca.gc.cra.bulk.application.pipeline.BulkSessions;
import ca.gc.cra.bulk.application.pipeline.SessionHandle;
import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.application.port.ClockPort;
import ca.gc.cra.bulk.application.port.MetricsPort;
import ca.gc.cra.bulk.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.bulk.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.bulk.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.bulk.infrastructure.output.ConsoleBulkConsumer;
import ca.gc.cra.bulk.infrastructure.output.FileBulkConsumer;
import ca.gc.cra.bulk.infrastructure.output.KafkaBulkConsumer;
import ca.gc.cra.bulk.infrastructure.time.SystemClockAdapter;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link BulkConfig} to sessions, consumers, metrics, and the dispatch pool.
 * <p><strong>Role:</strong> Adapter composition root used by the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the shared dispatch pool and the metrics adapter once per run.</li>
 *   <li>Build the configured consumers for every new session.</li>
 *   <li>Release sessions, the pool, and metrics on {@link #close()}, in that order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #sessions()} is lazily created and not synchronized; wire on one
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final long POOL_SHUTDOWN_SECONDS = 5;

  private final BulkConfig config;
  private final PrintWriter consoleOut;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Function<SessionHandle, BulkConsumer> kafkaFactory;
  private ExecutorService dispatchPool;
  private BulkSessions sessions;

  /**
   * Creates a composition root that exports metrics as selected by {@code metricsExporter}.
   *
   * @param config validated configuration
   * @param consoleOut writer used by the console output
   * @param metricsExporter {@code otlp} or {@code none}
   */
  public CompositionRoot(BulkConfig config, PrintWriter consoleOut, String metricsExporter) {
    this(config, consoleOut, createMetrics(metricsExporter), new SystemClockAdapter(), null);
  }

  CompositionRoot(
      BulkConfig config,
      PrintWriter consoleOut,
      MetricsPort metrics,
      ClockPort clock,
      Function<SessionHandle, BulkConsumer> kafkaFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.consoleOut = Objects.requireNonNull(consoleOut, "consoleOut");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.kafkaFactory = kafkaFactory != null ? kafkaFactory : this::newKafkaConsumer;
  }

  /**
   * Returns the session facade, creating it and the dispatch pool on first use.
   *
   * @return session facade bound to this root's consumers
   */
  public BulkSessions sessions() {
    if (sessions == null) {
      dispatchPool = ExecutorFactories.newDispatchPool(
          config.dispatchWorkers(),
          ExecutorFactories.DEFAULT_DISPATCH_PREFIX,
          (thread, ex) -> log.error("Dispatch worker {} threw an uncaught exception", thread.getName(), ex));
      sessions = new BulkSessions(
          this::createConsumers, dispatchPool, config.unbalancedBlocks(), clock, metrics);
    }
    return sessions;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the consumers configured by {@code outputs=} for one session.
   *
   * @param handle session being opened
   * @return consumers in console, file, kafka order
   */
  List<BulkConsumer> createConsumers(SessionHandle handle) {
    List<BulkConsumer> consumers = new ArrayList<>(3);
    try {
      if (config.hasOutput(OutputKind.CONSOLE)) {
        consumers.add(new ConsoleBulkConsumer(consoleOut));
      }
      if (config.hasOutput(OutputKind.FILE)) {
        consumers.add(new FileBulkConsumer(config.outputDirectory()));
      }
      if (config.hasOutput(OutputKind.KAFKA)) {
        consumers.add(kafkaFactory.apply(handle));
      }
    } catch (RuntimeException ex) {
      for (BulkConsumer consumer : consumers) {
        try {
          consumer.close();
        } catch (Exception closeEx) {
          ex.addSuppressed(closeEx);
        }
      }
      throw ex;
    }
    return consumers;
  }

  /**
   * Disconnects remaining sessions, stops the dispatch pool, and shuts down metrics export.
   */
  @Override
  public void close() {
    try {
      if (sessions != null) {
        sessions.close();
      }
    } finally {
      shutdownPool();
      if (metrics instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception ex) {
          log.warn("Failed to close metrics adapter cleanly", ex);
        }
      }
    }
  }

  private void shutdownPool() {
    if (dispatchPool == null) {
      return;
    }
    dispatchPool.shutdown();
    try {
      if (!dispatchPool.awaitTermination(POOL_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Dispatch pool still busy after {}s; forcing shutdown", POOL_SHUTDOWN_SECONDS);
        dispatchPool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      dispatchPool.shutdownNow();
    }
  }

  private BulkConsumer newKafkaConsumer(SessionHandle handle) {
    String bootstrap = config.kafkaBootstrap()
        .orElseThrow(() -> new IllegalStateException("kafkaBootstrap is not configured"));
    return new KafkaBulkConsumer(bootstrap, config.kafkaTopic(), handle.label());
  }

  private static MetricsPort createMetrics(String exporter) {
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty() || normalized.equals("none")) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter();
  }
}
