/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.bulk.application.port.MetricsPort} adapters backed by the
 * OpenTelemetry SDK or discarding everything.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; instruments are cached per metric key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.infrastructure.metrics;
