/**
 * <strong>Purpose:</strong> Logging helpers shared by the engine, dispatcher, and CLI.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.logging;
