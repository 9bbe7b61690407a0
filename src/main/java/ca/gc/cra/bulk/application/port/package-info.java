/**
 * <strong>Purpose:</strong> Ports defining the ingest -> batch -> output workflow contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate
 * consoles, files, brokers, clocks, and metrics backends.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.application.port;
