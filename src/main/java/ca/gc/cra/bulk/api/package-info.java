/**
 * Command-line entry point for the bulk batcher.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, and feeds
 * input lines into a {@link ca.gc.cra.bulk.application.pipeline.BulkSessions} session.</p>
 * <p><strong>Concurrency:</strong> Runs single-threaded; consumers execute on the shared dispatch pool.</p>
 */
package ca.gc.cra.bulk.api;
