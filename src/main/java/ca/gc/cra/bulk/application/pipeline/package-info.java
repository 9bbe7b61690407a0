/**
 * <strong>Purpose:</strong> Batching use cases: the {@link ca.gc.cra.bulk.application.pipeline.BatchEngine},
 * its fan-out {@link ca.gc.cra.bulk.application.pipeline.BulkDispatcher}, text ingestion, and the
 * multi-session facade.
 * <p><strong>Concurrency:</strong> Engines are single-ingester; consumers run concurrently on the dispatch
 * pool and are joined before the next flush.
 * <p><strong>Observability:</strong> Emits {@code bulk.*} metrics through
 * {@link ca.gc.cra.bulk.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.application.pipeline;
