/**
 * <strong>Purpose:</strong> Immutable command and bulk values shared by ingestion, batching, and outputs.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to hand to consumer threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.domain.command;
