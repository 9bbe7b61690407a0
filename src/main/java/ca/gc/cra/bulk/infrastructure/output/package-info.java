/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.bulk.application.port.BulkConsumer} adapters for stdout,
 * report files, and Kafka.
 * <p><strong>Concurrency:</strong> {@code update} runs on the ingesting thread, {@code process} on a dispatch
 * worker; each adapter publishes the recorded bulk through a {@code volatile} field.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.infrastructure.output;
