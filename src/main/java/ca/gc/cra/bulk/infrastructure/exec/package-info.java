/**
 * Executor construction helpers; worker threads follow the {@code bulk-dispatch-*} naming convention.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.infrastructure.exec;
