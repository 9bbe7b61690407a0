/**
 * <strong>Purpose:</strong> Validation helpers used by CLI parsing and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface as {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.validation;
