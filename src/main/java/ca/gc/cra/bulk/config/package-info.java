/**
 * <strong>Purpose:</strong> Configuration loading, merging, and wiring for the bulk CLI.
 * <p>Precedence is CLI &gt; YAML ({@code common} then {@code bulk} sections) &gt; {@link
 * ca.gc.cra.bulk.config.BulkDefaults}. {@link ca.gc.cra.bulk.config.BulkConfig#fromMap(java.util.Map)}
 * validates the merged map and {@link ca.gc.cra.bulk.config.CompositionRoot} builds the runtime graph.
 *
 * @since 0.1.0
 */
package ca.gc.cra.bulk.config;
