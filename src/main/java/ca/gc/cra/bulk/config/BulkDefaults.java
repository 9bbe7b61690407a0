package ca.gc.cra.bulk.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded defaults for every optional bulk setting, as a flat key/value map.
 *
 * <p>Lowest-precedence source for {@link ConfigMerger}; {@code bulk} itself has no default and must come
 * from the command line or YAML.</p>
 */
public final class BulkDefaults {
  private static final Map<String, String> DEFAULTS = build();

  private BulkDefaults() {}

  /**
   * Returns the default settings.
   *
   * @return unmodifiable map of defaults
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("in", "");
    map.put("outputs", "console,file");
    map.put("out", BulkConfig.DEFAULT_OUTPUT_DIRECTORY.toString());
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", BulkConfig.DEFAULT_KAFKA_TOPIC);
    map.put("dispatchWorkers", Integer.toString(BulkConfig.DEFAULT_DISPATCH_WORKERS));
    map.put("unbalancedBlocks", "IGNORE");
    return Map.copyOf(map);
  }
}
