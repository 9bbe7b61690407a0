package ca.gc.cra.bulk.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings.
   *
   * @param yaml optional flattened YAML settings
   * @param cli CLI key/value overrides (may be {@code null})
   * @param defaults embedded defaults (may be {@code null})
   * @param warn receives a message whenever a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException if the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    if (trim(effective.get("bulk")).isEmpty()) {
      throw new IllegalArgumentException("bulk is required (bulk=N)");
    }
    String outputs = trim(effective.get("outputs")).toLowerCase(Locale.ROOT);
    boolean kafka = false;
    for (String token : outputs.split(",")) {
      kafka |= token.trim().equals("kafka");
    }
    if (kafka && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when outputs include kafka");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
