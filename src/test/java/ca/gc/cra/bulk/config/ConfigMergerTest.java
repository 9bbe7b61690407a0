package ca.gc.cra.bulk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("bulk", "4", "out", "yaml-dir")),
        Map.of("bulk", "7"),
        BulkDefaults.asFlatMap(),
        warnings::add);

    assertEquals("7", merged.get("bulk"));
    assertEquals("yaml-dir", merged.get("out"));
    assertEquals("console,file", merged.get("outputs"));
    assertEquals(List.of("CLI overrides YAML for key: bulk"), warnings);
  }

  @Test
  void noWarningWhenYamlAbsent() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("bulk", "2"), BulkDefaults.asFlatMap(), warnings::add);

    assertEquals("2", merged.get("bulk"));
    assertEquals(List.of(), warnings);
  }

  @Test
  void requiresBulkSize() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of(), BulkDefaults.asFlatMap(), null));
  }

  @Test
  void kafkaOutputRequiresBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("outputs", "console, KAFKA")), Map.of("bulk", "2"), BulkDefaults.asFlatMap(), null));
  }
}
