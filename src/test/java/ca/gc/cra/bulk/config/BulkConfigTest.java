package ca.gc.cra.bulk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bulk.application.pipeline.UnbalancedBlockPolicy;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BulkConfigTest {

  @Test
  void appliesDefaults() {
    BulkConfig config = BulkConfig.fromMap(Map.of("bulk", "3"));

    assertEquals(3, config.bulkSize());
    assertTrue(config.readsStdin());
    assertEquals(EnumSet.of(OutputKind.CONSOLE, OutputKind.FILE), config.outputs());
    assertEquals(BulkConfig.DEFAULT_OUTPUT_DIRECTORY, config.outputDirectory());
    assertEquals(Optional.empty(), config.kafkaBootstrap());
    assertEquals(BulkConfig.DEFAULT_KAFKA_TOPIC, config.kafkaTopic());
    assertEquals(BulkConfig.DEFAULT_DISPATCH_WORKERS, config.dispatchWorkers());
    assertEquals(UnbalancedBlockPolicy.IGNORE, config.unbalancedBlocks());
  }

  @Test
  void parsesEveryKey() {
    BulkConfig config = BulkConfig.fromMap(Map.of(
        "bulk", "5",
        "in", "a.txt, b.txt",
        "outputs", "kafka,console",
        "out", "/tmp/bulk",
        "kafkaBootstrap", "broker1:9092,broker2:9092",
        "kafkaTopic", "bulk.test",
        "dispatchWorkers", "8",
        "unbalancedBlocks", "reject"));

    assertEquals(List.of(Path.of("a.txt"), Path.of("b.txt")), config.inputs());
    assertFalse(config.readsStdin());
    assertTrue(config.hasOutput(OutputKind.KAFKA));
    assertFalse(config.hasOutput(OutputKind.FILE));
    assertEquals(Path.of("/tmp/bulk"), config.outputDirectory());
    assertEquals(Optional.of("broker1:9092,broker2:9092"), config.kafkaBootstrap());
    assertEquals("bulk.test", config.kafkaTopic());
    assertEquals(8, config.dispatchWorkers());
    assertEquals(UnbalancedBlockPolicy.REJECT, config.unbalancedBlocks());
  }

  @Test
  void rejectsMissingOrNonPositiveBulk() {
    assertThrows(IllegalArgumentException.class, () -> BulkConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> BulkConfig.fromMap(Map.of("bulk", "0")));
    assertThrows(IllegalArgumentException.class, () -> BulkConfig.fromMap(Map.of("bulk", "three")));
  }

  @Test
  void kafkaOutputRequiresBootstrap() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> BulkConfig.fromMap(Map.of("bulk", "2", "outputs", "kafka")));
    assertTrue(ex.getMessage().contains("kafkaBootstrap"));
  }

  @Test
  void rejectsUnknownValues() {
    assertThrows(IllegalArgumentException.class,
        () -> BulkConfig.fromMap(Map.of("bulk", "2", "outputs", "printer")));
    assertThrows(IllegalArgumentException.class,
        () -> BulkConfig.fromMap(Map.of("bulk", "2", "unbalancedBlocks", "sometimes")));
    assertThrows(IllegalArgumentException.class,
        () -> BulkConfig.fromMap(Map.of("bulk", "2", "dispatchWorkers", "1000")));
    assertThrows(IllegalArgumentException.class,
        () -> BulkConfig.fromMap(Map.of("bulk", "2", "kafkaTopic", "bad topic")));
  }

  @Test
  void outputsAccessorReturnsCopy() {
    BulkConfig config = BulkConfig.fromMap(Map.of("bulk", "1", "outputs", "console"));
    config.outputs().add(OutputKind.FILE);

    assertFalse(config.hasOutput(OutputKind.FILE));
  }
}
