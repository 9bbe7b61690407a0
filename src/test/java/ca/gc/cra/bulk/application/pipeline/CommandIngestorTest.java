package ca.gc.cra.bulk.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bulk.application.port.MetricsPort;
import ca.gc.cra.bulk.domain.command.Bulk;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandIngestorTest {

  @Test
  void splitsOnNewlinesAndDropsEmptyLines() {
    RecordingConsumer consumer = new RecordingConsumer();
    BatchEngine engine = new BatchEngine(10);
    engine.subscribe(consumer);
    CommandIngestor ingestor = new CommandIngestor(engine, () -> 5_000L);

    int routed = ingestor.receive("cmd1\n\ncmd2\r\n{\ncmd3\n}\n");
    engine.close();

    assertEquals(5, routed);
    assertEquals(List.of(List.of("cmd1", "cmd2"), List.of("cmd3")), consumer.processed());
  }

  @Test
  void stampsCommandsWithClock() {
    Bulk[] seen = new Bulk[1];
    RecordingConsumer consumer = new RecordingConsumer() {
      @Override
      public void update(Bulk bulk) {
        super.update(bulk);
        seen[0] = bulk;
      }
    };
    BatchEngine engine = new BatchEngine(
        1, UnbalancedBlockPolicy.IGNORE, BulkDispatcher.pooled(1, MetricsPort.NO_OP), MetricsPort.NO_OP);
    engine.subscribe(consumer);

    new CommandIngestor(engine, () -> 42_123L).accept("x");
    engine.close();

    assertEquals(42_123L, seen[0].firstTimestampMillis());
    assertEquals(42L, seen[0].commands().get(0).timestampSeconds());
  }

  @Test
  void markersMustMatchWholeLine() {
    BatchEngine engine = new BatchEngine(10);
    CommandIngestor ingestor = new CommandIngestor(engine, null);

    assertTrue(ingestor.accept(" {"));
    assertTrue(ingestor.accept("{}"));
    assertFalse(ingestor.accept(""));
    assertFalse(ingestor.accept("\r"));
    assertFalse(ingestor.accept(null));

    assertEquals(0, engine.depth());
    assertEquals(2, engine.pendingSize());
    engine.close();
  }

  @Test
  void emptyInputRoutesNothing() {
    BatchEngine engine = new BatchEngine(1);
    CommandIngestor ingestor = new CommandIngestor(engine, null);

    assertEquals(0, ingestor.receive(""));
    assertEquals(0, ingestor.receive(null));
    assertEquals(0, ingestor.receive("\n\n"));
    engine.close();
  }
}
