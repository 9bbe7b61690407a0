package ca.gc.cra.bulk.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bulk.domain.command.Bulk;
import ca.gc.cra.bulk.domain.command.Command;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileBulkConsumerTest {
  @TempDir Path tempDir;

  @Test
  void writesRenderingToFileNamedAfterFirstCommandSecond() throws Exception {
    Path out = tempDir.resolve("reports");
    FileBulkConsumer consumer = new FileBulkConsumer(out);

    consumer.update(Bulk.of(List.of(new Command("cmd1", 1_700_000_000_500L), new Command("cmd2", 1_700_000_009_000L))));
    consumer.process();

    List<Path> files = list(out);
    assertEquals(1, files.size());
    String name = files.get(0).getFileName().toString();
    assertTrue(name.matches("bulk1700000000_\\d+\\.log"), name);
    assertEquals("bulk: cmd1, cmd2", Files.readString(files.get(0), StandardCharsets.UTF_8));
  }

  @Test
  void bulksInSameSecondGetDistinctFiles() throws Exception {
    FileBulkConsumer consumer = new FileBulkConsumer(tempDir);

    consumer.update(Bulk.of(List.of(new Command("a", 5_000L))));
    consumer.process();
    consumer.update(Bulk.of(List.of(new Command("b", 5_100L))));
    consumer.process();

    assertEquals(2, list(tempDir).size());
  }

  @Test
  void takenNamesAreSkippedWithoutOverwriting() throws Exception {
    for (int seq = 1; seq <= 5; seq++) {
      Files.writeString(tempDir.resolve("bulk1_" + seq + ".log"), "earlier run " + seq);
    }
    FileBulkConsumer consumer = new FileBulkConsumer(tempDir, new AtomicLong());

    consumer.update(Bulk.of(List.of(new Command("new", 1_000L))));
    consumer.process();

    assertEquals("bulk: new", Files.readString(tempDir.resolve("bulk1_6.log"), StandardCharsets.UTF_8));
    assertEquals("earlier run 1", Files.readString(tempDir.resolve("bulk1_1.log"), StandardCharsets.UTF_8));
    assertEquals(6, list(tempDir).size());
  }

  @Test
  void fileNameUsesSequence() {
    Bulk bulk = Bulk.of(List.of(new Command("a", 42_999L)));
    assertEquals("bulk42_7.log", FileBulkConsumer.fileName(bulk, 7));
  }

  private static List<Path> list(Path dir) throws Exception {
    try (Stream<Path> stream = Files.list(dir)) {
      return stream.sorted().collect(Collectors.toList());
    }
  }
}
