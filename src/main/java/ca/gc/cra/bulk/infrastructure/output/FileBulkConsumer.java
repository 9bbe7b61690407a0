package ca.gc.cra.bulk.infrastructure.output;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.domain.command.Bulk;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each bulk to its own report file.
 *
 * <p>Files are named {@code bulk<epochSeconds>_<seq>.log}, where {@code epochSeconds} comes from the first
 * command of the bulk and {@code seq} is a process-wide counter, so two bulks started in the same second
 * never share a file. Existing files are never overwritten: when a name is already taken, for example by
 * an earlier run into the same directory, the next sequence number is tried. The content is the same
 * {@code bulk: ...} rendering the console consumer prints, without a trailing newline.</p>
 *
 * @since 0.1.0
 */
public final class FileBulkConsumer implements BulkConsumer {
  private static final Logger log = LoggerFactory.getLogger(FileBulkConsumer.class);
  private static final AtomicLong SEQUENCE = new AtomicLong();
  private static final int MAX_NAME_ATTEMPTS = 10_000;

  private final Path outputDirectory;
  private final AtomicLong sequence;
  private volatile Bulk current = Bulk.empty();

  /**
   * Creates a file consumer.
   *
   * @param outputDirectory directory receiving report files; created on first write when missing
   */
  public FileBulkConsumer(Path outputDirectory) {
    this(outputDirectory, SEQUENCE);
  }

  FileBulkConsumer(Path outputDirectory, AtomicLong sequence) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.sequence = Objects.requireNonNull(sequence, "sequence");
  }

  @Override
  public void update(Bulk bulk) {
    current = Objects.requireNonNull(bulk, "bulk");
  }

  /**
   * Writes the recorded bulk to a new file.
   *
   * @throws IOException if the directory cannot be created or the file cannot be written
   */
  @Override
  public void process() throws IOException {
    Bulk bulk = current;
    if (bulk.isEmpty()) {
      return;
    }
    ensureDirectory();
    String rendered = bulk.render();
    for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
      Path outFile = outputDirectory.resolve(fileName(bulk, sequence.incrementAndGet()));
      try {
        Files.writeString(outFile, rendered, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        log.debug("Wrote {} commands to {}", bulk.size(), outFile);
        return;
      } catch (FileAlreadyExistsException ex) {
        log.debug("Report file {} already exists; trying next sequence", outFile);
      }
    }
    throw new IOException("No free report file name in " + outputDirectory + " after "
        + MAX_NAME_ATTEMPTS + " attempts");
  }

  static String fileName(Bulk bulk, long sequence) {
    return "bulk" + bulk.commands().get(0).timestampSeconds() + "_" + sequence + ".log";
  }

  public Path outputDirectory() {
    return outputDirectory;
  }

  @Override
  public String name() {
    return "file";
  }

  private void ensureDirectory() throws IOException {
    if (!Files.exists(outputDirectory)) {
      Files.createDirectories(outputDirectory);
    }
  }
}
