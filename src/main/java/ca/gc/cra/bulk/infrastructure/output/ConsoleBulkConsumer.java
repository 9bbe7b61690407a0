package ca.gc.cra.bulk.infrastructure.output;

import ca.gc.cra.bulk.application.port.BulkConsumer;
import ca.gc.cra.bulk.domain.command.Bulk;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Prints each bulk as one {@code bulk: c1, c2, ...} line.
 *
 * <p>Writes go through a {@link PrintWriter}; the default targets stdout via the native file descriptor
 * so log output on stderr never interleaves with bulk lines.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleBulkConsumer implements BulkConsumer {
  private final PrintWriter out;
  private volatile Bulk current = Bulk.empty();

  /**
   * Creates a console consumer writing to stdout.
   */
  public ConsoleBulkConsumer() {
    this(new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true));
  }

  /**
   * Creates a console consumer writing to {@code out}.
   *
   * @param out destination writer; flushed after every bulk
   */
  public ConsoleBulkConsumer(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void update(Bulk bulk) {
    current = Objects.requireNonNull(bulk, "bulk");
  }

  /**
   * Prints the recorded bulk.
   *
   * @throws IllegalStateException if the writer reports an error
   */
  @Override
  public void process() {
    Bulk bulk = current;
    if (bulk.isEmpty()) {
      return;
    }
    synchronized (out) {
      out.println(bulk.render());
      out.flush();
      if (out.checkError()) {
        throw new IllegalStateException("console output failed");
      }
    }
  }

  @Override
  public String name() {
    return "console";
  }
}
