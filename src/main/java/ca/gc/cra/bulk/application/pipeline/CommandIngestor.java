package ca.gc.cra.bulk.application.pipeline;

import ca.gc.cra.bulk.application.port.ClockPort;
import ca.gc.cra.bulk.domain.command.Command;
import java.util.Objects;

/**
 * Turns raw text into commands and block markers for a {@link BatchEngine}.
 *
 * <p>Input is split on {@code '\n'}; a trailing {@code '\r'} is dropped from each line and empty lines
 * are discarded. A line equal to {@value #BLOCK_BEGIN} opens a block, {@value #BLOCK_END} closes one,
 * anything else becomes a {@link Command} stamped with the current clock.</p>
 *
 * <p>Not thread-safe; shares the single-ingester precondition of the engine it feeds.</p>
 *
 * @since 0.1.0
 */
public final class CommandIngestor {
  /** Reserved line that opens a block. */
  public static final String BLOCK_BEGIN = "{";
  /** Reserved line that closes a block. */
  public static final String BLOCK_END = "}";

  private final BatchEngine engine;
  private final ClockPort clock;

  /**
   * Creates an ingestor feeding {@code engine}.
   *
   * @param engine engine receiving commands and markers
   * @param clock clock used to stamp commands
   */
  public CommandIngestor(BatchEngine engine, ClockPort clock) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Splits {@code data} into lines and routes each non-empty line.
   *
   * @param data raw text, possibly containing several lines; {@code null} is treated as empty
   * @return number of lines routed to the engine
   */
  public int receive(String data) {
    if (data == null || data.isEmpty()) {
      return 0;
    }
    int routed = 0;
    int start = 0;
    int length = data.length();
    while (start <= length) {
      int end = data.indexOf('\n', start);
      if (end < 0) {
        end = length;
      }
      if (accept(data.substring(start, end))) {
        routed++;
      }
      start = end + 1;
    }
    return routed;
  }

  /**
   * Routes a single line.
   *
   * @param line one line of input without its line separator
   * @return {@code false} if the line was empty and therefore discarded
   */
  public boolean accept(String line) {
    if (line == null) {
      return false;
    }
    String text = stripCarriageReturn(line);
    if (text.isEmpty()) {
      return false;
    }
    switch (text) {
      case BLOCK_BEGIN -> engine.enterBlock();
      case BLOCK_END -> engine.exitBlock();
      default -> engine.submit(new Command(text, clock.nowMillis()));
    }
    return true;
  }

  private static String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
