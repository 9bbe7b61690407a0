package ca.gc.cra.bulk.domain.command;

import java.util.Objects;

/**
 * <strong>What:</strong> A single textual command received by an ingestion session.
 * <p><strong>Why:</strong> Carries the text together with the moment it arrived so consumers can name
 * outputs after the first command of a bulk.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across consumer threads.</p>
 *
 * @param text command text exactly as received (without the line separator); never {@code null}
 * @param timestampMillis epoch milliseconds captured when the command was ingested
 * @since 0.1.0
 */
public record Command(String text, long timestampMillis) {
  /**
   * Validates command invariants.
   *
   * @throws NullPointerException if {@code text} is {@code null}
   */
  public Command {
    Objects.requireNonNull(text, "text");
  }

  /**
   * Returns the creation time truncated to whole seconds.
   *
   * @return epoch seconds of {@link #timestampMillis()}
   */
  public long timestampSeconds() {
    return Math.floorDiv(timestampMillis, 1_000L);
  }
}
