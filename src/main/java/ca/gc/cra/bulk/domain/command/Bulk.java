package ca.gc.cra.bulk.domain.command;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Immutable snapshot of commands grouped into one delivery unit.
 * <p><strong>Why:</strong> The batching engine hands the same snapshot to every consumer; immutability
 * lets consumers keep it after {@code update} without copying.</p>
 * <p><strong>Role:</strong> Domain value passed through
 * {@link ca.gc.cra.bulk.application.port.BulkConsumer}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to read from any number of threads.</p>
 *
 * @param commands commands in arrival order; copied on construction
 * @since 0.1.0
 */
public record Bulk(List<Command> commands) {
  private static final Bulk EMPTY = new Bulk(List.of());

  /** Prefix written in front of every rendered bulk. */
  public static final String RENDER_PREFIX = "bulk: ";

  /**
   * Copies the supplied commands so later changes to the source list are not observed.
   *
   * @throws NullPointerException if {@code commands} or any element is {@code null}
   */
  public Bulk {
    commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
  }

  /**
   * Returns the shared empty bulk.
   *
   * @return bulk with no commands
   */
  public static Bulk empty() {
    return EMPTY;
  }

  /**
   * Creates a bulk from an ordered list of commands.
   *
   * @param commands commands in arrival order
   * @return immutable bulk snapshot
   */
  public static Bulk of(List<Command> commands) {
    return commands.isEmpty() ? EMPTY : new Bulk(commands);
  }

  public int size() {
    return commands.size();
  }

  public boolean isEmpty() {
    return commands.isEmpty();
  }

  /**
   * Returns the timestamp of the first command in the bulk.
   *
   * @return epoch milliseconds of the first command
   * @throws IllegalStateException if the bulk is empty
   */
  public long firstTimestampMillis() {
    if (commands.isEmpty()) {
      throw new IllegalStateException("empty bulk has no first command");
    }
    return commands.get(0).timestampMillis();
  }

  /**
   * Renders the bulk as {@code bulk: c1, c2, ...}.
   *
   * @return single-line rendering without a trailing line separator
   */
  public String render() {
    return commands.stream()
        .map(Command::text)
        .collect(Collectors.joining(", ", RENDER_PREFIX, ""));
  }
}
