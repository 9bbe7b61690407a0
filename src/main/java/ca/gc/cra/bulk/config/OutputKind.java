package ca.gc.cra.bulk.config;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Output consumers that can be attached to a session via {@code outputs=}.
 *
 * @since 0.1.0
 */
public enum OutputKind {
  /** {@code bulk: ...} lines on stdout. */
  CONSOLE,
  /** One {@code bulk<seconds>_<seq>.log} file per bulk. */
  FILE,
  /** JSON documents on a Kafka topic. */
  KAFKA;

  /**
   * Parses a single output name.
   *
   * @param value case-insensitive name
   * @return matching output kind
   * @throws IllegalArgumentException if the name is blank or unknown
   */
  public static OutputKind fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("output name must not be blank");
    }
    try {
      return OutputKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown output: " + value.trim(), ex);
    }
  }

  /**
   * Parses a comma-separated list of outputs; duplicates collapse.
   *
   * @param value list such as {@code console,file}
   * @return non-empty set of outputs in declaration order
   * @throws IllegalArgumentException if the list is empty or names an unknown output
   */
  public static Set<OutputKind> parseList(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("outputs must name at least one of console, file, kafka");
    }
    EnumSet<OutputKind> kinds = EnumSet.noneOf(OutputKind.class);
    for (String token : value.split(",")) {
      if (!token.isBlank()) {
        kinds.add(fromString(token));
      }
    }
    if (kinds.isEmpty()) {
      throw new IllegalArgumentException("outputs must name at least one of console, file, kafka");
    }
    return kinds;
  }
}
