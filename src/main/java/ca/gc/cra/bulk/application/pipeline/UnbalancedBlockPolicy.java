package ca.gc.cra.bulk.application.pipeline;

import java.util.Locale;

/**
 * Behaviour applied when a block end marker arrives while no block is open.
 *
 * @since 0.1.0
 */
public enum UnbalancedBlockPolicy {
  /** Log and count the marker; depth stays at zero and nothing is flushed. */
  IGNORE,
  /** Throw {@link UnbalancedBlockException}; engine state is left untouched. */
  REJECT;

  /**
   * Parses a policy name, defaulting to {@link #IGNORE} when blank.
   *
   * @param value textual representation such as {@code "ignore"} or {@code "reject"}
   * @return parsed policy
   * @throws IllegalArgumentException if the value does not match a known policy
   */
  public static UnbalancedBlockPolicy fromString(String value) {
    if (value == null || value.isBlank()) {
      return IGNORE;
    }
    try {
      return UnbalancedBlockPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown unbalancedBlocks policy: " + value, ex);
    }
  }
}
