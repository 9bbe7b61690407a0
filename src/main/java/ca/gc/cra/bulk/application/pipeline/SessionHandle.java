package ca.gc.cra.bulk.application.pipeline;

/**
 * Opaque identifier returned by {@link BulkSessions#connect(int)}.
 *
 * @param id process-unique session number
 * @since 0.1.0
 */
public record SessionHandle(long id) {
  /**
   * Returns the label used for logging and output keys.
   *
   * @return {@code session-<id>}
   */
  public String label() {
    return "session-" + id;
  }
}
