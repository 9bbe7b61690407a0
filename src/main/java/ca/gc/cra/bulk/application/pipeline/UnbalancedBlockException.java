package ca.gc.cra.bulk.application.pipeline;

/**
 * Raised under {@link UnbalancedBlockPolicy#REJECT} when a block end marker has no matching begin.
 *
 * @since 0.1.0
 */
public final class UnbalancedBlockException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the offending marker
   */
  public UnbalancedBlockException(String message) {
    super(message);
  }
}
