package ca.gc.cra.relay.application.port;

/**
 * Raised when signals arrive at a pipeline that is not in the {@code RUNNING} state.
 *
 * @since 0.1.0
 */
public class SignalRejectedException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message rejection reason
   */
  public SignalRejectedException(String message) {
    super(message);
  }
}
