package ca.gc.cra.relay.infrastructure.codec;

/**
 * Malformed inbound signal payload. Scoped to the request, line or record that carried it.
 *
 * @since 0.1.0
 */
public class DecodeException extends Exception {
  private static final long serialVersionUID = 1L;

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
