package ca.gc.cra.relay.application.port;

/**
 * Recoverable export failure such as a timeout, refused connection, HTTP 429 or 5xx. Retried with backoff.
 *
 * @since 0.1.0
 */
public class ExportTransientException extends ExportException {
  private static final long serialVersionUID = 1L;

  public ExportTransientException(String message) {
    super(message);
  }

  public ExportTransientException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
