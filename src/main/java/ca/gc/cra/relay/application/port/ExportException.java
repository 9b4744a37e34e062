package ca.gc.cra.relay.application.port;

/**
 * Base class for failures delivering a batch to an exporter.
 *
 * @since 0.1.0
 * @see ExportTransientException
 * @see ExportTerminalException
 */
public abstract class ExportException extends Exception {
  private static final long serialVersionUID = 1L;

  protected ExportException(String message) {
    super(message);
  }

  protected ExportException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Indicates whether the delivery may be retried.
   *
   * @return {@code true} for transient failures
   */
  public abstract boolean isRetryable();
}
