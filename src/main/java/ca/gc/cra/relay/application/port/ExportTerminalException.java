package ca.gc.cra.relay.application.port;

/**
 * Non-recoverable export failure: authentication or validation rejection by the sink, an unsupported
 * signal type, or an exhausted retry budget. Never retried.
 *
 * @since 0.1.0
 */
public class ExportTerminalException extends ExportException {
  private static final long serialVersionUID = 1L;

  public ExportTerminalException(String message) {
    super(message);
  }

  public ExportTerminalException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
