package ca.gc.cra.relay.application.pipeline;

/**
 * Raised when a pipeline cannot reach {@code RUNNING}, typically because a required exporter is unreachable.
 *
 * @since 0.1.0
 */
public class PipelineStartupException extends Exception {
  private static final long serialVersionUID = 1L;

  public PipelineStartupException(String message) {
    super(message);
  }

  public PipelineStartupException(String message, Throwable cause) {
    super(message, cause);
  }
}
