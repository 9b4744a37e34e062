package ca.gc.cra.relay.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the relay commands.
 * <p><strong>Why:</strong> Gives operators and supervisors (systemd, Kubernetes) stable process status semantics.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The configuration file could not be read or a socket could not be bound. */
  IO_ERROR(3),
  /** The configuration was malformed or could not be wired, or a required exporter was unreachable. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
