package ca.gc.cra.relay.domain.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of delivering one batch to one exporter.
 *
 * @param exporterId exporter identifier (e.g., {@code otlp/honeycomb})
 * @param status terminal status
 * @param attempts number of transmission attempts made; zero when abandoned before the first try
 * @param latencyNanos wall time from dispatch to the terminal state
 * @param error failure cause for {@link Status#FAILED} and {@link Status#ABANDONED}; {@code null} on success
 * @since 0.1.0
 */
public record ExportResult(String exporterId, Status status, int attempts, long latencyNanos, Throwable error) {

  /**
   * Validates the result.
   */
  public ExportResult {
    Objects.requireNonNull(exporterId, "exporterId");
    Objects.requireNonNull(status, "status");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must not be negative");
    }
    if (status == Status.SUCCESS && error != null) {
      throw new IllegalArgumentException("successful result cannot carry an error");
    }
  }

  /**
   * Creates a success result.
   *
   * @param exporterId exporter identifier
   * @param attempts attempts used
   * @param latencyNanos elapsed nanoseconds
   * @return success result
   */
  public static ExportResult success(String exporterId, int attempts, long latencyNanos) {
    return new ExportResult(exporterId, Status.SUCCESS, attempts, latencyNanos, null);
  }

  /**
   * Creates a failure result.
   *
   * @param exporterId exporter identifier
   * @param attempts attempts used
   * @param latencyNanos elapsed nanoseconds
   * @param error terminal cause
   * @return failure result
   */
  public static ExportResult failed(String exporterId, int attempts, long latencyNanos, Throwable error) {
    return new ExportResult(exporterId, Status.FAILED, attempts, latencyNanos, Objects.requireNonNull(error, "error"));
  }

  /**
   * Creates a result for an attempt cancelled during drain.
   *
   * @param exporterId exporter identifier
   * @param attempts attempts started before cancellation
   * @param latencyNanos elapsed nanoseconds
   * @param error reason for abandonment, may be {@code null}
   * @return abandoned result
   */
  public static ExportResult abandoned(String exporterId, int attempts, long latencyNanos, Throwable error) {
    return new ExportResult(exporterId, Status.ABANDONED, attempts, latencyNanos, error);
  }

  /**
   * Indicates success.
   *
   * @return {@code true} when the exporter accepted the batch
   */
  public boolean succeeded() {
    return status == Status.SUCCESS;
  }

  /**
   * Returns the failure cause, if any.
   *
   * @return optional error
   */
  public Optional<Throwable> errorOptional() {
    return Optional.ofNullable(error);
  }

  /** Terminal delivery status. */
  public enum Status {
    SUCCESS,
    FAILED,
    ABANDONED
  }
}
