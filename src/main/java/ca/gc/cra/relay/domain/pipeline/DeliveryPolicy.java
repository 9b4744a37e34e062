package ca.gc.cra.relay.domain.pipeline;

import java.util.Collection;
import java.util.Locale;

/**
 * Rule deciding whether a batch counts as delivered given the per-exporter results.
 *
 * @since 0.1.0
 */
public enum DeliveryPolicy {
  /** Delivered when at least one exporter succeeded. */
  AT_LEAST_ONE,
  /** Delivered only when every exporter succeeded. */
  ALL_REQUIRED;

  /**
   * Applies the policy to a set of results.
   *
   * @param results terminal per-exporter results; an empty collection is never delivered
   * @return {@code true} if the batch is considered delivered
   */
  public boolean isDelivered(Collection<ExportResult> results) {
    if (results.isEmpty()) {
      return false;
    }
    return switch (this) {
      case AT_LEAST_ONE -> results.stream().anyMatch(ExportResult::succeeded);
      case ALL_REQUIRED -> results.stream().allMatch(ExportResult::succeeded);
    };
  }

  /**
   * Parses a configuration value such as {@code at_least_one} or {@code all-required}.
   *
   * @param raw configured value; {@code null} or blank yields {@link #AT_LEAST_ONE}
   * @return parsed policy
   * @throws IllegalArgumentException if the value is not recognised
   */
  public static DeliveryPolicy fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return AT_LEAST_ONE;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "at_least_one", "any" -> AT_LEAST_ONE;
      case "all_required", "all" -> ALL_REQUIRED;
      default -> throw new IllegalArgumentException("Unknown delivery policy: " + raw);
    };
  }
}
