package ca.gc.cra.relay.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by configuration and CLI layers.
 * <p><strong>Why:</strong> Topic names, header names and other identifiers are checked once at startup so exporters
 * never send malformed requests.</p>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Normalize Kafka topic identifiers to the supported character set.</li>
 *   <li>Verify HTTP header names use token characters only.</li>
 * </ul>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final Pattern HEADER_NAME = Pattern.compile("^[!#$%&'*+.^_`|~0-9A-Za-z-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates and normalizes a Kafka topic identifier.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate topic; must be non-null
   * @return sanitized topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic contains unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates an HTTP header name and that its value carries no line breaks.
   *
   * @param name header name
   * @param value header value
   * @return trimmed header name
   * @throws IllegalArgumentException if the name is not an HTTP token or the value contains control characters
   */
  public static String requireHeader(String name, String value) {
    String header = requireNonBlank("header name", name);
    if (!HEADER_NAME.matcher(header).matches()) {
      throw new IllegalArgumentException("header name " + header + " must be an HTTP token");
    }
    if (value != null && containsControl(value)) {
      throw new IllegalArgumentException("header " + header + " value must not contain control characters");
    }
    return header;
  }

  /**
   * Requires printable ASCII text of bounded length, e.g. for {@code OTEL_RESOURCE_ATTRIBUTES} overrides.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate value
   * @param maxLength largest accepted length
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
