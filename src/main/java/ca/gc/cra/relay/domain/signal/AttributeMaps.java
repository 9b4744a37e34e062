package ca.gc.cra.relay.domain.signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the scalar attribute maps carried by every {@link Signal}.
 * <p>Attribute values are restricted to {@link String}, {@link Long}, {@link Double} and
 * {@link Boolean}; other integral and floating types are widened. Insertion order is preserved so
 * encoders emit attributes in receipt order.</p>
 *
 * @since 0.1.0
 */
public final class AttributeMaps {
  private static final Map<String, Object> EMPTY = Collections.unmodifiableMap(new LinkedHashMap<>());

  private AttributeMaps() {
    // Utility
  }

  /**
   * Returns the shared empty attribute map.
   *
   * @return immutable empty map
   */
  public static Map<String, Object> empty() {
    return EMPTY;
  }

  /**
   * Validates and copies an attribute map into an immutable, insertion-ordered map.
   *
   * @param source attributes to copy; {@code null} yields an empty map
   * @return immutable copy containing only normalized scalar values
   * @throws IllegalArgumentException if a key is blank or a value is not a supported scalar
   */
  public static Map<String, Object> copyOf(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return EMPTY;
    }
    Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("attribute keys must not be blank");
      }
      copy.put(key, normalize(key, entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Normalizes a single attribute value to one of the supported scalar types.
   *
   * @param key attribute key used in diagnostics
   * @param value candidate value
   * @return normalized value
   * @throws IllegalArgumentException if the value is {@code null} or not a scalar
   */
  public static Object normalize(String key, Object value) {
    if (value instanceof String || value instanceof Long || value instanceof Double
        || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    if (value == null) {
      throw new IllegalArgumentException("attribute " + key + " must not be null");
    }
    throw new IllegalArgumentException(
        "attribute " + key + " has unsupported type " + value.getClass().getSimpleName());
  }

  /**
   * Returns the value rendered as a string, or the fallback when absent.
   *
   * @param attributes attribute map to read
   * @param key attribute key
   * @param fallback value returned when the key is missing
   * @return string form of the attribute
   */
  public static String stringValue(Map<String, Object> attributes, String key, String fallback) {
    Object value = attributes.get(key);
    return value == null ? fallback : value.toString();
  }
}
