package ca.gc.cra.relay.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over one mapping of the YAML document with typed accessors.
 * <p>Every accessor reports failures as {@link ConfigException} naming the full dotted path of the offending key.
 * Absent and explicitly {@code null} keys are treated alike, so {@code batch:} with no body yields an empty
 * section.</p>
 *
 * @since 0.1.0
 */
public final class ConfigSection {
  private final String path;
  private final Map<String, Object> values;

  private ConfigSection(String path, Map<String, Object> values) {
    this.path = path;
    this.values = values;
  }

  /**
   * Wraps a parsed YAML node.
   *
   * @param path dotted location of the node
   * @param node parsed mapping, or {@code null} for an empty section
   * @return section view
   * @throws ConfigException if the node is not a mapping with string keys
   */
  public static ConfigSection of(String path, Object node) {
    if (node == null) {
      return new ConfigSection(path, Map.of());
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ConfigException(path + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new ConfigException(path + " contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return new ConfigSection(path, Collections.unmodifiableMap(map));
  }

  /**
   * Returns an empty section.
   *
   * @param path dotted location
   * @return empty view
   */
  public static ConfigSection empty(String path) {
    return new ConfigSection(path, Map.of());
  }

  public String path() {
    return path;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public boolean has(String key) {
    return values.get(key) != null;
  }

  /**
   * Returns the keys in document order.
   *
   * @return key list
   */
  public List<String> keys() {
    return List.copyOf(values.keySet());
  }

  /**
   * Returns a nested section.
   *
   * @param key child key
   * @return child view; empty when absent
   */
  public ConfigSection section(String key) {
    return of(child(key), values.get(key));
  }

  /**
   * Returns a required string value.
   *
   * @param key child key
   * @return trimmed value
   * @throws ConfigException if the key is absent, blank or not a scalar
   */
  public String requireString(String key) {
    return optionalString(key)
        .orElseThrow(() -> new ConfigException(child(key) + " is required"));
  }

  /**
   * Returns an optional string value. Numbers and booleans are rendered as text.
   *
   * @param key child key
   * @return trimmed value when present and not blank
   */
  public Optional<String> optionalString(String key) {
    Object value = values.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new ConfigException(child(key) + " must be a scalar value");
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  public String string(String key, String fallback) {
    return optionalString(key).orElse(fallback);
  }

  /**
   * Returns a boolean value.
   *
   * @param key child key
   * @param fallback value when absent
   * @return parsed boolean
   * @throws ConfigException if the value is not {@code true} or {@code false}
   */
  public boolean bool(String key, boolean fallback) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new ConfigException(child(key) + " must be true or false (was " + text + ")");
  }

  /**
   * Returns an integer value.
   *
   * @param key child key
   * @param fallback value when absent
   * @return parsed integer
   * @throws ConfigException if the value is not an integer
   */
  public int integer(String key, int fallback) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Integer i) {
      return i;
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new ConfigException(child(key) + " must be an integer (was " + value + ")", ex);
    }
  }

  /**
   * Returns a floating-point value.
   *
   * @param key child key
   * @param fallback value when absent
   * @return parsed number
   * @throws ConfigException if the value is not numeric
   */
  public double decimal(String key, double fallback) {
    Object value = values.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new ConfigException(child(key) + " must be a number (was " + value + ")", ex);
    }
  }

  /**
   * Returns a duration value.
   *
   * @param key child key
   * @param fallback value when absent
   * @return parsed duration
   * @see Durations#parse(String, String)
   */
  public Duration duration(String key, Duration fallback) {
    Optional<String> text = optionalString(key);
    return text.isPresent() ? Durations.parse(text.get(), child(key)) : fallback;
  }

  /**
   * Returns a list of scalar strings. A single scalar is treated as a one-element list.
   *
   * @param key child key
   * @return values in document order; empty when absent
   */
  public List<String> stringList(String key) {
    Object value = values.get(key);
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> list) {
      List<String> result = new ArrayList<>(list.size());
      for (Object item : list) {
        if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
          throw new ConfigException(child(key) + " must be a list of names");
        }
        result.add(item.toString().trim());
      }
      return List.copyOf(result);
    }
    if (value instanceof Map<?, ?>) {
      throw new ConfigException(child(key) + " must be a list");
    }
    return List.of(value.toString().trim());
  }

  /**
   * Returns a list of mappings.
   *
   * @param key child key
   * @return sections in document order; empty when absent
   */
  public List<ConfigSection> sectionList(String key) {
    Object value = values.get(key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new ConfigException(child(key) + " must be a list");
    }
    List<ConfigSection> result = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); i++) {
      result.add(of(child(key) + "[" + i + "]", list.get(i)));
    }
    return List.copyOf(result);
  }

  /**
   * Returns a flat string map, e.g. HTTP headers.
   *
   * @param key child key
   * @return insertion-ordered map; empty when absent
   */
  public Map<String, String> stringMap(String key) {
    ConfigSection section = section(key);
    Map<String, String> result = new LinkedHashMap<>();
    for (String name : section.keys()) {
      result.put(name, section.optionalString(name).orElse(""));
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Returns the raw value for a key.
   *
   * @param key child key
   * @return raw parsed value or {@code null}
   */
  public Object raw(String key) {
    return values.get(key);
  }

  /**
   * Builds the dotted path for a child key.
   *
   * @param key child key
   * @return full path
   */
  public String child(String key) {
    return path.isEmpty() ? key : path + "." + key;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ConfigSection section
        && path.equals(section.path)
        && values.equals(section.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, values);
  }

  @Override
  public String toString() {
    return path + values;
  }
}
