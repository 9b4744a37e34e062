package ca.gc.cra.relay.config;

import java.util.Objects;

/**
 * Component identifier of the form {@code type} or {@code type/name}, e.g. {@code otlp/honeycomb/metrics}.
 *
 * @param type component type used to select the implementation
 * @param name optional instance name; empty when absent
 * @since 0.1.0
 */
public record ComponentId(String type, String name) {

  public ComponentId {
    Objects.requireNonNull(type, "type");
    name = Objects.requireNonNullElse(name, "");
  }

  /**
   * Parses an identifier. Everything after the first {@code /} is the instance name.
   *
   * @param raw identifier text
   * @return parsed id
   * @throws ConfigException if the type part is blank
   */
  public static ComponentId parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigException("component id must not be blank");
    }
    String trimmed = raw.trim();
    int slash = trimmed.indexOf('/');
    String type = slash < 0 ? trimmed : trimmed.substring(0, slash);
    String name = slash < 0 ? "" : trimmed.substring(slash + 1);
    if (type.isBlank()) {
      throw new ConfigException("component id '" + raw + "' has no type");
    }
    if (slash >= 0 && name.isBlank()) {
      throw new ConfigException("component id '" + raw + "' has an empty name");
    }
    return new ComponentId(type, name);
  }

  @Override
  public String toString() {
    return name.isEmpty() ? type : type + "/" + name;
  }
}
