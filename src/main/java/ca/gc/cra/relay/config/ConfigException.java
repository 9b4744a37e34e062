package ca.gc.cra.relay.config;

/**
 * Invalid collector configuration: malformed YAML, undefined component references, unknown component types,
 * unsupported signal types or unresolved environment placeholders. Fatal at startup.
 *
 * @since 0.1.0
 */
public class ConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
