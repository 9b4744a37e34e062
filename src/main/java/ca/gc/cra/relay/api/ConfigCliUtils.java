package ca.gc.cra.relay.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Shared argument handling for the commands that take a collector configuration file.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the configuration path argument ({@code config=} or {@code --config=}).
   *
   * @param args mutable argument map
   * @return configured path, or {@code null} when absent
   */
  static Path extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return Path.of(value.trim());
      }
    }
    return null;
  }

  /**
   * Fails on arguments no command consumed.
   *
   * @param args remaining arguments
   * @throws IllegalArgumentException if any argument is left
   */
  static void rejectUnknown(Map<String, String> args) {
    if (args != null && !args.isEmpty()) {
      throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", args.keySet()));
    }
  }
}
