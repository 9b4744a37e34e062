package ca.gc.cra.relay.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable copy of the process environment captured once at configuration load.
 * <p>Resolves {@code ${env:NAME}}, {@code ${NAME}} and {@code ${env:NAME:-default}} placeholders. A literal
 * {@code $$} yields a single {@code $}.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentSnapshot {
  private static final Pattern PLACEHOLDER =
      Pattern.compile("\\$\\$|\\$\\{(?:env:)?([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

  private final Map<String, String> variables;

  private EnvironmentSnapshot(Map<String, String> variables) {
    this.variables = Map.copyOf(variables);
  }

  /**
   * Captures the current process environment.
   *
   * @return snapshot of {@link System#getenv()}
   */
  public static EnvironmentSnapshot capture() {
    return new EnvironmentSnapshot(System.getenv());
  }

  /**
   * Creates a snapshot from explicit variables.
   *
   * @param variables variable map
   * @return snapshot
   */
  public static EnvironmentSnapshot of(Map<String, String> variables) {
    return new EnvironmentSnapshot(Objects.requireNonNull(variables, "variables"));
  }

  /**
   * Looks up a variable.
   *
   * @param name variable name
   * @return value when defined
   */
  public Optional<String> get(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  /**
   * Substitutes every placeholder in a configuration value.
   *
   * @param value raw configuration text
   * @param location configuration path used in error messages (e.g., {@code exporters.otlp/honeycomb.headers})
   * @return text with placeholders replaced
   * @throws ConfigException if a placeholder names an undefined variable and carries no default
   */
  public String substitute(String value, String location) {
    if (value == null || value.indexOf('$') < 0) {
      return value;
    }
    Matcher matcher = PLACEHOLDER.matcher(value);
    StringBuilder result = new StringBuilder(value.length());
    while (matcher.find()) {
      String replacement;
      if (matcher.group(1) == null) {
        replacement = "$";
      } else {
        String name = matcher.group(1);
        String fallback = matcher.group(2);
        String resolved = variables.get(name);
        if (resolved == null) {
          if (fallback == null) {
            throw new ConfigException(
                "Environment variable " + name + " referenced at " + location + " is not set");
          }
          resolved = fallback;
        }
        replacement = resolved;
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
