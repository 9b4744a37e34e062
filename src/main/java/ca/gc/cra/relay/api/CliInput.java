package ca.gc.cra.relay.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Relay command line split into an optional leading command word, flags and {@code key=value} pairs.
 * <p>{@code relay run config=relay.yaml --verbose} parses to command {@code run}, the pair
 * {@code config=relay.yaml} and the verbose flag.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String command;
  private final String[] keyValueArgs;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String command, String[] keyValueArgs, boolean help, boolean verbose) {
    this.command = command;
    this.keyValueArgs = keyValueArgs;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. The first token without {@code =} that is not a flag becomes the command; any further
   * bare token is kept with the pairs so the key/value parser can reject it.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(null, new String[0], false, false);
    }
    String command = null;
    List<String> kv = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (command == null && kv.isEmpty() && !arg.contains("=") && !arg.startsWith("-")) {
        command = lower;
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(command, kv.toArray(String[]::new), help, verbose);
  }

  /**
   * Returns the leading command word.
   *
   * @return lowercase command such as {@code run}, when present
   */
  public Optional<String> command() {
    return Optional.ofNullable(command);
  }

  /**
   * Returns a copy of the arguments left for {@code key=value} parsing.
   *
   * @return remaining arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }
}
