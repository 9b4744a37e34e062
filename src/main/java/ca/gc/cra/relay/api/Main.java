package ca.gc.cra.relay.api;

import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relay CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: relay <run|validate> config=PATH [options]";
  private static final String HELP_TEXT = """
      Relay telemetry pipeline router

      Usage:
        relay <command> [options]

      Commands:
        run         Start receivers, pipelines and exporters until SIGTERM/SIGINT (run --help for details)
        validate    Resolve a configuration and print the pipeline plan

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first word is the command)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.command().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = input.command().get();
    String[] delegateArgs = delegateArgs(args, command);
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "validate" -> ValidateCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] delegateArgs(String[] args, String command) {
    List<String> rest = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < rest.size(); i++) {
      String arg = rest.get(i);
      if (arg != null && arg.trim().equalsIgnoreCase(command)) {
        rest.remove(i);
        break;
      }
    }
    return rest.toArray(String[]::new);
  }
}
