package ca.gc.cra.relay.api;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.config.CollectorConfig;
import ca.gc.cra.relay.config.CollectorConfigLoader;
import ca.gc.cra.relay.config.CompositionRoot;
import ca.gc.cra.relay.config.ConfigException;
import ca.gc.cra.relay.config.EnvironmentSnapshot;
import ca.gc.cra.relay.config.PipelineGraph;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code relay validate}: resolves a configuration exactly as {@code run} would, without starting anything, and
 * prints the resulting pipeline plan.
 *
 * @since 0.1.0
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  private static final String SUMMARY_USAGE = "usage: relay validate config=PATH [--verbose]";
  private static final String HELP_TEXT = """
      Relay configuration validation

      Usage:
        relay validate config=PATH

      Checks YAML syntax, environment placeholders, component references, component types and
      signal type support, then prints receivers, pipelines (in drain order) and exporters.
      Header values that look like credentials are redacted.

      Options:
        config=PATH   Collector YAML document (required)
        --verbose     Enable DEBUG logging
        --help        Show this message
      """;

  private ValidateCli() {}

  /**
   * Executes the command.
   *
   * @param args command arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, EnvironmentSnapshot.capture());
  }

  static ExitCode run(String[] args, EnvironmentSnapshot environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (input.command().isPresent()) {
      log.error("Unexpected argument '{}'; expected key=value", input.command().get());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path configPath;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      configPath = ConfigCliUtils.extractConfigPath(kv);
      ConfigCliUtils.rejectUnknown(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (configPath == null) {
      log.error("config=PATH is required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      CollectorConfig config = CollectorConfigLoader.load(configPath, environment);
      PipelineGraph graph = new CompositionRoot(MetricsPort.NO_OP).resolve(config);
      CliPrinter.println("Configuration " + configPath + " is valid.");
      CliPrinter.println(graph.describe().stripTrailing());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Cannot read configuration {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (ConfigException ex) {
      log.error("Invalid configuration {}: {}", configPath, ex.getMessage());
      CliPrinter.println("Configuration " + configPath + " is invalid: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure validating {}", configPath, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
