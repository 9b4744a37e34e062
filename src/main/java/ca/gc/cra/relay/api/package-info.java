/**
 * Command-line entry points: the {@code relay} dispatcher with its {@code run} and {@code validate} commands.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and self-telemetry, loads the
 * collector document and hands it to {@link ca.gc.cra.relay.config.CompositionRoot}.</p>
 * <p><strong>Security:</strong> Credential-like header values are redacted in printed plans.</p>
 */
package ca.gc.cra.relay.api;
