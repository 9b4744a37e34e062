/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize values before emission.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.logging;
