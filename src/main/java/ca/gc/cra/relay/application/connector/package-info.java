/**
 * Connectors: components that export from one pipeline and receive into another.
 */
package ca.gc.cra.relay.application.connector;
