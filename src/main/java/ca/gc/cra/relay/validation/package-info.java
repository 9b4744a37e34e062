/**
 * Input validation helpers shared by configuration resolution and the CLI.
 */
package ca.gc.cra.relay.validation;
