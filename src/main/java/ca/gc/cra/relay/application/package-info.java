/**
 * Application layer: ports and the pipeline use cases built on them.
 */
package ca.gc.cra.relay.application;
