/**
 * Signal processors applied before batching.
 */
package ca.gc.cra.relay.application.processor;
