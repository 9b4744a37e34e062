/**
 * Domain model for the relay: signals, batches and delivery outcomes.
 * <p>No dependencies on infrastructure; everything here is plain immutable Java.</p>
 */
package ca.gc.cra.relay.domain;
