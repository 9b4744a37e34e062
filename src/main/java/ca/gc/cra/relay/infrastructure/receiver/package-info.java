/**
 * Ingestion adapters: OTLP/JSON over HTTP and over a line-delimited TCP stream.
 */
package ca.gc.cra.relay.infrastructure.receiver;
