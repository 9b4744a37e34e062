/**
 * Exporter adapters: logging, OTLP/HTTP, Jaeger (Zipkin JSON), Datadog and the Prometheus pull endpoint.
 * <p>HTTP push exporters share {@link ca.gc.cra.relay.infrastructure.exporter.HttpTransport}, which maps HTTP
 * outcomes onto transient and terminal export failures.</p>
 */
package ca.gc.cra.relay.infrastructure.exporter;
