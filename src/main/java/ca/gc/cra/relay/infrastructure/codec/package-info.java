/**
 * Wire formats: OTLP/JSON decoding and encoding, Zipkin v2 JSON and the Datadog intake payloads, all built on the
 * Jackson streaming API.
 */
package ca.gc.cra.relay.infrastructure.codec;
