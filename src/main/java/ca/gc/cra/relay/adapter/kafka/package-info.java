/**
 * Kafka adapters that consume and publish OTLP/JSON documents.
 * <p><strong>Role:</strong> Adapter layer on both sides of the relay; implements
 * {@link ca.gc.cra.relay.application.port.SignalReceiver} and {@link ca.gc.cra.relay.application.port.SignalExporter}
 * on Kafka topics.</p>
 * <p><strong>Concurrency:</strong> The receiver confines its consumer to one poll thread; the exporter shares one
 * thread-safe producer across export tasks.</p>
 * <p><strong>Metrics:</strong> Emits {@code receiver.<id>.*} counters; exporter outcomes are counted by the
 * fan-out.</p>
 */
package ca.gc.cra.relay.adapter.kafka;
