package ca.gc.cra.relay.adapter.kafka;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.ExportTransientException;
import ca.gc.cra.relay.application.port.SignalExporter;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import ca.gc.cra.relay.validation.Net;
import ca.gc.cra.relay.validation.Strings;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * <strong>What:</strong> Exporter that publishes each batch as one OTLP/JSON document to a Kafka topic, keyed by
 * pipeline id.
 * <p><strong>Why:</strong> Decouples the relay from slow consumers; another relay can drain the topic with
 * {@link KafkaSignalReceiver}.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is
 * thread-safe.</p>
 * <p>Each export waits for the broker acknowledgement so the delivery outcome is known; retriable Kafka errors
 * map to {@link ExportTransientException}.</p>
 *
 * @since 0.1.0
 */
public final class KafkaSignalExporter implements SignalExporter {
  private static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(30);

  private final String id;
  private final Supplier<Producer<String, byte[]>> producerFactory;
  private final String topic;
  private final Duration ackTimeout;
  private final OtlpJsonCodec codec;
  private volatile Producer<String, byte[]> producer;

  /**
   * Creates an unstarted exporter; the producer is created on {@link #start()}.
   *
   * @param id exporter id
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @param codec OTLP/JSON codec
   */
  public KafkaSignalExporter(String id, String bootstrapServers, String topic, OtlpJsonCodec codec) {
    this(id, producerFactory(bootstrapServers), topic, DEFAULT_ACK_TIMEOUT, codec);
  }

  KafkaSignalExporter(
      String id,
      Supplier<Producer<String, byte[]>> producerFactory,
      String topic,
      Duration ackTimeout,
      OtlpJsonCodec codec) {
    this.id = Objects.requireNonNull(id, "id");
    this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory");
    this.topic = Strings.sanitizeTopic("topic", topic);
    this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Set<SignalType> supportedTypes() {
    return EnumSet.allOf(SignalType.class);
  }

  @Override
  public synchronized void start() {
    if (producer == null) {
      producer = producerFactory.get();
    }
  }

  @Override
  public void export(Batch batch) throws ExportException, InterruptedException {
    Producer<String, byte[]> kafka = producer;
    if (kafka == null) {
      throw new ExportTerminalException("Exporter " + id + " is not started");
    }
    ProducerRecord<String, byte[]> record =
        new ProducerRecord<>(topic, batch.pipelineId(), codec.encode(batch.type(), batch.signals()));
    Future<RecordMetadata> ack;
    try {
      ack = kafka.send(record);
    } catch (RuntimeException ex) {
      throw classify("send to " + topic + " failed", ex);
    }
    try {
      ack.get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      throw classify("broker rejected batch for " + topic, ex.getCause());
    } catch (TimeoutException ex) {
      throw new ExportTransientException("no acknowledgement from " + topic + " within " + ackTimeout, ex);
    }
  }

  @Override
  public synchronized void close() {
    if (producer != null) {
      producer.flush();
      producer.close(Duration.ofSeconds(5));
      producer = null;
    }
  }

  private static ExportException classify(String message, Throwable cause) {
    String detail = message + ": " + (cause == null ? "unknown" : cause.getMessage());
    if (cause instanceof RetriableException) {
      return new ExportTransientException(detail, cause);
    }
    return new ExportTerminalException(detail, cause);
  }

  private static Supplier<Producer<String, byte[]>> producerFactory(String bootstrapServers) {
    String servers = Net.validateHostPortList(bootstrapServers);
    return () -> {
      Properties props = new Properties();
      props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
      props.put(ProducerConfig.ACKS_CONFIG, "all");
      props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
      props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
      props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
      return new KafkaProducer<>(props);
    };
  }
}
