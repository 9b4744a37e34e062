package ca.gc.cra.relay.adapter.kafka;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SignalConsumer;
import ca.gc.cra.relay.application.port.SignalReceiver;
import ca.gc.cra.relay.application.port.SignalRejectedException;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.DecodeException;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import ca.gc.cra.relay.validation.Net;
import ca.gc.cra.relay.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Receiver that consumes OTLP/JSON documents of one signal type from a Kafka topic.
 * <p><strong>Why:</strong> Lets upstream collectors buffer telemetry in Kafka and have the relay drain it.</p>
 * <p><strong>Role:</strong> Inbound adapter feeding a {@link SignalConsumer}.</p>
 * <p><strong>Thread-safety:</strong> The Kafka consumer is confined to one poll thread; {@link #close()} wakes it up
 * from any thread.</p>
 * <p><strong>Observability:</strong> Counts {@code receiver.<id>.decode.failed} for malformed records (skipped) and
 * {@code receiver.<id>.rejected} when no pipeline accepts a record. A record whose delivery fails unexpectedly is
 * logged, counted under {@code receiver.<id>.errors} and skipped.</p>
 *
 * @since 0.1.0
 */
public final class KafkaSignalReceiver implements SignalReceiver {
  private static final Logger log = LoggerFactory.getLogger(KafkaSignalReceiver.class);
  private static final Duration DEFAULT_POLL = Duration.ofMillis(200);

  private final String id;
  private final Supplier<Consumer<String, byte[]>> consumerFactory;
  private final String topic;
  private final SignalType signalType;
  private final Duration pollInterval;
  private final OtlpJsonCodec codec;
  private final MetricsPort metrics;

  private volatile Consumer<String, byte[]> consumer;
  private volatile boolean running;
  private Thread poller;

  /**
   * Creates an unstarted receiver; the Kafka consumer is created on {@link #start(SignalConsumer)}.
   *
   * @param id receiver id
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic topic carrying OTLP/JSON documents
   * @param signalType signal type every record carries
   * @param groupId consumer group id
   * @param codec OTLP/JSON codec
   * @param metrics metrics sink
   */
  public KafkaSignalReceiver(
      String id,
      String bootstrapServers,
      String topic,
      SignalType signalType,
      String groupId,
      OtlpJsonCodec codec,
      MetricsPort metrics) {
    this(id, consumerFactory(bootstrapServers, groupId), topic, signalType, DEFAULT_POLL, codec, metrics);
  }

  KafkaSignalReceiver(
      String id,
      Supplier<Consumer<String, byte[]>> consumerFactory,
      String topic,
      SignalType signalType,
      Duration pollInterval,
      OtlpJsonCodec codec,
      MetricsPort metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.topic = Strings.sanitizeTopic("topic", topic);
    this.signalType = Objects.requireNonNull(signalType, "signalType");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public synchronized void start(SignalConsumer signalConsumer) {
    Objects.requireNonNull(signalConsumer, "signalConsumer");
    if (poller != null) {
      throw new IllegalStateException("Receiver " + id + " already started");
    }
    Consumer<String, byte[]> created = consumerFactory.get();
    created.subscribe(List.of(topic));
    consumer = created;
    running = true;
    poller = new Thread(() -> pollLoop(created, signalConsumer), "relay-kafka-" + id.replace('/', '-'));
    poller.start();
    log.info("Receiver {} consuming {} from Kafka topic {}", id, signalType.path(), topic);
  }

  @Override
  public synchronized void close() {
    if (poller == null || !running) {
      return;
    }
    running = false;
    consumer.wakeup();
    try {
      poller.join(Duration.ofSeconds(10).toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    log.info("Receiver {} stopped", id);
  }

  private void pollLoop(Consumer<String, byte[]> kafka, SignalConsumer signalConsumer) {
    MDC.put("receiver", id);
    try {
      while (running) {
        ConsumerRecords<String, byte[]> records = kafka.poll(pollInterval);
        for (ConsumerRecord<String, byte[]> record : records) {
          deliver(record, signalConsumer);
        }
      }
    } catch (WakeupException ex) {
      if (running) {
        log.warn("Receiver {} woken up unexpectedly", id);
      }
    } catch (KafkaException ex) {
      log.error("Receiver {} stopped consuming after Kafka failure", id, ex);
      metrics.increment("receiver." + id + ".errors");
    } catch (RuntimeException ex) {
      log.error("Receiver {} poll thread failed", id, ex);
      metrics.increment("receiver." + id + ".errors");
    } finally {
      kafka.close(Duration.ofSeconds(5));
      MDC.remove("receiver");
    }
  }

  void deliver(ConsumerRecord<String, byte[]> record, SignalConsumer signalConsumer) {
    List<Signal> signals;
    try {
      if (record.value() == null) {
        throw new DecodeException("record value is null");
      }
      signals = codec.decode(signalType, record.value());
    } catch (DecodeException ex) {
      metrics.increment("receiver." + id + ".decode.failed");
      log.warn("Receiver {} skipped malformed record {}-{}@{}: {}",
          id, record.topic(), record.partition(), record.offset(), ex.getMessage());
      return;
    }
    try {
      int accepted = signalConsumer.accept(signalType, signals);
      metrics.observe("receiver." + id + ".signals", accepted);
    } catch (SignalRejectedException ex) {
      metrics.increment("receiver." + id + ".rejected");
      log.warn("Receiver {} dropped record {}-{}@{}: {}",
          id, record.topic(), record.partition(), record.offset(), ex.getMessage());
    } catch (RuntimeException ex) {
      // One bad record must not stop the poll thread.
      metrics.increment("receiver." + id + ".errors");
      log.error("Receiver {} failed to deliver record {}-{}@{}",
          id, record.topic(), record.partition(), record.offset(), ex);
    }
  }

  private static Supplier<Consumer<String, byte[]>> consumerFactory(String bootstrapServers, String groupId) {
    String servers = Net.validateHostPortList(bootstrapServers);
    String group = Strings.requireNonBlank("group_id", groupId);
    return () -> {
      Properties props = new Properties();
      props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
      props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
      props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
      props.put(ConsumerConfig.GROUP_ID_CONFIG, group);
      props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
      props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
      props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
      return new KafkaConsumer<>(props);
    };
  }
}
