package ca.gc.cra.relay.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.ExportTransientException;
import ca.gc.cra.relay.domain.signal.Batch;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import ca.gc.cra.relay.testutil.TestSignals;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class KafkaSignalExporterTest {
  private final OtlpJsonCodec codec = new OtlpJsonCodec();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void publishesBatchKeyedByPipeline() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaSignalExporter exporter = exporter(producer, Duration.ofSeconds(5));
    exporter.start();

    exporter.export(TestSignals.traceBatch(3));

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    assertEquals("otlp-spans", record.topic());
    assertEquals("traces", record.key());
    String json = new String(record.value(), StandardCharsets.UTF_8);
    assertTrue(json.contains("resourceSpans"), json);
    assertEquals(3, codec.decode(SignalType.TRACES, record.value()).size());

    exporter.close();
    assertTrue(producer.closed());
  }

  @Test
  void retriableBrokerErrorIsTransient() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaSignalExporter exporter = exporter(producer, Duration.ofSeconds(5));
    exporter.start();

    Future<Void> pending = exportAsync(exporter, TestSignals.traceBatch(1));
    while (!producer.errorNext(new NetworkException("broker gone"))) {
      Thread.sleep(5);
    }

    ExecutionException failure = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
    assertInstanceOf(ExportTransientException.class, failure.getCause());
  }

  @Test
  void nonRetriableBrokerErrorIsTerminal() throws Exception {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaSignalExporter exporter = exporter(producer, Duration.ofSeconds(5));
    exporter.start();

    Future<Void> pending = exportAsync(exporter, TestSignals.traceBatch(1));
    while (!producer.errorNext(new RecordTooLargeException("too big"))) {
      Thread.sleep(5);
    }

    ExecutionException failure = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
    assertInstanceOf(ExportTerminalException.class, failure.getCause());
    assertTrue(failure.getCause().getMessage().contains("too big"));
  }

  @Test
  void missingAcknowledgementIsTransient() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaSignalExporter exporter = exporter(producer, Duration.ofMillis(50));
    exporter.start();

    ExportTransientException ex =
        assertThrows(ExportTransientException.class, () -> exporter.export(TestSignals.traceBatch(1)));
    assertTrue(ex.getMessage().contains("no acknowledgement"));
  }

  @Test
  void exportBeforeStartIsTerminal() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaSignalExporter exporter = exporter(producer, Duration.ofSeconds(1));

    assertThrows(ExportTerminalException.class, () -> exporter.export(TestSignals.traceBatch(1)));
    assertTrue(producer.history().isEmpty());
  }

  @Test
  void rejectsInvalidTopic() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaSignalExporter("kafka", () -> producer, "bad topic", Duration.ofSeconds(1), codec));
  }

  private KafkaSignalExporter exporter(MockProducer<String, byte[]> producer, Duration ackTimeout) {
    return new KafkaSignalExporter("kafka", () -> producer, "otlp-spans", ackTimeout, codec);
  }

  private Future<Void> exportAsync(KafkaSignalExporter exporter, Batch batch) {
    return executor.submit(() -> {
      exporter.export(batch);
      return null;
    });
  }
}
