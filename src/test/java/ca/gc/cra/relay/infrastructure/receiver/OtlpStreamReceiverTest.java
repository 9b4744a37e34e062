package ca.gc.cra.relay.infrastructure.receiver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import ca.gc.cra.relay.testutil.OtlpPayloads;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OtlpStreamReceiverTest {
  private final List<Signal> received = new CopyOnWriteArrayList<>();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private OtlpStreamReceiver receiver;

  @BeforeEach
  void setUp() throws Exception {
    receiver = new OtlpStreamReceiver(
        "otlp/stream", new InetSocketAddress("127.0.0.1", 0), 2, new OtlpJsonCodec(), metrics);
    receiver.start((type, signals) -> {
      received.addAll(signals);
      return signals.size();
    });
  }

  @AfterEach
  void tearDown() {
    receiver.close();
  }

  @Test
  void connectionSurvivesMalformedLine() throws Exception {
    try (Socket socket = new Socket()) {
      socket.connect(receiver.boundAddress(), 2000);
      socket.setSoTimeout(5000);
      Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
      BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

      out.write("{this is not json\n");
      out.flush();
      String first = in.readLine();
      out.write(envelope("traces", OtlpPayloads.traces(2)) + "\n");
      out.flush();
      String second = in.readLine();

      assertTrue(first.contains("\"error\""), first);
      assertEquals("{\"accepted\":2}", second);
      assertEquals(2, received.size());
      assertEquals(1, metrics.count("receiver.otlp/stream.decode.failed"));
    }
  }

  @Test
  void oversizedLineIsRejectedAndConnectionKeepsReading() throws Exception {
    List<Signal> limited = new CopyOnWriteArrayList<>();
    OtlpStreamReceiver small = new OtlpStreamReceiver(
        "otlp/small", new InetSocketAddress("127.0.0.1", 0), 1, 512, new OtlpJsonCodec(), metrics);
    small.start((type, signals) -> {
      limited.addAll(signals);
      return signals.size();
    });
    try (Socket socket = new Socket()) {
      socket.connect(small.boundAddress(), 2000);
      socket.setSoTimeout(5000);
      Writer out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
      BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

      String padded = envelope("logs", OtlpPayloads.logs("big")) + " ".repeat(64 * 1024);
      out.write(padded + "\n");
      out.flush();
      String first = in.readLine();
      out.write(envelope("logs", OtlpPayloads.logs("small")) + "\n");
      out.flush();
      String second = in.readLine();

      assertTrue(first.contains("line exceeds 512 bytes"), first);
      assertEquals("{\"accepted\":1}", second);
      assertEquals(1, limited.size());
      assertEquals(1, metrics.count("receiver.otlp/small.rejected"));
    } finally {
      small.close();
    }
  }

  @Test
  void rejectsUnknownSignalType() {
    String reply = new String(receiver.handleLine(envelope("profiles", "{}")), StandardCharsets.UTF_8);

    assertTrue(reply.contains("signalType"), reply);
    assertTrue(received.isEmpty());
  }

  @Test
  void missingPayloadIsAnError() {
    String reply = new String(receiver.handleLine("{\"signalType\":\"logs\"}"), StandardCharsets.UTF_8);

    assertTrue(reply.contains("payload"), reply);
  }

  @Test
  void handlesEachSignalType() {
    receiver.handleLine(envelope("metrics", OtlpPayloads.gauge("cpu", 1)));
    receiver.handleLine(envelope("logs", OtlpPayloads.logs("hello")));

    assertEquals(2, received.size());
  }

  private static String envelope(String type, String payload) {
    return "{\"signalType\":\"" + type + "\",\"payload\":" + payload.replace("\n", "") + "}";
  }
}
