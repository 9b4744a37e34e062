package ca.gc.cra.relay.infrastructure.receiver;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.SignalConsumer;
import ca.gc.cra.relay.application.port.SignalReceiver;
import ca.gc.cra.relay.application.port.SignalRejectedException;
import ca.gc.cra.relay.domain.signal.Signal;
import ca.gc.cra.relay.domain.signal.SignalType;
import ca.gc.cra.relay.infrastructure.codec.DecodeException;
import ca.gc.cra.relay.infrastructure.codec.OtlpJsonCodec;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Streaming OTLP/JSON receiver over TCP. Each line is an envelope
 * {@code {"signalType":"traces","payload":{...}}} and is answered with exactly one JSON line, either
 * {@code {"accepted":N}} or {@code {"error":"..."}}.
 * <p><strong>Why:</strong> Long-lived producers can push many small requests without per-request connection
 * setup.</p>
 * <p><strong>Role:</strong> Inbound adapter feeding a {@link SignalConsumer}.</p>
 * <p><strong>Thread-safety:</strong> One dedicated acceptor thread; each connection is served by one worker from a
 * bounded pool. Connections beyond the pool's capacity are refused and counted.</p>
 * <p>A malformed line is rejected with an error reply and the connection keeps reading. A line longer than the
 * configured byte limit is discarded up to its newline without being buffered, answered with an error and counted
 * as rejected.</p>
 *
 * @since 0.1.0
 */
public final class OtlpStreamReceiver implements SignalReceiver {
  private static final Logger log = LoggerFactory.getLogger(OtlpStreamReceiver.class);

  private final String id;
  private final InetSocketAddress address;
  private final int maxConnections;
  private final int maxLineBytes;
  private final OtlpJsonCodec codec;
  private final MetricsPort metrics;
  private final Set<Socket> connections = ConcurrentHashMap.newKeySet();

  private ServerSocket serverSocket;
  private ExecutorService workers;
  private Thread acceptor;
  private volatile SignalConsumer consumer;
  private volatile boolean closed;

  /**
   * Creates an unstarted receiver whose line limit matches the HTTP receiver's default body limit.
   *
   * @param id receiver id
   * @param address listen address; port {@code 0} picks an ephemeral port
   * @param maxConnections concurrently served connections
   * @param codec OTLP/JSON codec
   * @param metrics metrics sink
   */
  public OtlpStreamReceiver(
      String id, InetSocketAddress address, int maxConnections, OtlpJsonCodec codec, MetricsPort metrics) {
    this(id, address, maxConnections, OtlpHttpReceiver.DEFAULT_MAX_BODY_BYTES, codec, metrics);
  }

  /**
   * Creates an unstarted receiver.
   *
   * @param id receiver id
   * @param address listen address; port {@code 0} picks an ephemeral port
   * @param maxConnections concurrently served connections
   * @param maxLineBytes largest accepted line in bytes, excluding the newline
   * @param codec OTLP/JSON codec
   * @param metrics metrics sink
   */
  public OtlpStreamReceiver(
      String id,
      InetSocketAddress address,
      int maxConnections,
      int maxLineBytes,
      OtlpJsonCodec codec,
      MetricsPort metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.address = Objects.requireNonNull(address, "address");
    if (maxConnections <= 0 || maxLineBytes <= 0) {
      throw new IllegalArgumentException("maxConnections and maxLineBytes must be positive");
    }
    this.maxConnections = maxConnections;
    this.maxLineBytes = maxLineBytes;
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public synchronized void start(SignalConsumer consumer) throws IOException {
    if (serverSocket != null) {
      throw new IllegalStateException("Receiver " + id + " already started");
    }
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    ServerSocket socket = new ServerSocket();
    socket.setReuseAddress(true);
    try {
      socket.bind(address);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
    serverSocket = socket;
    String prefix = "relay-stream-" + id.replace('/', '-');
    // one slot of queueing smooths reconnect bursts without letting clients pile up
    workers = ExecutorFactories.newReceiverPool(maxConnections, 1, prefix, null);
    acceptor = new Thread(this::acceptLoop, prefix + "-accept");
    acceptor.setDaemon(true);
    acceptor.start();
    log.info("Receiver {} listening for OTLP/JSON stream on {}", id, socket.getLocalSocketAddress());
  }

  /**
   * Returns the bound address, useful when the receiver was configured with port {@code 0}.
   *
   * @return bound address
   * @throws IllegalStateException if the receiver has not been started
   */
  public synchronized InetSocketAddress boundAddress() {
    if (serverSocket == null) {
      throw new IllegalStateException("Receiver " + id + " is not started");
    }
    return (InetSocketAddress) serverSocket.getLocalSocketAddress();
  }

  @Override
  public synchronized void close() {
    if (serverSocket == null || closed) {
      return;
    }
    closed = true;
    try {
      serverSocket.close();
    } catch (IOException ex) {
      log.warn("Receiver {} failed to close listen socket", id, ex);
    }
    for (Socket connection : connections) {
      closeConnection(connection);
    }
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Receiver {} connection workers did not stop within 5s", id);
      }
      acceptor.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    log.info("Receiver {} stopped", id);
  }

  private void acceptLoop() {
    while (!closed) {
      Socket connection;
      try {
        connection = serverSocket.accept();
      } catch (SocketException ex) {
        if (!closed) {
          log.error("Receiver {} listen socket failed", id, ex);
        }
        return;
      } catch (IOException ex) {
        log.warn("Receiver {} failed to accept connection", id, ex);
        continue;
      }
      connections.add(connection);
      try {
        workers.execute(() -> serve(connection));
      } catch (RejectedExecutionException ex) {
        metrics.increment("receiver." + id + ".connection.rejected");
        log.warn("Receiver {} refused connection from {}: all {} workers busy",
            id, connection.getRemoteSocketAddress(), maxConnections);
        connections.remove(connection);
        closeConnection(connection);
      }
    }
  }

  private void serve(Socket connection) {
    MDC.put("receiver", id);
    metrics.increment("receiver." + id + ".connections");
    try (InputStream in = new BufferedInputStream(connection.getInputStream());
        OutputStream out = new BufferedOutputStream(connection.getOutputStream())) {
      ByteArrayOutputStream line = new ByteArrayOutputStream(1024);
      boolean oversized = false;
      int b;
      while ((b = in.read()) != -1) {
        if (b != '\n') {
          if (oversized) {
            continue;
          }
          if (line.size() >= maxLineBytes) {
            oversized = true;
            line.reset();
            continue;
          }
          line.write(b);
          continue;
        }
        byte[] reply;
        if (oversized) {
          reply = rejectOversized();
          oversized = false;
        } else {
          String text = line.toString(StandardCharsets.UTF_8);
          line.reset();
          if (text.isBlank()) {
            continue;
          }
          reply = handleLine(text);
        }
        out.write(reply);
        out.write('\n');
        out.flush();
      }
    } catch (IOException ex) {
      if (!closed) {
        log.debug("Receiver {} connection {} ended: {}", id, connection.getRemoteSocketAddress(), ex.getMessage());
      }
    } finally {
      connections.remove(connection);
      closeConnection(connection);
      MDC.remove("receiver");
    }
  }

  private byte[] rejectOversized() {
    metrics.increment("receiver." + id + ".rejected");
    log.warn("Receiver {} discarded a line longer than {} bytes", id, maxLineBytes);
    return ReceiverReplies.error("line exceeds " + maxLineBytes + " bytes");
  }

  byte[] handleLine(String line) {
    SignalType type;
    List<Signal> signals;
    try {
      JsonNode envelope = codec.parse(line);
      if (!envelope.isObject()) {
        throw new DecodeException("envelope must be a JSON object");
      }
      type = envelopeType(envelope);
      JsonNode payload = envelope.get("payload");
      if (payload == null || payload.isNull()) {
        throw new DecodeException("envelope.payload is required");
      }
      signals = codec.decodeTree(type, payload);
    } catch (DecodeException ex) {
      metrics.increment("receiver." + id + ".decode.failed");
      log.warn("Receiver {} rejected malformed line: {}", id, ex.getMessage());
      return ReceiverReplies.error(ex.getMessage());
    }
    try {
      int accepted = consumer.accept(type, signals);
      metrics.observe("receiver." + id + ".signals", accepted);
      return ReceiverReplies.accepted(accepted);
    } catch (SignalRejectedException ex) {
      metrics.increment("receiver." + id + ".rejected");
      return ReceiverReplies.error(ex.getMessage());
    } catch (RuntimeException ex) {
      metrics.increment("receiver." + id + ".errors");
      log.error("Receiver {} failed to process line", id, ex);
      return ReceiverReplies.error("internal error");
    }
  }

  private static SignalType envelopeType(JsonNode envelope) throws DecodeException {
    String raw = envelope.path("signalType").asText("");
    try {
      return SignalType.fromString(raw);
    } catch (IllegalArgumentException ex) {
      throw new DecodeException("envelope.signalType must be traces, metrics or logs (was '" + raw + "')", ex);
    }
  }

  private void closeConnection(Socket connection) {
    try {
      connection.close();
    } catch (IOException ex) {
      log.debug("Receiver {} failed to close connection", id, ex);
    }
  }
}
