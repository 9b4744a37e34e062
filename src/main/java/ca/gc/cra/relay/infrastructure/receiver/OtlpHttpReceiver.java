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
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> OTLP/JSON request/response receiver on {@code POST /v1/traces}, {@code /v1/metrics} and
 * {@code /v1/logs}.
 * <p><strong>Why:</strong> Lets instrumented services push signals over plain HTTP.</p>
 * <p><strong>Role:</strong> Inbound adapter feeding a {@link SignalConsumer}.</p>
 * <p><strong>Thread-safety:</strong> Requests are served concurrently by a fixed worker pool; the consumer must be
 * thread-safe.</p>
 * <p>Replies: {@code 200 {"accepted":N}}, {@code 400} on a malformed body, {@code 404} for unknown paths,
 * {@code 405} for non-POST requests, {@code 413} for oversized bodies and {@code 503} when no bound pipeline is
 * accepting signals.</p>
 *
 * @since 0.1.0
 */
public final class OtlpHttpReceiver implements SignalReceiver {
  private static final Logger log = LoggerFactory.getLogger(OtlpHttpReceiver.class);
  public static final int DEFAULT_MAX_BODY_BYTES = 16 * 1024 * 1024;

  private final String id;
  private final InetSocketAddress address;
  private final int workers;
  private final int maxBodyBytes;
  private final OtlpJsonCodec codec;
  private final MetricsPort metrics;

  private HttpServer server;
  private ExecutorService executor;
  private volatile SignalConsumer consumer;

  /**
   * Creates an unstarted receiver.
   *
   * @param id receiver id, e.g. {@code otlp}
   * @param address listen address; port {@code 0} picks an ephemeral port
   * @param workers request worker threads
   * @param maxBodyBytes largest accepted request body
   * @param codec OTLP/JSON codec
   * @param metrics metrics sink
   */
  public OtlpHttpReceiver(
      String id,
      InetSocketAddress address,
      int workers,
      int maxBodyBytes,
      OtlpJsonCodec codec,
      MetricsPort metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.address = Objects.requireNonNull(address, "address");
    if (workers <= 0 || maxBodyBytes <= 0) {
      throw new IllegalArgumentException("workers and maxBodyBytes must be positive");
    }
    this.workers = workers;
    this.maxBodyBytes = maxBodyBytes;
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public synchronized void start(SignalConsumer consumer) throws IOException {
    if (server != null) {
      throw new IllegalStateException("Receiver " + id + " already started");
    }
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    HttpServer created = HttpServer.create(address, 0);
    created.createContext("/", this::handle);
    executor = ExecutorFactories.newWorkerPool(workers, "relay-http-" + sanitize(id), null);
    created.setExecutor(executor);
    created.start();
    server = created;
    log.info("Receiver {} listening for OTLP/JSON HTTP on {}", id, created.getAddress());
  }

  /**
   * Returns the bound address, useful when the receiver was configured with port {@code 0}.
   *
   * @return bound address
   * @throws IllegalStateException if the receiver has not been started
   */
  public synchronized InetSocketAddress boundAddress() {
    if (server == null) {
      throw new IllegalStateException("Receiver " + id + " is not started");
    }
    return server.getAddress();
  }

  @Override
  public synchronized void close() {
    if (server == null) {
      return;
    }
    server.stop(0);
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("Receiver {} stopped", id);
    server = null;
  }

  private void handle(HttpExchange exchange) throws IOException {
    MDC.put("receiver", id);
    try {
      SignalType type = typeForPath(exchange.getRequestURI().getPath());
      if (type == null) {
        reply(exchange, 404, ReceiverReplies.error("unknown path " + exchange.getRequestURI().getPath()));
        return;
      }
      if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().set("Allow", "POST");
        reply(exchange, 405, ReceiverReplies.error("method " + exchange.getRequestMethod() + " not allowed"));
        return;
      }
      metrics.increment("receiver." + id + ".requests");
      byte[] body;
      try {
        body = readBody(exchange);
      } catch (ZipException ex) {
        metrics.increment("receiver." + id + ".decode.failed");
        reply(exchange, 400, ReceiverReplies.error("invalid gzip body: " + ex.getMessage()));
        return;
      }
      if (body == null) {
        metrics.increment("receiver." + id + ".rejected");
        reply(exchange, 413, ReceiverReplies.error("request body exceeds " + maxBodyBytes + " bytes"));
        return;
      }
      List<Signal> signals;
      try {
        signals = codec.decode(type, body);
      } catch (DecodeException ex) {
        metrics.increment("receiver." + id + ".decode.failed");
        log.warn("Receiver {} rejected malformed {} request: {}", id, type.path(), ex.getMessage());
        reply(exchange, 400, ReceiverReplies.error(ex.getMessage()));
        return;
      }
      try {
        int accepted = consumer.accept(type, signals);
        metrics.observe("receiver." + id + ".signals", accepted);
        reply(exchange, 200, ReceiverReplies.accepted(accepted));
      } catch (SignalRejectedException ex) {
        metrics.increment("receiver." + id + ".rejected");
        log.debug("Receiver {} could not route {} signal(s): {}", id, signals.size(), ex.getMessage());
        reply(exchange, 503, ReceiverReplies.error(ex.getMessage()));
      }
    } catch (IOException ex) {
      log.warn("Receiver {} failed to serve request", id, ex);
      throw ex;
    } catch (RuntimeException ex) {
      metrics.increment("receiver." + id + ".errors");
      log.error("Receiver {} failed to process request", id, ex);
      reply(exchange, 500, ReceiverReplies.error("internal error"));
    } finally {
      exchange.close();
      MDC.remove("receiver");
    }
  }

  private byte[] readBody(HttpExchange exchange) throws IOException {
    String encoding = exchange.getRequestHeaders().getFirst("Content-Encoding");
    InputStream raw = exchange.getRequestBody();
    try (InputStream in = encoding != null && "gzip".equalsIgnoreCase(encoding.trim())
        ? new GZIPInputStream(raw) : raw) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buffer = new byte[8192];
      int read;
      while ((read = in.read(buffer)) != -1) {
        if (out.size() + read > maxBodyBytes) {
          return null;
        }
        out.write(buffer, 0, read);
      }
      return out.toByteArray();
    }
  }

  private static void reply(HttpExchange exchange, int status, byte[] body) throws IOException {
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  static SignalType typeForPath(String path) {
    if (path == null) {
      return null;
    }
    String normalized = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
    return switch (normalized.toLowerCase(Locale.ROOT)) {
      case "/v1/traces" -> SignalType.TRACES;
      case "/v1/metrics" -> SignalType.METRICS;
      case "/v1/logs" -> SignalType.LOGS;
      default -> null;
    };
  }

  private static String sanitize(String id) {
    return id.replace('/', '-');
  }
}
