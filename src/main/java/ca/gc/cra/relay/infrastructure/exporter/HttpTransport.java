package ca.gc.cra.relay.infrastructure.exporter;

import ca.gc.cra.relay.application.port.ExportException;
import ca.gc.cra.relay.application.port.ExportTerminalException;
import ca.gc.cra.relay.application.port.ExportTransientException;
import ca.gc.cra.relay.logging.Logs;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> HTTP push transport shared by the OTLP, Jaeger and Datadog exporters.
 * <p><strong>Why:</strong> Centralizes TLS setup, headers, compression and the mapping of HTTP outcomes onto
 * {@link ExportTransientException} and {@link ExportTerminalException}.</p>
 * <p><strong>Thread-safety:</strong> The underlying {@link HttpClient} is created once on {@link #start()} and
 * shared by concurrent export tasks.</p>
 * <p>Classification: 2xx succeeds; 408, 429, 5xx and I/O failures are transient; every other status is
 * terminal.</p>
 *
 * @since 0.1.0
 */
public final class HttpTransport {
  private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
  private static final int ERROR_BODY_BYTES = 256;

  private final String exporterId;
  private final Settings settings;
  private volatile HttpClient client;

  /**
   * Creates an unstarted transport.
   *
   * @param exporterId owning exporter id, used in messages
   * @param settings endpoint and transport options
   */
  public HttpTransport(String exporterId, Settings settings) {
    this.exporterId = Objects.requireNonNull(exporterId, "exporterId");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public Settings settings() {
    return settings;
  }

  /**
   * Builds the HTTP client. Idempotent.
   *
   * @throws IOException if the TLS trust material cannot be loaded
   */
  public synchronized void start() throws IOException {
    if (client != null) {
      return;
    }
    HttpClient.Builder builder = HttpClient.newBuilder()
        .connectTimeout(settings.timeout())
        .followRedirects(HttpClient.Redirect.NEVER);
    if ("https".equalsIgnoreCase(settings.endpoint().getScheme())) {
      builder.sslContext(sslContext());
    }
    client = builder.build();
    log.debug("Exporter {} HTTP transport ready for {} (headers {})",
        exporterId, settings.endpoint(), Logs.redactHeaders(settings.headers()));
  }

  /**
   * Resolves a path against the configured endpoint.
   *
   * @param path absolute path such as {@code /v1/traces}
   * @return target URI
   */
  public URI resolve(String path) {
    String base = settings.endpoint().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }

  /**
   * POSTs a payload and classifies the outcome.
   *
   * @param target request URI
   * @param contentType content type of {@code body}
   * @param extraHeaders request-specific headers added after the configured ones
   * @param body payload
   * @throws ExportTransientException on I/O failure, timeout, 408, 429 or 5xx
   * @throws ExportTerminalException on any other non-2xx status
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public void post(URI target, String contentType, Map<String, String> extraHeaders, byte[] body)
      throws ExportException, InterruptedException {
    HttpClient http = client;
    if (http == null) {
      throw new ExportTerminalException("Exporter " + exporterId + " transport is not started");
    }
    HttpRequest.Builder request = HttpRequest.newBuilder(target)
        .timeout(settings.timeout())
        .header("Content-Type", contentType)
        .header("User-Agent", "relay");
    settings.headers().forEach(request::header);
    extraHeaders.forEach(request::header);
    byte[] payload = body;
    if (settings.gzip()) {
      payload = gzip(body);
      request.header("Content-Encoding", "gzip");
    }
    request.POST(HttpRequest.BodyPublishers.ofByteArray(payload));
    HttpResponse<String> response;
    try {
      response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException ex) {
      throw new ExportTransientException(
          "POST " + target + " failed: " + ex.getClass().getSimpleName() + " " + ex.getMessage(), ex);
    }
    ExportException failure = classify(response.statusCode(), "POST " + target, response.body());
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Checks that the endpoint accepts TCP connections.
   *
   * @throws ExportTransientException if the connection is refused or times out
   */
  public void checkReachable() throws ExportException {
    URI endpoint = settings.endpoint();
    int port = endpoint.getPort() > 0 ? endpoint.getPort()
        : "https".equalsIgnoreCase(endpoint.getScheme()) ? 443 : 80;
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(endpoint.getHost(), port), (int) settings.timeout().toMillis());
    } catch (IOException ex) {
      throw new ExportTransientException(
          "endpoint " + endpoint.getHost() + ":" + port + " is unreachable: " + ex.getMessage(), ex);
    }
  }

  /**
   * Maps an HTTP status onto the export error taxonomy.
   *
   * @param status response status
   * @param request request description for the message
   * @param body response body, may be {@code null}
   * @return {@code null} for 2xx, otherwise the exception to throw
   */
  static ExportException classify(int status, String request, String body) {
    if (status >= 200 && status < 300) {
      return null;
    }
    String message = request + " returned HTTP " + status
        + (body == null || body.isBlank() ? "" : ": " + Logs.truncate(body.trim(), ERROR_BODY_BYTES));
    if (status == 408 || status == 429 || status >= 500) {
      return new ExportTransientException(message);
    }
    return new ExportTerminalException(message);
  }

  /**
   * Normalizes a configured endpoint into an absolute URI. A bare {@code host:port} gets {@code http://} when the
   * connection is configured as insecure and {@code https://} otherwise.
   *
   * @param raw configured endpoint
   * @param insecure {@code tls.insecure} setting
   * @return absolute URI
   * @throws IllegalArgumentException if the endpoint is not a valid URI
   */
  public static URI endpointUri(String raw, boolean insecure) {
    String value = Objects.requireNonNull(raw, "endpoint").trim();
    if (!value.contains("://")) {
      value = (insecure ? "http://" : "https://") + value;
    }
    URI uri = URI.create(value);
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("endpoint " + raw + " must use http or https");
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("endpoint " + raw + " has no host");
    }
    return uri;
  }

  private SSLContext sslContext() throws IOException {
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      if (settings.insecureSkipVerify()) {
        log.warn("Exporter {} skips TLS certificate verification", exporterId);
        context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
      } else if (settings.caFile() != null) {
        context.init(null, trustManagers(settings.caFile()), new SecureRandom());
      } else {
        context.init(null, null, null);
      }
      return context;
    } catch (GeneralSecurityException ex) {
      throw new IOException("Exporter " + exporterId + " cannot initialise TLS: " + ex.getMessage(), ex);
    }
  }

  private static TrustManager[] trustManagers(Path caFile) throws IOException, GeneralSecurityException {
    KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
    store.load(null, null);
    CertificateFactory factory = CertificateFactory.getInstance("X.509");
    Collection<? extends Certificate> certificates;
    try (InputStream in = Files.newInputStream(caFile)) {
      certificates = factory.generateCertificates(in);
    }
    if (certificates.isEmpty()) {
      throw new IOException("CA file " + caFile + " contains no certificates");
    }
    int index = 0;
    for (Certificate certificate : certificates) {
      store.setCertificateEntry("ca-" + index++, certificate);
    }
    TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
    tmf.init(store);
    return tmf.getTrustManagers();
  }

  private static byte[] gzip(byte[] body) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, body.length / 4));
    try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
      gz.write(body);
    } catch (IOException ex) {
      throw new IllegalStateException("in-memory gzip failed", ex);
    }
    return out.toByteArray();
  }

  /**
   * Transport options.
   *
   * @param endpoint absolute base URI
   * @param headers static headers added to every request
   * @param timeout connect and request timeout
   * @param gzip whether bodies are gzip-compressed
   * @param insecureSkipVerify accept any server certificate
   * @param caFile PEM bundle of trusted CAs, or {@code null} for the JDK defaults
   */
  public record Settings(
      URI endpoint,
      Map<String, String> headers,
      Duration timeout,
      boolean gzip,
      boolean insecureSkipVerify,
      Path caFile) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public Settings {
      Objects.requireNonNull(endpoint, "endpoint");
      headers = Map.copyOf(Objects.requireNonNullElse(headers, Map.of()));
      timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
      if (timeout.isZero() || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be positive");
      }
    }

    /**
     * Plain settings with default timeout and no compression.
     *
     * @param endpoint absolute base URI
     * @return settings
     */
    public static Settings of(URI endpoint) {
      return new Settings(endpoint, Map.of(), DEFAULT_TIMEOUT, false, false, null);
    }
  }

  private static final class TrustAllManager implements X509TrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
