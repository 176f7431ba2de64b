package ca.gc.cra.netprov.infrastructure.transport.eos;

import ca.gc.cra.netprov.application.port.transport.CommitFailureException;
import ca.gc.cra.netprov.application.port.transport.ConnectionFailureException;
import ca.gc.cra.netprov.application.port.transport.DiscardFailureException;
import ca.gc.cra.netprov.application.port.transport.StageFailureException;
import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.port.transport.TransportException;
import ca.gc.cra.netprov.application.port.transport.TransportSession;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.deploy.StageMode;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Transport driver {@code eos} for Arista EOS over eAPI.
 * <p><strong>Role:</strong> {@link TransportAdapter} implementation registered in the driver registry.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stage candidates in a named configuration session ({@code configure session <id>}); replace mode starts
 *   from {@code rollback clean-config}.</li>
 *   <li>Report {@code show session-config named <id> diffs} as the diff.</li>
 *   <li>Commit with {@code configure session <id> commit}, then save with {@code write memory}.</li>
 *   <li>Abort the session on discard and, when still pending, on close.</li>
 *   <li>Read facts from {@code show version} and {@code show hostname}.</li>
 * </ul>
 * <p><strong>Options:</strong> {@code transport} ({@code https} default, or {@code http}), {@code port}
 * (443/80), {@code verifyTls} (default {@code true}), {@code timeoutSeconds} (per HTTP request, default 60).</p>
 * <p><strong>Thread-safety:</strong> Stateless; each session carries its own client.</p>
 *
 * @since 0.1.0
 */
public final class EosEapiTransportAdapter implements TransportAdapter {
  public static final String DRIVER = "eos";

  private static final Logger log = LoggerFactory.getLogger(EosEapiTransportAdapter.class);
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 60;

  @Override
  public String driver() {
    return DRIVER;
  }

  @Override
  public TransportSession open(DeviceTarget target, Credentials credentials, Map<String, Object> options)
      throws ConnectionFailureException {
    Map<String, Object> effective = options == null ? target.options() : options;
    EapiClient client;
    try {
      client = new EapiClient(
          httpClient(effective),
          endpoint(target, effective),
          credentials.username(),
          credentials.password(),
          Duration.ofSeconds(intOption(effective, "timeoutSeconds", DEFAULT_REQUEST_TIMEOUT_SECONDS)));
    } catch (IllegalArgumentException | GeneralSecurityException ex) {
      throw new ConnectionFailureException("invalid eAPI connection options: " + ex.getMessage(), ex);
    }
    try {
      client.runCmds(List.of("show version"), EapiClient.JSON);
    } catch (IOException | EapiCommandException ex) {
      throw new ConnectionFailureException(
          "cannot reach eAPI at " + client.endpoint() + ": " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ConnectionFailureException("interrupted while connecting to " + client.endpoint(), ex);
    }
    String sessionName = "netprov_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    log.debug("Connected to eAPI at {} as {}", client.endpoint(), credentials.username());
    return new EosSession(target, client, sessionName);
  }

  @Override
  public void stage(TransportSession session, String configText, StageMode mode) throws StageFailureException {
    EosSession eos = live(session, StageFailureException::new);
    List<String> commands = new ArrayList<>();
    commands.add("configure session " + eos.sessionName);
    if (mode == StageMode.REPLACE) {
      commands.add("rollback clean-config");
    }
    commands.addAll(candidateLines(configText));
    commands.add("end");
    eos.pending = true;
    try {
      eos.client.runCmds(commands, EapiClient.JSON);
    } catch (IOException | EapiCommandException ex) {
      throw new StageFailureException("loading candidate failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new StageFailureException("interrupted while loading candidate", ex);
    }
  }

  @Override
  public String diff(TransportSession session) throws TransportException {
    EosSession eos = live(session, TransportException::new);
    if (!eos.pending) {
      return "";
    }
    List<Object> results = run(eos, List.of("show session-config named " + eos.sessionName + " diffs"),
        EapiClient.TEXT, "diff");
    return textOutput(results, 0).strip();
  }

  @Override
  public void commit(TransportSession session) throws CommitFailureException {
    EosSession eos = live(session, CommitFailureException::new);
    if (!eos.pending) {
      throw new CommitFailureException("no configuration session pending on " + eos.target.name());
    }
    try {
      eos.client.runCmds(List.of("configure session " + eos.sessionName + " commit"), EapiClient.JSON);
    } catch (IOException | EapiCommandException ex) {
      throw new CommitFailureException("commit failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CommitFailureException("interrupted while committing", ex);
    }
    eos.pending = false;
    try {
      eos.client.runCmds(List.of("write memory"), EapiClient.JSON);
    } catch (IOException | EapiCommandException ex) {
      log.warn("Configuration committed on {} but not saved to startup-config: {}",
          eos.target.name(), ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while saving configuration on {}", eos.target.name());
    }
  }

  @Override
  public void discard(TransportSession session) throws DiscardFailureException {
    EosSession eos = live(session, DiscardFailureException::new);
    if (!eos.pending) {
      return;
    }
    try {
      eos.client.runCmds(List.of("configure session " + eos.sessionName + " abort"), EapiClient.JSON);
      eos.pending = false;
    } catch (IOException | EapiCommandException ex) {
      throw new DiscardFailureException("aborting configuration session failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new DiscardFailureException("interrupted while aborting configuration session", ex);
    }
  }

  @Override
  public Map<String, Object> facts(TransportSession session) throws TransportException {
    EosSession eos = live(session, TransportException::new);
    List<Object> results = run(eos, List.of("show version", "show hostname"), EapiClient.JSON, "facts");
    Map<?, ?> version = !results.isEmpty() && results.get(0) instanceof Map<?, ?> m ? m : Map.of();
    Map<?, ?> hostname = results.size() > 1 && results.get(1) instanceof Map<?, ?> m ? m : Map.of();
    Map<String, Object> facts = new LinkedHashMap<>();
    facts.put("vendor", "Arista");
    putIfPresent(facts, "hostname", hostname.get("hostname"));
    putIfPresent(facts, "fqdn", hostname.get("fqdn"));
    putIfPresent(facts, "model", version.get("modelName"));
    putIfPresent(facts, "serial_number", version.get("serialNumber"));
    putIfPresent(facts, "os_version", version.get("version"));
    if (version.get("uptime") instanceof Number uptime) {
      facts.put("uptime", uptime.longValue());
    }
    return facts;
  }

  @Override
  public void close(TransportSession session) throws TransportException {
    if (!(session instanceof EosSession eos)) {
      throw new TransportException("session does not belong to the eos driver");
    }
    if (eos.closed) {
      return;
    }
    eos.closed = true;
    if (eos.pending) {
      try {
        eos.client.runCmds(List.of("configure session " + eos.sessionName + " abort"), EapiClient.JSON);
      } catch (IOException | EapiCommandException ex) {
        throw new TransportException("aborting pending session on close failed: " + ex.getMessage(), ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new TransportException("interrupted while closing", ex);
      }
    }
  }

  private static List<Object> run(EosSession eos, List<String> commands, String format, String operation)
      throws TransportException {
    try {
      return eos.client.runCmds(commands, format);
    } catch (IOException | EapiCommandException ex) {
      throw new TransportException(operation + " failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TransportException(operation + " interrupted", ex);
    }
  }

  static List<String> candidateLines(String configText) {
    List<String> lines = new ArrayList<>();
    if (configText == null) {
      return lines;
    }
    for (String line : configText.split("\\R")) {
      String trimmed = line.stripTrailing();
      String bare = trimmed.strip();
      if (bare.isEmpty() || bare.startsWith("!") || bare.equals("end")) {
        continue;
      }
      lines.add(trimmed);
    }
    return lines;
  }

  private static String textOutput(List<Object> results, int index) throws TransportException {
    if (results.size() <= index || !(results.get(index) instanceof Map<?, ?> result)) {
      throw new TransportException("eAPI returned no output for command " + (index + 1));
    }
    Object output = result.get("output");
    return output == null ? "" : output.toString();
  }

  private static void putIfPresent(Map<String, Object> facts, String key, Object value) {
    if (value != null && !value.toString().isBlank()) {
      facts.put(key, value.toString());
    }
  }

  private static URI endpoint(DeviceTarget target, Map<String, Object> options) {
    String scheme = stringOption(options, "transport", "https").toLowerCase(Locale.ROOT);
    if (!scheme.equals("https") && !scheme.equals("http")) {
      throw new IllegalArgumentException("transport must be https or http");
    }
    int port = intOption(options, "port", scheme.equals("https") ? 443 : 80);
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    String host = target.managementAddress();
    if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
      host = "[" + host + "]";
    }
    return URI.create(scheme + "://" + host + ":" + port + "/command-api");
  }

  private static HttpClient httpClient(Map<String, Object> options) throws GeneralSecurityException {
    HttpClient.Builder builder = HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NEVER);
    if (!Boolean.parseBoolean(stringOption(options, "verifyTls", "true"))) {
      log.warn("TLS certificate verification disabled for eAPI connection");
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {new TrustAllCertificates()}, new SecureRandom());
      builder.sslContext(context);
    }
    return builder.build();
  }

  private static String stringOption(Map<String, Object> options, String key, String defaultValue) {
    Object value = options.get(key);
    return value == null || value.toString().isBlank() ? defaultValue : value.toString().trim();
  }

  private static int intOption(Map<String, Object> options, String key, int defaultValue) {
    Object value = options.get(key);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value == null || value.toString().isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer", ex);
    }
  }

  private static <E extends TransportException> EosSession live(
      TransportSession session, Function<String, E> failure) throws E {
    if (!(session instanceof EosSession eos)) {
      throw failure.apply("session does not belong to the eos driver");
    }
    if (eos.closed) {
      throw failure.apply("session to " + eos.target.name() + " is closed");
    }
    return eos;
  }

  private static final class EosSession implements TransportSession {
    private final DeviceTarget target;
    private final EapiClient client;
    private final String sessionName;
    private volatile boolean pending;
    private volatile boolean closed;

    private EosSession(DeviceTarget target, EapiClient client, String sessionName) {
      this.target = target;
      this.client = client;
      this.sessionName = sessionName;
    }

    @Override
    public DeviceTarget target() {
      return target;
    }
  }

  /** Accepts any server certificate; only installed when {@code verifyTls=false}. */
  private static final class TrustAllCertificates extends X509ExtendedTrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // accept
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // accept
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // accept
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // accept
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // accept
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // accept
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
