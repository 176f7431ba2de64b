package ca.gc.cra.netprov.infrastructure.transport.eos;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal eAPI JSON-RPC client bound to one device endpoint.
 *
 * <p>Each {@link #runCmds(List, String)} call is one HTTP POST to {@code /command-api}; eAPI executes the commands
 * in order and stops at the first failure. Not thread-safe per instance; owned by one session.</p>
 *
 * @since 0.1.0
 */
final class EapiClient {
  static final String JSON = "json";
  static final String TEXT = "text";

  private final HttpClient http;
  private final URI endpoint;
  private final String authorization;
  private final Duration requestTimeout;
  private final EapiCodec codec = new EapiCodec();
  private final AtomicLong requestIds = new AtomicLong();

  EapiClient(HttpClient http, URI endpoint, String username, String password, Duration requestTimeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.authorization = "Basic " + Base64.getEncoder()
        .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  URI endpoint() {
    return endpoint;
  }

  /**
   * Runs commands and returns one result per command.
   *
   * @param commands CLI commands
   * @param format {@link #JSON} or {@link #TEXT}
   * @return per-command results; text results are maps with an {@code output} entry
   * @throws IOException on HTTP failures, non-200 replies or malformed bodies
   * @throws EapiCommandException when the device rejects a command
   * @throws InterruptedException when the calling thread is interrupted
   */
  List<Object> runCmds(List<String> commands, String format)
      throws IOException, EapiCommandException, InterruptedException {
    String id = "netprov-" + requestIds.incrementAndGet();
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(requestTimeout)
        .header("Content-Type", "application/json")
        .header("Authorization", authorization)
        .POST(HttpRequest.BodyPublishers.ofString(codec.runCmds(id, commands, format), StandardCharsets.UTF_8))
        .build();
    HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (response.statusCode() == 401 || response.statusCode() == 403) {
      throw new IOException("eAPI rejected the credentials (HTTP " + response.statusCode() + ")");
    }
    if (response.statusCode() != 200) {
      throw new IOException("eAPI returned HTTP " + response.statusCode());
    }
    Object body;
    try {
      body = codec.parse(response.body());
    } catch (IllegalArgumentException ex) {
      throw new IOException("eAPI returned a malformed reply", ex);
    }
    if (!(body instanceof Map<?, ?> reply)) {
      throw new IOException("eAPI reply is not a JSON object");
    }
    if (reply.get("error") instanceof Map<?, ?> error) {
      throw commandFailure(error);
    }
    if (!(reply.get("result") instanceof List<?> results)) {
      throw new IOException("eAPI reply has no result list");
    }
    return new ArrayList<>(results);
  }

  private static EapiCommandException commandFailure(Map<?, ?> error) {
    int code = error.get("code") instanceof Number number ? number.intValue() : -1;
    StringBuilder message = new StringBuilder(String.valueOf(error.get("message")));
    if (error.get("data") instanceof List<?> data) {
      for (Object entry : data) {
        if (entry instanceof Map<?, ?> result && result.get("errors") instanceof List<?> errors) {
          for (Object detail : errors) {
            message.append("; ").append(detail);
          }
        }
      }
    }
    return new EapiCommandException(code, message.toString());
  }
}
