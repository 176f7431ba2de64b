package ca.gc.cra.netprov.infrastructure.transport.eos;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netprov.application.port.transport.ConnectionFailureException;
import ca.gc.cra.netprov.application.port.transport.StageFailureException;
import ca.gc.cra.netprov.application.port.transport.TransportException;
import ca.gc.cra.netprov.application.port.transport.TransportSession;
import ca.gc.cra.netprov.domain.credentials.CredentialSource;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.deploy.StageMode;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EosEapiTransportAdapterTest {
  private static final Credentials CREDS =
      new Credentials("netops", "s3cret", CredentialSource.FROM_SECRET_STORE, CredentialSource.FROM_SECRET_STORE);

  private final EapiCodec codec = new EapiCodec();
  private final List<Request> requests = Collections.synchronizedList(new ArrayList<>());
  private final EosEapiTransportAdapter adapter = new EosEapiTransportAdapter();
  private HttpServer server;
  private DeviceTarget target;
  private volatile int status = 200;
  private volatile String rejectCommand = "";
  private volatile boolean failWriteMemory;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/command-api", this::handle);
    server.start();
    target = DeviceTarget.of("leaf1", "127.0.0.1", "eos")
        .withOptions(Map.of("transport", "http", "port", server.getAddress().getPort(), "timeoutSeconds", 5));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void replaceStagesInNamedSessionThenCommitsAndSaves() throws Exception {
    TransportSession session = adapter.open(target, CREDS, target.options());
    adapter.stage(session, "hostname leaf1\n!\nvlan 20\n   name users\nend\n", StageMode.REPLACE);
    String diff = adapter.diff(session);
    adapter.commit(session);
    adapter.close(session);

    assertEquals("+vlan 20\n+   name users", diff);
    assertEquals(5, requests.size());
    assertEquals(List.of("show version"), requests.get(0).cmds);
    assertEquals("Basic " + Base64.getEncoder().encodeToString("netops:s3cret".getBytes(StandardCharsets.UTF_8)),
        requests.get(0).authorization);

    List<String> staged = requests.get(1).cmds;
    String sessionCommand = staged.get(0);
    assertTrue(sessionCommand.startsWith("configure session netprov_"));
    assertEquals(List.of(sessionCommand, "rollback clean-config", "hostname leaf1", "vlan 20", "   name users", "end"),
        staged);

    String sessionName = sessionCommand.substring("configure session ".length());
    assertEquals(List.of("show session-config named " + sessionName + " diffs"), requests.get(2).cmds);
    assertEquals("text", requests.get(2).format);
    assertEquals(List.of("configure session " + sessionName + " commit"), requests.get(3).cmds);
    assertEquals(List.of("write memory"), requests.get(4).cmds);
  }

  @Test
  void mergeDoesNotResetTheSession() throws Exception {
    TransportSession session = adapter.open(target, CREDS, target.options());
    adapter.stage(session, "vlan 20", StageMode.MERGE);

    List<String> staged = requests.get(1).cmds;
    assertEquals(3, staged.size());
    assertEquals("vlan 20", staged.get(1));
  }

  @Test
  void rejectedCommandFailsStageWithDeviceDetail() throws Exception {
    rejectCommand = "bogus";
    TransportSession session = adapter.open(target, CREDS, target.options());

    StageFailureException ex =
        assertThrows(StageFailureException.class, () -> adapter.stage(session, "bogus", StageMode.MERGE));

    assertTrue(ex.getMessage().contains("Invalid input"), ex.getMessage());
  }

  @Test
  void closeAbortsPendingSessionOnce() throws Exception {
    TransportSession session = adapter.open(target, CREDS, target.options());
    adapter.stage(session, "vlan 20", StageMode.MERGE);

    adapter.close(session);
    adapter.close(session);

    assertEquals(3, requests.size());
    assertTrue(requests.get(2).cmds.get(0).endsWith(" abort"));
    assertThrows(TransportException.class, () -> adapter.diff(session));
  }

  @Test
  void diffWithoutStagedCandidateIsEmpty() throws Exception {
    TransportSession session = adapter.open(target, CREDS, target.options());

    assertEquals("", adapter.diff(session));
    assertEquals(1, requests.size());
  }

  @Test
  void failedSaveAfterCommitIsNotACommitFailure() throws Exception {
    failWriteMemory = true;
    TransportSession session = adapter.open(target, CREDS, target.options());
    adapter.stage(session, "vlan 20", StageMode.MERGE);

    adapter.commit(session);
    adapter.close(session);

    assertEquals("write memory", requests.get(requests.size() - 1).cmds.get(0));
  }

  @Test
  void rejectedCredentialsFailTheConnection() {
    status = 401;

    ConnectionFailureException ex =
        assertThrows(ConnectionFailureException.class, () -> adapter.open(target, CREDS, target.options()));

    assertTrue(ex.getMessage().contains("rejected the credentials"), ex.getMessage());
  }

  @Test
  void invalidTransportOptionFailsTheConnection() {
    DeviceTarget bad = target.withOptions(Map.of("transport", "telnet"));

    assertThrows(ConnectionFailureException.class, () -> adapter.open(bad, CREDS, bad.options()));
    assertTrue(requests.isEmpty());
  }

  @Test
  void factsCombineVersionAndHostname() throws Exception {
    TransportSession session = adapter.open(target, CREDS, target.options());

    Map<String, Object> facts = adapter.facts(session);

    assertEquals("Arista", facts.get("vendor"));
    assertEquals("leaf1", facts.get("hostname"));
    assertEquals("leaf1.lab.example", facts.get("fqdn"));
    assertEquals("DCS-7050SX3-48YC8", facts.get("model"));
    assertEquals("4.30.1F", facts.get("os_version"));
    assertEquals(86400L, facts.get("uptime"));
  }

  @Test
  void candidateLinesDropCommentsBlankLinesAndEnd() {
    assertEquals(List.of("hostname leaf1", "interface Ethernet1", "   description uplink"),
        EosEapiTransportAdapter.candidateLines("! header\nhostname leaf1\n\ninterface Ethernet1\n   description uplink   \n"
            + "end\n"));
  }

  @SuppressWarnings("unchecked")
  private void handle(HttpExchange exchange) throws IOException {
    String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    Map<String, Object> request = (Map<String, Object>) codec.parse(body);
    Map<String, Object> params = (Map<String, Object>) request.get("params");
    List<String> cmds = new ArrayList<>();
    for (Object cmd : (List<Object>) params.get("cmds")) {
      cmds.add(cmd.toString());
    }
    requests.add(new Request(cmds, params.get("format").toString(),
        exchange.getRequestHeaders().getFirst("Authorization")));
    respond(exchange, status, status == 200 ? reply(request.get("id").toString(), cmds) : "");
  }

  private String reply(String id, List<String> cmds) {
    for (int i = 0; i < cmds.size(); i++) {
      String cmd = cmds.get(i);
      if ((!rejectCommand.isEmpty() && cmd.equals(rejectCommand)) || (failWriteMemory && cmd.equals("write memory"))) {
        return "{\"jsonrpc\":\"2.0\",\"id\":\"" + id + "\",\"error\":{\"code\":1002,"
            + "\"message\":\"CLI command " + (i + 1) + " of " + cmds.size() + " '" + cmd + "' failed: invalid command\","
            + "\"data\":[{},{\"errors\":[\"Invalid input (at token 0: '" + cmd + "')\"]}]}}";
      }
    }
    StringBuilder results = new StringBuilder();
    for (String cmd : cmds) {
      if (results.length() > 0) {
        results.append(',');
      }
      if (cmd.equals("show version")) {
        results.append("{\"modelName\":\"DCS-7050SX3-48YC8\",\"version\":\"4.30.1F\","
            + "\"serialNumber\":\"JPE1234\",\"uptime\":86400.5}");
      } else if (cmd.equals("show hostname")) {
        results.append("{\"hostname\":\"leaf1\",\"fqdn\":\"leaf1.lab.example\"}");
      } else if (cmd.endsWith(" diffs")) {
        results.append("{\"output\":\"+vlan 20\\n+   name users\\n\"}");
      } else {
        results.append("{}");
      }
    }
    return "{\"jsonrpc\":\"2.0\",\"id\":\"" + id + "\",\"result\":[" + results + "]}";
  }

  private static void respond(HttpExchange exchange, int code, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }

  private static final class Request {
    private final List<String> cmds;
    private final String format;
    private final String authorization;

    private Request(List<String> cmds, String format, String authorization) {
      this.cmds = cmds;
      this.format = format;
      this.authorization = authorization;
    }
  }
}
