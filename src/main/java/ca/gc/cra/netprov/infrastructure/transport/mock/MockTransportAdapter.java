package ca.gc.cra.netprov.infrastructure.transport.mock;

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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver {@code mock}: keeps one running configuration per device name in memory.
 *
 * <p>Lines are grouped into blocks: an unindented line followed by its indented children. Merge appends candidate
 * blocks missing from the running configuration and, for blocks present on both sides, the missing children;
 * replace swaps the configuration wholesale. The diff is a line diff over the longest common subsequence, removed
 * lines prefixed with {@code -} and added lines with {@code +}, in order. Failures can be injected per device
 * with the transport option {@code mock.failOn} (one of {@code open}, {@code stage}, {@code diff},
 * {@code commit}, {@code discard}, {@code facts}, {@code close}); {@code mock.rollbackOnFailure=true} marks an
 * injected commit failure as rolled back.</p>
 *
 * <p>Thread-safe across devices.</p>
 *
 * @since 0.1.0
 */
public final class MockTransportAdapter implements TransportAdapter {
  public static final String DRIVER = "mock";
  public static final String FAIL_ON_OPTION = "mock.failOn";
  public static final String ROLLBACK_OPTION = "mock.rollbackOnFailure";

  private static final Logger log = LoggerFactory.getLogger(MockTransportAdapter.class);

  private final ConcurrentMap<String, String> running = new ConcurrentHashMap<>();

  @Override
  public String driver() {
    return DRIVER;
  }

  /**
   * Seeds the running configuration of a device.
   *
   * @param device device name
   * @param config running configuration text
   */
  public void seed(String device, String config) {
    running.put(Objects.requireNonNull(device, "device"), Objects.requireNonNullElse(config, ""));
  }

  /**
   * Returns the running configuration of a device.
   *
   * @param device device name
   * @return running configuration, empty when the device was never seeded nor committed
   */
  public Optional<String> runningConfig(String device) {
    return Optional.ofNullable(running.get(device));
  }

  @Override
  public TransportSession open(DeviceTarget target, Credentials credentials, Map<String, Object> options)
      throws ConnectionFailureException {
    Map<String, Object> effective = options == null ? target.options() : options;
    MockSession session = new MockSession(target, failOn(effective), rollback(effective));
    if (session.failOn("open")) {
      throw new ConnectionFailureException("mock device " + target.name() + " refused the connection");
    }
    log.debug("Opened mock session to {} as {}", target.name(), credentials.username());
    return session;
  }

  @Override
  public void stage(TransportSession session, String configText, StageMode mode) throws StageFailureException {
    MockSession mock = live(session, StageFailureException::new);
    if (mock.failOn("stage")) {
      throw new StageFailureException("mock device rejected the candidate configuration");
    }
    List<String> current = lines(running.getOrDefault(mock.target().name(), ""));
    List<String> candidate = lines(configText);
    if (mode == StageMode.REPLACE) {
      mock.candidate = candidate;
    } else {
      mock.candidate = merge(current, candidate);
    }
  }

  @Override
  public String diff(TransportSession session) throws TransportException {
    MockSession mock = live(session, TransportException::new);
    if (mock.failOn("diff")) {
      throw new TransportException("mock device could not compute the diff");
    }
    if (mock.candidate == null) {
      return "";
    }
    return lineDiff(lines(running.getOrDefault(mock.target().name(), "")), mock.candidate);
  }

  @Override
  public void commit(TransportSession session) throws CommitFailureException {
    MockSession mock = live(session, CommitFailureException::new);
    if (mock.failOn("commit")) {
      mock.candidate = null;
      throw new CommitFailureException("mock device rejected the commit", null, mock.rollbackOnFailure);
    }
    if (mock.candidate == null) {
      throw new CommitFailureException("no candidate configuration staged");
    }
    running.put(mock.target().name(), String.join("\n", mock.candidate));
    mock.candidate = null;
  }

  @Override
  public void discard(TransportSession session) throws DiscardFailureException {
    MockSession mock = live(session, DiscardFailureException::new);
    if (mock.failOn("discard")) {
      throw new DiscardFailureException("mock device refused to discard the candidate");
    }
    mock.candidate = null;
  }

  @Override
  public Map<String, Object> facts(TransportSession session) throws TransportException {
    MockSession mock = live(session, TransportException::new);
    if (mock.failOn("facts")) {
      throw new TransportException("mock device did not report facts");
    }
    List<String> config = lines(running.getOrDefault(mock.target().name(), ""));
    String hostname = config.stream()
        .filter(line -> line.startsWith("hostname "))
        .map(line -> line.substring("hostname ".length()).trim())
        .reduce((first, second) -> second)
        .orElse(mock.target().name());
    Map<String, Object> facts = new LinkedHashMap<>();
    facts.put("hostname", hostname);
    facts.put("vendor", "netprov");
    facts.put("model", "mock");
    facts.put("os_version", "1.0");
    facts.put("config_lines", config.size());
    return facts;
  }

  @Override
  public void close(TransportSession session) throws TransportException {
    if (!(session instanceof MockSession mock) || mock.closed) {
      return;
    }
    mock.closed = true;
    mock.candidate = null;
    if (mock.failOn("close")) {
      throw new TransportException("mock device dropped the connection while closing");
    }
  }

  private static <E extends TransportException> MockSession live(
      TransportSession session, Function<String, E> failure) throws E {
    if (!(session instanceof MockSession mock)) {
      throw failure.apply("session does not belong to the mock driver");
    }
    if (mock.closed) {
      throw failure.apply("session to " + mock.target().name() + " is closed");
    }
    return mock;
  }

  private static List<String> merge(List<String> current, List<String> candidate) {
    List<List<String>> merged = new ArrayList<>();
    for (List<String> block : blocks(current)) {
      merged.add(new ArrayList<>(block));
    }
    for (List<String> block : blocks(candidate)) {
      List<String> existing = null;
      for (List<String> m : merged) {
        if (m.get(0).equals(block.get(0))) {
          existing = m;
          break;
        }
      }
      if (existing == null) {
        merged.add(new ArrayList<>(block));
        continue;
      }
      Map<String, Integer> present = new HashMap<>();
      for (String child : existing.subList(1, existing.size())) {
        present.merge(child, 1, Integer::sum);
      }
      for (String child : block.subList(1, block.size())) {
        Integer count = present.get(child);
        if (count == null || count == 0) {
          existing.add(child);
        } else {
          present.put(child, count - 1);
        }
      }
    }
    List<String> result = new ArrayList<>();
    merged.forEach(result::addAll);
    return result;
  }

  private static List<List<String>> blocks(List<String> lines) {
    List<List<String>> blocks = new ArrayList<>();
    List<String> block = null;
    for (String line : lines) {
      boolean child = Character.isWhitespace(line.charAt(0));
      if (!child || block == null) {
        block = new ArrayList<>();
        blocks.add(block);
      }
      block.add(line);
    }
    return blocks;
  }

  private static String lineDiff(List<String> before, List<String> after) {
    int n = before.size();
    int m = after.size();
    int[][] common = new int[n + 1][m + 1];
    for (int i = n - 1; i >= 0; i--) {
      for (int j = m - 1; j >= 0; j--) {
        common[i][j] = before.get(i).equals(after.get(j))
            ? common[i + 1][j + 1] + 1
            : Math.max(common[i + 1][j], common[i][j + 1]);
      }
    }
    StringBuilder diff = new StringBuilder();
    int i = 0;
    int j = 0;
    while (i < n && j < m) {
      if (before.get(i).equals(after.get(j))) {
        i++;
        j++;
      } else if (common[i + 1][j] >= common[i][j + 1]) {
        diff.append('-').append(before.get(i++)).append('\n');
      } else {
        diff.append('+').append(after.get(j++)).append('\n');
      }
    }
    while (i < n) {
      diff.append('-').append(before.get(i++)).append('\n');
    }
    while (j < m) {
      diff.append('+').append(after.get(j++)).append('\n');
    }
    return diff.toString();
  }

  private static List<String> lines(String text) {
    List<String> result = new ArrayList<>();
    if (text == null) {
      return result;
    }
    for (String line : text.split("\\R")) {
      String trimmed = line.stripTrailing();
      if (!trimmed.isBlank()) {
        result.add(trimmed);
      }
    }
    return result;
  }

  private static String failOn(Map<String, Object> options) {
    Object value = options.get(FAIL_ON_OPTION);
    return value == null ? "" : value.toString().trim().toLowerCase(Locale.ROOT);
  }

  private static boolean rollback(Map<String, Object> options) {
    Object value = options.get(ROLLBACK_OPTION);
    return value != null && Boolean.parseBoolean(value.toString().trim());
  }

  private static final class MockSession implements TransportSession {
    private final DeviceTarget target;
    private final String failOn;
    private final boolean rollbackOnFailure;
    private volatile List<String> candidate;
    private volatile boolean closed;

    private MockSession(DeviceTarget target, String failOn, boolean rollbackOnFailure) {
      this.target = target;
      this.failOn = failOn;
      this.rollbackOnFailure = rollbackOnFailure;
    }

    @Override
    public DeviceTarget target() {
      return target;
    }

    boolean failOn(String operation) {
      return failOn.equals(operation);
    }
  }
}
