package ca.gc.cra.netprov.testing;

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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Transport adapter double that records every call in order and fails or blocks on request.
 *
 * <p>Calls are recorded as {@code open}, {@code stage:MERGE}/{@code stage:REPLACE}, {@code diff},
 * {@code commit}, {@code discard}, {@code facts} and {@code close}.</p>
 */
public final class ScriptedTransportAdapter implements TransportAdapter {
  /** Operations that can be scripted. */
  public enum Op { OPEN, STAGE, DIFF, COMMIT, DISCARD, FACTS, CLOSE }

  private final String driver;
  private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
  private final Map<Op, Exception> failures = Collections.synchronizedMap(new EnumMap<>(Op.class));
  private final Map<Op, Long> delays = Collections.synchronizedMap(new EnumMap<>(Op.class));
  private volatile String diff = "";
  private volatile Map<String, Object> facts = Map.of("hostname", "leaf1");
  private volatile Credentials lastCredentials;
  private volatile String lastConfig;
  private final CountDownLatch entered = new CountDownLatch(1);
  private volatile Op blockOn;

  public ScriptedTransportAdapter() {
    this("fake");
  }

  public ScriptedTransportAdapter(String driver) {
    this.driver = driver;
  }

  public ScriptedTransportAdapter diff(String text) {
    this.diff = text;
    return this;
  }

  public ScriptedTransportAdapter facts(Map<String, Object> values) {
    this.facts = values;
    return this;
  }

  public ScriptedTransportAdapter fail(Op op, Exception failure) {
    failures.put(op, failure);
    return this;
  }

  /** Makes {@code op} sleep for {@code millis}, honouring interruption. */
  public ScriptedTransportAdapter delay(Op op, long millis) {
    delays.put(op, millis);
    return this;
  }

  /** Makes {@code op} block until interrupted; {@link #awaitBlocked} waits for a thread to arrive. */
  public ScriptedTransportAdapter blockOn(Op op) {
    this.blockOn = op;
    return this;
  }

  public boolean awaitBlocked(long timeout, TimeUnit unit) throws InterruptedException {
    return entered.await(timeout, unit);
  }

  public List<String> calls() {
    synchronized (calls) {
      return List.copyOf(calls);
    }
  }

  public long count(String call) {
    return calls().stream().filter(call::equals).count();
  }

  public Credentials lastCredentials() {
    return lastCredentials;
  }

  public String lastConfig() {
    return lastConfig;
  }

  @Override
  public String driver() {
    return driver;
  }

  @Override
  public TransportSession open(DeviceTarget target, Credentials credentials, Map<String, Object> options)
      throws ConnectionFailureException {
    calls.add("open");
    lastCredentials = credentials;
    perform(Op.OPEN, ConnectionFailureException.class);
    return () -> target;
  }

  @Override
  public void stage(TransportSession session, String configText, StageMode mode) throws StageFailureException {
    calls.add("stage:" + mode);
    lastConfig = configText;
    perform(Op.STAGE, StageFailureException.class);
  }

  @Override
  public String diff(TransportSession session) throws TransportException {
    calls.add("diff");
    perform(Op.DIFF, TransportException.class);
    return diff;
  }

  @Override
  public void commit(TransportSession session) throws CommitFailureException {
    calls.add("commit");
    perform(Op.COMMIT, CommitFailureException.class);
  }

  @Override
  public void discard(TransportSession session) throws DiscardFailureException {
    calls.add("discard");
    perform(Op.DISCARD, DiscardFailureException.class);
  }

  @Override
  public Map<String, Object> facts(TransportSession session) throws TransportException {
    calls.add("facts");
    perform(Op.FACTS, TransportException.class);
    return facts;
  }

  @Override
  public void close(TransportSession session) throws TransportException {
    calls.add("close");
    perform(Op.CLOSE, TransportException.class);
  }

  private <E extends Exception> void perform(Op op, Class<E> checked) throws E {
    if (op == blockOn) {
      entered.countDown();
      try {
        new CountDownLatch(1).await();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw checkedOrRuntime(checked, new TransportException(op + " interrupted", ex));
      }
    }
    Long delay = delays.get(op);
    if (delay != null) {
      try {
        Thread.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw checkedOrRuntime(checked, new TransportException(op + " interrupted", ex));
      }
    }
    Exception failure = failures.get(op);
    if (failure == null) {
      return;
    }
    if (failure instanceof RuntimeException unchecked) {
      throw unchecked;
    }
    throw checkedOrRuntime(checked, failure);
  }

  private static <E extends Exception> E checkedOrRuntime(Class<E> checked, Exception failure) {
    if (checked.isInstance(failure)) {
      return checked.cast(failure);
    }
    try {
      return checked.getConstructor(String.class, Throwable.class).newInstance(failure.getMessage(), failure);
    } catch (ReflectiveOperationException ex) {
      throw new IllegalStateException("cannot wrap " + failure + " as " + checked.getSimpleName(), ex);
    }
  }
}
