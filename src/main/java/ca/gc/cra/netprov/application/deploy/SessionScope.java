package ca.gc.cra.netprov.application.deploy;

import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.application.port.transport.DiscardFailureException;
import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.port.transport.TransportException;
import ca.gc.cra.netprov.application.port.transport.TransportSession;
import java.util.Objects;

/**
 * Scoped ownership of one open transport session.
 *
 * <p>{@link #close()} calls {@link TransportAdapter#close(TransportSession)} exactly once no matter how many
 * times it is invoked; close and discard failures are recorded as warnings and never propagate.</p>
 *
 * @since 0.1.0
 */
final class SessionScope implements AutoCloseable {
  private final TransportAdapter adapter;
  private final TransportSession session;
  private final DeploymentTrail trail;
  private final MetricsPort metrics;
  private boolean closed;

  SessionScope(TransportAdapter adapter, TransportSession session, DeploymentTrail trail, MetricsPort metrics) {
    this.adapter = Objects.requireNonNull(adapter, "adapter");
    this.session = Objects.requireNonNull(session, "session");
    this.trail = Objects.requireNonNull(trail, "trail");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  TransportSession session() {
    return session;
  }

  /**
   * Abandons the staged candidate; failures are logged as warnings only.
   */
  void discardQuietly() {
    try {
      adapter.discard(session);
      trail.info("Configuration changes discarded");
    } catch (DiscardFailureException | RuntimeException ex) {
      metrics.increment("deploy.discard.failed");
      trail.warning("Could not discard configuration changes: {}", describe(ex));
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      adapter.close(session);
      trail.info("Connection closed");
    } catch (TransportException | RuntimeException ex) {
      metrics.increment("deploy.close.failed");
      trail.warning("Error closing connection: {}", describe(ex));
    }
  }

  static String describe(Throwable ex) {
    return ex.getMessage() == null
        ? ex.getClass().getSimpleName()
        : ex.getClass().getSimpleName() + ": " + ex.getMessage();
  }
}
