package ca.gc.cra.netprov.application.port.transport;

import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.deploy.StageMode;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import java.util.Map;

/**
 * <strong>What:</strong> Capability interface over one vendor family's device-management protocol.
 * <p><strong>Role:</strong> Output port consumed by the deployment orchestrator; one implementation per driver
 * (for example {@code EosEapiTransportAdapter}).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and close sessions.</li>
 *   <li>Stage a candidate configuration in merge or replace mode and report the pending diff.</li>
 *   <li>Commit or discard the candidate.</li>
 *   <li>Report device facts after a commit.</li>
 *   <li>Map native driver errors onto the {@link TransportException} family.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Adapters may be shared across attempts, but each
 * {@link TransportSession} is used by one thread at a time.</p>
 * <p><strong>Performance:</strong> Every operation may block on the network; callers apply timeouts through
 * {@code TimeLimitedTransportAdapter}.</p>
 *
 * @since 0.1.0
 */
public interface TransportAdapter {
  /**
   * Driver identifier this adapter serves (matches {@link DeviceTarget#driver()}).
   *
   * @return lower-case driver id
   */
  String driver();

  /**
   * Opens a session to the device.
   *
   * @param target device to reach
   * @param credentials login credentials
   * @param options vendor-specific connection options, passed through opaquely
   * @return live session
   * @throws ConnectionFailureException if the device cannot be reached or rejects the login
   */
  TransportSession open(DeviceTarget target, Credentials credentials, Map<String, Object> options)
      throws ConnectionFailureException;

  /**
   * Loads a candidate configuration without applying it.
   *
   * @param session open session
   * @param configText candidate configuration
   * @param mode merge or replace
   * @throws StageFailureException if the device rejects the candidate
   */
  void stage(TransportSession session, String configText, StageMode mode) throws StageFailureException;

  /**
   * Computes the diff between the running configuration and the staged candidate.
   *
   * @param session open session with a staged candidate
   * @return diff text; empty when nothing would change
   * @throws TransportException if the diff cannot be computed
   */
  String diff(TransportSession session) throws TransportException;

  /**
   * Makes the staged candidate the running configuration.
   *
   * @param session open session with a staged candidate
   * @throws CommitFailureException if the commit fails; see {@link CommitFailureException#rolledBack()}
   */
  void commit(TransportSession session) throws CommitFailureException;

  /**
   * Abandons the staged candidate. Best effort.
   *
   * @param session open session
   * @throws DiscardFailureException if the device refuses to abandon the candidate
   */
  void discard(TransportSession session) throws DiscardFailureException;

  /**
   * Returns a snapshot of device facts (hostname, model, version and similar).
   *
   * @param session open session
   * @return fact snapshot; values are scalars
   * @throws TransportException if the facts cannot be read
   */
  Map<String, Object> facts(TransportSession session) throws TransportException;

  /**
   * Closes the session. Must be idempotent.
   *
   * @param session session to close
   * @throws TransportException if the driver reports a failure while closing
   */
  void close(TransportSession session) throws TransportException;
}
