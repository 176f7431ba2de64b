package ca.gc.cra.netprov.application.port.transport;

/**
 * Raised when a session cannot be opened (unreachable device, rejected login, open timeout).
 *
 * @since 0.1.0
 */
public final class ConnectionFailureException extends TransportException {
  public ConnectionFailureException(String msg) { super(msg); }

  public ConnectionFailureException(String msg, Throwable cause) { super(msg, cause); }
}
