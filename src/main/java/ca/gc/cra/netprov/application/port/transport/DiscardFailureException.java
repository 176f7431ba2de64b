package ca.gc.cra.netprov.application.port.transport;

/**
 * Raised when a staged candidate cannot be abandoned. Logged by callers, never escalated.
 *
 * @since 0.1.0
 */
public final class DiscardFailureException extends TransportException {
  public DiscardFailureException(String msg) { super(msg); }

  public DiscardFailureException(String msg, Throwable cause) { super(msg, cause); }
}
