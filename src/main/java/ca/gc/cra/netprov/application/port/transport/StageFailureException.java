package ca.gc.cra.netprov.application.port.transport;

/**
 * Raised when the candidate configuration cannot be loaded.
 *
 * @since 0.1.0
 */
public final class StageFailureException extends TransportException {
  public StageFailureException(String msg) { super(msg); }

  public StageFailureException(String msg, Throwable cause) { super(msg, cause); }
}
