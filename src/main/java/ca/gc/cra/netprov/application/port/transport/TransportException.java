package ca.gc.cra.netprov.application.port.transport;

/**
 * Checked base exception for transport adapter failures.
 *
 * @since 0.1.0
 */
public class TransportException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public TransportException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause raised by the vendor driver
   */
  public TransportException(String msg, Throwable cause) { super(msg, cause); }
}
