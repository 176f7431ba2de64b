package ca.gc.cra.netprov.application.port.transport;

import java.time.Duration;

/**
 * Raised when a transport operation without a dedicated failure kind exceeds its time budget.
 *
 * @since 0.1.0
 */
public final class TransportTimeoutException extends TransportException {
  private final String operation;

  /**
   * Creates a timeout failure.
   *
   * @param operation operation name such as {@code diff}
   * @param budget time budget that was exceeded
   */
  public TransportTimeoutException(String operation, Duration budget) {
    super(operation + " timed out after " + budget.toMillis() + " ms");
    this.operation = operation;
  }

  /**
   * Operation that timed out.
   *
   * @return operation name
   */
  public String operation() {
    return operation;
  }
}
