package ca.gc.cra.netprov.application.port.transport;

/**
 * Raised when committing a staged candidate fails, including vendor replace-config failures.
 *
 * <p>Adapters set {@link #rolledBack()} only when the driver explicitly confirms that the device rolled back
 * to its previous configuration. Without that signal callers report a plain failure.</p>
 *
 * @since 0.1.0
 */
public final class CommitFailureException extends TransportException {
  private final boolean rolledBack;

  public CommitFailureException(String msg) {
    this(msg, null, false);
  }

  public CommitFailureException(String msg, Throwable cause) {
    this(msg, cause, false);
  }

  /**
   * Creates a commit failure with an explicit rollback signal.
   *
   * @param msg human-readable error
   * @param cause driver failure; may be {@code null}
   * @param rolledBack {@code true} when the driver confirmed an automatic rollback
   */
  public CommitFailureException(String msg, Throwable cause, boolean rolledBack) {
    super(msg, cause);
    this.rolledBack = rolledBack;
  }

  /**
   * Indicates whether the driver confirmed an automatic rollback.
   *
   * @return {@code true} only on an explicit driver signal
   */
  public boolean rolledBack() {
    return rolledBack;
  }
}
