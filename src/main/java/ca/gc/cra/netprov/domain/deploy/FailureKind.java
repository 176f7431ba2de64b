package ca.gc.cra.netprov.domain.deploy;

/**
 * Closed set of failure kinds surfaced in a failed {@link DeploymentResult}.
 *
 * <p>Transport adapters map their native errors into these kinds so the orchestrator never reasons about
 * vendor exception types.</p>
 *
 * @since 0.1.0
 */
public enum FailureKind {
  /** Intended configuration missing or empty; no connection attempted. */
  CONFIG_UNAVAILABLE(true),
  /** Inventory record incomplete or driver unknown; no connection attempted. */
  INVALID_TARGET(true),
  /** Opening the session failed. */
  CONNECTION(true),
  /** Loading the candidate failed. */
  STAGE(true),
  /** Computing the diff failed. */
  DIFF(true),
  /** Commit failed; the driver is assumed to have discarded the candidate. */
  COMMIT(false),
  /** The attempt was interrupted by its caller. */
  CANCELLED(false),
  /** Any other adapter failure. */
  UNEXPECTED(false);

  private final boolean retrySafe;

  FailureKind(boolean retrySafe) {
    this.retrySafe = retrySafe;
  }

  /**
   * Indicates whether the device is known to be untouched, so that a retry is safe without inspection.
   *
   * @return {@code true} when nothing was committed before the failure
   */
  public boolean retrySafe() {
    return retrySafe;
  }
}
