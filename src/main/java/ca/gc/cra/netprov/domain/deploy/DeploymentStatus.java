package ca.gc.cra.netprov.domain.deploy;

import java.util.Locale;

/**
 * Final outcome reported for a deployment attempt.
 *
 * @since 0.1.0
 */
public enum DeploymentStatus {
  /** Candidate committed to the device. */
  COMMITTED,
  /** Candidate staged and diffed, then discarded because commit was disabled. */
  DISCARDED,
  /** Dry run: candidate staged and diffed, then discarded. */
  DRY_RUN_DISCARDED,
  /** Device already matched the candidate; nothing committed. */
  NO_OP_NO_DIFF,
  /** Commit failed and the driver reported an automatic rollback. */
  ROLLED_BACK,
  /** Attempt failed; see the attached error. */
  FAILED,
  /** Empty candidate; no connection attempted. */
  NO_CHANGE_REQUESTED;

  /**
   * Indicates whether this status should be treated as a failed run by callers.
   *
   * @return {@code true} for {@link #FAILED} and {@link #ROLLED_BACK}
   */
  public boolean failure() {
    return this == FAILED || this == ROLLED_BACK;
  }

  /**
   * Returns the metric-friendly tag for the status.
   *
   * @return lower-case status name
   */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
