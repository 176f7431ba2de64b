package ca.gc.cra.netprov.application.deploy;

/**
 * Ordered decision table applied once the diff is known.
 *
 * <table>
 *   <caption>Evaluated top to bottom; first match wins</caption>
 *   <tr><th>diff empty</th><th>dry run</th><th>commit on success</th><th>decision</th></tr>
 *   <tr><td>yes</td><td>any</td><td>any</td><td>{@link #NO_OP}</td></tr>
 *   <tr><td>no</td><td>yes</td><td>any</td><td>{@link #DRY_RUN_DISCARD}</td></tr>
 *   <tr><td>no</td><td>no</td><td>no</td><td>{@link #DISCARD}</td></tr>
 *   <tr><td>no</td><td>no</td><td>yes</td><td>{@link #COMMIT}</td></tr>
 * </table>
 *
 * @since 0.1.0
 */
public enum DeploymentDecision {
  /** Nothing to change: discard any pending state and close. */
  NO_OP,
  /** Preview only: discard and report the diff. */
  DRY_RUN_DISCARD,
  /** Commit disabled: discard the staged candidate. */
  DISCARD,
  /** Commit the staged candidate. */
  COMMIT;

  /**
   * Applies the decision table.
   *
   * @param diffEmpty whether the device reported no pending change
   * @param dryRun dry-run flag of the request
   * @param commitOnSuccess commit flag of the request
   * @return decision
   */
  public static DeploymentDecision decide(boolean diffEmpty, boolean dryRun, boolean commitOnSuccess) {
    if (diffEmpty) {
      return NO_OP;
    }
    if (dryRun) {
      return DRY_RUN_DISCARD;
    }
    if (!commitOnSuccess) {
      return DISCARD;
    }
    return COMMIT;
  }
}
