package ca.gc.cra.netprov.application.provision;

/**
 * Mode flags applied to every device of a provisioning run.
 *
 * @param dryRun stage and diff only; never commit
 * @param replace replace the running configuration instead of merging into it
 * @param commitOnSuccess commit when the diff is non-empty (ignored on dry runs)
 * @since 0.1.0
 */
public record DeploymentOptions(boolean dryRun, boolean replace, boolean commitOnSuccess) {
  /**
   * Returns the job defaults: dry run, merge, commit enabled.
   *
   * @return default options
   */
  public static DeploymentOptions defaults() {
    return new DeploymentOptions(true, false, true);
  }
}
