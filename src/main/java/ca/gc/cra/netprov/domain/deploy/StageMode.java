package ca.gc.cra.netprov.domain.deploy;

/**
 * How a candidate configuration is combined with the running configuration.
 *
 * @since 0.1.0
 */
public enum StageMode {
  /** Candidate lines are merged into the running configuration. */
  MERGE,
  /** Candidate fully supersedes the running configuration. */
  REPLACE
}
