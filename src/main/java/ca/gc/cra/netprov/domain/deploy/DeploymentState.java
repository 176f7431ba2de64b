package ca.gc.cra.netprov.domain.deploy;

/**
 * States traversed by one deployment attempt.
 *
 * <p>{@code IDLE -> CONNECTING -> STAGED -> DIFFED -> (COMMITTING | DISCARDING) -> CLOSED}, with
 * {@code FAILED} reachable from any non-terminal state. No state is re-entered.</p>
 *
 * @since 0.1.0
 */
public enum DeploymentState {
  IDLE,
  CONNECTING,
  STAGED,
  DIFFED,
  COMMITTING,
  DISCARDING,
  CLOSED,
  FAILED;

  /**
   * Indicates whether the state ends the attempt.
   *
   * @return {@code true} for {@link #CLOSED} and {@link #FAILED}
   */
  public boolean terminal() {
    return this == CLOSED || this == FAILED;
  }
}
