package ca.gc.cra.netprov.domain.deploy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of one deployment attempt, produced exactly once per invocation.
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied.</p>
 *
 * @param device device name
 * @param status final status
 * @param diff diff reported by the device, when one was computed and non-empty
 * @param error structured error for {@link DeploymentStatus#FAILED} and {@link DeploymentStatus#ROLLED_BACK}
 * @param facts post-commit fact snapshot; empty unless committed and the fact query succeeded
 * @param trail diagnostic trail in emission order
 * @param elapsedMillis wall-clock duration of the attempt
 * @since 0.1.0
 */
public record DeploymentResult(
    String device,
    DeploymentStatus status,
    Optional<String> diff,
    Optional<DeploymentError> error,
    Map<String, Object> facts,
    List<TrailEntry> trail,
    long elapsedMillis) {

  public DeploymentResult {
    Objects.requireNonNull(device, "device");
    Objects.requireNonNull(status, "status");
    diff = Objects.requireNonNullElse(diff, Optional.empty());
    error = Objects.requireNonNullElse(error, Optional.empty());
    facts = facts == null ? Map.of() : Map.copyOf(facts);
    trail = trail == null ? List.of() : List.copyOf(trail);
  }

  /**
   * Builds a failed result that never reached the transport.
   *
   * @param device device name
   * @param error failure description
   * @param trail diagnostic trail
   * @return failed result
   */
  public static DeploymentResult failedBeforeConnect(
      String device, DeploymentError error, List<TrailEntry> trail) {
    return new DeploymentResult(
        device, DeploymentStatus.FAILED, Optional.empty(), Optional.of(error), Map.of(), trail, 0L);
  }

  /**
   * Returns the failure kind, when the result carries an error.
   *
   * @return failure kind
   */
  public Optional<FailureKind> failureKind() {
    return error.map(DeploymentError::kind);
  }
}
