package ca.gc.cra.netprov.domain.deploy;

import ca.gc.cra.netprov.domain.device.DeviceTarget;
import java.util.Objects;

/**
 * <strong>What:</strong> One deployment attempt against one device.
 * <p><strong>Role:</strong> Built by the caller and handed to
 * {@code DeploymentOrchestrator#deploy(DeploymentRequest)}.</p>
 * <p>An empty or blank {@code candidateConfig} is accepted and reported as
 * {@link DeploymentStatus#NO_CHANGE_REQUESTED} without connecting.</p>
 *
 * @param target device to configure
 * @param candidateConfig configuration text to stage
 * @param dryRun stage and diff only; always wins over {@code commitOnSuccess}
 * @param replace stage with {@link StageMode#REPLACE} instead of {@link StageMode#MERGE}
 * @param commitOnSuccess commit a non-empty diff when not a dry run
 * @since 0.1.0
 */
public record DeploymentRequest(
    DeviceTarget target,
    String candidateConfig,
    boolean dryRun,
    boolean replace,
    boolean commitOnSuccess) {

  public DeploymentRequest {
    Objects.requireNonNull(target, "target");
    candidateConfig = Objects.requireNonNullElse(candidateConfig, "");
  }

  /**
   * Returns the staging mode implied by {@link #replace()}.
   *
   * @return staging mode
   */
  public StageMode stageMode() {
    return replace ? StageMode.REPLACE : StageMode.MERGE;
  }

  /**
   * Indicates whether the request carries no candidate configuration.
   *
   * @return {@code true} when the candidate is blank
   */
  public boolean emptyCandidate() {
    return candidateConfig.isBlank();
  }
}
