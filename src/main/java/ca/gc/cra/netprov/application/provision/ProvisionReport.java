package ca.gc.cra.netprov.application.provision;

import ca.gc.cra.netprov.domain.deploy.DeploymentResult;
import ca.gc.cra.netprov.domain.deploy.DeploymentStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of a provisioning run, in the order the devices were requested.
 *
 * @param results one result per requested device
 * @since 0.1.0
 */
public record ProvisionReport(List<DeploymentResult> results) {
  public ProvisionReport {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /**
   * Counts results by status.
   *
   * @return status counts; statuses without results are absent
   */
  public Map<DeploymentStatus, Integer> counts() {
    Map<DeploymentStatus, Integer> counts = new EnumMap<>(DeploymentStatus.class);
    for (DeploymentResult result : results) {
      counts.merge(result.status(), 1, Integer::sum);
    }
    return Collections.unmodifiableMap(counts);
  }

  /**
   * Indicates whether any device failed or rolled back.
   *
   * @return {@code true} if at least one result is a failure
   */
  public boolean hasFailures() {
    return results.stream().anyMatch(result -> result.status().failure());
  }
}
