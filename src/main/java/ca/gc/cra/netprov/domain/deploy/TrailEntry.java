package ca.gc.cra.netprov.domain.deploy;

import java.util.Objects;

/**
 * One line of the diagnostic trail attached to a deployment result.
 *
 * @param tier severity tier
 * @param message human-readable text; never contains credential material
 * @since 0.1.0
 */
public record TrailEntry(Tier tier, String message) {

  public TrailEntry {
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    return "[" + tier + "] " + message;
  }

  /** Severity tiers understood by job runners. */
  public enum Tier {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
  }
}
