package ca.gc.cra.netprov.application.port;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Intended configuration generated for a device.
 *
 * @param text configuration text
 * @param lastUpdated when the intended configuration was last generated, if known
 * @since 0.1.0
 */
public record IntendedConfig(String text, Optional<Instant> lastUpdated) {
  public IntendedConfig {
    Objects.requireNonNull(text, "text");
    lastUpdated = Objects.requireNonNullElse(lastUpdated, Optional.empty());
  }
}
