package ca.gc.cra.netprov.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Port onto the configuration-intent store.
 * <p><strong>Role:</strong> Supplies the candidate configuration text consumed by the provisioning job.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent lookups for different devices.</p>
 *
 * @since 0.1.0
 */
public interface IntendedConfigPort {
  /**
   * Looks up the intended configuration for a device.
   *
   * @param deviceName device name
   * @return intended configuration, or empty when none exists for the device
   * @throws IOException if the store exists but cannot be read
   */
  Optional<IntendedConfig> intendedConfig(String deviceName) throws IOException;
}
