package ca.gc.cra.netprov.application.port;

import java.util.Optional;

/**
 * Read-only port onto the device inventory.
 *
 * @since 0.1.0
 */
public interface DeviceInventoryPort {
  /**
   * Finds a device by name.
   *
   * @param deviceName device name
   * @return inventory record, or empty when the device is unknown
   */
  Optional<InventoryDevice> find(String deviceName);
}
