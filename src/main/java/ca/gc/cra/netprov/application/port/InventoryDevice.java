package ca.gc.cra.netprov.application.port;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw device record as held by the inventory. Fields may be missing; the provisioning job validates them
 * before building a {@code DeviceTarget}.
 *
 * @param name device name
 * @param managementAddress primary management address, if assigned
 * @param driver transport driver of the device platform, if configured
 * @param secretsGroup secrets group name, if assigned
 * @param options transport options of the platform
 * @since 0.1.0
 */
public record InventoryDevice(
    String name,
    Optional<String> managementAddress,
    Optional<String> driver,
    Optional<String> secretsGroup,
    Map<String, Object> options) {

  public InventoryDevice {
    Objects.requireNonNull(name, "name");
    managementAddress = Objects.requireNonNullElse(managementAddress, Optional.empty());
    driver = Objects.requireNonNullElse(driver, Optional.empty());
    secretsGroup = Objects.requireNonNullElse(secretsGroup, Optional.empty());
    options = options == null ? Map.of() : Map.copyOf(options);
  }
}
