package ca.gc.cra.netprov.domain.device;

import ca.gc.cra.netprov.validation.Strings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Identifies the device configured by one deployment attempt.
 * <p><strong>Role:</strong> Domain value supplied by the caller (usually built from the device inventory) and
 * passed unchanged to the credential resolver and the transport adapter.</p>
 * <p><strong>Thread-safety:</strong> Immutable; transport options are copied into an unmodifiable map.</p>
 *
 * @param name unique device name
 * @param managementAddress host name or IP literal used to reach the management plane
 * @param driver transport driver identifier (for example {@code eos}); normalized to lower case
 * @param secretsGroup optional secrets group holding the device credentials
 * @param options vendor specific transport options; values must be scalars
 *     ({@link String}, {@link Number}, {@link Boolean})
 * @since 0.1.0
 */
public record DeviceTarget(
    String name,
    String managementAddress,
    String driver,
    Optional<SecretsGroupRef> secretsGroup,
    Map<String, Object> options) {

  public DeviceTarget {
    name = Strings.requireNonBlank("name", name);
    managementAddress = Strings.requireNonBlank("managementAddress", managementAddress);
    driver = Strings.requireNonBlank("driver", driver).toLowerCase(Locale.ROOT);
    secretsGroup = Objects.requireNonNullElse(secretsGroup, Optional.empty());
    options = copyScalars(options);
  }

  /**
   * Creates a target without a secrets group or transport options.
   *
   * @param name device name
   * @param managementAddress management host or address
   * @param driver transport driver identifier
   * @return target with default credentials and driver defaults
   */
  public static DeviceTarget of(String name, String managementAddress, String driver) {
    return new DeviceTarget(name, managementAddress, driver, Optional.empty(), Map.of());
  }

  /**
   * Returns a copy of this target bound to the given secrets group.
   *
   * @param group secrets group name
   * @return new target referencing {@code group}
   */
  public DeviceTarget withSecretsGroup(String group) {
    return new DeviceTarget(
        name, managementAddress, driver, Optional.of(new SecretsGroupRef(group)), options);
  }

  /**
   * Returns a copy of this target with the given transport options.
   *
   * @param transportOptions scalar options passed opaquely to the driver
   * @return new target carrying {@code transportOptions}
   */
  public DeviceTarget withOptions(Map<String, Object> transportOptions) {
    return new DeviceTarget(name, managementAddress, driver, secretsGroup, transportOptions);
  }

  private static Map<String, Object> copyScalars(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = Strings.requireNonBlank("option name", entry.getKey());
      Object value = entry.getValue();
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        throw new IllegalArgumentException("transport option " + key + " must be a scalar value");
      }
      copy.put(key, value);
    }
    return Collections.unmodifiableMap(copy);
  }
}
