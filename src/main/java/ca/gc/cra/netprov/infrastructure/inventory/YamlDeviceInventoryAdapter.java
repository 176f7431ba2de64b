package ca.gc.cra.netprov.infrastructure.inventory;

import ca.gc.cra.netprov.application.port.DeviceInventoryPort;
import ca.gc.cra.netprov.application.port.InventoryDevice;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Device inventory loaded once from a YAML document:
 *
 * <pre>
 * devices:
 *   leaf-1:
 *     address: 192.0.2.11
 *     driver: eos
 *     secretsGroup: lab-switches
 *     options:
 *       port: 8443
 *       verifyTls: false
 * </pre>
 *
 * <p>Missing fields are reported as empty; validation is left to the provisioning job. Immutable after
 * loading.</p>
 *
 * @since 0.1.0
 */
public final class YamlDeviceInventoryAdapter implements DeviceInventoryPort {
  private static final Logger log = LoggerFactory.getLogger(YamlDeviceInventoryAdapter.class);

  private final Map<String, InventoryDevice> devices;

  private YamlDeviceInventoryAdapter(Map<String, InventoryDevice> devices) {
    this.devices = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
  }

  /**
   * Loads the inventory file.
   *
   * @param path YAML inventory
   * @return loaded inventory
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document structure is invalid
   */
  public static YamlDeviceInventoryAdapter load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      Map<String, InventoryDevice> devices = new LinkedHashMap<>();
      if (document != null) {
        Object section = asMap(document, "root").get("devices");
        if (section != null) {
          for (Map.Entry<String, Object> entry : asMap(section, "devices").entrySet()) {
            devices.put(entry.getKey(), device(entry.getKey(), entry.getValue()));
          }
        }
      }
      log.info("Loaded {} devices from inventory {}", devices.size(), path);
      return new YamlDeviceInventoryAdapter(devices);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse inventory YAML at " + path, ex);
    }
  }

  @Override
  public Optional<InventoryDevice> find(String deviceName) {
    return Optional.ofNullable(devices.get(deviceName));
  }

  /**
   * Lists the device names, in document order.
   *
   * @return device names
   */
  public Set<String> deviceNames() {
    return devices.keySet();
  }

  private static InventoryDevice device(String name, Object node) {
    Map<String, Object> fields = node == null ? Map.of() : asMap(node, "devices." + name);
    Map<String, Object> options = new LinkedHashMap<>();
    Object rawOptions = fields.get("options");
    if (rawOptions != null) {
      for (Map.Entry<String, Object> option : asMap(rawOptions, "devices." + name + ".options").entrySet()) {
        Object value = option.getValue();
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
          throw new IllegalArgumentException(
              "devices." + name + ".options." + option.getKey() + " must be a scalar");
        }
        options.put(option.getKey(), value);
      }
    }
    return new InventoryDevice(
        name,
        text(fields.get("address")),
        text(fields.get("driver")),
        text(fields.get("secretsGroup")),
        options);
  }

  private static Optional<String> text(Object value) {
    if (value == null || value.toString().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.toString().trim());
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains a non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
