package ca.gc.cra.netprov.config;

import ca.gc.cra.netprov.infrastructure.transport.TransportTimeouts;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each NETPROV CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command CLI command ({@code provision} or {@code credentials})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "provision" -> buildProvisionDefaults();
      case "credentials" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("inventory", "inventory.yaml");
    map.put("defaults.username", "admin");
    map.put("defaults.password", "admin");
    map.put("secretAccessType", "generic");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildProvisionDefaults() {
    TransportTimeouts timeouts = TransportTimeouts.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("intendedDir", "intended");
    map.put("parallelism", "4");
    map.put("attemptTimeoutMs", "600000");
    map.put("timeout.openMs", Long.toString(timeouts.open().toMillis()));
    map.put("timeout.stageMs", Long.toString(timeouts.stage().toMillis()));
    map.put("timeout.diffMs", Long.toString(timeouts.diff().toMillis()));
    map.put("timeout.commitMs", Long.toString(timeouts.commit().toMillis()));
    map.put("timeout.discardMs", Long.toString(timeouts.discard().toMillis()));
    map.put("timeout.factsMs", Long.toString(timeouts.facts().toMillis()));
    map.put("timeout.closeMs", Long.toString(timeouts.close().toMillis()));
    map.put("dryRun", "true");
    map.put("replace", "false");
    map.put("commit", "true");
    return map;
  }
}
