package ca.gc.cra.netprov.api;

import ca.gc.cra.netprov.config.ConfigMerger;
import ca.gc.cra.netprov.config.DefaultsForMode;
import ca.gc.cra.netprov.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI arguments with the YAML configuration file.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Loads the optional YAML file named by {@code config=} and merges it with the CLI arguments and the command
   * defaults.
   *
   * @param command CLI command
   * @param cli CLI arguments; {@code config} is removed from the map
   * @param log logger receiving override warnings
   * @return effective configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the file is missing or the merged configuration is invalid
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cli, Logger log)
      throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, command);
      log.debug("Loaded {} settings from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(
        command, yaml, cli, DefaultsForMode.asFlatMap(command), log::warn);
  }
}
