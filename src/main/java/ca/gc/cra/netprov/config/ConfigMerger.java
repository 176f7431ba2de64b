package ca.gc.cra.netprov.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked for overrides worth an operator's attention
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> warnings = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (key.startsWith("secretsGroups.")) {
        throw new IllegalArgumentException("secretsGroups must be defined in the YAML configuration: " + key);
      }
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      if (key.equals("defaults.password")) {
        warnings.accept("defaults.password given on the command line is visible to other local users");
      }
      merged.put(key, entry.getValue());
    }

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    String username = trim(effective.get("defaults.username"));
    String password = trim(effective.get("defaults.password"));
    if (username.isEmpty() != password.isEmpty()) {
      throw new IllegalArgumentException("defaults.username and defaults.password must be set together");
    }
    if ("provision".equalsIgnoreCase(command)) {
      for (String flag : new String[] {"dryRun", "replace", "commit"}) {
        requireBoolean(flag, effective.get(flag));
      }
    }
  }

  private static void requireBoolean(String key, String value) {
    String normalized = trim(value).toLowerCase(Locale.ROOT);
    if (!normalized.isEmpty() && !normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException(key + " must be true or false");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
