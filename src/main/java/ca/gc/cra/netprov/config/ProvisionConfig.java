package ca.gc.cra.netprov.config;

import ca.gc.cra.netprov.application.credentials.DefaultCredentials;
import ca.gc.cra.netprov.application.port.secrets.SecretAccessType;
import ca.gc.cra.netprov.application.provision.DeploymentOptions;
import ca.gc.cra.netprov.infrastructure.transport.TransportTimeouts;
import ca.gc.cra.netprov.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated configuration of a NETPROV run.
 * <p><strong>Role:</strong> Built by the CLI from the merged configuration map and consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inventory YAML device inventory
 * @param intendedDir directory of {@code <device>.cfg} intended configurations
 * @param defaultCredentials fallback credential pair
 * @param secretAccessType access type requested from secrets groups
 * @param parallelism devices deployed concurrently (1..64)
 * @param attemptTimeout deadline of one device attempt
 * @param timeouts per-operation transport budgets
 * @param deployment mode flags
 * @param secretsGroups {@code secretsGroups.*} entries, passed to the secret store adapter
 * @since 0.1.0
 */
public record ProvisionConfig(
    Path inventory,
    Path intendedDir,
    DefaultCredentials defaultCredentials,
    SecretAccessType secretAccessType,
    int parallelism,
    Duration attemptTimeout,
    TransportTimeouts timeouts,
    DeploymentOptions deployment,
    Map<String, String> secretsGroups) {

  static final int MAX_PARALLELISM = 64;
  static final long MAX_TIMEOUT_MS = 3_600_000L;

  public ProvisionConfig {
    Objects.requireNonNull(inventory, "inventory");
    Objects.requireNonNull(intendedDir, "intendedDir");
    Objects.requireNonNull(defaultCredentials, "defaultCredentials");
    Objects.requireNonNull(secretAccessType, "secretAccessType");
    Numbers.requireRange("parallelism", parallelism, 1, MAX_PARALLELISM);
    Objects.requireNonNull(attemptTimeout, "attemptTimeout");
    Objects.requireNonNull(timeouts, "timeouts");
    Objects.requireNonNull(deployment, "deployment");
    secretsGroups = secretsGroups == null ? Map.of() : Map.copyOf(secretsGroups);
  }

  /**
   * Returns a configuration built only from {@link DefaultsForMode}.
   *
   * @return default configuration
   */
  public static ProvisionConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap("provision"));
  }

  /**
   * Creates a configuration from merged key/value pairs. Missing keys fall back to {@link DefaultsForMode}.
   *
   * @param options keys such as {@code inventory}, {@code parallelism}, {@code timeout.commitMs}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ProvisionConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> effective = new LinkedHashMap<>(DefaultsForMode.asFlatMap("provision"));
    options.forEach((key, value) -> {
      if (value != null && !value.isBlank()) {
        effective.put(key, value);
      }
    });

    DefaultCredentials credentials = new DefaultCredentials(
        effective.get("defaults.username").trim(), effective.get("defaults.password"));
    TransportTimeouts timeouts = new TransportTimeouts(
        millis(effective, "timeout.openMs"),
        millis(effective, "timeout.stageMs"),
        millis(effective, "timeout.diffMs"),
        millis(effective, "timeout.commitMs"),
        millis(effective, "timeout.discardMs"),
        millis(effective, "timeout.factsMs"),
        millis(effective, "timeout.closeMs"));
    DeploymentOptions deployment = new DeploymentOptions(
        Boolean.parseBoolean(effective.get("dryRun").trim()),
        Boolean.parseBoolean(effective.get("replace").trim()),
        Boolean.parseBoolean(effective.get("commit").trim()));

    Map<String, String> secretsGroups = new LinkedHashMap<>();
    options.forEach((key, value) -> {
      if (key.startsWith("secretsGroups.")) {
        secretsGroups.put(key, value);
      }
    });

    return new ProvisionConfig(
        path("inventory", effective.get("inventory")),
        path("intendedDir", effective.get("intendedDir")),
        credentials,
        SecretAccessType.fromString(effective.get("secretAccessType")),
        (int) Numbers.parseInRange("parallelism", effective.get("parallelism"), 1, MAX_PARALLELISM),
        millis(effective, "attemptTimeoutMs"),
        timeouts,
        deployment,
        secretsGroups);
  }

  private static Duration millis(Map<String, String> options, String key) {
    return Duration.ofMillis(Numbers.parseInRange(key, options.get(key), 1, MAX_TIMEOUT_MS));
  }

  private static Path path(String key, String raw) {
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }
}
