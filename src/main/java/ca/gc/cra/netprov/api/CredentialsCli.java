package ca.gc.cra.netprov.api;

import ca.gc.cra.netprov.application.port.InventoryDevice;
import ca.gc.cra.netprov.config.CompositionRoot;
import ca.gc.cra.netprov.config.ProvisionConfig;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;
import ca.gc.cra.netprov.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.netprov.logging.LoggingConfigurator;
import ca.gc.cra.netprov.logging.Logs;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code credentials} command: shows which username a device would log in with and where
 * each field came from. The password is always redacted.
 *
 * @since 0.1.0
 */
public final class CredentialsCli {
  private static final Logger log = LoggerFactory.getLogger(CredentialsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: credentials device=NAME [config=PATH] [inventory=PATH] [secretAccessType=TYPE]";
  private static final String HELP_TEXT = """
      NETPROV credentials

      Usage:
        credentials device=leaf1 [options]

      Options:
        device=NAME              Inventory device to resolve credentials for (required)
        inventory=PATH           YAML device inventory (default inventory.yaml)
        config=PATH              YAML configuration file holding secretsGroups
        secretAccessType=TYPE    Access type read from secrets groups (default generic)
        defaults.username=USER   Fallback username (default admin)
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private CredentialsCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ProvisionConfig config;
    String deviceName;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      deviceName = kv.remove("device");
      if (deviceName == null || deviceName.isBlank()) {
        throw new IllegalArgumentException("device is required");
      }
      config = ProvisionConfig.fromMap(ConfigCliUtils.effectiveConfig("credentials", kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid credentials arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(config, new NoOpMetricsAdapter(), List.of())) {
      Optional<InventoryDevice> device = root.inventory().find(deviceName);
      if (device.isEmpty()) {
        log.error("Device {} is not in the inventory {}", deviceName, config.inventory());
        return ExitCode.CONFIG_ERROR;
      }
      DeviceTarget target = target(device.get());
      Credentials credentials = root.credentialResolver().resolve(target);
      CliPrinter.printLines(
          "Device         : " + target.name(),
          "Secrets group  : " + target.secretsGroup().map(SecretsGroupRef::name).orElse("<none>"),
          "Username       : " + credentials.username() + " (" + credentials.usernameSource().tag() + ")",
          "Password       : " + Logs.redact(credentials.password())
              + " (" + credentials.passwordSource().tag() + ")",
          "Provenance     : " + credentials.provenance().tag());
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Credentials configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to load inventory {}", config.inventory(), ex);
      return ExitCode.IO_ERROR;
    }
  }

  private static DeviceTarget target(InventoryDevice device) {
    return new DeviceTarget(
        device.name(),
        device.managementAddress().orElse(device.name()),
        device.driver().orElse("unknown"),
        device.secretsGroup().map(SecretsGroupRef::new),
        device.options());
  }
}
