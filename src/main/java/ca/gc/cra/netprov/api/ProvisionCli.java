package ca.gc.cra.netprov.api;

import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.application.provision.DeploymentOptions;
import ca.gc.cra.netprov.application.provision.ProvisionDeviceUseCase;
import ca.gc.cra.netprov.application.provision.ProvisionReport;
import ca.gc.cra.netprov.config.CompositionRoot;
import ca.gc.cra.netprov.config.ProvisionConfig;
import ca.gc.cra.netprov.domain.deploy.DeploymentError;
import ca.gc.cra.netprov.domain.deploy.DeploymentResult;
import ca.gc.cra.netprov.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.netprov.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.netprov.logging.LoggingConfigurator;
import ca.gc.cra.netprov.validation.Paths;
import ca.gc.cra.netprov.validation.Strings;
import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code provision} command: deploys each device's intended configuration.
 *
 * @since 0.1.0
 */
public final class ProvisionCli {
  private static final Logger log = LoggerFactory.getLogger(ProvisionCli.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--replace", "--no-commit", "--live", "--dry-run");
  private static final String SUMMARY_USAGE =
      "usage: provision [devices=A,B] [config=PATH] [inventory=PATH] [intendedDir=PATH] "
          + "[dryRun=true|false] [--live] [--replace] [--no-commit] [parallelism=N] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      NETPROV provision

      Usage:
        provision devices=leaf1,leaf2 inventory=./inventory.yaml intendedDir=./intended [options]

      Targets:
        devices=A,B              Devices to deploy (default: every device in the inventory)
        inventory=PATH           YAML device inventory (default inventory.yaml)
        intendedDir=PATH         Directory of <device>.cfg intended configurations (default intended)
        config=PATH              YAML configuration file (common, secretsGroups, provision sections)

      Mode:
        dryRun=true|false        Stage and diff, then discard (default true)
        --live                   Same as dryRun=false
        --dry-run                Same as dryRun=true
        --replace                Replace the whole running configuration instead of merging
        --no-commit              Stage and diff, then discard even when live

      Tuning:
        parallelism=N            Devices deployed concurrently (1..64, default 4)
        attemptTimeoutMs=MS      Deadline of one device attempt (default 600000)
        timeout.<op>Ms=MS        Per-operation budget for open, stage, diff, commit, discard, facts, close
        defaults.username=USER   Fallback username when no secret is available (default admin)
        defaults.password=PASS   Fallback password (default admin)
        secretAccessType=TYPE    Access type read from secrets groups (default generic)

      Telemetry:
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit status is 6 when any device fails or is rolled back.
      """;

  private ProvisionCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the provision command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for provision CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flags: {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--live") && input.hasFlag("--dry-run")) {
      log.error("--live and --dry-run are mutually exclusive");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      applyFlags(input, kv);
      effective = new LinkedHashMap<>(ConfigCliUtils.effectiveConfig("provision", kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid provision arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    ProvisionConfig config;
    String[] devices;
    String metricsExporter;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      devices = Strings.splitCsv("devices", effective.get("devices"));
      config = ProvisionConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid provision arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Paths.requireReadableFile("inventory", config.inventory());
      Paths.requireReadableDir("intendedDir", config.intendedDir());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid provision path configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    MetricsPort metrics = metricsExporter.equals("none")
        ? new NoOpMetricsAdapter()
        : new OpenTelemetryMetricsAdapter();
    try (CompositionRoot root = new CompositionRoot(config, metrics)) {
      List<String> names = devices.length > 0
          ? Arrays.asList(devices)
          : List.copyOf(root.inventory().deviceNames());
      if (names.isEmpty()) {
        log.error("No devices selected and the inventory {} is empty", config.inventory());
        return ExitCode.INVALID_ARGS;
      }
      DeploymentOptions options = config.deployment();
      log.info("Provisioning {} device(s): dryRun={}, replace={}, commit={}, parallelism={}, metricsExporter={}",
          names.size(), options.dryRun(), options.replace(), options.commitOnSuccess(),
          config.parallelism(), metricsExporter);

      ProvisionDeviceUseCase useCase = root.provisionUseCase();
      ProvisionReport report = useCase.provisionAll(names, options);
      printReport(report);
      return report.hasFailures() ? ExitCode.DEPLOYMENT_FAILED : ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Provision configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to load inventory {}", config.inventory(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Provisioning interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while provisioning", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void applyFlags(CliInput input, Map<String, String> kv) {
    if (input.hasFlag("--live")) {
      kv.put("dryRun", "false");
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }
    if (input.hasFlag("--replace")) {
      kv.put("replace", "true");
    }
    if (input.hasFlag("--no-commit")) {
      kv.put("commit", "false");
    }
  }

  private static void printReport(ProvisionReport report) {
    for (DeploymentResult result : report.results()) {
      String line = result.device() + ": " + result.status().tag() + " (" + result.elapsedMillis() + " ms)";
      CliPrinter.println(line + result.error().map(DeploymentError::describe).map(d -> " - " + d).orElse(""));
      result.diff().ifPresent(diff -> CliPrinter.printIndented("    ", diff));
    }
    StringBuilder summary = new StringBuilder("Summary:");
    report.counts().forEach((status, count) -> summary.append(' ').append(status.tag()).append('=').append(count));
    CliPrinter.println(summary.toString());
  }
}
