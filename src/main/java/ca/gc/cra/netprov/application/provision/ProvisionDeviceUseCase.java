package ca.gc.cra.netprov.application.provision;

import ca.gc.cra.netprov.application.deploy.DeploymentOrchestrator;
import ca.gc.cra.netprov.application.deploy.DeploymentTrail;
import ca.gc.cra.netprov.application.port.DeviceInventoryPort;
import ca.gc.cra.netprov.application.port.IntendedConfig;
import ca.gc.cra.netprov.application.port.IntendedConfigPort;
import ca.gc.cra.netprov.application.port.InventoryDevice;
import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.domain.deploy.DeploymentError;
import ca.gc.cra.netprov.domain.deploy.DeploymentRequest;
import ca.gc.cra.netprov.domain.deploy.DeploymentResult;
import ca.gc.cra.netprov.domain.deploy.DeploymentState;
import ca.gc.cra.netprov.domain.deploy.FailureKind;
import ca.gc.cra.netprov.domain.deploy.TrailEntry;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;
import ca.gc.cra.netprov.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.netprov.logging.Logs;
import ca.gc.cra.netprov.validation.Net;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Provisioning job that deploys each device's intended configuration.
 * <p><strong>Role:</strong> Application use case invoked by the {@code provision} CLI command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the inventory record (driver and management address) before anything else.</li>
 *   <li>Fail with {@link FailureKind#CONFIG_UNAVAILABLE} before connecting when no intended configuration
 *   exists.</li>
 *   <li>Build the {@link DeploymentRequest} from {@link DeploymentOptions} and delegate to the orchestrator.</li>
 *   <li>Run several devices concurrently, one attempt per device at a time, each under a deadline.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; attempts on the same device are serialized by
 * {@link DeviceLocks}.</p>
 * <p><strong>Observability:</strong> Emits {@code provision.devices}, {@code provision.invalidTarget},
 * {@code provision.configUnavailable} and {@code provision.deadlineExceeded}.</p>
 *
 * @since 0.1.0
 */
public final class ProvisionDeviceUseCase {
  private static final Logger log = LoggerFactory.getLogger(ProvisionDeviceUseCase.class);
  private static final int PREVIEW_LINES = 10;

  private final DeviceInventoryPort inventory;
  private final IntendedConfigPort intendedConfigs;
  private final DeploymentOrchestrator orchestrator;
  private final MetricsPort metrics;
  private final DeviceLocks locks;
  private final int parallelism;
  private final Duration attemptTimeout;

  /**
   * Creates the use case.
   *
   * @param inventory device inventory
   * @param intendedConfigs configuration-intent store
   * @param orchestrator deployment orchestrator
   * @param metrics metrics sink
   * @param parallelism maximum number of devices deployed concurrently by {@link #provisionAll}
   * @param attemptTimeout deadline of one attempt started by {@link #provisionAll}
   */
  public ProvisionDeviceUseCase(
      DeviceInventoryPort inventory,
      IntendedConfigPort intendedConfigs,
      DeploymentOrchestrator orchestrator,
      MetricsPort metrics,
      int parallelism,
      Duration attemptTimeout) {
    this.inventory = Objects.requireNonNull(inventory, "inventory");
    this.intendedConfigs = Objects.requireNonNull(intendedConfigs, "intendedConfigs");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.locks = new DeviceLocks();
    if (parallelism <= 0) {
      throw new IllegalArgumentException("parallelism must be positive");
    }
    this.parallelism = parallelism;
    this.attemptTimeout = Objects.requireNonNull(attemptTimeout, "attemptTimeout");
    if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
      throw new IllegalArgumentException("attemptTimeout must be positive");
    }
  }

  /**
   * Provisions one device on the calling thread.
   *
   * @param deviceName inventory name
   * @param options mode flags
   * @return result of the attempt
   */
  public DeploymentResult provision(String deviceName, DeploymentOptions options) {
    Objects.requireNonNull(deviceName, "deviceName");
    Objects.requireNonNull(options, "options");
    metrics.increment("provision.devices");
    String previousDevice = MDC.get("device");
    MDC.put("device", deviceName);
    DeploymentTrail trail = new DeploymentTrail(log);
    try (DeviceLocks.Lease ignored = locks.acquire(deviceName)) {
      return run(deviceName, options, trail);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      trail.error("Interrupted while waiting for another attempt on {} to finish", deviceName);
      return DeploymentResult.failedBeforeConnect(deviceName,
          DeploymentError.of(FailureKind.CANCELLED, DeploymentState.IDLE, ex), trail.entries());
    } finally {
      if (previousDevice == null) {
        MDC.remove("device");
      } else {
        MDC.put("device", previousDevice);
      }
    }
  }

  /**
   * Provisions several devices concurrently, at most {@code parallelism} at a time. An attempt running past the
   * deadline is interrupted; its session is still closed and it reports {@link FailureKind#CANCELLED}.
   *
   * @param deviceNames inventory names; duplicates are deployed one after the other
   * @param options mode flags applied to every device
   * @return report with one result per requested name, in request order
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public ProvisionReport provisionAll(List<String> deviceNames, DeploymentOptions options)
      throws InterruptedException {
    Objects.requireNonNull(deviceNames, "deviceNames");
    if (deviceNames.isEmpty()) {
      return new ProvisionReport(List.of());
    }
    ExecutorService pool = ExecutorFactories.newDeploymentPool(
        Math.min(parallelism, deviceNames.size()), "netprov-deploy", null);
    ScheduledExecutorService watchdog = ExecutorFactories.newWatchdog("netprov-watchdog");
    try {
      List<Future<DeploymentResult>> futures = new ArrayList<>();
      for (String name : deviceNames) {
        futures.add(pool.submit(() -> provisionWithDeadline(name, options, watchdog)));
      }
      List<DeploymentResult> results = new ArrayList<>();
      for (int i = 0; i < futures.size(); i++) {
        results.add(collect(deviceNames.get(i), futures.get(i)));
      }
      ProvisionReport report = new ProvisionReport(results);
      log.info("Provisioned {} devices: {}", results.size(), report.counts());
      return report;
    } catch (InterruptedException ex) {
      log.warn("Provisioning interrupted; cancelling remaining attempts");
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
      watchdog.shutdownNow();
    }
  }

  private DeploymentResult provisionWithDeadline(
      String deviceName, DeploymentOptions options, ScheduledExecutorService watchdog) {
    AttemptDeadline guard = new AttemptDeadline(Thread.currentThread());
    ScheduledFuture<?> deadline = watchdog.schedule(
        () -> guard.expire(deviceName), attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
    try {
      return provision(deviceName, options);
    } finally {
      guard.finish();
      deadline.cancel(false);
      // An expiry that won the race has already interrupted this thread; the next task starts clean.
      Thread.interrupted();
    }
  }

  /** Interrupts the worker only while its attempt is still running. */
  private final class AttemptDeadline {
    private final Thread worker;
    private boolean running = true;

    private AttemptDeadline(Thread worker) {
      this.worker = worker;
    }

    synchronized void expire(String deviceName) {
      if (!running) {
        return;
      }
      metrics.increment("provision.deadlineExceeded");
      log.warn("Attempt on {} exceeded {} ms; interrupting", deviceName, attemptTimeout.toMillis());
      worker.interrupt();
    }

    synchronized void finish() {
      running = false;
    }
  }

  private static DeploymentResult collect(String deviceName, Future<DeploymentResult> future)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      log.error("Provisioning {} failed unexpectedly", deviceName, cause);
      return DeploymentResult.failedBeforeConnect(deviceName,
          DeploymentError.of(FailureKind.UNEXPECTED, DeploymentState.IDLE, cause),
          List.of(new TrailEntry(TrailEntry.Tier.ERROR, "Unexpected failure: " + cause)));
    }
  }

  private DeploymentResult run(String deviceName, DeploymentOptions options, DeploymentTrail trail) {
    trail.info("Starting provisioning for device: {}", deviceName);
    trail.info("Mode: {} | Method: {} | Commit: {}",
        options.dryRun() ? "DRY RUN" : "LIVE DEPLOYMENT",
        options.replace() ? "REPLACE" : "MERGE",
        options.commitOnSuccess());

    Optional<DeviceTarget> target = validate(deviceName, trail);
    if (target.isEmpty()) {
      metrics.increment("provision.invalidTarget");
      return failed(deviceName, FailureKind.INVALID_TARGET, "device failed validation", trail);
    }

    Optional<IntendedConfig> intended;
    try {
      intended = intendedConfigs.intendedConfig(deviceName);
    } catch (IOException | RuntimeException ex) {
      trail.error("Could not read intended configuration for {}: {}", deviceName, ex.getMessage());
      metrics.increment("provision.configUnavailable");
      return DeploymentResult.failedBeforeConnect(deviceName,
          DeploymentError.of(FailureKind.CONFIG_UNAVAILABLE, DeploymentState.IDLE, ex), trail.entries());
    }
    if (intended.isEmpty() || intended.get().text().isBlank()) {
      trail.error("No intended configuration found for {}; generate it before provisioning", deviceName);
      metrics.increment("provision.configUnavailable");
      return failed(deviceName, FailureKind.CONFIG_UNAVAILABLE, "no intended configuration", trail);
    }
    IntendedConfig config = intended.get();
    trail.success("Found intended config (last updated: {})",
        config.lastUpdated().map(Object::toString).orElse("unknown"));
    trail.info("Config preview:\n{}", Logs.preview(config.text(), PREVIEW_LINES));

    DeploymentRequest request = new DeploymentRequest(
        target.get(), config.text(), options.dryRun(), options.replace(), options.commitOnSuccess());
    DeploymentResult result = orchestrator.deploy(request);

    List<TrailEntry> combined = new ArrayList<>(trail.entries());
    combined.addAll(result.trail());
    return new DeploymentResult(result.device(), result.status(), result.diff(), result.error(),
        result.facts(), combined, result.elapsedMillis());
  }

  private Optional<DeviceTarget> validate(String deviceName, DeploymentTrail trail) {
    trail.info("Validating device configuration");
    Optional<InventoryDevice> found = inventory.find(deviceName);
    if (found.isEmpty()) {
      trail.error("Device {} is not in the inventory", deviceName);
      return Optional.empty();
    }
    InventoryDevice device = found.get();
    if (device.driver().isEmpty()) {
      trail.error("Device {} has no transport driver configured", deviceName);
      return Optional.empty();
    }
    if (device.managementAddress().isEmpty()) {
      trail.error("Device {} has no management address", deviceName);
      return Optional.empty();
    }
    String address;
    try {
      address = Net.validateManagementAddress(device.managementAddress().get());
    } catch (IllegalArgumentException ex) {
      trail.error("Device {} has an invalid management address: {}", deviceName, ex.getMessage());
      return Optional.empty();
    }
    DeviceTarget target;
    try {
      target = new DeviceTarget(deviceName, address, device.driver().get(),
          device.secretsGroup().map(SecretsGroupRef::new), device.options());
    } catch (IllegalArgumentException ex) {
      trail.error("Device {} cannot be targeted: {}", deviceName, ex.getMessage());
      return Optional.empty();
    }
    trail.success("Device validation passed");
    return Optional.of(target);
  }

  private static DeploymentResult failed(
      String deviceName, FailureKind kind, String message, DeploymentTrail trail) {
    return DeploymentResult.failedBeforeConnect(
        deviceName, DeploymentError.of(kind, DeploymentState.IDLE, message), trail.entries());
  }
}
