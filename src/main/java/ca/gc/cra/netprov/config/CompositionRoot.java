package ca.gc.cra.netprov.config;

import ca.gc.cra.netprov.application.credentials.CredentialResolver;
import ca.gc.cra.netprov.application.deploy.DeploymentOrchestrator;
import ca.gc.cra.netprov.application.port.ClockPort;
import ca.gc.cra.netprov.application.port.IntendedConfigPort;
import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.application.port.secrets.SecretStorePort;
import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.provision.ProvisionDeviceUseCase;
import ca.gc.cra.netprov.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.netprov.infrastructure.intent.FileIntendedConfigAdapter;
import ca.gc.cra.netprov.infrastructure.inventory.YamlDeviceInventoryAdapter;
import ca.gc.cra.netprov.infrastructure.secrets.ProviderSecretStoreAdapter;
import ca.gc.cra.netprov.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.netprov.infrastructure.transport.DriverRegistry;
import ca.gc.cra.netprov.infrastructure.transport.eos.EosEapiTransportAdapter;
import ca.gc.cra.netprov.infrastructure.transport.mock.MockTransportAdapter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires NETPROV use cases to concrete adapters.
 * <p><strong>Role:</strong> Translates a validated {@link ProvisionConfig} into the credential resolver, the
 * driver registry, the orchestrator and the provisioning job.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register the built-in transport drivers behind the time-limited decorator.</li>
 *   <li>Load the device inventory and point the intent store at the intended-config directory.</li>
 *   <li>Own the transport call pool and the metrics adapter; {@link #close()} releases both.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on a single thread during startup; the wired services are
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final ProvisionConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ExecutorService transportCalls;
  private final DriverRegistry drivers;
  private final SecretStorePort secretStore;
  private final CredentialResolver credentialResolver;
  private final DeploymentOrchestrator orchestrator;
  private final YamlDeviceInventoryAdapter inventory;
  private final IntendedConfigPort intendedConfigs;

  /**
   * Creates a composition root with the built-in {@code eos} and {@code mock} drivers.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by all services
   * @throws IOException if the inventory cannot be read
   */
  public CompositionRoot(ProvisionConfig config, MetricsPort metrics) throws IOException {
    this(config, metrics, List.of(new EosEapiTransportAdapter(), new MockTransportAdapter()));
  }

  /**
   * Creates a composition root with an explicit driver set, typically for tests and lab setups.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by all services
   * @param adapters transport drivers to register
   * @throws IOException if the inventory cannot be read
   */
  public CompositionRoot(ProvisionConfig config, MetricsPort metrics, List<TransportAdapter> adapters)
      throws IOException {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = new SystemClockAdapter();
    this.transportCalls = ExecutorFactories.newTransportCallPool("netprov-transport");
    DriverRegistry.Builder builder = DriverRegistry.builder(config.timeouts(), transportCalls);
    adapters.forEach(builder::register);
    this.drivers = builder.build();
    this.secretStore = new ProviderSecretStoreAdapter(config.secretsGroups());
    this.credentialResolver = new CredentialResolver(
        secretStore, config.defaultCredentials(), config.secretAccessType(), this.metrics);
    this.orchestrator = new DeploymentOrchestrator(drivers, credentialResolver, this.metrics, clock);
    this.inventory = YamlDeviceInventoryAdapter.load(config.inventory());
    this.intendedConfigs = new FileIntendedConfigAdapter(config.intendedDir());
    log.debug("Wired drivers {} with timeouts {}", drivers.drivers(), config.timeouts());
  }

  /**
   * Builds the provisioning job.
   *
   * @return use case wired to the configured inventory, intent store and orchestrator
   */
  public ProvisionDeviceUseCase provisionUseCase() {
    return new ProvisionDeviceUseCase(inventory, intendedConfigs, orchestrator, metrics,
        config.parallelism(), config.attemptTimeout());
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Wired services are shared with CLI commands.")
  public CredentialResolver credentialResolver() {
    return credentialResolver;
  }

  /**
   * Returns the loaded inventory; {@link YamlDeviceInventoryAdapter#deviceNames()} lists every device in file
   * order.
   *
   * @return device inventory
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Wired services are shared with CLI commands.")
  public YamlDeviceInventoryAdapter inventory() {
    return inventory;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Wired services are shared with CLI commands.")
  public DriverRegistry drivers() {
    return drivers;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /** Stops the transport call pool and closes the metrics adapter when it is closeable. */
  @Override
  public void close() {
    transportCalls.shutdown();
    try {
      if (!transportCalls.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Transport calls still running after {}s; abandoning them", SHUTDOWN_WAIT_SECONDS);
        transportCalls.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      transportCalls.shutdownNow();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
