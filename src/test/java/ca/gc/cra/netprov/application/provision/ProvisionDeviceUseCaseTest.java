package ca.gc.cra.netprov.application.provision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netprov.application.credentials.CredentialResolver;
import ca.gc.cra.netprov.application.credentials.DefaultCredentials;
import ca.gc.cra.netprov.application.deploy.DeploymentOrchestrator;
import ca.gc.cra.netprov.application.port.IntendedConfig;
import ca.gc.cra.netprov.application.port.InventoryDevice;
import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.application.port.secrets.SecretType;
import ca.gc.cra.netprov.domain.deploy.DeploymentResult;
import ca.gc.cra.netprov.domain.deploy.DeploymentStatus;
import ca.gc.cra.netprov.domain.deploy.FailureKind;
import ca.gc.cra.netprov.domain.deploy.TrailEntry;
import ca.gc.cra.netprov.testing.FixedTransportProvider;
import ca.gc.cra.netprov.testing.InMemorySecretStore;
import ca.gc.cra.netprov.testing.RecordingMetricsPort;
import ca.gc.cra.netprov.testing.ScriptedTransportAdapter;
import ca.gc.cra.netprov.testing.ScriptedTransportAdapter.Op;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProvisionDeviceUseCaseTest {
  private final Map<String, InventoryDevice> inventory = new HashMap<>();
  private final Map<String, String> intended = new HashMap<>();
  private ScriptedTransportAdapter adapter;
  private RecordingMetricsPort metrics;
  private InMemorySecretStore secrets;

  @BeforeEach
  void setUp() {
    adapter = new ScriptedTransportAdapter("eos").diff("+vlan 10\n");
    metrics = new RecordingMetricsPort();
    secrets = new InMemorySecretStore();
    inventory.put("leaf1", device("leaf1", "192.0.2.11/24", "eos"));
    inventory.put("leaf2", device("leaf2", "192.0.2.12", "eos"));
    intended.put("leaf1", "hostname leaf1\nvlan 10\n");
    intended.put("leaf2", "hostname leaf2\nvlan 10\n");
  }

  @Test
  void dryRunDeploysIntendedConfigAndMergesTrail() {
    DeploymentResult result = useCase(Duration.ofSeconds(30)).provision("leaf1", DeploymentOptions.defaults());

    assertEquals(DeploymentStatus.DRY_RUN_DISCARDED, result.status());
    assertEquals("hostname leaf1\nvlan 10\n", adapter.lastConfig());
    List<String> messages = result.trail().stream().map(TrailEntry::message).toList();
    assertEquals("Starting provisioning for device: leaf1", messages.get(0));
    assertTrue(messages.contains("Found intended config (last updated: 2024-05-01T12:00:00Z)"));
    assertTrue(messages.stream().anyMatch(message -> message.startsWith("Config preview:\nhostname leaf1")));
    assertTrue(messages.stream().anyMatch(message -> message.startsWith("Deploying configuration to leaf1 (192.0.2.11")));
  }

  @Test
  void missingIntendedConfigFailsBeforeConnecting() {
    intended.remove("leaf1");

    DeploymentResult result = useCase(Duration.ofSeconds(30)).provision("leaf1", DeploymentOptions.defaults());

    assertEquals(DeploymentStatus.FAILED, result.status());
    assertEquals(FailureKind.CONFIG_UNAVAILABLE, result.failureKind().orElseThrow());
    assertTrue(adapter.calls().isEmpty());
    assertEquals(1, metrics.count("provision.configUnavailable"));
  }

  @Test
  void blankIntendedConfigFailsBeforeConnecting() {
    intended.put("leaf1", "   \n");

    DeploymentResult result = useCase(Duration.ofSeconds(30)).provision("leaf1", DeploymentOptions.defaults());

    assertEquals(FailureKind.CONFIG_UNAVAILABLE, result.failureKind().orElseThrow());
    assertTrue(adapter.calls().isEmpty());
  }

  @Test
  void unreadableIntendedConfigFailsBeforeConnecting() {
    ProvisionDeviceUseCase useCase = new ProvisionDeviceUseCase(
        name -> Optional.ofNullable(inventory.get(name)),
        name -> {
          throw new IOException("permission denied");
        },
        orchestrator(), metrics, 2, Duration.ofSeconds(30));

    DeploymentResult result = useCase.provision("leaf1", DeploymentOptions.defaults());

    assertEquals(FailureKind.CONFIG_UNAVAILABLE, result.failureKind().orElseThrow());
    assertTrue(result.error().orElseThrow().message().contains("permission denied"));
  }

  @Test
  void deviceWithoutDriverIsInvalidTarget() {
    inventory.put("leaf1", new InventoryDevice("leaf1", Optional.of("192.0.2.11"), Optional.empty(),
        Optional.empty(), Map.of()));

    DeploymentResult result = useCase(Duration.ofSeconds(30)).provision("leaf1", DeploymentOptions.defaults());

    assertEquals(FailureKind.INVALID_TARGET, result.failureKind().orElseThrow());
    assertTrue(result.trail().stream().anyMatch(entry -> entry.message().contains("no transport driver")));
    assertEquals(1, metrics.count("provision.invalidTarget"));
  }

  @Test
  void deviceWithoutAddressOrUnknownIsInvalidTarget() {
    inventory.put("leaf1", new InventoryDevice("leaf1", Optional.empty(), Optional.of("eos"),
        Optional.empty(), Map.of()));
    inventory.put("leaf3", device("leaf3", "999.1.1.1", "eos"));
    ProvisionDeviceUseCase useCase = useCase(Duration.ofSeconds(30));

    assertEquals(FailureKind.INVALID_TARGET,
        useCase.provision("leaf1", DeploymentOptions.defaults()).failureKind().orElseThrow());
    assertEquals(FailureKind.INVALID_TARGET,
        useCase.provision("leaf3", DeploymentOptions.defaults()).failureKind().orElseThrow());
    assertEquals(FailureKind.INVALID_TARGET,
        useCase.provision("spine9", DeploymentOptions.defaults()).failureKind().orElseThrow());
    assertTrue(adapter.calls().isEmpty());
  }

  @Test
  void secretsGroupFromInventoryReachesCredentialResolver() {
    inventory.put("leaf1", new InventoryDevice("leaf1", Optional.of("192.0.2.11"), Optional.of("eos"),
        Optional.of("lab"), Map.of()));
    secrets.put("lab", SecretType.USERNAME, "netops").put("lab", SecretType.PASSWORD, "pw");

    useCase(Duration.ofSeconds(30)).provision("leaf1", new DeploymentOptions(false, false, true));

    assertEquals("netops", adapter.lastCredentials().username());
    assertEquals(1, adapter.count("commit"));
  }

  @Test
  void provisionAllKeepsRequestOrderAndCounts() throws Exception {
    ProvisionReport report = useCase(Duration.ofSeconds(30))
        .provisionAll(List.of("leaf2", "missing", "leaf1"), new DeploymentOptions(false, true, true));

    assertEquals(List.of("leaf2", "missing", "leaf1"),
        report.results().stream().map(DeploymentResult::device).toList());
    assertEquals(2, report.counts().get(DeploymentStatus.COMMITTED));
    assertEquals(1, report.counts().get(DeploymentStatus.FAILED));
    assertTrue(report.hasFailures());
    assertEquals(2, adapter.count("stage:REPLACE"));
    assertEquals(2, adapter.count("close"));
  }

  @Test
  void provisionAllWithoutDevicesReturnsEmptyReport() throws Exception {
    ProvisionReport report = useCase(Duration.ofSeconds(30)).provisionAll(List.of(), DeploymentOptions.defaults());

    assertTrue(report.results().isEmpty());
    assertFalse(report.hasFailures());
  }

  @Test
  void attemptDeadlineCancelsAndStillCloses() throws Exception {
    adapter.blockOn(Op.COMMIT);

    ProvisionReport report = useCase(Duration.ofMillis(200))
        .provisionAll(List.of("leaf1"), new DeploymentOptions(false, false, true));

    DeploymentResult result = report.results().get(0);
    assertEquals(DeploymentStatus.FAILED, result.status());
    assertEquals(FailureKind.CANCELLED, result.failureKind().orElseThrow());
    assertEquals(1, adapter.count("close"));
    assertEquals(1, metrics.count("provision.deadlineExceeded"));
    assertFalse(Thread.currentThread().isInterrupted());
  }

  @Test
  void deadlineFiringAsAttemptEndsDoesNotCancelNextDevice() throws Exception {
    ScriptedTransportAdapter slow = new ScriptedTransportAdapter("slow").diff("+vlan 10\n").delay(Op.DIFF, 250L);
    inventory.put("leaf1", device("leaf1", "192.0.2.11", "slow"));
    MetricsPort lagging = new MetricsPort() {
      @Override
      public void increment(String key) {
        metrics.increment(key);
        if (key.equals("provision.deadlineExceeded")) {
          try {
            Thread.sleep(150);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        }
      }

      @Override
      public void observe(String key, long value) {
        metrics.observe(key, value);
      }
    };
    CredentialResolver resolver = new CredentialResolver(secrets, DefaultCredentials.LAB, metrics);
    DeploymentOrchestrator orchestrator =
        new DeploymentOrchestrator(new FixedTransportProvider(adapter, slow), resolver, metrics);
    ProvisionDeviceUseCase useCase = new ProvisionDeviceUseCase(
        name -> Optional.ofNullable(inventory.get(name)),
        name -> Optional.ofNullable(intended.get(name)).map(text -> new IntendedConfig(text, Optional.empty())),
        orchestrator, lagging, 1, Duration.ofMillis(200));

    ProvisionReport report = useCase.provisionAll(List.of("leaf1", "leaf2"), DeploymentOptions.defaults());

    DeploymentResult leaf2 = report.results().get(1);
    assertEquals(DeploymentStatus.DRY_RUN_DISCARDED, leaf2.status(), () -> leaf2.error().toString());
    assertEquals(1, metrics.count("provision.deadlineExceeded"));
  }

  private ProvisionDeviceUseCase useCase(Duration attemptTimeout) {
    return new ProvisionDeviceUseCase(
        name -> Optional.ofNullable(inventory.get(name)),
        name -> Optional.ofNullable(intended.get(name))
            .map(text -> new IntendedConfig(text, Optional.of(Instant.parse("2024-05-01T12:00:00Z")))),
        orchestrator(), metrics, 2, attemptTimeout);
  }

  private DeploymentOrchestrator orchestrator() {
    CredentialResolver resolver = new CredentialResolver(secrets, DefaultCredentials.LAB, metrics);
    return new DeploymentOrchestrator(new FixedTransportProvider(adapter), resolver, metrics);
  }

  private static InventoryDevice device(String name, String address, String driver) {
    return new InventoryDevice(name, Optional.of(address), Optional.of(driver), Optional.empty(), Map.of());
  }
}
