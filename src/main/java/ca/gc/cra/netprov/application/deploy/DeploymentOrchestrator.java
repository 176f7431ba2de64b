package ca.gc.cra.netprov.application.deploy;

import ca.gc.cra.netprov.application.credentials.CredentialResolver;
import ca.gc.cra.netprov.application.port.ClockPort;
import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.application.port.transport.CommitFailureException;
import ca.gc.cra.netprov.application.port.transport.ConnectionFailureException;
import ca.gc.cra.netprov.application.port.transport.StageFailureException;
import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.port.transport.TransportException;
import ca.gc.cra.netprov.application.port.transport.TransportProvider;
import ca.gc.cra.netprov.application.port.transport.TransportSession;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.deploy.DeploymentError;
import ca.gc.cra.netprov.domain.deploy.DeploymentRequest;
import ca.gc.cra.netprov.domain.deploy.DeploymentResult;
import ca.gc.cra.netprov.domain.deploy.DeploymentState;
import ca.gc.cra.netprov.domain.deploy.DeploymentStatus;
import ca.gc.cra.netprov.domain.deploy.FailureKind;
import ca.gc.cra.netprov.domain.deploy.StageMode;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one configuration deployment attempt against one device.
 * <p><strong>Role:</strong> Application-layer use case sitting between the provisioning job and the transport
 * adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sequence {@code open -> stage -> diff -> commit | discard -> close} on a single session.</li>
 *   <li>Apply the dry-run / commit decision table ({@link DeploymentDecision}).</li>
 *   <li>Map every transport failure kind to its recovery action and a {@link DeploymentResult}.</li>
 *   <li>Close every opened session exactly once through {@link SessionScope}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each {@link #deploy(DeploymentRequest)} owns its
 * session. Callers must not run two attempts against the same device concurrently.</p>
 * <p><strong>Observability:</strong> Emits {@code deploy.*} metrics, puts {@code device} in the MDC for the
 * duration of an attempt, and attaches a diagnostic trail to every result.</p>
 *
 * @since 0.1.0
 */
public final class DeploymentOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);
  private static final int MAX_DIFF_LOG_BYTES = 16 * 1024;

  private final TransportProvider transports;
  private final CredentialResolver credentialResolver;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates an orchestrator using the system clock.
   *
   * @param transports driver lookup
   * @param credentialResolver credential source
   * @param metrics metrics sink
   */
  public DeploymentOrchestrator(
      TransportProvider transports, CredentialResolver credentialResolver, MetricsPort metrics) {
    this(transports, credentialResolver, metrics, ClockPort.SYSTEM);
  }

  public DeploymentOrchestrator(
      TransportProvider transports,
      CredentialResolver credentialResolver,
      MetricsPort metrics,
      ClockPort clock) {
    this.transports = Objects.requireNonNull(transports, "transports");
    this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Executes one deployment attempt. Never throws for transport failures; they are reported in the result.
   *
   * @param request deployment request
   * @return result produced exactly once for this attempt
   */
  public DeploymentResult deploy(DeploymentRequest request) {
    Objects.requireNonNull(request, "request");
    metrics.increment("deploy.attempts");
    String previousDevice = MDC.get("device");
    MDC.put("device", request.target().name());
    try {
      DeploymentResult result = new Attempt(request).run();
      metrics.increment("deploy.status." + result.status().tag());
      metrics.observe("deploy.latencyMillis", result.elapsedMillis());
      return result;
    } finally {
      if (previousDevice == null) {
        MDC.remove("device");
      } else {
        MDC.put("device", previousDevice);
      }
    }
  }

  /** State of a single attempt. Never reused. */
  private final class Attempt {
    private final DeploymentRequest request;
    private final DeviceTarget target;
    private final DeploymentTrail trail = new DeploymentTrail(log);
    private final long startedMillis = clock.nowMillis();
    private DeploymentState state = DeploymentState.IDLE;
    private String diff;
    private Map<String, Object> facts = Map.of();
    private TransportException lastDiffFailure;

    private Attempt(DeploymentRequest request) {
      this.request = request;
      this.target = request.target();
    }

    DeploymentResult run() {
      trail.info("Deploying configuration to {} ({}, driver {})",
          target.name(), target.managementAddress(), target.driver());
      trail.info("Mode: {} | Method: {}",
          request.dryRun() ? "DRY RUN" : "LIVE DEPLOYMENT", request.stageMode());

      if (request.emptyCandidate()) {
        trail.info("Candidate configuration is empty; nothing to deploy");
        return finish(Outcome.of(DeploymentStatus.NO_CHANGE_REQUESTED));
      }

      Optional<TransportAdapter> maybeAdapter = transports.forDriver(target.driver());
      if (maybeAdapter.isEmpty()) {
        trail.error("No transport driver registered for '{}' (known: {})",
            target.driver(), new TreeSet<>(transports.drivers()));
        return finish(failed(FailureKind.INVALID_TARGET, "unknown driver " + target.driver()));
      }
      TransportAdapter adapter = maybeAdapter.get();
      Credentials credentials = credentialResolver.resolve(target);

      transition(DeploymentState.CONNECTING);
      TransportSession session;
      try {
        session = adapter.open(target, credentials, target.options());
      } catch (ConnectionFailureException | RuntimeException ex) {
        trail.error("Connection to {} failed: {}", target.name(), SessionScope.describe(ex));
        trail.error("Verify the device is reachable, the credentials are correct, "
            + "and the management API or SSH is enabled");
        return finish(failed(FailureKind.CONNECTION, ex));
      }
      trail.success("Connected to {}", target.name());

      Outcome outcome;
      try (SessionScope scope = new SessionScope(adapter, session, trail, metrics)) {
        outcome = runSession(adapter, scope);
      }
      return finish(outcome);
    }

    private Outcome runSession(TransportAdapter adapter, SessionScope scope) {
      boolean committed = false;
      try {
        StageMode mode = request.stageMode();
        if (mode == StageMode.REPLACE) {
          trail.warning("REPLACE mode: the entire configuration will be replaced");
        } else {
          trail.info("MERGE mode: configuration will be merged with the running configuration");
        }
        try {
          adapter.stage(scope.session(), request.candidateConfig(), mode);
        } catch (StageFailureException ex) {
          trail.error("Loading configuration failed: {}", SessionScope.describe(ex));
          return failed(FailureKind.STAGE, ex);
        }
        transition(DeploymentState.STAGED);
        trail.success("Configuration loaded successfully");

        String pending = computeDiff(adapter, scope);
        if (pending == null) {
          return failed(FailureKind.DIFF, lastDiffFailure);
        }
        transition(DeploymentState.DIFFED);

        DeploymentDecision decision =
            DeploymentDecision.decide(pending.isBlank(), request.dryRun(), request.commitOnSuccess());
        switch (decision) {
          case NO_OP -> {
            trail.info("No configuration changes detected");
            discard(scope);
            return Outcome.of(DeploymentStatus.NO_OP_NO_DIFF);
          }
          case DRY_RUN_DISCARD -> {
            trail.warning("DRY RUN mode: discarding configuration changes");
            discard(scope);
            trail.info("Run again with dry run disabled to apply these changes");
            return Outcome.of(DeploymentStatus.DRY_RUN_DISCARDED);
          }
          case DISCARD -> {
            trail.warning("Commit disabled: changes loaded but not committed");
            discard(scope);
            return Outcome.of(DeploymentStatus.DISCARDED);
          }
          default -> {
            Outcome commitOutcome = commit(adapter, scope);
            committed = commitOutcome.status() == DeploymentStatus.COMMITTED;
            return commitOutcome;
          }
        }
      } catch (RuntimeException ex) {
        trail.error("Unexpected error during deployment: {}", SessionScope.describe(ex));
        log.debug("Unexpected deployment failure for {}", target.name(), ex);
        if (!committed) {
          trail.info("Attempting to discard configuration changes");
          scope.discardQuietly();
        }
        return failed(FailureKind.UNEXPECTED, ex);
      }
    }

    private String computeDiff(TransportAdapter adapter, SessionScope scope) {
      trail.info("Generating configuration diff");
      try {
        String result = Objects.requireNonNullElse(adapter.diff(scope.session()), "");
        if (!result.isBlank()) {
          diff = result;
          trail.info("Configuration changes:\n{}", Logs.truncate(result, MAX_DIFF_LOG_BYTES));
        }
        return result;
      } catch (TransportException ex) {
        lastDiffFailure = ex;
        trail.error("Computing configuration diff failed: {}", SessionScope.describe(ex));
        trail.info("Attempting to discard configuration changes");
        scope.discardQuietly();
        return null;
      }
    }

    private void discard(SessionScope scope) {
      transition(DeploymentState.DISCARDING);
      scope.discardQuietly();
    }

    private Outcome commit(TransportAdapter adapter, SessionScope scope) {
      transition(DeploymentState.COMMITTING);
      trail.info("Committing configuration changes");
      try {
        adapter.commit(scope.session());
      } catch (CommitFailureException ex) {
        trail.error("Configuration deployment error: {}", SessionScope.describe(ex));
        if (ex.rolledBack()) {
          trail.warning("Driver reported an automatic rollback to the previous configuration");
          Outcome outcome = failed(FailureKind.COMMIT, ex);
          return new Outcome(DeploymentStatus.ROLLED_BACK, outcome.error());
        }
        trail.error("Commit did not complete; inspect the device before retrying");
        return failed(FailureKind.COMMIT, ex);
      }
      trail.success("Configuration committed successfully");
      verify(adapter, scope);
      return Outcome.of(DeploymentStatus.COMMITTED);
    }

    private void verify(TransportAdapter adapter, SessionScope scope) {
      try {
        facts = scalarFacts(adapter.facts(scope.session()));
        trail.success("Device {} is running with the new configuration",
            facts.getOrDefault("hostname", target.name()));
      } catch (TransportException | RuntimeException ex) {
        trail.warning("Could not verify configuration through device facts: {}", SessionScope.describe(ex));
      }
    }

    private Outcome failed(FailureKind kind, Throwable cause) {
      FailureKind effective = Thread.currentThread().isInterrupted() ? FailureKind.CANCELLED : kind;
      return new Outcome(DeploymentStatus.FAILED, DeploymentError.of(effective, state, cause));
    }

    private Outcome failed(FailureKind kind, String message) {
      return new Outcome(DeploymentStatus.FAILED, DeploymentError.of(kind, state, message));
    }

    private void transition(DeploymentState next) {
      log.debug("{}: {} -> {}", target.name(), state, next);
      state = next;
    }

    private DeploymentResult finish(Outcome outcome) {
      transition(outcome.error() == null ? DeploymentState.CLOSED : DeploymentState.FAILED);
      if (outcome.error() == null) {
        trail.success("Deployment to {} finished: {}", target.name(), outcome.status());
      } else {
        trail.error("Deployment to {} finished: {} ({})",
            target.name(), outcome.status(), outcome.error().describe());
      }
      return new DeploymentResult(
          target.name(),
          outcome.status(),
          Optional.ofNullable(diff),
          Optional.ofNullable(outcome.error()),
          facts,
          trail.entries(),
          Math.max(0L, clock.nowMillis() - startedMillis));
    }
  }

  private static Map<String, Object> scalarFacts(Map<String, Object> raw) {
    if (raw == null || raw.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (key == null || value == null) {
        return;
      }
      boolean scalar = value instanceof String || value instanceof Number || value instanceof Boolean;
      copy.put(key, scalar ? value : value.toString());
    });
    return copy;
  }

  private record Outcome(DeploymentStatus status, DeploymentError error) {
    static Outcome of(DeploymentStatus status) {
      return new Outcome(status, null);
    }
  }
}
