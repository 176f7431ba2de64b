package ca.gc.cra.netprov.application.credentials;

import ca.gc.cra.netprov.application.port.MetricsPort;
import ca.gc.cra.netprov.application.port.secrets.SecretAccessType;
import ca.gc.cra.netprov.application.port.secrets.SecretStoreException;
import ca.gc.cra.netprov.application.port.secrets.SecretStorePort;
import ca.gc.cra.netprov.application.port.secrets.SecretType;
import ca.gc.cra.netprov.domain.credentials.CredentialSource;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;
import ca.gc.cra.netprov.logging.Logs;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Produces the username/password pair for one deployment attempt.
 * <p><strong>Role:</strong> Application service consumed by the deployment orchestrator and the
 * {@code credentials} CLI command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch the username and password independently from the target's secrets group.</li>
 *   <li>Treat any store failure or empty value as "unavailable" and fall back to {@link DefaultCredentials}
 *       for that field only.</li>
 *   <li>Distinguish a misconfigured secrets group from a target without one in the logs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no mutable state; safe to call concurrently for different targets.</p>
 * <p><strong>Observability:</strong> Increments {@code credentials.source.<provenance>} and
 * {@code credentials.unavailable}; never logs a password.</p>
 *
 * @since 0.1.0
 */
public final class CredentialResolver {
  private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

  private final SecretStorePort secretStore;
  private final DefaultCredentials defaults;
  private final SecretAccessType accessType;
  private final MetricsPort metrics;

  /**
   * Creates a resolver reading {@link SecretAccessType#GENERIC} secrets.
   *
   * @param secretStore secret store collaborator
   * @param defaults fallback pair
   * @param metrics metrics sink
   */
  public CredentialResolver(SecretStorePort secretStore, DefaultCredentials defaults, MetricsPort metrics) {
    this(secretStore, defaults, SecretAccessType.GENERIC, metrics);
  }

  /**
   * Creates a resolver reading secrets scoped to {@code accessType}.
   *
   * @param secretStore secret store collaborator
   * @param defaults fallback pair
   * @param accessType access type requested from the secrets group
   * @param metrics metrics sink
   */
  public CredentialResolver(
      SecretStorePort secretStore,
      DefaultCredentials defaults,
      SecretAccessType accessType,
      MetricsPort metrics) {
    this.secretStore = Objects.requireNonNull(secretStore, "secretStore");
    this.defaults = Objects.requireNonNull(defaults, "defaults");
    this.accessType = Objects.requireNonNull(accessType, "accessType");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Resolves credentials for {@code target}. Never fails.
   *
   * @param target device being configured
   * @return usable credentials with per-field provenance
   */
  public Credentials resolve(DeviceTarget target) {
    Objects.requireNonNull(target, "target");
    Optional<SecretsGroupRef> group = target.secretsGroup();
    if (group.isEmpty()) {
      log.info("No secrets group configured for {}; using default credentials for user {}",
          target.name(), defaults.username());
      return record(new Credentials(
          defaults.username(), defaults.password(), CredentialSource.DEFAULT, CredentialSource.DEFAULT));
    }

    SecretsGroupRef ref = group.get();
    log.debug("Secrets group configured for {}: {}", target.name(), ref);
    Optional<String> username = fetch(ref, SecretType.USERNAME, target);
    Optional<String> password = fetch(ref, SecretType.PASSWORD, target);
    username.ifPresent(value -> log.info("Retrieved username {} from secrets group {}", value, ref));
    password.ifPresent(value -> log.info("Retrieved password from secrets group {}", ref));

    Credentials credentials = new Credentials(
        username.orElse(defaults.username()),
        password.orElse(defaults.password()),
        username.isPresent() ? CredentialSource.FROM_SECRET_STORE : CredentialSource.DEFAULT,
        password.isPresent() ? CredentialSource.FROM_SECRET_STORE : CredentialSource.DEFAULT);

    if (credentials.provenance() == CredentialSource.FROM_SECRET_STORE) {
      log.info("Using credentials from secrets group {} for {}: {}/{}",
          ref, target.name(), credentials.username(), Logs.redact(credentials.password()));
    } else {
      log.warn("Secrets group '{}' is configured for {} but no secrets could be retrieved; "
              + "check the secret providers. Using default credentials for user {}",
          ref, target.name(), defaults.username());
    }
    return record(credentials);
  }

  private Optional<String> fetch(SecretsGroupRef group, SecretType type, DeviceTarget target) {
    String field = type.name().toLowerCase(Locale.ROOT);
    try {
      String value = secretStore.secretValue(group, accessType, type, target);
      if (value == null || value.isEmpty()) {
        unavailable(target, group, field, "empty value");
        return Optional.empty();
      }
      return Optional.of(value);
    } catch (SecretStoreException | RuntimeException ex) {
      unavailable(target, group, field, ex.getClass().getSimpleName() + ": " + ex.getMessage());
      return Optional.empty();
    }
  }

  private void unavailable(DeviceTarget target, SecretsGroupRef group, String field, String reason) {
    metrics.increment("credentials.unavailable");
    log.debug("credentials.unavailable device={} group={} field={} accessType={} reason={}",
        target.name(), group, field, accessType, reason);
  }

  private Credentials record(Credentials credentials) {
    metrics.increment("credentials.source." + credentials.provenance().tag());
    return credentials;
  }
}
