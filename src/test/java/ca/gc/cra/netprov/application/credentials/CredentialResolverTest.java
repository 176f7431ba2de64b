package ca.gc.cra.netprov.application.credentials;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netprov.application.port.secrets.SecretAccessType;
import ca.gc.cra.netprov.application.port.secrets.SecretStoreException;
import ca.gc.cra.netprov.application.port.secrets.SecretType;
import ca.gc.cra.netprov.domain.credentials.CredentialSource;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.testing.InMemorySecretStore;
import ca.gc.cra.netprov.testing.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class CredentialResolverTest {
  private static final DeviceTarget PLAIN = DeviceTarget.of("leaf1", "192.0.2.10", "eos");
  private static final DeviceTarget GROUPED = PLAIN.withSecretsGroup("lab-switches");

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private RecordingMetricsPort metrics;
  private InMemorySecretStore store;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CredentialResolver.class);
    originalLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    metrics = new RecordingMetricsPort();
    store = new InMemorySecretStore();
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setLevel(originalLevel);
  }

  @Test
  void noSecretsGroupUsesDefaultPair() {
    Credentials credentials = resolver().resolve(PLAIN);

    assertEquals("admin", credentials.username());
    assertEquals("admin", credentials.password());
    assertEquals(CredentialSource.DEFAULT, credentials.provenance());
    assertTrue(store.lookups().isEmpty());
    assertTrue(logged(Level.INFO, "No secrets group configured"));
    assertEquals(1, metrics.count("credentials.source.default"));
  }

  @Test
  void passwordFailureFallsBackForThatFieldOnly() {
    store.put("lab-switches", SecretType.USERNAME, "netops")
        .fail("lab-switches", SecretType.PASSWORD, new SecretStoreException("vault sealed"));

    Credentials credentials = resolver().resolve(GROUPED);

    assertEquals("netops", credentials.username());
    assertEquals("admin", credentials.password());
    assertEquals(CredentialSource.FROM_SECRET_STORE, credentials.usernameSource());
    assertEquals(CredentialSource.DEFAULT, credentials.passwordSource());
    assertEquals(CredentialSource.FROM_SECRET_STORE, credentials.provenance());
    assertEquals(1, metrics.count("credentials.unavailable"));
    assertTrue(logged(Level.DEBUG, "vault sealed"));
  }

  @Test
  void bothFieldsFromStore() {
    store.put("lab-switches", SecretType.USERNAME, "netops")
        .put("lab-switches", SecretType.PASSWORD, "s3cr3t-Pa55");

    Credentials credentials = resolver().resolve(GROUPED);

    assertEquals("s3cr3t-Pa55", credentials.password());
    assertEquals(CredentialSource.FROM_SECRET_STORE, credentials.passwordSource());
    assertEquals(1, metrics.count("credentials.source.from_secret_store"));
    assertFalse(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("s3cr3t-Pa55")),
        "password must never be logged");
    assertFalse(credentials.toString().contains("s3cr3t-Pa55"));
  }

  @Test
  void emptyValuesAreUnavailableAndWarnAboutMisconfiguredGroup() {
    store.put("lab-switches", SecretType.USERNAME, "")
        .put("lab-switches", SecretType.PASSWORD, "");

    Credentials credentials = resolver().resolve(GROUPED);

    assertEquals(CredentialSource.DEFAULT, credentials.provenance());
    assertEquals(2, metrics.count("credentials.unavailable"));
    assertTrue(logged(Level.WARN, "is configured for leaf1 but no secrets could be retrieved"));
    assertFalse(logged(Level.INFO, "No secrets group configured"));
  }

  @Test
  void runtimeFailuresFromStoreAreNotFatal() {
    store.fail("lab-switches", SecretType.USERNAME, new IllegalStateException("provider crashed"))
        .put("lab-switches", SecretType.PASSWORD, "pw");

    Credentials credentials = resolver().resolve(GROUPED);

    assertEquals("admin", credentials.username());
    assertEquals("pw", credentials.password());
  }

  @Test
  void requestsConfiguredAccessTypeWithTargetAsContext() {
    store.put("lab-switches", SecretType.USERNAME, "netops")
        .put("lab-switches", SecretType.PASSWORD, "pw");
    CredentialResolver resolver = new CredentialResolver(
        store, new DefaultCredentials("ops", "changeme"), SecretAccessType.SSH, metrics);

    resolver.resolve(GROUPED);

    assertTrue(store.lookups().contains("lab-switches/USERNAME@SSH/leaf1"));
    assertTrue(store.lookups().contains("lab-switches/PASSWORD@SSH/leaf1"));
  }

  @Test
  void injectedDefaultsReplaceLabPair() {
    CredentialResolver resolver = new CredentialResolver(store, new DefaultCredentials("ops", "changeme"), metrics);

    Credentials credentials = resolver.resolve(PLAIN);

    assertEquals("ops", credentials.username());
    assertEquals("changeme", credentials.password());
  }

  private CredentialResolver resolver() {
    return new CredentialResolver(store, DefaultCredentials.LAB, metrics);
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }
}
