package ca.gc.cra.netprov.infrastructure.secrets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netprov.application.port.secrets.SecretAccessType;
import ca.gc.cra.netprov.application.port.secrets.SecretStoreException;
import ca.gc.cra.netprov.application.port.secrets.SecretType;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProviderSecretStoreAdapterTest {
  private static final SecretsGroupRef LAB = new SecretsGroupRef("lab");
  private static final DeviceTarget LEAF = DeviceTarget.of("leaf1", "192.0.2.10", "eos");
  private static final Map<String, String> ENV = Map.of("LAB_USER", "netops", "LAB_PASS", "s3cret");

  @TempDir
  Path dir;

  @Test
  void resolvesEnvironmentReferences() throws Exception {
    ProviderSecretStoreAdapter store = new ProviderSecretStoreAdapter(Map.of(
        "secretsGroups.lab.generic.username", "env:LAB_USER",
        "secretsGroups.lab.generic.password", "env:LAB_PASS"), ENV::get);

    assertEquals("netops", store.secretValue(LAB, SecretAccessType.GENERIC, SecretType.USERNAME, LEAF));
    assertEquals("s3cret", store.secretValue(LAB, SecretAccessType.GENERIC, SecretType.PASSWORD, LEAF));
  }

  @Test
  void expandsDeviceTemplateInFileReference() throws Exception {
    Files.writeString(dir.resolve("leaf1.pass"), "per-device\r\n", StandardCharsets.UTF_8);
    ProviderSecretStoreAdapter store = new ProviderSecretStoreAdapter(Map.of(
        "secretsGroups.lab.ssh.password", "file:" + dir + "/{{ obj.name }}.pass"), ENV::get);

    assertEquals("per-device", store.secretValue(LAB, SecretAccessType.SSH, SecretType.PASSWORD, LEAF));
  }

  @Test
  void ignoresUnrelatedKeysAndParsesTokensCaseInsensitively() throws Exception {
    ProviderSecretStoreAdapter store = new ProviderSecretStoreAdapter(Map.of(
        "inventory", "inventory.yaml",
        "secretsGroups.lab.HTTP.Username", "env:LAB_USER"), ENV::get);

    assertEquals("netops", store.secretValue(LAB, SecretAccessType.HTTP, SecretType.USERNAME, LEAF));
  }

  @Test
  void undefinedGroupAndMissingSecretAreDistinguished() {
    ProviderSecretStoreAdapter store = new ProviderSecretStoreAdapter(Map.of(
        "secretsGroups.lab.generic.username", "env:LAB_USER"), ENV::get);

    SecretStoreException missingGroup = assertThrows(SecretStoreException.class,
        () -> store.secretValue(new SecretsGroupRef("prod"), SecretAccessType.GENERIC, SecretType.USERNAME, LEAF));
    SecretStoreException missingSecret = assertThrows(SecretStoreException.class,
        () -> store.secretValue(LAB, SecretAccessType.GENERIC, SecretType.PASSWORD, LEAF));

    assertEquals("secrets group prod is not defined", missingGroup.getMessage());
    assertEquals("secrets group lab has no GENERIC/PASSWORD secret", missingSecret.getMessage());
  }

  @Test
  void unsetVariableAndUnreadableFileFailWithoutValues() {
    ProviderSecretStoreAdapter store = new ProviderSecretStoreAdapter(Map.of(
        "secretsGroups.lab.generic.username", "env:NOT_SET",
        "secretsGroups.lab.generic.password", "file:" + dir.resolve("missing")), ENV::get);

    SecretStoreException unset = assertThrows(SecretStoreException.class,
        () -> store.secretValue(LAB, SecretAccessType.GENERIC, SecretType.USERNAME, LEAF));
    SecretStoreException unreadable = assertThrows(SecretStoreException.class,
        () -> store.secretValue(LAB, SecretAccessType.GENERIC, SecretType.PASSWORD, LEAF));

    assertEquals("environment variable NOT_SET is not set", unset.getMessage());
    assertTrue(unreadable.getMessage().startsWith("secret file "));
    assertFalse(unreadable.getMessage().contains("s3cret"));
  }

  @Test
  void unsupportedTemplateFieldFails() {
    ProviderSecretStoreAdapter store = new ProviderSecretStoreAdapter(Map.of(
        "secretsGroups.lab.generic.password", "env:{{ obj.tenant }}_PASS"), ENV::get);

    assertThrows(SecretStoreException.class,
        () -> store.secretValue(LAB, SecretAccessType.GENERIC, SecretType.PASSWORD, LEAF));
  }

  @Test
  void malformedEntriesAreRejectedAtConstruction() {
    assertThrows(IllegalArgumentException.class,
        () -> new ProviderSecretStoreAdapter(Map.of("secretsGroups.lab.username", "env:X"), ENV::get));
    assertThrows(IllegalArgumentException.class,
        () -> new ProviderSecretStoreAdapter(Map.of("secretsGroups.lab.generic.username", "vault:x"), ENV::get));
    assertThrows(IllegalArgumentException.class,
        () -> new ProviderSecretStoreAdapter(Map.of("secretsGroups.lab.generic.username", "env:"), ENV::get));
    assertThrows(IllegalArgumentException.class,
        () -> new ProviderSecretStoreAdapter(Map.of("secretsGroups.lab.telnet.username", "env:X"), ENV::get));
  }
}
