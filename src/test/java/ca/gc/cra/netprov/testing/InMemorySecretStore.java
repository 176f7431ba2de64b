package ca.gc.cra.netprov.testing;

import ca.gc.cra.netprov.application.port.secrets.SecretAccessType;
import ca.gc.cra.netprov.application.port.secrets.SecretStoreException;
import ca.gc.cra.netprov.application.port.secrets.SecretStorePort;
import ca.gc.cra.netprov.application.port.secrets.SecretType;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Secret store double keyed by group and secret type. Unknown entries raise {@link SecretStoreException};
 * entries can also be scripted to fail.
 */
public final class InMemorySecretStore implements SecretStorePort {
  private final Map<String, String> values = new HashMap<>();
  private final Map<String, Exception> failures = new HashMap<>();
  private final List<String> lookups = new ArrayList<>();

  public InMemorySecretStore put(String group, SecretType type, String value) {
    values.put(key(group, type), value);
    return this;
  }

  public InMemorySecretStore fail(String group, SecretType type, Exception failure) {
    failures.put(key(group, type), failure);
    return this;
  }

  public List<String> lookups() {
    return List.copyOf(lookups);
  }

  @Override
  public String secretValue(
      SecretsGroupRef group, SecretAccessType accessType, SecretType secretType, DeviceTarget context)
      throws SecretStoreException {
    String key = key(group.name(), secretType);
    lookups.add(key + "@" + accessType + "/" + context.name());
    Exception failure = failures.get(key);
    if (failure instanceof SecretStoreException checked) {
      throw checked;
    }
    if (failure instanceof RuntimeException unchecked) {
      throw unchecked;
    }
    if (!values.containsKey(key)) {
      throw new SecretStoreException("no " + secretType + " secret in group " + group.name());
    }
    return values.get(key);
  }

  private static String key(String group, SecretType type) {
    return group + "/" + type;
  }
}
