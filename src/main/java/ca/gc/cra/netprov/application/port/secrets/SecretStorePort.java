package ca.gc.cra.netprov.application.port.secrets;

import ca.gc.cra.netprov.domain.device.DeviceTarget;
import ca.gc.cra.netprov.domain.device.SecretsGroupRef;

/**
 * <strong>What:</strong> Port onto the external secret store.
 * <p><strong>Role:</strong> Consumed only by {@code CredentialResolver}; storage back ends live in adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent lookups.</p>
 *
 * @since 0.1.0
 */
public interface SecretStorePort {
  /**
   * Fetches one secret value from a secrets group.
   *
   * @param group secrets group
   * @param accessType access method the secret is scoped to
   * @param secretType kind of secret
   * @param context device used as template context when resolving the secret reference
   * @return secret value; may be empty when the provider holds an empty value
   * @throws SecretStoreException if the group, secret or provider value is unavailable
   */
  String secretValue(
      SecretsGroupRef group, SecretAccessType accessType, SecretType secretType, DeviceTarget context)
      throws SecretStoreException;
}
