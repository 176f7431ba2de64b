package ca.gc.cra.netprov.domain.credentials;

import ca.gc.cra.netprov.logging.Logs;
import java.util.Objects;

/**
 * <strong>What:</strong> Username/password pair used to open one transport session.
 * <p><strong>Role:</strong> Produced once per deployment attempt by the credential resolver and discarded
 * afterwards.</p>
 * <p><strong>Security:</strong> {@link #toString()} redacts the password; callers must never log
 * {@link #password()} directly.</p>
 *
 * @param username login name
 * @param password login secret
 * @param usernameSource provenance of {@code username}
 * @param passwordSource provenance of {@code password}
 * @since 0.1.0
 */
public record Credentials(
    String username,
    String password,
    CredentialSource usernameSource,
    CredentialSource passwordSource) {

  public Credentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(usernameSource, "usernameSource");
    Objects.requireNonNull(passwordSource, "passwordSource");
  }

  /**
   * Provenance of the pair: {@link CredentialSource#FROM_SECRET_STORE} when at least one field was read from
   * the secret store.
   *
   * @return pair provenance
   */
  public CredentialSource provenance() {
    if (usernameSource == CredentialSource.FROM_SECRET_STORE
        || passwordSource == CredentialSource.FROM_SECRET_STORE) {
      return CredentialSource.FROM_SECRET_STORE;
    }
    return CredentialSource.DEFAULT;
  }

  @Override
  public String toString() {
    return "Credentials[username=" + username
        + ", password=" + Logs.redact(password)
        + ", provenance=" + provenance().tag() + "]";
  }
}
