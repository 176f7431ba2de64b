package ca.gc.cra.netprov.application.credentials;

import ca.gc.cra.netprov.logging.Logs;
import java.util.Objects;

/**
 * Fallback username/password used for any field the secret store cannot supply.
 *
 * @param username fallback username
 * @param password fallback password
 * @since 0.1.0
 */
public record DefaultCredentials(String username, String password) {
  /** Lab default pair {@code admin}/{@code admin}. */
  public static final DefaultCredentials LAB = new DefaultCredentials("admin", "admin");

  public DefaultCredentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  @Override
  public String toString() {
    return "DefaultCredentials[username=" + username + ", password=" + Logs.redact(password) + "]";
  }
}
