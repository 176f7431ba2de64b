package ca.gc.cra.netprov.application.port.secrets;

import java.util.Locale;

/**
 * Kind of secret value stored in a secrets group.
 *
 * @since 0.1.0
 */
public enum SecretType {
  KEY,
  PASSWORD,
  SECRET,
  TOKEN,
  USERNAME;

  /**
   * Parses a configuration token such as {@code username}.
   *
   * @param raw token
   * @return secret type
   * @throws IllegalArgumentException if the token is unknown
   */
  public static SecretType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("secret type must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown secret type: " + raw, ex);
    }
  }
}
