package ca.gc.cra.netprov.application.port.secrets;

import java.util.Locale;

/**
 * Access method a secret is scoped to within a secrets group.
 *
 * @since 0.1.0
 */
public enum SecretAccessType {
  GENERIC,
  CONSOLE,
  GNMI,
  HTTP,
  NETCONF,
  REST,
  RESTCONF,
  SNMP,
  SSH;

  /**
   * Parses a configuration token such as {@code generic} or {@code ssh}.
   *
   * @param raw token
   * @return access type
   * @throws IllegalArgumentException if the token is unknown
   */
  public static SecretAccessType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("secret access type must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown secret access type: " + raw, ex);
    }
  }
}
