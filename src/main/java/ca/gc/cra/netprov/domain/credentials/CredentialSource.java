package ca.gc.cra.netprov.domain.credentials;

import java.util.Locale;

/**
 * Where a credential value came from.
 *
 * @since 0.1.0
 */
public enum CredentialSource {
  /** Value fetched from the secret store through the device's secrets group. */
  FROM_SECRET_STORE,
  /** Configured fallback value. */
  DEFAULT;

  /**
   * Returns the lower-case tag used in metric names and diagnostics.
   *
   * @return tag such as {@code from_secret_store}
   */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
