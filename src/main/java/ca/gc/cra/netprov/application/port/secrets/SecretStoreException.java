package ca.gc.cra.netprov.application.port.secrets;

/**
 * Checked exception raised when a secret cannot be retrieved (missing group or secret, provider failure).
 * Messages must never contain secret values.
 *
 * @since 0.1.0
 */
public final class SecretStoreException extends Exception {
  public SecretStoreException(String msg) { super(msg); }

  public SecretStoreException(String msg, Throwable cause) { super(msg, cause); }
}
