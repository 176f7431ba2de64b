/**
 * Logging bootstrap and log-hygiene helpers.
 * <p><strong>Security:</strong> {@link ca.gc.cra.netprov.logging.Logs#redact(String)} is the only way credential
 * values appear in output.</p>
 */
package ca.gc.cra.netprov.logging;
