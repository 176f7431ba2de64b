/**
 * Input validation helpers shared by configuration loading, the CLI and the inventory adapter.
 * <p><strong>Security:</strong> Rejects control characters, malformed hosts and unreadable paths before any
 * adapter touches the network or file system.</p>
 */
package ca.gc.cra.netprov.validation;
