/**
 * CLI entry points for the {@code provision} and {@code credentials} commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, and invokes use cases.</p>
 * <p><strong>Security:</strong> Never prints passwords; credentials are shown redacted.</p>
 */
package ca.gc.cra.netprov.api;
