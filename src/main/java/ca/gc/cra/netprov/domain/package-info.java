/**
 * Domain model for NETPROV device configuration deployments.
 * <p><strong>Role:</strong> Immutable value types shared by the credential resolver, the deployment
 * orchestrator, and the adapters that talk to devices and collaborator stores.</p>
 * <p><strong>Thread-safety:</strong> All types are immutable records or enums.</p>
 * <p><strong>Security:</strong> {@link ca.gc.cra.netprov.domain.credentials.Credentials} never renders its
 * password in {@code toString()}.</p>
 */
package ca.gc.cra.netprov.domain;
