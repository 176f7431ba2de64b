/**
 * Application layer orchestration for NETPROV deployments.
 * <p><strong>Role:</strong> Hosts the credential resolver, the deployment orchestrator and the provisioning
 * job, plus the ports they consume.</p>
 * <p><strong>Concurrency:</strong> One deployment attempt is sequential; the provisioning job runs independent
 * devices in parallel and serializes attempts per device.</p>
 * <p><strong>Metrics:</strong> Emits namespaces including {@code deploy.*}, {@code credentials.*} and
 * {@code provision.*}.</p>
 * <p><strong>Security:</strong> Passwords never leave the credential value objects; logs carry usernames and
 * provenance only.</p>
 */
package ca.gc.cra.netprov.application;
