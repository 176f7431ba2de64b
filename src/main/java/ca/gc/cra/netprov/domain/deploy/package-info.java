/**
 * Deployment request, outcome and state-machine vocabulary.
 * <p><strong>Role:</strong> Values exchanged between the provisioning job, the deployment orchestrator and the
 * CLI.</p>
 */
package ca.gc.cra.netprov.domain.deploy;
