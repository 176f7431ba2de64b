/**
 * Deployment state machine: connect, stage, diff, then commit or discard, always closing the session.
 * <p><strong>Concurrency:</strong> One attempt runs sequentially on the calling thread; independent
 * orchestrator calls for different devices may run in parallel.</p>
 * <p><strong>Metrics:</strong> {@code deploy.attempts}, {@code deploy.status.*}, {@code deploy.latencyMillis},
 * {@code deploy.discard.failed}, {@code deploy.close.failed}.</p>
 */
package ca.gc.cra.netprov.application.deploy;
