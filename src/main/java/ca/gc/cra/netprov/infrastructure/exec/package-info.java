/**
 * Executor factories for deployment workers and per-operation timeouts.
 */
package ca.gc.cra.netprov.infrastructure.exec;
