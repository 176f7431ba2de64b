/**
 * Provisioning job: resolves devices from the inventory, fetches their intended configuration and drives the
 * deployment orchestrator, one device at a time or across a bounded worker pool.
 */
package ca.gc.cra.netprov.application.provision;
