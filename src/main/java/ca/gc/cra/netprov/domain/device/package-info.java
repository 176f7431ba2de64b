/**
 * Device identity as supplied by the inventory: name, management address, driver and secrets group.
 */
package ca.gc.cra.netprov.domain.device;
