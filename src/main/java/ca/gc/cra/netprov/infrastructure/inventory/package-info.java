/**
 * YAML-backed device inventory.
 */
package ca.gc.cra.netprov.infrastructure.inventory;
