/**
 * Clock adapters.
 */
package ca.gc.cra.netprov.infrastructure.time;
