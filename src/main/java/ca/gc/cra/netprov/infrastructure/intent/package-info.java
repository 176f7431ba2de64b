/**
 * File-backed configuration-intent store.
 */
package ca.gc.cra.netprov.infrastructure.intent;
