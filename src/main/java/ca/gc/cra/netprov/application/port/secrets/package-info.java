/**
 * Secret store port used by the credential resolver.
 */
package ca.gc.cra.netprov.application.port.secrets;
