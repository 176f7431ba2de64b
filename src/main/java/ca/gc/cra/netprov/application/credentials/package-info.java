/**
 * Credential resolution for deployment attempts: secrets group first, configured defaults otherwise.
 */
package ca.gc.cra.netprov.application.credentials;
