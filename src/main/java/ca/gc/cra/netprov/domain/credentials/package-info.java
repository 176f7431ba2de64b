/**
 * Credential values and their provenance.
 */
package ca.gc.cra.netprov.domain.credentials;
