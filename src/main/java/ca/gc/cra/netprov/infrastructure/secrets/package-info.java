/**
 * Secret store adapter resolving secrets-group references against environment variables and text files.
 */
package ca.gc.cra.netprov.infrastructure.secrets;
