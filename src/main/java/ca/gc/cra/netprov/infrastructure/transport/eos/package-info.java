/**
 * Arista EOS driver ({@code eos}) speaking eAPI JSON-RPC over HTTP(S) and staging candidates in configuration
 * sessions.
 */
package ca.gc.cra.netprov.infrastructure.transport.eos;
