/**
 * Ports describing the collaborators NETPROV consumes: device transports, the secret store, the intended
 * configuration store, the device inventory, metrics and time.
 */
package ca.gc.cra.netprov.application.port;
