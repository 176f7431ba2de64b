/**
 * Adapters implementing the application ports: transport drivers, secret providers, file and YAML collaborators,
 * metrics and executors.
 */
package ca.gc.cra.netprov.infrastructure;
