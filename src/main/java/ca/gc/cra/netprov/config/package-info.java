/**
 * Configuration loading (YAML plus CLI overrides), validated configuration records and the composition root
 * wiring use cases to adapters.
 */
package ca.gc.cra.netprov.config;
