/**
 * {@link ca.gc.cra.netprov.application.port.MetricsPort} adapters backed by OpenTelemetry or discarding all
 * updates.
 */
package ca.gc.cra.netprov.infrastructure.metrics;
