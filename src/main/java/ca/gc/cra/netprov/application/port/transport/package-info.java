/**
 * Vendor-neutral device transport capability and its failure taxonomy.
 * <p>Every driver maps its native errors into {@link ca.gc.cra.netprov.application.port.transport.TransportException}
 * subclasses so the orchestrator reasons about failure kinds only.</p>
 */
package ca.gc.cra.netprov.application.port.transport;
