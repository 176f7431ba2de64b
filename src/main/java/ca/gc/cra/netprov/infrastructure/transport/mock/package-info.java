/**
 * In-memory {@code mock} driver for labs, demonstrations and end-to-end tests.
 */
package ca.gc.cra.netprov.infrastructure.transport.mock;
