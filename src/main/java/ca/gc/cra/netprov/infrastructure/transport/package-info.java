/**
 * Transport adapter plumbing shared by all drivers: the driver registry and the per-operation time budget
 * decorator. Vendor drivers live in sub-packages.
 */
package ca.gc.cra.netprov.infrastructure.transport;
