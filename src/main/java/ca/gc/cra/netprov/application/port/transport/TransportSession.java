package ca.gc.cra.netprov.application.port.transport;

import ca.gc.cra.netprov.domain.device.DeviceTarget;

/**
 * Live connection handle returned by {@link TransportAdapter#open}.
 *
 * <p>Owned by exactly one deployment attempt; never shared between threads. Adapters keep their
 * driver-specific state behind this handle.</p>
 *
 * @since 0.1.0
 */
public interface TransportSession {
  /**
   * Device the session is connected to.
   *
   * @return target device
   */
  DeviceTarget target();
}
