package ca.gc.cra.netprov.application.port.transport;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves driver identifiers to transport adapters.
 *
 * @since 0.1.0
 */
public interface TransportProvider {
  /**
   * Looks up the adapter serving a driver.
   *
   * @param driver driver id (case-insensitive)
   * @return adapter, or empty when no adapter is registered
   */
  Optional<TransportAdapter> forDriver(String driver);

  /**
   * Lists registered driver ids.
   *
   * @return driver ids
   */
  Set<String> drivers();
}
