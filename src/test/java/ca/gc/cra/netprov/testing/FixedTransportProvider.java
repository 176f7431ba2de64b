package ca.gc.cra.netprov.testing;

import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.port.transport.TransportProvider;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Transport provider over a fixed set of adapters, without timeouts. */
public final class FixedTransportProvider implements TransportProvider {
  private final Map<String, TransportAdapter> adapters = new LinkedHashMap<>();

  public FixedTransportProvider(TransportAdapter... adapters) {
    for (TransportAdapter adapter : adapters) {
      this.adapters.put(adapter.driver(), adapter);
    }
  }

  @Override
  public Optional<TransportAdapter> forDriver(String driver) {
    return Optional.ofNullable(adapters.get(driver));
  }

  @Override
  public Set<String> drivers() {
    return Set.copyOf(adapters.keySet());
  }
}
