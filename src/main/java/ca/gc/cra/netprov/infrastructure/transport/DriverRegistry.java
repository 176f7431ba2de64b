package ca.gc.cra.netprov.infrastructure.transport;

import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.port.transport.TransportProvider;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportProvider} over a fixed set of drivers, each wrapped in a {@link TimeLimitedTransportAdapter}.
 *
 * <p>Immutable once built; thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DriverRegistry implements TransportProvider {
  private static final Logger log = LoggerFactory.getLogger(DriverRegistry.class);

  private final Map<String, TransportAdapter> adapters;

  private DriverRegistry(Map<String, TransportAdapter> adapters) {
    this.adapters = Map.copyOf(adapters);
  }

  /**
   * Starts a registry whose adapters run under {@code timeouts} on {@code executor}.
   *
   * @param timeouts per-operation budgets
   * @param executor pool executing transport calls
   * @return builder
   */
  public static Builder builder(TransportTimeouts timeouts, ExecutorService executor) {
    return new Builder(timeouts, executor);
  }

  @Override
  public Optional<TransportAdapter> forDriver(String driver) {
    if (driver == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(adapters.get(driver.trim().toLowerCase(Locale.ROOT)));
  }

  @Override
  public Set<String> drivers() {
    return adapters.keySet();
  }

  /** Collects drivers before the registry is frozen. */
  public static final class Builder {
    private final TransportTimeouts timeouts;
    private final ExecutorService executor;
    private final Map<String, TransportAdapter> adapters = new LinkedHashMap<>();

    private Builder(TransportTimeouts timeouts, ExecutorService executor) {
      this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
      this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Registers an adapter under its {@link TransportAdapter#driver()} id.
     *
     * @param adapter adapter to register
     * @return this builder
     * @throws IllegalArgumentException if the driver id is already registered
     */
    public Builder register(TransportAdapter adapter) {
      Objects.requireNonNull(adapter, "adapter");
      String id = adapter.driver().trim().toLowerCase(Locale.ROOT);
      if (adapters.containsKey(id)) {
        throw new IllegalArgumentException("driver already registered: " + id);
      }
      adapters.put(id, new TimeLimitedTransportAdapter(adapter, timeouts, executor));
      log.debug("Registered transport driver {}", id);
      return this;
    }

    public DriverRegistry build() {
      return new DriverRegistry(adapters);
    }
  }
}
