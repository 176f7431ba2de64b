package ca.gc.cra.netprov.infrastructure.time;

import ca.gc.cra.netprov.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing; deployment latency is measured
   *     in whole milliseconds.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
