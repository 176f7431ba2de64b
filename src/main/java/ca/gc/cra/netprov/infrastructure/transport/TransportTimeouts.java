package ca.gc.cra.netprov.infrastructure.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-operation time budgets applied by {@link TimeLimitedTransportAdapter}.
 *
 * @param open connection and login budget
 * @param stage candidate load budget
 * @param diff diff computation budget
 * @param commit commit budget
 * @param discard discard budget
 * @param facts fact query budget
 * @param close session close budget
 * @since 0.1.0
 */
public record TransportTimeouts(
    Duration open,
    Duration stage,
    Duration diff,
    Duration commit,
    Duration discard,
    Duration facts,
    Duration close) {

  public TransportTimeouts {
    requirePositive("open", open);
    requirePositive("stage", stage);
    requirePositive("diff", diff);
    requirePositive("commit", commit);
    requirePositive("discard", discard);
    requirePositive("facts", facts);
    requirePositive("close", close);
  }

  /**
   * Returns the default budgets: open 30s, stage 60s, diff 60s, commit 120s, discard 30s, facts 30s,
   * close 15s.
   *
   * @return default budgets
   */
  public static TransportTimeouts defaults() {
    return new TransportTimeouts(
        Duration.ofSeconds(30),
        Duration.ofSeconds(60),
        Duration.ofSeconds(60),
        Duration.ofSeconds(120),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        Duration.ofSeconds(15));
  }

  /**
   * Returns the same budget for every operation. Used by tests and labs.
   *
   * @param budget budget applied to all operations
   * @return uniform budgets
   */
  public static TransportTimeouts uniform(Duration budget) {
    return new TransportTimeouts(budget, budget, budget, budget, budget, budget, budget);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " timeout must be positive");
    }
  }
}
