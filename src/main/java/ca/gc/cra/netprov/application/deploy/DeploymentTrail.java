package ca.gc.cra.netprov.application.deploy;

import ca.gc.cra.netprov.domain.deploy.TrailEntry;
import ca.gc.cra.netprov.domain.deploy.TrailEntry.Tier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

/**
 * Collects the human-readable diagnostic trail of one attempt and mirrors each entry to SLF4J.
 *
 * <p>{@code SUCCESS} entries are logged at INFO. Not thread-safe; owned by a single attempt.</p>
 *
 * @since 0.1.0
 */
public final class DeploymentTrail {
  private final Logger log;
  private final List<TrailEntry> entries = new ArrayList<>();

  /**
   * Creates a trail that mirrors entries to {@code log}.
   *
   * @param log destination logger
   */
  public DeploymentTrail(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  public void info(String format, Object... args) {
    String message = format(format, args);
    log.info(message);
    entries.add(new TrailEntry(Tier.INFO, message));
  }

  public void success(String format, Object... args) {
    String message = format(format, args);
    log.info(message);
    entries.add(new TrailEntry(Tier.SUCCESS, message));
  }

  public void warning(String format, Object... args) {
    String message = format(format, args);
    log.warn(message);
    entries.add(new TrailEntry(Tier.WARNING, message));
  }

  public void error(String format, Object... args) {
    String message = format(format, args);
    log.error(message);
    entries.add(new TrailEntry(Tier.ERROR, message));
  }

  /**
   * Returns a snapshot of the entries recorded so far.
   *
   * @return immutable copy in emission order
   */
  public List<TrailEntry> entries() {
    return List.copyOf(entries);
  }

  private static String format(String format, Object... args) {
    return MessageFormatter.arrayFormat(format, args).getMessage();
  }
}
