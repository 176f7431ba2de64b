package ca.gc.cra.netprov.infrastructure.transport;

import ca.gc.cra.netprov.application.port.transport.CommitFailureException;
import ca.gc.cra.netprov.application.port.transport.ConnectionFailureException;
import ca.gc.cra.netprov.application.port.transport.DiscardFailureException;
import ca.gc.cra.netprov.application.port.transport.StageFailureException;
import ca.gc.cra.netprov.application.port.transport.TransportAdapter;
import ca.gc.cra.netprov.application.port.transport.TransportException;
import ca.gc.cra.netprov.application.port.transport.TransportSession;
import ca.gc.cra.netprov.application.port.transport.TransportTimeoutException;
import ca.gc.cra.netprov.domain.credentials.Credentials;
import ca.gc.cra.netprov.domain.deploy.StageMode;
import ca.gc.cra.netprov.domain.device.DeviceTarget;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decorator that runs every call of a {@link TransportAdapter} under a time budget.
 * <p><strong>Role:</strong> Wraps each registered driver in {@link DriverRegistry} so the orchestrator never
 * blocks indefinitely on a device.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run delegate calls on a worker pool and wait at most the configured {@link TransportTimeouts} budget.</li>
 *   <li>Map a timeout to the failure type of the operation: open to {@link ConnectionFailureException}, stage to
 *   {@link StageFailureException}, commit to a non-rolled-back {@link CommitFailureException}, discard to
 *   {@link DiscardFailureException}, others to {@link TransportTimeoutException}.</li>
 *   <li>Close sessions whose {@code open} completes after the caller gave up.</li>
 *   <li>Serialize delegate calls per session: a call abandoned after its budget keeps the session until it
 *   returns, and later calls on that session wait for it. An abandoned {@code close} is left to finish.</li>
 *   <li>Run {@code discard} and {@code close} even when the calling thread is interrupted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; a session is still driven by one caller at a time.</p>
 *
 * @since 0.1.0
 */
public final class TimeLimitedTransportAdapter implements TransportAdapter {
  private static final Logger log = LoggerFactory.getLogger(TimeLimitedTransportAdapter.class);

  private final TransportAdapter delegate;
  private final TransportTimeouts timeouts;
  private final ExecutorService executor;
  private final Map<TransportSession, ReentrantLock> sessionLocks =
      Collections.synchronizedMap(new IdentityHashMap<>());

  /**
   * Creates the decorator.
   *
   * @param delegate adapter performing the actual calls
   * @param timeouts per-operation budgets
   * @param executor pool running the delegate calls; must not reject tasks while the caller waits
   */
  public TimeLimitedTransportAdapter(
      TransportAdapter delegate, TransportTimeouts timeouts, ExecutorService executor) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Returns the decorated adapter.
   *
   * @return delegate
   */
  public TransportAdapter delegate() {
    return delegate;
  }

  @Override
  public String driver() {
    return delegate.driver();
  }

  @Override
  public TransportSession open(DeviceTarget target, Credentials credentials, Map<String, Object> options)
      throws ConnectionFailureException {
    try {
      return await("open", null, timeouts.open(),
          () -> delegate.open(target, credentials, options), this::closeLate);
    } catch (ConnectionFailureException ex) {
      throw ex;
    } catch (TransportException ex) {
      throw new ConnectionFailureException(ex.getMessage(), ex);
    }
  }

  @Override
  public void stage(TransportSession session, String configText, StageMode mode) throws StageFailureException {
    try {
      await("stage", session, timeouts.stage(), () -> {
        delegate.stage(session, configText, mode);
        return null;
      }, null);
    } catch (StageFailureException ex) {
      throw ex;
    } catch (TransportException ex) {
      throw new StageFailureException(ex.getMessage(), ex);
    }
  }

  @Override
  public String diff(TransportSession session) throws TransportException {
    return await("diff", session, timeouts.diff(), () -> delegate.diff(session), null);
  }

  @Override
  public void commit(TransportSession session) throws CommitFailureException {
    try {
      await("commit", session, timeouts.commit(), () -> {
        delegate.commit(session);
        return null;
      }, null);
    } catch (CommitFailureException ex) {
      throw ex;
    } catch (TransportException ex) {
      throw new CommitFailureException(ex.getMessage(), ex, false);
    }
  }

  @Override
  public void discard(TransportSession session) throws DiscardFailureException {
    boolean interrupted = Thread.interrupted();
    try {
      await("discard", session, timeouts.discard(), () -> {
        delegate.discard(session);
        return null;
      }, null);
    } catch (DiscardFailureException ex) {
      throw ex;
    } catch (TransportException ex) {
      throw new DiscardFailureException(ex.getMessage(), ex);
    } finally {
      restoreInterrupt(interrupted);
    }
  }

  @Override
  public Map<String, Object> facts(TransportSession session) throws TransportException {
    return await("facts", session, timeouts.facts(), () -> delegate.facts(session), null);
  }

  @Override
  public void close(TransportSession session) throws TransportException {
    boolean interrupted = Thread.interrupted();
    try {
      await("close", session, timeouts.close(), () -> {
        try {
          delegate.close(session);
        } finally {
          sessionLocks.remove(session);
        }
        return null;
      }, null);
    } finally {
      restoreInterrupt(interrupted);
    }
  }

  private <T> T await(
      String operation, TransportSession session, Duration budget, TransportCall<T> call, Consumer<T> lateResult)
      throws TransportException {
    boolean closing = operation.equals("close");
    AtomicBoolean claimed = new AtomicBoolean();
    Future<T> future = executor.submit(() -> {
      ReentrantLock lock = session == null ? null : sessionLocks.computeIfAbsent(session, s -> new ReentrantLock());
      if (lock != null) {
        if (closing) {
          lock.lock();
        } else {
          lock.lockInterruptibly();
        }
      }
      try {
        T value = call.call();
        if (lateResult != null && !claimed.compareAndSet(false, true)) {
          lateResult.accept(value);
        }
        return value;
      } finally {
        if (lock != null) {
          lock.unlock();
        }
      }
    });
    try {
      T value = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
      claimed.set(true);
      return value;
    } catch (TimeoutException ex) {
      abandon(future, claimed, lateResult, !closing);
      log.warn("{} on {} exceeded its {} ms budget", operation, driver(), budget.toMillis());
      throw new TransportTimeoutException(operation, budget);
    } catch (InterruptedException ex) {
      abandon(future, claimed, lateResult, !closing);
      Thread.currentThread().interrupt();
      throw new TransportException(operation + " interrupted", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof TransportException transportFailure) {
        throw transportFailure;
      }
      if (cause instanceof RuntimeException runtimeFailure) {
        throw runtimeFailure;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new TransportException(operation + " failed", cause);
    }
  }

  private <T> void abandon(
      Future<T> future, AtomicBoolean claimed, Consumer<T> lateResult, boolean interruptWorker) {
    if (lateResult == null || claimed.compareAndSet(false, true)) {
      if (interruptWorker) {
        future.cancel(true);
      }
      return;
    }
    // The call finished while the caller gave up: the worker handed the result over to us.
    boolean interrupted = Thread.interrupted();
    try {
      lateResult.accept(future.get());
    } catch (InterruptedException | ExecutionException ex) {
      log.debug("Late result of abandoned {} call was not retrievable", driver(), ex);
    } finally {
      restoreInterrupt(interrupted);
    }
  }

  private void closeLate(TransportSession session) {
    log.warn("Closing session to {} opened after the caller gave up", session.target().name());
    try {
      delegate.close(session);
    } catch (TransportException | RuntimeException ex) {
      log.warn("Failed to close late session to {}: {}", session.target().name(), ex.toString());
    }
  }

  private static void restoreInterrupt(boolean interrupted) {
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  @FunctionalInterface
  private interface TransportCall<T> {
    T call() throws TransportException;
  }
}
