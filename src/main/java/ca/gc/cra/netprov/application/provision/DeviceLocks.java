package ca.gc.cra.netprov.application.provision;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed locks serializing deployment attempts per device name within this process.
 *
 * <p>Locks are created on first use and kept for the lifetime of the instance. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DeviceLocks {
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Blocks until the lock for {@code device} is held by the calling thread.
   *
   * @param device device name
   * @return lease releasing the lock on close; must be closed by the same thread
   * @throws InterruptedException if interrupted while waiting
   */
  public Lease acquire(String device) throws InterruptedException {
    ReentrantLock lock = locks.computeIfAbsent(Objects.requireNonNull(device, "device"), k -> new ReentrantLock());
    lock.lockInterruptibly();
    return new Lease(lock);
  }

  /**
   * Indicates whether another attempt currently holds the device.
   *
   * @param device device name
   * @return {@code true} while the device is locked
   */
  public boolean isLocked(String device) {
    ReentrantLock lock = locks.get(device);
    return lock != null && lock.isLocked();
  }

  /** Held device lock. */
  public static final class Lease implements AutoCloseable {
    private final ReentrantLock lock;

    private Lease(ReentrantLock lock) {
      this.lock = lock;
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
