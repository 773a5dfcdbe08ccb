package tech.yump.cendre.storage;

import lombok.extern.slf4j.Slf4j;
import tech.yump.cendre.secrets.Secret;
import tech.yump.cendre.secrets.SecretValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process {@link SecretStore} for tests and local development.
 * <p>
 * All map access happens under one lock, so the check-and-remove in {@link #take(String)} is indivisible.
 * Expired entries are dropped lazily on access and by a periodic sweep; the sweep only reclaims memory.
 * Offers no durability and no cross-process guarantee.
 */
@Slf4j
public class InMemorySecretStore extends AbstractSecretStore {

  private final Map<String, Secret> secrets = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Duration sweepInterval;

  private ScheduledExecutorService sweeper;

  public InMemorySecretStore(SecretValidator validator, Clock clock, Duration sweepInterval) {
    super(validator, clock);
    this.sweepInterval = sweepInterval;
  }

  @Override
  public synchronized void start() {
    if (sweeper != null) {
      return;
    }
    sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "cendre-memory-sweeper");
      thread.setDaemon(true);
      return thread;
    });
    long periodMillis = sweepInterval.toMillis();
    sweeper.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    log.info("InMemorySecretStore started. Expired secrets are swept every {}", sweepInterval);
  }

  @Override
  public synchronized void close() {
    if (sweeper == null) {
      return;
    }
    sweeper.shutdownNow();
    sweeper = null;
    log.info("InMemorySecretStore stopped.");
  }

  @Override
  protected void write(Secret secret) {
    lock.lock();
    try {
      if (secrets.putIfAbsent(secret.id(), secret) != null) {
        throw new InvariantViolationException("Secret id collision detected for id '" + secret.id() + "'");
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  protected Optional<Secret> fetchAndDelete(String id) {
    Instant now = clock.instant();
    lock.lock();
    try {
      Secret secret = secrets.remove(id);
      if (secret == null || secret.isExpiredAt(now)) {
        return Optional.empty();
      }
      return Optional.of(secret);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void ping() {
    // Nothing to verify beyond being constructed.
  }

  @Override
  public String description() {
    return "memory";
  }

  /**
   * Removes every expired entry.
   *
   * @return the number of entries removed.
   */
  public int sweepExpired() {
    Instant now = clock.instant();
    int removed = 0;
    lock.lock();
    try {
      Iterator<Secret> iterator = secrets.values().iterator();
      while (iterator.hasNext()) {
        if (iterator.next().isExpiredAt(now)) {
          iterator.remove();
          removed++;
        }
      }
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      log.debug("Swept {} expired secret(s) from memory", removed);
    }
    return removed;
  }

  /**
   * Number of entries currently held, including expired ones not yet swept.
   */
  public int size() {
    lock.lock();
    try {
      return secrets.size();
    } finally {
      lock.unlock();
    }
  }

  private void sweepSafely() {
    try {
      sweepExpired();
    } catch (RuntimeException e) {
      // An exception would cancel the scheduled task; log and keep sweeping.
      log.error("Failed to sweep expired secrets: {}", e.getMessage(), e);
    }
  }
}
