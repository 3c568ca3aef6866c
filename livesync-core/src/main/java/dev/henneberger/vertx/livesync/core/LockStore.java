package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.time.Instant;

/**
 * Storage for record locks. Implementations shared by several processes must make
 * {@link #acquire(Lock)} atomic.
 */
public interface LockStore {

  /**
   * Stores {@code requested} unless another holder has a lock on the same record that has not
   * expired by {@code requested.acquiredAt()}. A re-lock by the same holder replaces the stored
   * lock. Fails with {@link LockHeldException} naming the current holder otherwise.
   */
  Future<Lock> acquire(Lock requested);

  Future<Integer> release(UnlockCriteria criteria);

  /**
   * The lock on {@code recordId}, or {@code null}.
   */
  Future<Lock> find(String recordId);

  Future<Integer> purgeExpired(Instant now);
}
