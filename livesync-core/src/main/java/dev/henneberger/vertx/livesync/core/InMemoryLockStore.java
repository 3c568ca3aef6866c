package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps locks in process memory. Only correct when a single process serves the tenant.
 */
public final class InMemoryLockStore implements LockStore {

  private final Map<String, Lock> locks = new LinkedHashMap<>();

  @Override
  public synchronized Future<Lock> acquire(Lock requested) {
    Objects.requireNonNull(requested, "requested");
    Lock current = locks.get(requested.recordId());
    if (current != null && !current.isExpired(requested.acquiredAt()) && !current.sameHolder(requested)) {
      return Future.failedFuture(new LockHeldException(current));
    }
    locks.put(requested.recordId(), requested);
    return Future.succeededFuture(requested);
  }

  @Override
  public synchronized Future<Integer> release(UnlockCriteria criteria) {
    Objects.requireNonNull(criteria, "criteria");
    int removed = 0;
    Iterator<Lock> it = locks.values().iterator();
    while (it.hasNext()) {
      if (criteria.matches(it.next())) {
        it.remove();
        removed++;
      }
    }
    return Future.succeededFuture(removed);
  }

  @Override
  public synchronized Future<Lock> find(String recordId) {
    return Future.succeededFuture(locks.get(recordId));
  }

  @Override
  public synchronized Future<Integer> purgeExpired(Instant now) {
    int removed = 0;
    Iterator<Lock> it = locks.values().iterator();
    while (it.hasNext()) {
      if (it.next().isExpired(now)) {
        it.remove();
        removed++;
      }
    }
    return Future.succeededFuture(removed);
  }

  public synchronized int size() {
    return locks.size();
  }
}
