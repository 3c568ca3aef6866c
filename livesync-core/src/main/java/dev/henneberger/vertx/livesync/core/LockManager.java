package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grants and releases record locks held in each tenant's {@link LockStore}, and releases the
 * locks of a session when it goes away.
 */
public final class LockManager implements SessionTeardownListener {

  private static final Logger LOG = LoggerFactory.getLogger(LockManager.class);

  private final Vertx vertx;
  private final LockStoreProvider stores;
  private final String nodeId;
  private final Duration defaultTtl;
  private final Clock clock;
  // event key -> tenants it has locked records in
  private final Map<String, Set<String>> lockedTenants = new HashMap<>();
  private long sweepTimer = -1L;

  public LockManager(Vertx vertx, LockStoreProvider stores, String nodeId, Duration defaultTtl) {
    this(vertx, stores, nodeId, defaultTtl, Clock.systemUTC());
  }

  public LockManager(Vertx vertx, LockStoreProvider stores, String nodeId, Duration defaultTtl, Clock clock) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    this.defaultTtl = defaultTtl == null ? Duration.ZERO : defaultTtl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Locks {@code recordId} for {@code username} on behalf of {@code eventKey}. Locking a record
   * the same session already holds refreshes the lock; any other live holder makes this fail
   * with {@link LockHeldException}.
   */
  public Future<Lock> lock(String tenantId,
                           String recordId,
                           String username,
                           String eventKey,
                           LockOptions options) {
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(username, "username");
    LockOptions resolved = options == null ? LockOptions.defaults() : options;
    Duration ttl = resolved.getTtl() == null ? defaultTtl : resolved.getTtl();
    Instant now = clock.instant();
    Lock requested = new Lock(recordId, username, eventKey, nodeId, now, ttl.isZero() ? null : now.plus(ttl));

    LockStore store;
    try {
      store = stores.forTenant(tenantId);
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
    return store.acquire(requested)
      .onSuccess(lock -> {
        track(eventKey, tenantId);
        LOG.debug("Locked {} for {} ({})", recordId, username, eventKey);
      })
      .onFailure(err -> {
        if (err instanceof LockHeldException) {
          LOG.debug("Lock on {} refused for {}: held by {}", recordId, username,
            ((LockHeldException) err).holder().username());
        } else {
          LOG.warn("Lock on {} failed for {}", recordId, username, err);
        }
      });
  }

  /**
   * Releases the matching locks. Releasing a lock that does not exist is not an error.
   */
  public Future<Integer> unlock(String tenantId, UnlockCriteria criteria) {
    Objects.requireNonNull(criteria, "criteria");
    try {
      return stores.forTenant(tenantId).release(criteria)
        .onSuccess(count -> LOG.debug("Released {} lock(s) matching {}", count, criteria));
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
  }

  public Future<Lock> find(String tenantId, String recordId) {
    try {
      return stores.forTenant(tenantId).find(recordId);
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
  }

  public Future<Integer> releaseAll(String tenantId, String eventKey) {
    return unlock(tenantId, UnlockCriteria.eventKey(eventKey));
  }

  /**
   * Drops locks left behind by an earlier run of this node.
   */
  public Future<Integer> releaseNodeLocks(Collection<String> tenantIds) {
    List<Future<Integer>> releases = new ArrayList<>();
    for (String tenantId : tenantIds) {
      releases.add(unlock(tenantId, UnlockCriteria.node(nodeId)));
    }
    return sum(releases);
  }

  public Future<Integer> purgeExpired(Collection<String> tenantIds) {
    Instant now = clock.instant();
    List<Future<Integer>> purges = new ArrayList<>();
    for (String tenantId : tenantIds) {
      try {
        purges.add(stores.forTenant(tenantId).purgeExpired(now));
      } catch (RuntimeException e) {
        purges.add(Future.failedFuture(e));
      }
    }
    return sum(purges);
  }

  /**
   * Periodically deletes expired locks of the tenants {@code tenantIds} reports.
   */
  public void startExpirySweep(Duration interval, Supplier<Collection<String>> tenantIds) {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(tenantIds, "tenantIds");
    stopExpirySweep();
    if (interval.isZero() || interval.isNegative()) {
      return;
    }
    sweepTimer = vertx.setPeriodic(interval.toMillis(), id -> purgeExpired(tenantIds.get())
      .onSuccess(count -> {
        if (count > 0) {
          LOG.info("Expired {} lock(s)", count);
        }
      })
      .onFailure(err -> LOG.warn("Lock expiry sweep failed", err)));
  }

  public void stopExpirySweep() {
    if (sweepTimer >= 0) {
      vertx.cancelTimer(sweepTimer);
      sweepTimer = -1L;
    }
  }

  public String nodeId() {
    return nodeId;
  }

  /**
   * Releases the locks of {@code eventKey} in its own tenant and in every tenant it locked a
   * record in, whichever tenant the session itself belongs to.
   */
  @Override
  public void onTeardown(String eventKey, String tenantId) {
    if (eventKey == null) {
      return;
    }
    Set<String> tenantIds;
    synchronized (lockedTenants) {
      Set<String> tracked = lockedTenants.remove(eventKey);
      tenantIds = tracked == null ? new LinkedHashSet<>() : tracked;
    }
    if (tenantId != null) {
      tenantIds.add(tenantId);
    }
    if (tenantIds.isEmpty()) {
      return;
    }
    List<Future<Integer>> releases = new ArrayList<>();
    for (String id : tenantIds) {
      releases.add(releaseAll(id, eventKey));
    }
    sum(releases)
      .onSuccess(count -> {
        if (count > 0) {
          LOG.info("Released {} lock(s) held by {}", count, eventKey);
        }
      })
      .onFailure(err -> LOG.warn("Could not release locks held by {}", eventKey, err));
  }

  private void track(String eventKey, String tenantId) {
    if (eventKey == null) {
      return;
    }
    synchronized (lockedTenants) {
      lockedTenants.computeIfAbsent(eventKey, key -> new LinkedHashSet<>()).add(tenantId);
    }
  }

  private static Future<Integer> sum(List<Future<Integer>> futures) {
    if (futures.isEmpty()) {
      return Future.succeededFuture(0);
    }
    return Future.join(futures).map(composite -> {
      int total = 0;
      for (int i = 0; i < composite.size(); i++) {
        Integer count = composite.resultAt(i);
        total += count == null ? 0 : count;
      }
      return total;
    });
  }
}
