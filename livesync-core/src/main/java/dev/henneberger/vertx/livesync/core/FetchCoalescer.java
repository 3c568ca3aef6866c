package dev.henneberger.vertx.livesync.core;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses concurrent re-fetches of the same record into one query.
 *
 * <p>Requests are queued in arrival order. A request for a record that is already queued or in
 * flight joins that entry instead of issuing another query. At most {@code maxConcurrent}
 * distinct records are fetched at a time, and never the same record twice at once. Confined to
 * the owning event loop.
 */
public final class FetchCoalescer {

  private static final Logger LOG = LoggerFactory.getLogger(FetchCoalescer.class);

  private final QueryExecutor executor;
  private final int maxConcurrent;
  private final Map<FetchKey, PendingFetch> pending = new LinkedHashMap<>();
  private int inFlight;

  public FetchCoalescer(QueryExecutor executor) {
    this(executor, 1);
  }

  public FetchCoalescer(QueryExecutor executor, int maxConcurrent) {
    this.executor = Objects.requireNonNull(executor, "executor");
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be >= 1");
    }
    this.maxConcurrent = maxConcurrent;
  }

  public void requestFetch(String feather, String id, Tenant tenant, Handler<AsyncResult<JsonObject>> callback) {
    Objects.requireNonNull(feather, "feather");
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(callback, "callback");

    FetchKey key = new FetchKey(tenant == null ? null : tenant.id(), feather, id);
    PendingFetch existing = pending.get(key);
    if (existing != null) {
      existing.waiters.add(callback);
      LOG.debug("Coalesced fetch of {} '{}' ({} waiting)", feather, id, existing.waiters.size());
      return;
    }

    pending.put(key, new PendingFetch(key, tenant, callback));
    pump();
  }

  public int pendingCount() {
    return pending.size();
  }

  public int inFlightCount() {
    return inFlight;
  }

  private void pump() {
    while (inFlight < maxConcurrent) {
      PendingFetch next = nextQueued();
      if (next == null) {
        return;
      }
      begin(next);
    }
  }

  private PendingFetch nextQueued() {
    for (PendingFetch candidate : pending.values()) {
      if (!candidate.started) {
        return candidate;
      }
    }
    return null;
  }

  private void begin(PendingFetch fetch) {
    fetch.started = true;
    inFlight++;

    Future<JsonObject> result;
    try {
      result = executor.fetch(fetch.key.feather, fetch.key.id, fetch.tenant);
      if (result == null) {
        result = Future.failedFuture(new IllegalStateException("query executor returned no future"));
      }
    } catch (RuntimeException e) {
      result = Future.failedFuture(e);
    }
    result.onComplete(ar -> finish(fetch, ar));
  }

  private void finish(PendingFetch fetch, AsyncResult<JsonObject> ar) {
    inFlight--;
    if (pending.get(fetch.key) == fetch) {
      pending.remove(fetch.key);
    }

    AsyncResult<JsonObject> outcome = ar;
    if (ar.failed()) {
      LOG.warn("Fetch of {} '{}' failed for {} waiter(s)", fetch.key.feather, fetch.key.id, fetch.waiters.size(),
        ar.cause());
      outcome = Future.failedFuture(new FetchFailedException(fetch.key.feather, fetch.key.id, ar.cause()));
    }

    for (Handler<AsyncResult<JsonObject>> waiter : new ArrayList<>(fetch.waiters)) {
      try {
        waiter.handle(outcome);
      } catch (RuntimeException e) {
        LOG.warn("Fetch waiter for {} '{}' threw", fetch.key.feather, fetch.key.id, e);
      }
    }
    pump();
  }

  private static final class PendingFetch {
    private final FetchKey key;
    private final Tenant tenant;
    private final List<Handler<AsyncResult<JsonObject>>> waiters = new ArrayList<>();
    private boolean started;

    private PendingFetch(FetchKey key, Tenant tenant, Handler<AsyncResult<JsonObject>> first) {
      this.key = key;
      this.tenant = tenant;
      this.waiters.add(first);
    }
  }

  private static final class FetchKey {
    private final String tenantId;
    private final String feather;
    private final String id;

    private FetchKey(String tenantId, String feather, String id) {
      this.tenantId = tenantId;
      this.feather = feather;
      this.id = id;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof FetchKey)) {
        return false;
      }
      FetchKey other = (FetchKey) o;
      return Objects.equals(tenantId, other.tenantId) && feather.equals(other.feather) && id.equals(other.id);
    }

    @Override
    public int hashCode() {
      return Objects.hash(tenantId, feather, id);
    }
  }
}
