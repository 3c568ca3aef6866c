package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live-sync node: owns the tenant registry, the listeners, sessions, subscriptions, fetch
 * coalescing and locks, and wires session teardown to subscriptions and locks.
 *
 * <p>Use from a single Vert.x context.
 */
public final class LiveSync implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(LiveSync.class);

  private final LiveSyncOptions options;
  private final TenantRegistry tenants;
  private final EventSessionRegistry sessions;
  private final FetchCoalescer coalescer;
  private final SubscriptionManager subscriptions;
  private final ListenerSupervisor supervisor;
  private final LockManager locks;
  private final List<Registration> registrations = new ArrayList<>();
  private CatalogService catalog;
  private RouteRegistrar routes;
  private String internalEventKey;
  private boolean started;

  public LiveSync(Vertx vertx,
                  LiveSyncOptions options,
                  TenantSource tenantSource,
                  ChangeListenerFactory listenerFactory,
                  QueryExecutor queryExecutor,
                  LockStoreProvider lockStores) {
    Objects.requireNonNull(vertx, "vertx");
    this.options = new LiveSyncOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.tenants = new TenantRegistry(tenantSource);
    this.sessions = new EventSessionRegistry();
    this.coalescer = new FetchCoalescer(queryExecutor, this.options.getMaxConcurrentFetches());
    this.subscriptions = new SubscriptionManager(sessions, coalescer, tenants);
    this.supervisor = new ListenerSupervisor(listenerFactory, subscriptions, this.options.getReconnectPolicy());
    this.locks = new LockManager(vertx, lockStores, this.options.getNodeId(), this.options.getLockTtl());
  }

  /**
   * Catalog used by the feather and catalog streams. Set before {@link #start()}.
   */
  public LiveSync setCatalog(CatalogService catalog) {
    this.catalog = catalog;
    return this;
  }

  /**
   * Route registrar used by the feather and route streams. Set before {@link #start()}.
   */
  public LiveSync setRoutes(RouteRegistrar routes) {
    this.routes = routes;
    return this;
  }

  /**
   * Loads tenants, clears locks this node left behind, subscribes the metadata streams and
   * starts one listener per tenant. Fails only when the tenant configuration cannot be read;
   * unreachable tenants keep reconnecting in the background.
   */
  public Future<Void> start() {
    if (started) {
      return Future.failedFuture(new IllegalStateException("already started"));
    }
    started = true;
    registrations.add(sessions.addTeardownListener(subscriptions));
    registrations.add(sessions.addTeardownListener(locks));

    return tenants.reload()
      .compose(diff -> locks.releaseNodeLocks(tenantIds())
        .onSuccess(count -> {
          if (count > 0) {
            LOG.info("Released {} lock(s) left by node {}", count, options.getNodeId());
          }
        })
        .onFailure(err -> LOG.warn("Could not release locks left by node {}", options.getNodeId(), err))
        .otherwiseEmpty())
      .compose(v -> {
        if (options.isMetadataStreams()) {
          subscribeMetadataStreams();
        }
        return supervisor.startAll(tenants.list());
      })
      .onSuccess(v -> {
        locks.startExpirySweep(options.getLockSweepInterval(), this::tenantIds);
        LOG.info("Live sync node {} started with {} tenant(s)", options.getNodeId(), tenants.list().size());
      });
  }

  private void subscribeMetadataStreams() {
    internalEventKey = "node:" + options.getNodeId();
    sessions.registerInternal(internalEventKey, notification -> { }, false);

    if (catalog != null && routes != null) {
      subscribeStream(MetadataStreams.FEATHER, new FeatherChangeHandler(catalog, routes, sessions, subscriptions));
    }
    if (catalog != null) {
      subscribeStream(MetadataStreams.CATALOG, new CatalogChangeHandler(catalog));
    }
    if (routes != null) {
      subscribeStream(MetadataStreams.ROUTE, new RouteChangeHandler(routes));
    }
    subscribeStream(MetadataStreams.TENANT, new TenantChangeHandler(tenants, supervisor));
  }

  private void subscribeStream(String stream, MetadataHandler handler) {
    registrations.add(subscriptions.registerMetadataHandler(stream, handler));
    subscriptions.subscribe(null, internalEventKey, SubscriptionTarget.metadata(stream), SubscribeOptions.defaults());
    LOG.debug("Subscribed to {} stream", stream);
  }

  private Collection<String> tenantIds() {
    List<String> ids = new ArrayList<>();
    for (Tenant tenant : tenants.list()) {
      ids.add(tenant.id());
    }
    return ids;
  }

  public LiveSyncOptions options() {
    return options;
  }

  public TenantRegistry tenants() {
    return tenants;
  }

  public EventSessionRegistry sessions() {
    return sessions;
  }

  public SubscriptionManager subscriptions() {
    return subscriptions;
  }

  public FetchCoalescer coalescer() {
    return coalescer;
  }

  public ListenerSupervisor listeners() {
    return supervisor;
  }

  public LockManager locks() {
    return locks;
  }

  @Override
  public void close() {
    locks.stopExpirySweep();
    supervisor.closeAll();
    if (internalEventKey != null) {
      sessions.unregister(internalEventKey);
      internalEventKey = null;
    }
    for (Registration registration : registrations) {
      registration.cancel();
    }
    registrations.clear();
    LOG.info("Live sync node {} closed", options.getNodeId());
  }
}
