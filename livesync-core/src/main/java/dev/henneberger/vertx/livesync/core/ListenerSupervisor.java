package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps exactly one {@link ChangeListener} per known tenant. Confined to the owning event loop.
 */
public final class ListenerSupervisor {

  private static final Logger LOG = LoggerFactory.getLogger(ListenerSupervisor.class);

  private final ChangeListenerFactory factory;
  private final ChangeReceiver receiver;
  private final ReconnectPolicy reconnectPolicy;
  private final Map<String, ChangeListener> listeners = new LinkedHashMap<>();

  public ListenerSupervisor(ChangeListenerFactory factory, ChangeReceiver receiver) {
    this(factory, receiver, ReconnectPolicy.exponentialBackoff());
  }

  public ListenerSupervisor(ChangeListenerFactory factory, ChangeReceiver receiver, ReconnectPolicy reconnectPolicy) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.receiver = Objects.requireNonNull(receiver, "receiver");
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
  }

  /**
   * Starts listeners for every tenant that does not have one yet. Completes once each start has
   * settled; a tenant that cannot be reached is logged and does not fail the others.
   */
  public Future<Void> startAll(Collection<Tenant> tenants) {
    List<Future<Void>> starts = new ArrayList<>();
    for (Tenant tenant : tenants) {
      starts.add(ensure(tenant));
    }
    return settle(starts);
  }

  public Future<Void> apply(TenantDiff diff) {
    Objects.requireNonNull(diff, "diff");
    for (Tenant tenant : diff.removed()) {
      stop(tenant);
    }
    return startAll(diff.added());
  }

  public ChangeListener listener(String tenantId) {
    return listeners.get(tenantId);
  }

  public int size() {
    return listeners.size();
  }

  public void closeAll() {
    List<ChangeListener> all = new ArrayList<>(listeners.values());
    listeners.clear();
    for (ChangeListener listener : all) {
      closeQuietly(listener);
    }
  }

  private Future<Void> ensure(Tenant tenant) {
    ChangeListener existing = listeners.get(tenant.id());
    if (existing != null) {
      tenant.attachListener(existing);
      return existing.start();
    }

    ChangeListener listener;
    try {
      listener = factory.create(tenant, receiver, reconnectPolicy.copy());
    } catch (RuntimeException e) {
      LOG.error("Could not create change listener for tenant {}", tenant.id(), e);
      return Future.failedFuture(e);
    }
    listeners.put(tenant.id(), listener);
    tenant.attachListener(listener);
    LiveSyncLogging.attachDefaultLogging(listener, LOG, tenant.id());

    return listener.start()
      .onSuccess(v -> LOG.info("Listening for changes on tenant {}", tenant.id()))
      .onFailure(err -> LOG.error("Change listener for tenant {} could not be established", tenant.id(), err));
  }

  private void stop(Tenant tenant) {
    ChangeListener listener = listeners.remove(tenant.id());
    tenant.attachListener(null);
    if (listener != null) {
      LOG.info("Stopping change listener for tenant {}", tenant.id());
      closeQuietly(listener);
    }
  }

  private static void closeQuietly(ChangeListener listener) {
    try {
      listener.close();
    } catch (RuntimeException e) {
      LOG.warn("Closing change listener for tenant {} failed", listener.tenantId(), e);
    }
  }

  private static Future<Void> settle(List<Future<Void>> futures) {
    if (futures.isEmpty()) {
      return Future.succeededFuture();
    }
    return Future.join(futures).<Void>mapEmpty().otherwiseEmpty();
  }
}
