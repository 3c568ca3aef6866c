package dev.henneberger.vertx.livesync.core;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps change messages onto subscriptions and delivers notifications to their sessions.
 * Confined to the owning event loop; state is looked up again whenever a fetch completes.
 */
public final class SubscriptionManager implements ChangeReceiver, SessionTeardownListener {

  private static final Logger LOG = LoggerFactory.getLogger(SubscriptionManager.class);

  private final EventSessionRegistry sessions;
  private final FetchCoalescer coalescer;
  private final TenantRegistry tenants;
  private final Supplier<String> idGenerator;
  private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
  private final Map<String, Set<String>> byEventKey = new LinkedHashMap<>();
  private final Map<String, MetadataHandler> metadataHandlers = new LinkedHashMap<>();

  public SubscriptionManager(EventSessionRegistry sessions, FetchCoalescer coalescer, TenantRegistry tenants) {
    this(sessions, coalescer, tenants, () -> UUID.randomUUID().toString());
  }

  public SubscriptionManager(EventSessionRegistry sessions,
                             FetchCoalescer coalescer,
                             TenantRegistry tenants,
                             Supplier<String> idGenerator) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.coalescer = Objects.requireNonNull(coalescer, "coalescer");
    this.tenants = Objects.requireNonNull(tenants, "tenants");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * Registers interest of {@code eventKey} in {@code target}. A {@code null} tenant watches every
   * tenant. Re-using a subscription id replaces the earlier subscription.
   *
   * @return the subscription id
   */
  public String subscribe(String tenantId, String eventKey, SubscriptionTarget target, SubscribeOptions options) {
    Objects.requireNonNull(eventKey, "eventKey");
    Objects.requireNonNull(target, "target");
    SubscribeOptions resolved = options == null ? SubscribeOptions.defaults() : options;
    String id = resolved.getSubscriptionId() == null ? idGenerator.get() : resolved.getSubscriptionId();
    if (subscriptions.containsKey(id)) {
      unsubscribe(id);
    }
    Subscription subscription = new Subscription(id, eventKey, tenantId, target, resolved.isMerge());
    subscriptions.put(id, subscription);
    byEventKey.computeIfAbsent(eventKey, k -> new LinkedHashSet<>()).add(id);
    LOG.debug("Subscribed {}", subscription);
    return id;
  }

  public boolean unsubscribe(String subscriptionId) {
    Subscription removed = subscriptions.remove(subscriptionId);
    if (removed == null) {
      return false;
    }
    Set<String> owned = byEventKey.get(removed.eventKey());
    if (owned != null) {
      owned.remove(subscriptionId);
      if (owned.isEmpty()) {
        byEventKey.remove(removed.eventKey());
      }
    }
    LOG.debug("Unsubscribed {}", subscriptionId);
    return true;
  }

  public int unsubscribeAll(String eventKey) {
    Set<String> owned = byEventKey.remove(eventKey);
    if (owned == null) {
      return 0;
    }
    for (String id : owned) {
      subscriptions.remove(id);
    }
    return owned.size();
  }

  public List<Subscription> subscriptionsOf(String eventKey) {
    Set<String> owned = byEventKey.get(eventKey);
    if (owned == null) {
      return Collections.emptyList();
    }
    List<Subscription> out = new ArrayList<>(owned.size());
    for (String id : owned) {
      out.add(subscriptions.get(id));
    }
    return out;
  }

  public Subscription find(String subscriptionId) {
    return subscriptions.get(subscriptionId);
  }

  public int size() {
    return subscriptions.size();
  }

  /**
   * Event keys holding a subscription to the metadata {@code stream}.
   */
  public Set<String> streamSubscribers(String stream) {
    Set<String> out = new LinkedHashSet<>();
    for (Subscription subscription : subscriptions.values()) {
      SubscriptionTarget target = subscription.target();
      if (target.type() == SubscriptionTarget.Type.METADATA && target.name().equalsIgnoreCase(stream)) {
        out.add(subscription.eventKey());
      }
    }
    return out;
  }

  /**
   * Installs the server-side effect for a metadata stream, replacing any earlier one.
   */
  public Registration registerMetadataHandler(String stream, MetadataHandler handler) {
    Objects.requireNonNull(handler, "handler");
    String key = streamKey(stream);
    metadataHandlers.put(key, handler);
    return () -> metadataHandlers.remove(key, handler);
  }

  @Override
  public void onTeardown(String eventKey, String tenantId) {
    int removed = unsubscribeAll(eventKey);
    if (removed > 0) {
      LOG.debug("Dropped {} subscription(s) of {}", removed, eventKey);
    }
  }

  /**
   * Routes one message. Completes once the message is routed; record fetches finish later.
   */
  @Override
  public Future<Void> receive(ChangeMessage message) {
    if (message == null || message.kind() == null) {
      return Future.succeededFuture();
    }
    if (message.isAddressed()) {
      deliverAddressed(message);
      return Future.succeededFuture();
    }
    List<Subscription> matched = match(message);
    if (message.isMetadata()) {
      return receiveMetadata(message, matched);
    }
    if (matched.isEmpty()) {
      LOG.debug("No subscription for {}", message);
      return Future.succeededFuture();
    }
    for (Subscription subscription : matched) {
      subscription.track(message);
      deliver(subscription, message);
    }
    return Future.succeededFuture();
  }

  private Future<Void> receiveMetadata(ChangeMessage message, List<Subscription> matched) {
    if (matched.isEmpty()) {
      LOG.debug("No subscription for {}", message);
      return Future.succeededFuture();
    }
    MetadataHandler handler = metadataHandlers.get(streamKey(message.stream()));
    Future<Void> effect;
    if (handler == null) {
      effect = Future.succeededFuture();
    } else {
      try {
        effect = handler.apply(message);
      } catch (RuntimeException e) {
        effect = Future.failedFuture(e);
      }
      if (effect == null) {
        effect = Future.succeededFuture();
      }
    }
    return effect
      .onFailure(err -> LOG.warn("Handling {} change on {} failed", message.kind().wireName(), message.stream(), err))
      .otherwiseEmpty()
      .map(v -> {
        for (Subscription subscription : matched) {
          if (subscriptions.get(subscription.id()) == subscription) {
            deliver(subscription, message);
          }
        }
        return null;
      });
  }

  private void deliverAddressed(ChangeMessage message) {
    Subscription subscription = subscriptions.get(message.subscriptionId());
    if (subscription != null && subscription.eventKey().equals(message.eventKey())) {
      subscription.track(message);
      deliver(subscription, message);
      return;
    }
    sessions.dispatch(message.eventKey(), Notification.of(message.subscriptionId(), message.kind(), message.data()));
  }

  private List<Subscription> match(ChangeMessage message) {
    List<Subscription> matched = new ArrayList<>();
    for (Subscription subscription : subscriptions.values()) {
      if (subscription.matches(message)) {
        matched.add(subscription);
      }
    }
    return matched;
  }

  private void deliver(Subscription subscription, ChangeMessage message) {
    EventSession session = sessions.find(subscription.eventKey()).orElse(null);
    if (session == null) {
      LOG.debug("Session {} is gone, skipping {}", subscription.eventKey(), subscription.id());
      return;
    }
    if (subscription.merge()) {
      sessions.dispatch(session.eventKey(), Notification.merge(subscription.id(), message.kind(), message.data()));
      return;
    }
    if (message.isMetadata() || !session.fetch() || message.kind() == ChangeKind.DELETE) {
      sessions.dispatch(session.eventKey(), Notification.of(subscription.id(), message.kind(), message.data()));
      return;
    }
    Tenant tenant = tenants.find(message.tenantId()).orElse(null);
    coalescer.requestFetch(message.feather(), message.recordId(), tenant,
      ar -> fetched(subscription, session, message, ar));
  }

  private void fetched(Subscription subscription,
                       EventSession session,
                       ChangeMessage message,
                       AsyncResult<JsonObject> ar) {
    if (subscriptions.get(subscription.id()) != subscription
      || sessions.find(session.eventKey()).orElse(null) != session) {
      return;
    }
    Object data;
    if (ar.succeeded() && ar.result() != null) {
      data = ar.result();
    } else {
      data = message.data();
    }
    sessions.dispatch(session.eventKey(), Notification.of(subscription.id(), message.kind(), data));
  }

  private static String streamKey(String stream) {
    return Objects.requireNonNull(stream, "stream").toLowerCase(Locale.ROOT);
  }
}
