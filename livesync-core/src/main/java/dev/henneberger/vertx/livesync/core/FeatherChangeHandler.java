package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps data routes registered as feathers come and go, then tells every client session to
 * refresh its feather definitions. Sessions subscribed to the feather stream are left out of
 * that broadcast; they get the change through their subscription.
 */
public final class FeatherChangeHandler implements MetadataHandler {

  private static final Logger LOG = LoggerFactory.getLogger(FeatherChangeHandler.class);

  private final CatalogService catalog;
  private final RouteRegistrar routes;
  private final EventSessionRegistry sessions;
  private final SubscriptionManager subscriptions;

  public FeatherChangeHandler(CatalogService catalog,
                              RouteRegistrar routes,
                              EventSessionRegistry sessions,
                              SubscriptionManager subscriptions) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.routes = Objects.requireNonNull(routes, "routes");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
  }

  @Override
  public Future<Void> apply(ChangeMessage message) {
    String name = message.data().getString("name");
    if (name == null) {
      LOG.warn("Ignoring feather change without a name: {}", message.data());
      return Future.succeededFuture();
    }

    if (message.kind() == ChangeKind.DELETE) {
      return routes.unregister(name)
        .onSuccess(v -> LOG.info("Unregistered data route for {}", name))
        .onComplete(ar -> broadcast(Notification.feather(true, message.data())));
    }

    return catalog.feather(name)
      .compose(feather -> {
        if (feather.readOnly()) {
          return Future.succeededFuture(feather);
        }
        return routes.register(feather)
          .onSuccess(v -> LOG.info("Registered data route for {}", name))
          .map(feather);
      })
      .onComplete(ar -> {
        Object data = ar.succeeded() ? ar.result().toJson() : message.data();
        broadcast(Notification.feather(false, data));
      })
      .mapEmpty();
  }

  private void broadcast(Notification notification) {
    sessions.broadcast(notification, subscriptions.streamSubscribers(MetadataStreams.FEATHER));
  }
}
