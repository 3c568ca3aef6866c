package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.util.Objects;

public final class RouteChangeHandler implements MetadataHandler {

  private final RouteRegistrar routes;

  public RouteChangeHandler(RouteRegistrar routes) {
    this.routes = Objects.requireNonNull(routes, "routes");
  }

  @Override
  public Future<Void> apply(ChangeMessage message) {
    return routes.reloadRoutes();
  }
}
