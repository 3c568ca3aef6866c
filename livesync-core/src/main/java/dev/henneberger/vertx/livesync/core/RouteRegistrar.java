package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;

/**
 * Keeps the HTTP data routes in line with the catalog.
 */
public interface RouteRegistrar {

  Future<Void> register(FeatherDefinition feather);

  Future<Void> unregister(String featherName);

  /**
   * Re-reads module routes and registers each of them again.
   */
  Future<Void> reloadRoutes();
}
