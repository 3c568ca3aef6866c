package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Reads the current state of one record. A record that no longer exists resolves to
 * {@code null}.
 */
@FunctionalInterface
public interface QueryExecutor {
  Future<JsonObject> fetch(String feather, String id, Tenant tenant);
}
