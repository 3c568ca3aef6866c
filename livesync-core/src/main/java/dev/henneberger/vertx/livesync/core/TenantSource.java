package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import java.util.Objects;

/**
 * Supplies the raw tenant configuration: an array of objects, each with an {@code id} (or
 * {@code database}) and adapter-specific connection options.
 */
@FunctionalInterface
public interface TenantSource {

  Future<JsonArray> load();

  static TenantSource of(JsonArray tenants) {
    Objects.requireNonNull(tenants, "tenants");
    return () -> Future.succeededFuture(tenants.copy());
  }
}
