package dev.henneberger.vertx.livesync.core;

import java.util.Objects;

/**
 * Resolves the lock store of a tenant.
 */
@FunctionalInterface
public interface LockStoreProvider {

  LockStore forTenant(String tenantId);

  static LockStoreProvider shared(LockStore store) {
    Objects.requireNonNull(store, "store");
    return tenantId -> store;
  }
}
