/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.livesync.pg;

import dev.henneberger.vertx.livesync.core.LockStore;
import dev.henneberger.vertx.livesync.core.LockStoreProvider;
import io.vertx.core.Vertx;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link PostgresLockStore} per tenant database, all sharing the connection settings of a
 * template whose database is replaced by the tenant id.
 */
public final class PostgresLockStores implements LockStoreProvider {

  private final Vertx vertx;
  private final PostgresTenantOptions template;
  private final Map<String, PostgresLockStore> stores = new ConcurrentHashMap<>();

  public PostgresLockStores(Vertx vertx, PostgresTenantOptions template) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.template = new PostgresTenantOptions(Objects.requireNonNull(template, "template"));
  }

  @Override
  public LockStore forTenant(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    return stores.computeIfAbsent(tenantId,
      id -> new PostgresLockStore(vertx, new PostgresTenantOptions(template).setDatabase(id)));
  }
}
