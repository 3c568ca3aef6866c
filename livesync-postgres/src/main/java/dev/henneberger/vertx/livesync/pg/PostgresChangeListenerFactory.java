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

import dev.henneberger.vertx.livesync.core.ChangeListener;
import dev.henneberger.vertx.livesync.core.ChangeListenerFactory;
import dev.henneberger.vertx.livesync.core.ChangeReceiver;
import dev.henneberger.vertx.livesync.core.ReconnectPolicy;
import dev.henneberger.vertx.livesync.core.Tenant;
import io.vertx.core.Vertx;
import java.util.Objects;

public final class PostgresChangeListenerFactory implements ChangeListenerFactory {

  private final Vertx vertx;

  public PostgresChangeListenerFactory(Vertx vertx) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
  }

  @Override
  public ChangeListener create(Tenant tenant, ChangeReceiver receiver, ReconnectPolicy defaultPolicy) {
    PostgresTenantOptions options = PostgresTenantOptions.forTenant(tenant);
    if (options.getReconnectPolicy() == null && defaultPolicy != null) {
      options.setReconnectPolicy(defaultPolicy);
    }
    return new PostgresChangeListener(vertx, tenant.id(), options, receiver);
  }
}
