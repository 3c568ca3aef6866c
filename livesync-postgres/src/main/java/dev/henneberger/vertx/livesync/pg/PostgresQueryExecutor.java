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

import dev.henneberger.vertx.livesync.core.CatalogService;
import dev.henneberger.vertx.livesync.core.FeatherDefinition;
import dev.henneberger.vertx.livesync.core.QueryExecutor;
import dev.henneberger.vertx.livesync.core.Tenant;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Objects;

/**
 * Reads one record as JSON with {@code row_to_json}. The table comes from the catalog when one is
 * given and otherwise is the feather name in snake_case.
 */
public class PostgresQueryExecutor implements QueryExecutor {

  private final Vertx vertx;
  private final CatalogService catalog;

  public PostgresQueryExecutor(Vertx vertx) {
    this(vertx, null);
  }

  public PostgresQueryExecutor(Vertx vertx, CatalogService catalog) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.catalog = catalog;
  }

  @Override
  public Future<JsonObject> fetch(String feather, String id, Tenant tenant) {
    if (tenant == null) {
      return Future.failedFuture(new IllegalArgumentException("unknown tenant for " + feather + " " + id));
    }
    PostgresTenantOptions options = PostgresTenantOptions.forTenant(tenant);
    return tableOf(feather).compose(table -> vertx.executeBlocking(() -> {
      String sql = "SELECT row_to_json(t)::text FROM " + PgConnections.quoteIdentifier(table)
        + " t WHERE t.id::text = ?";
      try (Connection conn = PgConnections.open(options);
           PreparedStatement statement = conn.prepareStatement(sql)) {
        statement.setString(1, id);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            return null;
          }
          String row = rs.getString(1);
          return row == null ? null : new JsonObject(row);
        }
      }
    }, false));
  }

  private Future<String> tableOf(String feather) {
    if (catalog == null) {
      return Future.succeededFuture(defaultTable(feather));
    }
    return catalog.feather(feather).map(definition -> tableOf(definition, feather));
  }

  private static String tableOf(FeatherDefinition definition, String feather) {
    if (definition != null && definition.table() != null && !definition.table().isBlank()) {
      return definition.table();
    }
    return defaultTable(feather);
  }

  private static String defaultTable(String feather) {
    return FeatherNames.toTable(feather);
  }
}
