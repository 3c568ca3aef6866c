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

import dev.henneberger.vertx.livesync.core.LiveSyncException;
import dev.henneberger.vertx.livesync.core.Lock;
import dev.henneberger.vertx.livesync.core.LockHeldException;
import dev.henneberger.vertx.livesync.core.LockStore;
import dev.henneberger.vertx.livesync.core.UnlockCriteria;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locks kept in the tenant database's {@code livesync_lock} table, shared by every node serving
 * the tenant. Statements run on worker threads.
 */
public class PostgresLockStore implements LockStore {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresLockStore.class);

  static final String SCHEMA_RESOURCE = "/dev/henneberger/vertx/livesync/pg/livesync-schema.sql";

  private static final String ACQUIRE_SQL =
    "INSERT INTO livesync_lock (record_id, username, event_key, node_id, acquired_at, expires_at) "
      + "VALUES (?, ?, ?, ?, ?, ?) "
      + "ON CONFLICT (record_id) DO UPDATE SET "
      + "username = EXCLUDED.username, event_key = EXCLUDED.event_key, node_id = EXCLUDED.node_id, "
      + "acquired_at = EXCLUDED.acquired_at, expires_at = EXCLUDED.expires_at "
      + "WHERE (livesync_lock.username = EXCLUDED.username "
      + "AND livesync_lock.event_key IS NOT DISTINCT FROM EXCLUDED.event_key) "
      + "OR (livesync_lock.expires_at IS NOT NULL AND livesync_lock.expires_at <= EXCLUDED.acquired_at) "
      + "RETURNING record_id";
  private static final String SELECT_SQL =
    "SELECT record_id, username, event_key, node_id, acquired_at, expires_at FROM livesync_lock WHERE record_id = ?";

  private final Vertx vertx;
  private final PostgresTenantOptions options;
  private final boolean installSchema;
  private Future<Void> schemaReady;

  public PostgresLockStore(Vertx vertx, PostgresTenantOptions options) {
    this(vertx, options, true);
  }

  /**
   * @param installSchema whether the lock table is created on first use
   */
  public PostgresLockStore(Vertx vertx, PostgresTenantOptions options, boolean installSchema) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new PostgresTenantOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.installSchema = installSchema;
  }

  /**
   * Creates the lock table and the change-notification trigger function if they are missing.
   */
  public synchronized Future<Void> ensureSchema() {
    if (schemaReady == null) {
      schemaReady = vertx.<Void>executeBlocking(() -> {
        String script = readSchemaScript();
        try (Connection conn = PgConnections.open(options);
             Statement statement = conn.createStatement()) {
          statement.execute(script);
        }
        LOG.info("Installed live sync schema in {}", options.getDatabase());
        return null;
      }).onFailure(err -> {
        LOG.warn("Could not install live sync schema in {}", options.getDatabase(), err);
        resetSchema();
      });
    }
    return schemaReady;
  }

  @Override
  public Future<Lock> acquire(Lock requested) {
    Objects.requireNonNull(requested, "requested");
    return ready().compose(v -> blocking(() -> {
      try (Connection conn = PgConnections.open(options)) {
        for (int attempt = 0; attempt < 2; attempt++) {
          if (tryAcquire(conn, requested)) {
            return requested;
          }
          Lock holder = select(conn, requested.recordId());
          if (holder != null) {
            throw new LockHeldException(holder);
          }
        }
        throw new LiveSyncException("Could not lock record '" + requested.recordId() + "'");
      }
    }));
  }

  @Override
  public Future<Integer> release(UnlockCriteria criteria) {
    Objects.requireNonNull(criteria, "criteria");
    return ready().compose(v -> blocking(() -> {
      String sql;
      String[] params;
      if (criteria.recordId() != null) {
        sql = "DELETE FROM livesync_lock WHERE record_id = ? AND username = ?";
        params = new String[] {criteria.recordId(), criteria.username()};
      } else if (criteria.eventKey() != null) {
        sql = "DELETE FROM livesync_lock WHERE event_key = ?";
        params = new String[] {criteria.eventKey()};
      } else {
        sql = "DELETE FROM livesync_lock WHERE node_id = ?";
        params = new String[] {criteria.nodeId()};
      }
      try (Connection conn = PgConnections.open(options);
           PreparedStatement statement = conn.prepareStatement(sql)) {
        for (int i = 0; i < params.length; i++) {
          statement.setString(i + 1, params[i]);
        }
        return statement.executeUpdate();
      }
    }));
  }

  @Override
  public Future<Lock> find(String recordId) {
    Objects.requireNonNull(recordId, "recordId");
    return ready().compose(v -> blocking(() -> {
      try (Connection conn = PgConnections.open(options)) {
        return select(conn, recordId);
      }
    }));
  }

  @Override
  public Future<Integer> purgeExpired(Instant now) {
    Objects.requireNonNull(now, "now");
    return ready().compose(v -> blocking(() -> {
      try (Connection conn = PgConnections.open(options);
           PreparedStatement statement = conn.prepareStatement(
             "DELETE FROM livesync_lock WHERE expires_at IS NOT NULL AND expires_at <= ?")) {
        statement.setObject(1, toTimestamp(now));
        return statement.executeUpdate();
      }
    }));
  }

  private boolean tryAcquire(Connection conn, Lock requested) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(ACQUIRE_SQL)) {
      statement.setString(1, requested.recordId());
      statement.setString(2, requested.username());
      statement.setString(3, requested.eventKey());
      statement.setString(4, requested.nodeId());
      statement.setObject(5, toTimestamp(requested.acquiredAt()));
      statement.setObject(6, toTimestamp(requested.expiresAt()));
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static Lock select(Connection conn, String recordId) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(SELECT_SQL)) {
      statement.setString(1, recordId);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return null;
        }
        return new Lock(
          rs.getString("record_id"),
          rs.getString("username"),
          rs.getString("event_key"),
          rs.getString("node_id"),
          toInstant(rs.getObject("acquired_at", OffsetDateTime.class)),
          toInstant(rs.getObject("expires_at", OffsetDateTime.class)));
      }
    }
  }

  private Future<Void> ready() {
    return installSchema ? ensureSchema() : Future.succeededFuture();
  }

  private synchronized void resetSchema() {
    schemaReady = null;
  }

  private <T> Future<T> blocking(Callable<T> work) {
    return vertx.executeBlocking(work, false);
  }

  static String readSchemaScript() throws IOException {
    try (InputStream in = PostgresLockStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new IOException("missing resource " + SCHEMA_RESOURCE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static OffsetDateTime toTimestamp(Instant instant) {
    return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  private static Instant toInstant(OffsetDateTime value) {
    return value == null ? null : value.toInstant();
  }
}
