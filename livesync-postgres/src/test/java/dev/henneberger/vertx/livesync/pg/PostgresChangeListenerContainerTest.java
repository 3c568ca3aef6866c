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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.livesync.core.ChangeKind;
import dev.henneberger.vertx.livesync.core.ChangeMessage;
import dev.henneberger.vertx.livesync.core.ListenerState;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PostgresChangeListenerContainerTest {

  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";

  @Test
  void deliversNotifyPayloads() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();

      Vertx vertx = Vertx.vertx();
      BlockingQueue<ChangeMessage> received = new LinkedBlockingQueue<>();
      PostgresChangeListener listener = new PostgresChangeListener(vertx, "acme", options(postgres), message -> {
        received.add(message);
        return Future.succeededFuture();
      });

      try {
        listener.start().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        assertEquals(ListenerState.LISTENING, listener.state());

        execute(postgres, "SELECT pg_notify('livesync', "
          + "'{\"table\":\"contact\",\"id\":\"c1\",\"change\":\"update\",\"data\":{\"id\":\"c1\",\"name\":\"Ann\"}}')");
        execute(postgres, "SELECT pg_notify('livesync', 'not json')");
        execute(postgres, "SELECT pg_notify('livesync', "
          + "'{\"stream\":\"Tenant\",\"change\":\"update\"}')");

        ChangeMessage record = received.poll(30, TimeUnit.SECONDS);
        assertEquals("acme", record.tenantId());
        assertEquals("Contact", record.feather());
        assertEquals("c1", record.recordId());
        assertEquals("Ann", record.data().getString("name"));

        ChangeMessage metadata = received.poll(30, TimeUnit.SECONDS);
        assertTrue(metadata.isMetadata());
        assertEquals("Tenant", metadata.stream());
      } finally {
        listener.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
      assertEquals(ListenerState.CLOSED, listener.state());
    } finally {
      postgres.stop();
    }
  }

  @Test
  void triggerFunctionPublishesRowChanges() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();

      Vertx vertx = Vertx.vertx();
      PostgresTenantOptions options = options(postgres);
      new PostgresLockStore(vertx, options).ensureSchema()
        .toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
      execute(postgres, "CREATE TABLE contact (id SERIAL PRIMARY KEY, name TEXT NOT NULL)");
      execute(postgres, "CREATE TRIGGER contact_livesync AFTER INSERT OR UPDATE OR DELETE ON contact "
        + "FOR EACH ROW EXECUTE FUNCTION livesync_notify()");

      BlockingQueue<ChangeMessage> received = new LinkedBlockingQueue<>();
      PostgresChangeListener listener = new PostgresChangeListener(vertx, "acme", options, message -> {
        received.add(message);
        return Future.succeededFuture();
      });

      try {
        listener.start().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);

        execute(postgres, "INSERT INTO contact(name) VALUES ('Ann')");
        execute(postgres, "DELETE FROM contact WHERE name = 'Ann'");

        ChangeMessage created = received.poll(30, TimeUnit.SECONDS);
        assertEquals(ChangeKind.CREATE, created.kind());
        assertEquals("Contact", created.feather());
        assertEquals("1", created.recordId());
        assertEquals("Ann", created.data().getString("name"));

        ChangeMessage deleted = received.poll(30, TimeUnit.SECONDS);
        assertEquals(ChangeKind.DELETE, deleted.kind());
        assertEquals("1", deleted.recordId());
      } finally {
        listener.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static PostgresTenantOptions options(GenericContainer<?> postgres) {
    return new PostgresTenantOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD)
      .setNotificationPollInterval(Duration.ofMillis(100));
  }

  private static void execute(GenericContainer<?> postgres, String sql) throws Exception {
    try (Connection conn = DriverManager.getConnection(jdbcUrl(postgres), DB_USER, DB_PASSWORD);
         Statement statement = conn.createStatement()) {
      statement.execute(sql);
    }
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16-alpine")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(5));
  }

  private static String jdbcUrl(GenericContainer<?> postgres) {
    return "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME;
  }
}
