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
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.henneberger.vertx.livesync.core.Lock;
import dev.henneberger.vertx.livesync.core.LockHeldException;
import dev.henneberger.vertx.livesync.core.UnlockCriteria;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

class PostgresLockStoreContainerTest {

  private static final String DB_NAME = "testdb";
  private static final String DB_USER = "test";
  private static final String DB_PASSWORD = "test";

  @Test
  void locksAreExclusiveUntilReleased() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      Vertx vertx = Vertx.vertx();
      try {
        PostgresLockStore store = new PostgresLockStore(vertx, options(postgres));
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        await(store.acquire(new Lock("r1", "alice", "key-a", "node-1", now, now.plusSeconds(600))));
        Lock refreshed = await(store.acquire(new Lock("r1", "alice", "key-a", "node-1", now, now.plusSeconds(900))));
        assertEquals("alice", refreshed.username());

        ExecutionException held = assertThrows(ExecutionException.class,
          () -> await(store.acquire(new Lock("r1", "bob", "key-b", "node-2", now, null))));
        LockHeldException cause = assertInstanceOf(LockHeldException.class, held.getCause());
        assertEquals("alice", cause.holder().username());

        Lock found = await(store.find("r1"));
        assertEquals("key-a", found.eventKey());
        assertEquals(now.plusSeconds(900), found.expiresAt());

        assertEquals(Integer.valueOf(0), await(store.release(UnlockCriteria.record("r1", "bob"))));
        assertEquals(Integer.valueOf(1), await(store.release(UnlockCriteria.eventKey("key-a"))));
        assertNull(await(store.find("r1")));
      } finally {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void expiredLocksCanBeTakenOverAndPurged() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    GenericContainer<?> postgres = createPostgresContainer();
    try {
      postgres.start();
      Vertx vertx = Vertx.vertx();
      try {
        PostgresLockStore store = new PostgresLockStore(vertx, options(postgres));
        Instant past = Instant.now().minusSeconds(3600).truncatedTo(ChronoUnit.MILLIS);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        await(store.acquire(new Lock("r1", "alice", "key-a", "node-1", past, past.plusSeconds(60))));
        Lock taken = await(store.acquire(new Lock("r1", "bob", "key-b", "node-2", now, null)));
        assertEquals("bob", taken.username());
        assertEquals("node-2", await(store.find("r1")).nodeId());

        await(store.acquire(new Lock("r2", "carol", "key-c", "node-1", past, past.plusSeconds(60))));
        assertEquals(Integer.valueOf(1), await(store.purgeExpired(now)));
        assertNull(await(store.find("r2")));

        assertEquals(Integer.valueOf(1), await(store.release(UnlockCriteria.node("node-2"))));
      } finally {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static <T> T await(Future<T> future) throws Exception {
    return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
  }

  private static PostgresTenantOptions options(GenericContainer<?> postgres) {
    return new PostgresTenantOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD);
  }

  private static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16-alpine")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(5));
  }
}
