package dev.henneberger.vertx.livesync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class TenantRegistryTest {

  @Test
  void reloadReportsAddedAndRemovedTenants() throws Exception {
    AtomicReference<JsonArray> config = new AtomicReference<>(new JsonArray()
      .add(new JsonObject().put("id", "a").put("host", "h1"))
      .add(new JsonObject().put("id", "b")));
    TenantRegistry registry = new TenantRegistry(() -> Future.succeededFuture(config.get()));

    TenantDiff first = await(registry.reload());
    assertEquals(Arrays.asList("a", "b"), ids(first.added()));
    assertTrue(first.removed().isEmpty());
    Tenant a = registry.find("a").orElseThrow();

    config.set(new JsonArray()
      .add(new JsonObject().put("id", "a").put("host", "h1"))
      .add(new JsonObject().put("id", "c")));
    TenantDiff second = await(registry.reload());

    assertEquals(Arrays.asList("c"), ids(second.added()));
    assertEquals(Arrays.asList("b"), ids(second.removed()));
    assertSame(a, registry.find("a").orElseThrow());
    assertEquals(Arrays.asList("a", "c"), ids(registry.list()));
  }

  @Test
  void changedOptionsReplaceTheTenant() throws Exception {
    AtomicReference<JsonArray> config = new AtomicReference<>(new JsonArray()
      .add(new JsonObject().put("id", "a").put("host", "h1")));
    TenantRegistry registry = new TenantRegistry(() -> Future.succeededFuture(config.get()));
    await(registry.reload());
    Tenant before = registry.find("a").orElseThrow();

    config.set(new JsonArray().add(new JsonObject().put("id", "a").put("host", "h2")));
    TenantDiff diff = await(registry.reload());

    assertEquals(Arrays.asList("a"), ids(diff.added()));
    assertEquals(Arrays.asList("a"), ids(diff.removed()));
    assertNotSame(before, registry.find("a").orElseThrow());
    assertEquals("h2", registry.find("a").orElseThrow().options().getString("host"));
  }

  @Test
  void malformedEntriesAreSkipped() throws Exception {
    JsonArray config = new JsonArray()
      .add("not-an-object")
      .add(new JsonObject().put("host", "nowhere"))
      .add(new JsonObject().put("id", "a"))
      .add(new JsonObject().put("id", "a").put("host", "duplicate"))
      .add(new JsonObject().put("database", "d"))
      .add(new JsonObject().put("id", "off").put("enabled", false));
    TenantRegistry registry = new TenantRegistry(TenantSource.of(config));

    TenantDiff diff = await(registry.reload());

    assertEquals(Arrays.asList("a", "d"), ids(diff.added()));
    assertEquals(Arrays.asList("a", "d"), ids(registry.list()));
    assertTrue(registry.find("a").orElseThrow().options().getString("host") == null);
  }

  @Test
  void failingSourceKeepsCurrentTenants() throws Exception {
    AtomicReference<Future<JsonArray>> next = new AtomicReference<>(
      Future.succeededFuture(new JsonArray().add(new JsonObject().put("id", "a"))));
    TenantRegistry registry = new TenantRegistry(next::get);
    await(registry.reload());

    next.set(Future.failedFuture(new IllegalStateException("config store down")));
    ExecutionException err = assertThrows(ExecutionException.class, () -> await(registry.reload()));

    assertTrue(err.getCause() instanceof IllegalStateException);
    assertEquals(Arrays.asList("a"), ids(registry.list()));
  }

  @Test
  void findIgnoresUnknownAndNullIds() throws Exception {
    TenantRegistry registry = new TenantRegistry(TenantSource.of(new JsonArray().add(new JsonObject().put("id", "a"))));
    await(registry.reload());

    assertTrue(registry.find(null).isEmpty());
    assertTrue(registry.find("zzz").isEmpty());
  }

  private static List<String> ids(List<Tenant> tenants) {
    List<String> out = new ArrayList<>();
    for (Tenant tenant : tenants) {
      out.add(tenant.id());
    }
    return out;
  }

  private static <T> T await(Future<T> future) throws Exception {
    return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }
}
