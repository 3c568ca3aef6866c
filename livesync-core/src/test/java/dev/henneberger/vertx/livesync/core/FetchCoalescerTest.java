package dev.henneberger.vertx.livesync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class FetchCoalescerTest {

  private static final Tenant TENANT = new Tenant("t1", new JsonObject());

  @Test
  void identicalRequestsShareOneQuery() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor);
    List<AsyncResult<JsonObject>> results = new ArrayList<>();

    for (int i = 0; i < 5; i++) {
      coalescer.requestFetch("Contact", "1", TENANT, results::add);
    }
    assertEquals(1, executor.calls.size());

    JsonObject row = new JsonObject().put("id", "1").put("name", "Ada");
    executor.calls.get(0).complete(row);

    assertEquals(5, results.size());
    for (AsyncResult<JsonObject> result : results) {
      assertTrue(result.succeeded());
      assertSame(row, result.result());
    }
    assertEquals(0, coalescer.pendingCount());
    assertEquals(0, coalescer.inFlightCount());
  }

  @Test
  void requestArrivingWhileInFlightJoinsTheRunningQuery() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor);
    List<AsyncResult<JsonObject>> results = new ArrayList<>();

    coalescer.requestFetch("Contact", "1", TENANT, results::add);
    assertEquals(1, coalescer.inFlightCount());
    coalescer.requestFetch("Contact", "1", TENANT, results::add);
    executor.calls.get(0).complete(new JsonObject());

    assertEquals(1, executor.calls.size());
    assertEquals(2, results.size());
  }

  @Test
  void distinctRecordsAreFetchedOneAtATimeByDefault() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor);

    coalescer.requestFetch("Contact", "1", TENANT, ar -> { });
    coalescer.requestFetch("Contact", "2", TENANT, ar -> { });
    assertEquals(1, executor.calls.size());
    assertEquals(2, coalescer.pendingCount());

    executor.calls.get(0).complete(new JsonObject());

    assertEquals(Arrays.asList("1", "2"), executor.ids);
    assertEquals(1, coalescer.pendingCount());
  }

  @Test
  void sameIdOnDifferentTenantsIsNotCoalesced() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor, 4);

    coalescer.requestFetch("Contact", "1", TENANT, ar -> { });
    coalescer.requestFetch("Contact", "1", new Tenant("t2", new JsonObject()), ar -> { });

    assertEquals(2, executor.calls.size());
  }

  @Test
  void concurrencyLimitAppliesToDistinctKeys() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor, 2);

    coalescer.requestFetch("Contact", "1", TENANT, ar -> { });
    coalescer.requestFetch("Contact", "2", TENANT, ar -> { });
    coalescer.requestFetch("Contact", "3", TENANT, ar -> { });

    assertEquals(2, executor.calls.size());
    assertEquals(2, coalescer.inFlightCount());

    executor.calls.get(1).complete(new JsonObject());
    assertEquals(Arrays.asList("1", "2", "3"), executor.ids);
  }

  @Test
  void failureReachesEveryWaiterAndTheQueueContinues() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor);
    List<AsyncResult<JsonObject>> first = new ArrayList<>();
    List<AsyncResult<JsonObject>> second = new ArrayList<>();

    coalescer.requestFetch("Contact", "1", TENANT, first::add);
    coalescer.requestFetch("Contact", "1", TENANT, first::add);
    coalescer.requestFetch("Contact", "2", TENANT, second::add);

    IllegalStateException boom = new IllegalStateException("connection reset");
    executor.calls.get(0).fail(boom);

    assertEquals(2, first.size());
    for (AsyncResult<JsonObject> result : first) {
      assertTrue(result.failed());
      assertTrue(result.cause() instanceof FetchFailedException);
      assertSame(boom, result.cause().getCause());
    }
    assertEquals(2, executor.calls.size());

    executor.calls.get(1).complete(new JsonObject().put("id", "2"));
    assertEquals(1, second.size());
    assertTrue(second.get(0).succeeded());
  }

  @Test
  void throwingWaiterDoesNotStopTheOthers() {
    ControlledQueryExecutor executor = new ControlledQueryExecutor();
    FetchCoalescer coalescer = new FetchCoalescer(executor);
    List<AsyncResult<JsonObject>> results = new ArrayList<>();

    coalescer.requestFetch("Contact", "1", TENANT, ar -> {
      throw new IllegalStateException("waiter bug");
    });
    coalescer.requestFetch("Contact", "1", TENANT, results::add);
    executor.calls.get(0).complete(new JsonObject());

    assertEquals(1, results.size());
  }

  @Test
  void executorThrowingIsReportedAsFailure() {
    FetchCoalescer coalescer = new FetchCoalescer((feather, id, tenant) -> {
      throw new IllegalArgumentException("no such table");
    });
    List<AsyncResult<JsonObject>> results = new ArrayList<>();

    coalescer.requestFetch("Ghost", "1", TENANT, results::add);

    assertEquals(1, results.size());
    assertTrue(results.get(0).cause() instanceof FetchFailedException);
    assertEquals(0, coalescer.inFlightCount());
  }

  @Test
  void rejectsNonPositiveConcurrency() {
    assertThrows(IllegalArgumentException.class,
      () -> new FetchCoalescer((feather, id, tenant) -> Future.succeededFuture(), 0));
  }
}
