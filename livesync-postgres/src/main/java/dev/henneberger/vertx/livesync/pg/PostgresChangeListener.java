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
import dev.henneberger.vertx.livesync.core.ChangeMessage;
import dev.henneberger.vertx.livesync.core.ChangeReceiver;
import dev.henneberger.vertx.livesync.core.ChannelDroppedException;
import dev.henneberger.vertx.livesync.core.ListenerState;
import dev.henneberger.vertx.livesync.core.ListenerStateChange;
import dev.henneberger.vertx.livesync.core.ReconnectPolicy;
import dev.henneberger.vertx.livesync.core.Registration;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listens on a tenant database's notification channel with {@code LISTEN}. A worker thread owns
 * the connection, decodes each payload and hands it to the receiver on the creating context,
 * waiting for it before reading the next one.
 */
public class PostgresChangeListener implements ChangeListener {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresChangeListener.class);

  private final Context context;
  private final String tenantId;
  private final PostgresTenantOptions options;
  private final ReconnectPolicy reconnectPolicy;
  private final ChangeReceiver receiver;
  private final List<Handler<ListenerStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile Connection connection;
  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile ListenerState state = ListenerState.CREATED;

  public PostgresChangeListener(Vertx vertx,
                                String tenantId,
                                PostgresTenantOptions options,
                                ChangeReceiver receiver) {
    Objects.requireNonNull(vertx, "vertx");
    this.context = vertx.getOrCreateContext();
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    this.options = new PostgresTenantOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.reconnectPolicy = this.options.getReconnectPolicy() == null
      ? ReconnectPolicy.exponentialBackoff()
      : this.options.getReconnectPolicy();
    this.receiver = Objects.requireNonNull(receiver, "receiver");
  }

  @Override
  public String tenantId() {
    return tenantId;
  }

  @Override
  public Future<Void> start() {
    synchronized (this) {
      if (state == ListenerState.CLOSED) {
        return Future.failedFuture("listener is closed");
      }
      if (state == ListenerState.LISTENING) {
        return Future.succeededFuture();
      }
      if (startPromise != null && shouldRun.get()) {
        return startPromise.future();
      }

      shouldRun.set(true);
      startPromise = Promise.promise();
      transition(ListenerState.CONNECTING, null, 0);
      startWorker();
      return startPromise.future();
    }
  }

  @Override
  public ListenerState state() {
    return state;
  }

  @Override
  public Registration onStateChange(Handler<ListenerStateChange> handler) {
    Handler<ListenerStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  @Override
  public synchronized void close() {
    if (state == ListenerState.CLOSED) {
      return;
    }
    shouldRun.set(false);
    transition(ListenerState.CLOSED, null, 0);

    closeConnection();

    Thread thread = worker;
    worker = null;
    if (thread != null) {
      thread.interrupt();
    }

    Promise<Void> currentStartPromise = startPromise;
    startPromise = null;
    if (currentStartPromise != null && !currentStartPromise.future().isComplete()) {
      currentStartPromise.fail("listener closed before it was listening");
    }
  }

  private void startWorker() {
    if (worker != null && worker.isAlive()) {
      return;
    }
    worker = new Thread(this::runLoop, "livesync-listen-" + tenantId);
    worker.setDaemon(true);
    worker.start();
  }

  private void runLoop() {
    long failedAttempts = 0;

    try {
      while (shouldRun.get()) {
        transition(ListenerState.CONNECTING, null, failedAttempts + 1);
        try {
          runSession(failedAttempts + 1);
          if (!shouldRun.get()) {
            return;
          }
          throw new ChannelDroppedException(tenantId, "notification session ended unexpectedly", null);
        } catch (Exception e) {
          if (!shouldRun.get()) {
            return;
          }
          if (state == ListenerState.LISTENING) {
            failedAttempts = 0;
          }
          failedAttempts++;
          LOG.warn("Change channel {} of tenant {} dropped", options.getChannel(), tenantId, e);
          failStart(e);

          if (!reconnectPolicy.shouldReconnect(e, failedAttempts)) {
            transition(ListenerState.FAILED, e, failedAttempts);
            shouldRun.set(false);
            return;
          }

          transition(ListenerState.RECONNECTING, e, failedAttempts);
          sleepInterruptibly(reconnectPolicy.delayMillis(failedAttempts));
        }
      }
    } finally {
      closeConnection();
      synchronized (this) {
        if (worker == Thread.currentThread()) {
          worker = null;
        }
      }
    }
  }

  private void runSession(long attempt) throws Exception {
    try (Connection conn = openConnection()) {
      this.connection = conn;
      PGConnection pgConnection = conn.unwrap(PGConnection.class);

      try (Statement statement = conn.createStatement()) {
        statement.execute("LISTEN " + PgConnections.quoteIdentifier(options.getChannel()));
      }

      transition(ListenerState.LISTENING, null, attempt);
      completeStart();

      int pollMillis = (int) Math.max(1L, options.getNotificationPollInterval().toMillis());
      while (shouldRun.get()) {
        PGNotification[] notifications;
        try {
          notifications = pgConnection.getNotifications(pollMillis);
        } catch (SQLException e) {
          throw new ChannelDroppedException(tenantId, "lost connection while waiting for notifications", e);
        }
        if (notifications == null) {
          continue;
        }
        for (PGNotification notification : notifications) {
          if (!shouldRun.get()) {
            return;
          }
          handleNotification(notification);
        }
      }
    } finally {
      this.connection = null;
    }
  }

  private void handleNotification(PGNotification notification) throws InterruptedException {
    if (!options.getChannel().equals(notification.getName())) {
      return;
    }
    ChangeMessage message;
    try {
      message = NotificationDecoder.decode(tenantId, notification.getParameter());
    } catch (RuntimeException e) {
      LOG.warn("Ignoring malformed notification on tenant {}: {}", tenantId, notification.getParameter(), e);
      return;
    }
    if (message == null) {
      LOG.debug("Ignoring notification on tenant {}: {}", tenantId, notification.getParameter());
      return;
    }
    dispatchAndAwait(message);
  }

  private void dispatchAndAwait(ChangeMessage message) throws InterruptedException {
    CountDownLatch latch = new CountDownLatch(1);
    context.runOnContext(v -> {
      Future<Void> result;
      try {
        result = receiver.receive(message);
      } catch (RuntimeException e) {
        result = Future.failedFuture(e);
      }
      if (result == null) {
        result = Future.succeededFuture();
      }
      result.onComplete(ar -> {
        if (ar.failed()) {
          LOG.warn("Routing {} on tenant {} failed", message, tenantId, ar.cause());
        }
        latch.countDown();
      });
    });
    latch.await();
  }

  private Connection openConnection() throws SQLException {
    try {
      return PgConnections.open(options);
    } catch (SQLException e) {
      throw new ChannelDroppedException(tenantId, "could not connect to " + options.jdbcUrl(), e);
    }
  }

  private void closeConnection() {
    Connection conn = this.connection;
    this.connection = null;
    if (conn != null) {
      try {
        conn.close();
      } catch (SQLException e) {
        LOG.debug("Closing notification connection of tenant {} failed", tenantId, e);
      }
    }
  }

  private void transition(ListenerState nextState, Throwable cause, long attempt) {
    ListenerState previous = this.state;
    if (previous == nextState && cause == null) {
      return;
    }
    if (previous == ListenerState.CLOSED) {
      return;
    }

    this.state = nextState;
    ListenerStateChange change = new ListenerStateChange(tenantId, previous, nextState, cause, attempt);
    for (Handler<ListenerStateChange> handler : stateHandlers) {
      context.runOnContext(v -> handler.handle(change));
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private void sleepInterruptibly(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
