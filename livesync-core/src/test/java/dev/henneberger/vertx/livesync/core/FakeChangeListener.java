package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class FakeChangeListener implements ChangeListener {

  final Tenant tenant;
  final ChangeReceiver receiver;
  final ReconnectPolicy policy;
  private final List<Handler<ListenerStateChange>> handlers = new CopyOnWriteArrayList<>();
  private final Throwable startFailure;
  private ListenerState state = ListenerState.CREATED;
  int starts;
  boolean closed;

  FakeChangeListener(Tenant tenant, ChangeReceiver receiver, ReconnectPolicy policy, Throwable startFailure) {
    this.tenant = tenant;
    this.receiver = receiver;
    this.policy = policy;
    this.startFailure = startFailure;
  }

  @Override
  public String tenantId() {
    return tenant.id();
  }

  @Override
  public Future<Void> start() {
    starts++;
    if (startFailure != null) {
      emit(ListenerState.RECONNECTING, startFailure);
      return Future.failedFuture(startFailure);
    }
    emit(ListenerState.LISTENING, null);
    return Future.succeededFuture();
  }

  @Override
  public ListenerState state() {
    return state;
  }

  @Override
  public Registration onStateChange(Handler<ListenerStateChange> handler) {
    handlers.add(handler);
    return () -> handlers.remove(handler);
  }

  @Override
  public void close() {
    closed = true;
    emit(ListenerState.CLOSED, null);
  }

  void emit(ListenerState next, Throwable cause) {
    ListenerStateChange change = new ListenerStateChange(tenant.id(), state, next, cause, 1);
    state = next;
    for (Handler<ListenerStateChange> handler : handlers) {
      handler.handle(change);
    }
  }

  Future<Void> push(ChangeMessage message) {
    return receiver.receive(message);
  }
}
