package dev.henneberger.vertx.livesync.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

final class FakeListenerFactory implements ChangeListenerFactory {

  final Map<String, FakeChangeListener> created = new LinkedHashMap<>();
  final Set<String> unreachable = new CopyOnWriteArraySet<>();
  int creations;

  @Override
  public ChangeListener create(Tenant tenant, ChangeReceiver receiver, ReconnectPolicy defaultPolicy) {
    creations++;
    Throwable failure = unreachable.contains(tenant.id())
      ? new ChannelDroppedException(tenant.id(), "connection refused", null)
      : null;
    FakeChangeListener listener = new FakeChangeListener(tenant, receiver, defaultPolicy, failure);
    created.put(tenant.id(), listener);
    return listener;
  }
}
