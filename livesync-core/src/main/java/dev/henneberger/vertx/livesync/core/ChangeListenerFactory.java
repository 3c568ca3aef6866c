package dev.henneberger.vertx.livesync.core;

/**
 * Builds the listener for one tenant. {@code defaultPolicy} applies when the tenant's own
 * options carry no reconnect policy.
 */
@FunctionalInterface
public interface ChangeListenerFactory {
  ChangeListener create(Tenant tenant, ChangeReceiver receiver, ReconnectPolicy defaultPolicy);
}
