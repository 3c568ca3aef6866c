package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;

/**
 * Receives decoded change messages from a {@link ChangeListener}. The listener waits for the
 * returned future before handing over the next message of the same tenant.
 */
@FunctionalInterface
public interface ChangeReceiver {
  Future<Void> receive(ChangeMessage message);
}
