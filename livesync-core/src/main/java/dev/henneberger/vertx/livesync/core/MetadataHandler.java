package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;

/**
 * Server-side effect of a metadata stream change, run before subscribers are notified.
 */
@FunctionalInterface
public interface MetadataHandler {
  Future<Void> apply(ChangeMessage message);
}
