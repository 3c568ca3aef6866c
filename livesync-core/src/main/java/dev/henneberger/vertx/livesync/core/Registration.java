package dev.henneberger.vertx.livesync.core;

/**
 * Handle returned when a handler is attached; cancelling detaches it.
 */
@FunctionalInterface
public interface Registration {
  void cancel();
}
