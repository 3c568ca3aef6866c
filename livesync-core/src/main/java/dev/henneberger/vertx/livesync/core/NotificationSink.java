package dev.henneberger.vertx.livesync.core;

/**
 * Delivery side of a session's duplex channel. Called on the event loop; must not block.
 */
@FunctionalInterface
public interface NotificationSink {
  void deliver(Notification notification);
}
