package dev.henneberger.vertx.livesync.core;

/**
 * Told once when an event key goes away, whether by disconnect, sign-out or cleanup.
 */
@FunctionalInterface
public interface SessionTeardownListener {
  void onTeardown(String eventKey, String tenantId);
}
