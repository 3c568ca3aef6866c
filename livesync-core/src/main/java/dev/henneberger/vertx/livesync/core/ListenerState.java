package dev.henneberger.vertx.livesync.core;

public enum ListenerState {
  CREATED,
  CONNECTING,
  LISTENING,
  RECONNECTING,
  FAILED,
  CLOSED
}
