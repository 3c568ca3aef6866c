package dev.henneberger.vertx.livesync.core;

/**
 * Base type for failures raised by the live sync core.
 */
public class LiveSyncException extends RuntimeException {

  public LiveSyncException(String message) {
    super(message);
  }

  public LiveSyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
