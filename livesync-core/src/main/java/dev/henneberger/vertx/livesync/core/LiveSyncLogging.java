package dev.henneberger.vertx.livesync.core;

import java.util.Objects;
import org.slf4j.Logger;

public final class LiveSyncLogging {

  private LiveSyncLogging() {
  }

  public static Registration attachDefaultLogging(ChangeListener listener, Logger logger, String name) {
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(logger, "logger");
    String label = name == null || name.isBlank() ? listener.tenantId() : name;

    return listener.onStateChange(change -> {
      Throwable cause = change.cause();
      if (change.state() == ListenerState.FAILED) {
        logger.error("tenant={} listener state={} prev={} attempt={}",
          label, change.state(), change.previousState(), change.attempt(), cause);
      } else if (cause != null) {
        logger.warn("tenant={} listener state={} prev={} attempt={} cause={}",
          label, change.state(), change.previousState(), change.attempt(), cause.toString());
      } else {
        logger.info("tenant={} listener state={} prev={} attempt={}",
          label, change.state(), change.previousState(), change.attempt());
      }
    });
  }
}
