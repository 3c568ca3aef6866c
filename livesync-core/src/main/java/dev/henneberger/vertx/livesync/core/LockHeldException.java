package dev.henneberger.vertx.livesync.core;

import java.util.Objects;

/**
 * Raised when a record is already locked by another session.
 */
public final class LockHeldException extends LiveSyncException {

  private final Lock holder;

  public LockHeldException(Lock holder) {
    super("Record '" + Objects.requireNonNull(holder, "holder").recordId()
      + "' is locked by " + holder.username());
    this.holder = holder;
  }

  public Lock holder() {
    return holder;
  }
}
