package dev.henneberger.vertx.livesync.core;

public final class UnknownEventKeyException extends LiveSyncException {

  private final String eventKey;

  public UnknownEventKeyException(String eventKey) {
    super("Invalid event key " + eventKey);
    this.eventKey = eventKey;
  }

  public String eventKey() {
    return eventKey;
  }
}
