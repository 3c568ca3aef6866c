package dev.henneberger.vertx.livesync.core;

public final class FetchFailedException extends LiveSyncException {

  private final String feather;
  private final String recordId;

  public FetchFailedException(String feather, String recordId, Throwable cause) {
    super("Fetch of " + feather + " '" + recordId + "' failed"
      + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
    this.feather = feather;
    this.recordId = recordId;
  }

  public String feather() {
    return feather;
  }

  public String recordId() {
    return recordId;
  }
}
