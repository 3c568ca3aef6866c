package dev.henneberger.vertx.livesync.core;

/**
 * A tenant's change-notification channel went away. Listeners reconnect on this; it never reaches
 * a client.
 */
public final class ChannelDroppedException extends LiveSyncException {

  private final String tenantId;

  public ChannelDroppedException(String tenantId, String message, Throwable cause) {
    super(message, cause);
    this.tenantId = tenantId;
  }

  public String tenantId() {
    return tenantId;
  }
}
