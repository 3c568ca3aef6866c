package dev.henneberger.vertx.livesync.core;

/**
 * A tenant configuration entry that cannot be used. The entry is skipped; other tenants load.
 */
public final class TenantConfigException extends LiveSyncException {

  private final int index;

  public TenantConfigException(int index, String message) {
    super("Tenant entry #" + index + ": " + message);
    this.index = index;
  }

  public int index() {
    return index;
  }
}
