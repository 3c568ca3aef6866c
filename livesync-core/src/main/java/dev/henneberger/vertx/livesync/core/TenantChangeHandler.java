package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.util.Objects;

/**
 * Reloads tenants and starts or stops their listeners to match.
 */
public final class TenantChangeHandler implements MetadataHandler {

  private final TenantRegistry tenants;
  private final ListenerSupervisor supervisor;

  public TenantChangeHandler(TenantRegistry tenants, ListenerSupervisor supervisor) {
    this.tenants = Objects.requireNonNull(tenants, "tenants");
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
  }

  @Override
  public Future<Void> apply(ChangeMessage message) {
    return tenants.reload().compose(supervisor::apply);
  }
}
