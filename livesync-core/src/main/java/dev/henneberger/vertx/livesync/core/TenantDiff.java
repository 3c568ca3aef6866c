package dev.henneberger.vertx.livesync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tenants added and removed by a {@link TenantRegistry#reload()}. A tenant whose options changed
 * appears in both lists.
 */
public final class TenantDiff {

  private final List<Tenant> added;
  private final List<Tenant> removed;

  public TenantDiff(List<Tenant> added, List<Tenant> removed) {
    this.added = Collections.unmodifiableList(new ArrayList<>(added));
    this.removed = Collections.unmodifiableList(new ArrayList<>(removed));
  }

  public List<Tenant> added() {
    return added;
  }

  public List<Tenant> removed() {
    return removed;
  }

  public boolean isEmpty() {
    return added.isEmpty() && removed.isEmpty();
  }

  @Override
  public String toString() {
    return "TenantDiff{added=" + added + ", removed=" + removed + '}';
  }
}
