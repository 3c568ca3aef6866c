package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * One logical database served by the process, with the connection options its adapter needs.
 */
public final class Tenant {

  private final String id;
  private final JsonObject options;
  private volatile ChangeListener listener;

  public Tenant(String id, JsonObject options) {
    this.id = Objects.requireNonNull(id, "id");
    this.options = options == null ? new JsonObject() : options.copy();
  }

  public String id() {
    return id;
  }

  public JsonObject options() {
    return options.copy();
  }

  /**
   * The live listener for this tenant, or {@code null} until one has been attached.
   */
  public ChangeListener listener() {
    return listener;
  }

  void attachListener(ChangeListener listener) {
    this.listener = listener;
  }

  boolean sameConfiguration(Tenant other) {
    return other != null && id.equals(other.id) && options.equals(other.options);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tenant)) {
      return false;
    }
    return id.equals(((Tenant) o).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Tenant{id='" + id + "'}";
  }
}
