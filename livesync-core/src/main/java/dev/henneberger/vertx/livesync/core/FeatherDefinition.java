package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * The catalog's view of a feather (record type): its names, owning module and backing table.
 */
public final class FeatherDefinition {

  private final String name;
  private final String plural;
  private final String module;
  private final boolean readOnly;
  private final String table;

  public FeatherDefinition(String name, String plural, String module, boolean readOnly, String table) {
    this.name = Objects.requireNonNull(name, "name");
    this.plural = plural;
    this.module = module;
    this.readOnly = readOnly;
    this.table = table;
  }

  /**
   * Reads {@code name}, {@code plural}, {@code module}, {@code isReadOnly} and {@code table}.
   */
  public static FeatherDefinition fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    return new FeatherDefinition(
      json.getString("name"),
      json.getString("plural"),
      json.getString("module"),
      json.getBoolean("isReadOnly", json.getBoolean("readOnly", false)),
      json.getString("table"));
  }

  public String name() {
    return name;
  }

  public String plural() {
    return plural;
  }

  public String module() {
    return module;
  }

  public boolean readOnly() {
    return readOnly;
  }

  /**
   * Backing table, or {@code null} when it follows the feather name.
   */
  public String table() {
    return table;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("name", name)
      .put("isReadOnly", readOnly);
    if (plural != null) {
      json.put("plural", plural);
    }
    if (module != null) {
      json.put("module", module);
    }
    if (table != null) {
      json.put("table", table);
    }
    return json;
  }

  @Override
  public String toString() {
    return "FeatherDefinition{name='" + name + "', module='" + module + "', readOnly=" + readOnly + '}';
  }
}
