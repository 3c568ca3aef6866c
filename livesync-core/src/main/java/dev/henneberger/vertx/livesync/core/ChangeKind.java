package dev.henneberger.vertx.livesync.core;

import java.util.Locale;

/**
 * The kind of change carried by a {@link ChangeMessage}, with its wire name.
 */
public enum ChangeKind {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete");

  private final String wireName;

  ChangeKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static ChangeKind fromWire(String value) {
    if (value == null) {
      return null;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "create":
      case "insert":
      case "i":
        return CREATE;
      case "update":
      case "u":
        return UPDATE;
      case "delete":
      case "d":
        return DELETE;
      default:
        return null;
    }
  }
}
