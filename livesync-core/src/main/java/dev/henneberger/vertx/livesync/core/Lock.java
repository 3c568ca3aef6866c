package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Objects;

/**
 * An advisory edit lock on one record.
 */
public final class Lock {

  private final String recordId;
  private final String username;
  private final String eventKey;
  private final String nodeId;
  private final Instant acquiredAt;
  private final Instant expiresAt;

  public Lock(String recordId,
              String username,
              String eventKey,
              String nodeId,
              Instant acquiredAt,
              Instant expiresAt) {
    this.recordId = Objects.requireNonNull(recordId, "recordId");
    this.username = Objects.requireNonNull(username, "username");
    this.eventKey = eventKey;
    this.nodeId = nodeId;
    this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt");
    this.expiresAt = expiresAt;
  }

  public String recordId() {
    return recordId;
  }

  public String username() {
    return username;
  }

  public String eventKey() {
    return eventKey;
  }

  public String nodeId() {
    return nodeId;
  }

  public Instant acquiredAt() {
    return acquiredAt;
  }

  /**
   * When the lock lapses, or {@code null} if it never does.
   */
  public Instant expiresAt() {
    return expiresAt;
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  /**
   * True when {@code other} is a re-lock by the same holder.
   */
  public boolean sameHolder(Lock other) {
    return other != null
      && username.equals(other.username)
      && Objects.equals(eventKey, other.eventKey);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("id", recordId)
      .put("username", username)
      .put("eventKey", eventKey)
      .put("nodeId", nodeId)
      .put("created", acquiredAt.toString());
    if (expiresAt != null) {
      json.put("expires", expiresAt.toString());
    }
    return json;
  }

  @Override
  public String toString() {
    return "Lock" + toJson().encode();
  }
}
