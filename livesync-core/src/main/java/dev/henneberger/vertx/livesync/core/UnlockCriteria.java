package dev.henneberger.vertx.livesync.core;

import java.util.Objects;

/**
 * Selects the locks to release.
 */
public final class UnlockCriteria {

  private final String recordId;
  private final String username;
  private final String eventKey;
  private final String nodeId;

  private UnlockCriteria(String recordId, String username, String eventKey, String nodeId) {
    this.recordId = recordId;
    this.username = username;
    this.eventKey = eventKey;
    this.nodeId = nodeId;
  }

  /**
   * The lock on {@code recordId}, provided {@code username} holds it.
   */
  public static UnlockCriteria record(String recordId, String username) {
    return new UnlockCriteria(Objects.requireNonNull(recordId, "recordId"),
      Objects.requireNonNull(username, "username"), null, null);
  }

  /**
   * Every lock owned by a session.
   */
  public static UnlockCriteria eventKey(String eventKey) {
    return new UnlockCriteria(null, null, Objects.requireNonNull(eventKey, "eventKey"), null);
  }

  /**
   * Every lock taken through one server node.
   */
  public static UnlockCriteria node(String nodeId) {
    return new UnlockCriteria(null, null, null, Objects.requireNonNull(nodeId, "nodeId"));
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

  public boolean matches(Lock lock) {
    if (recordId != null) {
      return recordId.equals(lock.recordId()) && username.equals(lock.username());
    }
    if (eventKey != null) {
      return eventKey.equals(lock.eventKey());
    }
    return nodeId.equals(lock.nodeId());
  }

  @Override
  public String toString() {
    if (recordId != null) {
      return "UnlockCriteria{recordId='" + recordId + "', username='" + username + "'}";
    }
    if (eventKey != null) {
      return "UnlockCriteria{eventKey='" + eventKey + "'}";
    }
    return "UnlockCriteria{nodeId='" + nodeId + "'}";
  }
}
