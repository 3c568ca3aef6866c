package dev.henneberger.vertx.livesync.core;

import java.util.Objects;

/**
 * One live client channel, or a server-internal handler when it has no transport session.
 */
public final class EventSession {

  private final String eventKey;
  private final String sessionId;
  private final String tenantId;
  private final NotificationSink sink;
  private final boolean fetch;

  public EventSession(String eventKey, String sessionId, String tenantId, NotificationSink sink, boolean fetch) {
    this.eventKey = Objects.requireNonNull(eventKey, "eventKey");
    this.sessionId = sessionId;
    this.tenantId = tenantId;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.fetch = fetch;
  }

  public String eventKey() {
    return eventKey;
  }

  public String sessionId() {
    return sessionId;
  }

  public String tenantId() {
    return tenantId;
  }

  public NotificationSink sink() {
    return sink;
  }

  /**
   * Whether record changes should be re-fetched before delivery. When false the session only
   * gets a bare signal.
   */
  public boolean fetch() {
    return fetch;
  }

  public boolean isClient() {
    return sessionId != null;
  }

  @Override
  public String toString() {
    return "EventSession{eventKey='" + eventKey + "', sessionId='" + sessionId + "', tenantId='" + tenantId
      + "', fetch=" + fetch + '}';
  }
}
