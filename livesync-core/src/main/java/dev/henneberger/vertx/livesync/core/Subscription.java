package dev.henneberger.vertx.livesync.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A session's registered interest in a record, query or metadata stream.
 */
public final class Subscription {

  private final String id;
  private final String eventKey;
  private final String tenantId;
  private final SubscriptionTarget target;
  private final boolean merge;
  private final Set<String> members;

  Subscription(String id, String eventKey, String tenantId, SubscriptionTarget target, boolean merge) {
    this.id = Objects.requireNonNull(id, "id");
    this.eventKey = Objects.requireNonNull(eventKey, "eventKey");
    this.tenantId = tenantId;
    this.target = Objects.requireNonNull(target, "target");
    this.merge = merge;
    this.members = new LinkedHashSet<>(target.recordIds());
  }

  public String id() {
    return id;
  }

  public String eventKey() {
    return eventKey;
  }

  /**
   * The tenant watched, or {@code null} for every tenant.
   */
  public String tenantId() {
    return tenantId;
  }

  public SubscriptionTarget target() {
    return target;
  }

  public boolean merge() {
    return merge;
  }

  /**
   * Record ids currently covered; for a query this follows creates and deletes.
   */
  public Set<String> members() {
    return Collections.unmodifiableSet(members);
  }

  boolean coversTenant(String messageTenant) {
    return tenantId == null || messageTenant == null || tenantId.equals(messageTenant);
  }

  boolean matches(ChangeMessage message) {
    if (!coversTenant(message.tenantId())) {
      return false;
    }
    switch (target.type()) {
      case RECORD:
        return message.isRecord() && target.name().equals(message.recordId());
      case QUERY:
        if (!message.isRecord() || !target.sameFeather(message.feather())) {
          return false;
        }
        return message.kind() == ChangeKind.CREATE || members.contains(message.recordId());
      case METADATA:
        return message.isMetadata() && target.name().equalsIgnoreCase(message.stream());
      default:
        return false;
    }
  }

  void track(ChangeMessage message) {
    if (target.type() != SubscriptionTarget.Type.QUERY) {
      return;
    }
    if (message.kind() == ChangeKind.CREATE) {
      members.add(message.recordId());
    } else if (message.kind() == ChangeKind.DELETE) {
      members.remove(message.recordId());
    }
  }

  @Override
  public String toString() {
    return "Subscription{id='" + id + "', eventKey='" + eventKey + "', tenantId='" + tenantId
      + "', target=" + target + ", merge=" + merge + '}';
  }
}
