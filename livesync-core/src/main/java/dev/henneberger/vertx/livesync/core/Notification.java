package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * The object pushed to a session: {@code {subscription: {subscriptionId, change, deleted?}, data}}.
 */
public final class Notification {

  public static final String CHANGE_FEATHER = "feather";
  public static final String CHANGE_SIGNED_OUT = "signedOut";

  private final String subscriptionId;
  private final String change;
  private final Boolean deleted;
  private final boolean merge;
  private final Object data;

  private Notification(String subscriptionId, String change, Boolean deleted, boolean merge, Object data) {
    this.subscriptionId = subscriptionId == null ? "" : subscriptionId;
    this.change = Objects.requireNonNull(change, "change");
    this.deleted = deleted;
    this.merge = merge;
    this.data = data == null ? new JsonObject() : data;
  }

  public static Notification of(String subscriptionId, ChangeKind kind, Object data) {
    Objects.requireNonNull(kind, "kind");
    return new Notification(subscriptionId, kind.wireName(), kind == ChangeKind.DELETE ? Boolean.TRUE : null, false, data);
  }

  public static Notification merge(String subscriptionId, ChangeKind kind, Object data) {
    Objects.requireNonNull(kind, "kind");
    return new Notification(subscriptionId, kind.wireName(), kind == ChangeKind.DELETE ? Boolean.TRUE : null, true, data);
  }

  public static Notification feather(boolean deleted, Object data) {
    return new Notification("", CHANGE_FEATHER, deleted, false, data);
  }

  public static Notification signedOut() {
    return new Notification("", CHANGE_SIGNED_OUT, null, false, new JsonObject());
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public String change() {
    return change;
  }

  public Boolean deleted() {
    return deleted;
  }

  public boolean isMerge() {
    return merge;
  }

  public Object data() {
    return data;
  }

  public JsonObject toJson() {
    JsonObject subscription = new JsonObject()
      .put("subscriptionId", subscriptionId)
      .put("change", change);
    if (deleted != null) {
      subscription.put("deleted", deleted);
    }
    if (merge) {
      subscription.put("merge", true);
    }
    return new JsonObject()
      .put("subscription", subscription)
      .put("data", data);
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}
