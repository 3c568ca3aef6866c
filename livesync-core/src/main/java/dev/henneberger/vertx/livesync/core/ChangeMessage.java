package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * A decoded change notification. Either a record change on a feather's table or a change on a
 * well-known metadata stream. Transient: consumed as soon as it is routed.
 */
public final class ChangeMessage {

  /**
   * What the message is about.
   */
  public enum Type {
    RECORD,
    METADATA
  }

  private final Type type;
  private final String tenantId;
  private final String feather;
  private final String recordId;
  private final String stream;
  private final ChangeKind kind;
  private final JsonObject data;
  private final String subscriptionId;
  private final String eventKey;

  private ChangeMessage(Type type,
                        String tenantId,
                        String feather,
                        String recordId,
                        String stream,
                        ChangeKind kind,
                        JsonObject data,
                        String subscriptionId,
                        String eventKey) {
    this.type = type;
    this.tenantId = tenantId;
    this.feather = feather;
    this.recordId = recordId;
    this.stream = stream;
    this.kind = Objects.requireNonNull(kind, "kind");
    this.data = data == null ? new JsonObject() : data;
    this.subscriptionId = subscriptionId;
    this.eventKey = eventKey;
  }

  public static ChangeMessage record(String tenantId,
                                     String feather,
                                     String recordId,
                                     ChangeKind kind,
                                     JsonObject data) {
    Objects.requireNonNull(feather, "feather");
    Objects.requireNonNull(recordId, "recordId");
    return new ChangeMessage(Type.RECORD, tenantId, feather, recordId, null, kind, data, null, null);
  }

  public static ChangeMessage metadata(String tenantId, String stream, ChangeKind kind, JsonObject data) {
    Objects.requireNonNull(stream, "stream");
    return new ChangeMessage(Type.METADATA, tenantId, null, null, stream, kind, data, null, null);
  }

  /**
   * Returns a copy addressed to one subscription, as emitted by database-side subscription
   * triggers.
   */
  public ChangeMessage addressedTo(String subscriptionId, String eventKey) {
    return new ChangeMessage(type, tenantId, feather, recordId, stream, kind, data, subscriptionId, eventKey);
  }

  public ChangeMessage withTenant(String tenantId) {
    return new ChangeMessage(type, tenantId, feather, recordId, stream, kind, data, subscriptionId, eventKey);
  }

  public Type type() {
    return type;
  }

  public boolean isRecord() {
    return type == Type.RECORD;
  }

  public boolean isMetadata() {
    return type == Type.METADATA;
  }

  public String tenantId() {
    return tenantId;
  }

  public String feather() {
    return feather;
  }

  public String recordId() {
    return recordId;
  }

  public String stream() {
    return stream;
  }

  public ChangeKind kind() {
    return kind;
  }

  public JsonObject data() {
    return data;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public String eventKey() {
    return eventKey;
  }

  public boolean isAddressed() {
    return eventKey != null;
  }

  @Override
  public String toString() {
    return "ChangeMessage{" +
      "type=" + type +
      ", tenantId='" + tenantId + '\'' +
      (type == Type.RECORD
        ? ", feather='" + feather + '\'' + ", recordId='" + recordId + '\''
        : ", stream='" + stream + '\'') +
      ", kind=" + kind +
      (eventKey == null ? "" : ", eventKey='" + eventKey + '\'') +
      '}';
  }
}
