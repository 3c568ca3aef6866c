package dev.henneberger.vertx.livesync.core;

import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class LiveSyncOptionsConverter {

  private LiveSyncOptionsConverter() {
  }

  static void fromJson(JsonObject json, LiveSyncOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("nodeId")) {
      options.setNodeId(json.getString("nodeId"));
    }
    if (json.containsKey("maxConcurrentFetches")) {
      options.setMaxConcurrentFetches(json.getInteger("maxConcurrentFetches"));
    }
    if (json.containsKey("lockTtlMs")) {
      options.setLockTtl(Duration.ofMillis(json.getLong("lockTtlMs")));
    }
    if (json.containsKey("lockSweepIntervalMs")) {
      options.setLockSweepInterval(Duration.ofMillis(json.getLong("lockSweepIntervalMs")));
    }
    if (json.containsKey("metadataStreams")) {
      options.setMetadataStreams(json.getBoolean("metadataStreams"));
    }

    JsonObject reconnectJson = json.getJsonObject("reconnectPolicy");
    if (reconnectJson != null) {
      options.setReconnectPolicy(ReconnectPolicy.fromJson(reconnectJson));
    }
  }

  static void toJson(LiveSyncOptions options, JsonObject json) {
    json.put("nodeId", options.getNodeId());
    json.put("maxConcurrentFetches", options.getMaxConcurrentFetches());
    if (options.getLockTtl() != null) {
      json.put("lockTtlMs", options.getLockTtl().toMillis());
    }
    if (options.getLockSweepInterval() != null) {
      json.put("lockSweepIntervalMs", options.getLockSweepInterval().toMillis());
    }
    json.put("metadataStreams", options.isMetadataStreams());

    ReconnectPolicy reconnectPolicy = options.getReconnectPolicy();
    if (reconnectPolicy != null) {
      json.put("reconnectPolicy", reconnectPolicy.toJson());
    }
  }
}
