package dev.henneberger.vertx.livesync.core;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Process-wide settings of a {@link LiveSync} node.
 */
@DataObject
@JsonGen(publicConverter = false)
public class LiveSyncOptions {

  public static final int DEFAULT_MAX_CONCURRENT_FETCHES = 1;
  public static final Duration DEFAULT_LOCK_TTL = Duration.ofMinutes(30);
  public static final Duration DEFAULT_LOCK_SWEEP_INTERVAL = Duration.ofSeconds(60);

  private String nodeId;
  private int maxConcurrentFetches;
  private Duration lockTtl;
  private Duration lockSweepInterval;
  private boolean metadataStreams;
  private ReconnectPolicy reconnectPolicy;

  public LiveSyncOptions() {
    init();
  }

  public LiveSyncOptions(JsonObject json) {
    init();
    LiveSyncOptionsConverter.fromJson(json, this);
  }

  public LiveSyncOptions(LiveSyncOptions other) {
    this.nodeId = other.nodeId;
    this.maxConcurrentFetches = other.maxConcurrentFetches;
    this.lockTtl = other.lockTtl;
    this.lockSweepInterval = other.lockSweepInterval;
    this.metadataStreams = other.metadataStreams;
    this.reconnectPolicy = other.reconnectPolicy.copy();
  }

  /**
   * Identifies this process in the lock table. Generated when not set.
   */
  public String getNodeId() {
    return nodeId;
  }

  public LiveSyncOptions setNodeId(String nodeId) {
    this.nodeId = nodeId;
    return this;
  }

  public int getMaxConcurrentFetches() {
    return maxConcurrentFetches;
  }

  /**
   * How many distinct records may be re-fetched at once. {@code 1} serializes every fetch.
   */
  public LiveSyncOptions setMaxConcurrentFetches(int maxConcurrentFetches) {
    this.maxConcurrentFetches = maxConcurrentFetches;
    return this;
  }

  @GenIgnore
  public Duration getLockTtl() {
    return lockTtl;
  }

  /**
   * Default lifetime of a lock; {@link Duration#ZERO} keeps locks until released.
   */
  @GenIgnore
  public LiveSyncOptions setLockTtl(Duration lockTtl) {
    this.lockTtl = lockTtl;
    return this;
  }

  @GenIgnore
  public Duration getLockSweepInterval() {
    return lockSweepInterval;
  }

  /**
   * How often expired locks are deleted; {@link Duration#ZERO} disables the sweep.
   */
  @GenIgnore
  public LiveSyncOptions setLockSweepInterval(Duration lockSweepInterval) {
    this.lockSweepInterval = lockSweepInterval;
    return this;
  }

  public boolean isMetadataStreams() {
    return metadataStreams;
  }

  /**
   * Whether the node subscribes to the feather, route, catalog and tenant streams on start.
   */
  public LiveSyncOptions setMetadataStreams(boolean metadataStreams) {
    this.metadataStreams = metadataStreams;
    return this;
  }

  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public LiveSyncOptions setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    LiveSyncOptionsConverter.toJson(this, json);
    return json;
  }

  public LiveSyncOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new LiveSyncOptions(json);
  }

  public void validate() {
    if (nodeId == null || nodeId.isBlank()) {
      throw new IllegalArgumentException("nodeId is required");
    }
    if (maxConcurrentFetches < 1) {
      throw new IllegalArgumentException("maxConcurrentFetches must be >= 1");
    }
    if (lockTtl == null || lockTtl.isNegative()) {
      throw new IllegalArgumentException("lockTtl must be >= 0");
    }
    if (lockSweepInterval == null || lockSweepInterval.isNegative()) {
      throw new IllegalArgumentException("lockSweepInterval must be >= 0");
    }
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
  }

  private void init() {
    nodeId = UUID.randomUUID().toString();
    maxConcurrentFetches = DEFAULT_MAX_CONCURRENT_FETCHES;
    lockTtl = DEFAULT_LOCK_TTL;
    lockSweepInterval = DEFAULT_LOCK_SWEEP_INTERVAL;
    metadataStreams = true;
    reconnectPolicy = ReconnectPolicy.exponentialBackoff();
  }
}
