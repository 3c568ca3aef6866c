package dev.henneberger.vertx.livesync.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * What a subscription watches: one record, the records of a query, or a metadata stream.
 */
public final class SubscriptionTarget {

  public enum Type {
    RECORD,
    QUERY,
    METADATA
  }

  private final Type type;
  private final String name;
  private final Set<String> recordIds;

  private SubscriptionTarget(Type type, String name, Set<String> recordIds) {
    this.type = type;
    this.name = name;
    this.recordIds = recordIds;
  }

  public static SubscriptionTarget record(String recordId) {
    return new SubscriptionTarget(Type.RECORD, Objects.requireNonNull(recordId, "recordId"),
      Collections.singleton(recordId));
  }

  /**
   * A query result over {@code feather} currently holding {@code recordIds}. New records of the
   * feather join it as they are created.
   */
  public static SubscriptionTarget query(String feather, Collection<String> recordIds) {
    Objects.requireNonNull(feather, "feather");
    Set<String> ids = recordIds == null ? Collections.emptySet()
      : Collections.unmodifiableSet(new LinkedHashSet<>(recordIds));
    return new SubscriptionTarget(Type.QUERY, feather, ids);
  }

  public static SubscriptionTarget metadata(String stream) {
    return new SubscriptionTarget(Type.METADATA, Objects.requireNonNull(stream, "stream"), Collections.emptySet());
  }

  public Type type() {
    return type;
  }

  /**
   * The record id, the query's feather, or the stream name.
   */
  public String name() {
    return name;
  }

  public Set<String> recordIds() {
    return recordIds;
  }

  boolean sameFeather(String feather) {
    return feather != null && name.toLowerCase(Locale.ROOT).equals(feather.toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return type + ":" + name;
  }
}
