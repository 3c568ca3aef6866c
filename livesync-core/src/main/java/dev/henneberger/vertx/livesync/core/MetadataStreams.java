package dev.henneberger.vertx.livesync.core;

/**
 * Well-known metadata stream names.
 */
public final class MetadataStreams {

  public static final String FEATHER = "Feather";
  public static final String ROUTE = "Route";
  public static final String CATALOG = "Catalog";
  public static final String TENANT = "Tenant";

  private MetadataStreams() {
  }
}
