package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.util.Objects;

public final class CatalogChangeHandler implements MetadataHandler {

  private final CatalogService catalog;

  public CatalogChangeHandler(CatalogService catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public Future<Void> apply(ChangeMessage message) {
    return catalog.reload();
  }
}
