package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;

/**
 * Read access to feather definitions.
 */
public interface CatalogService {

  /**
   * Resolves a feather; fails when the catalog does not know it.
   */
  Future<FeatherDefinition> feather(String name);

  /**
   * Drops cached definitions so the next lookups read the catalog again.
   */
  Future<Void> reload();
}
