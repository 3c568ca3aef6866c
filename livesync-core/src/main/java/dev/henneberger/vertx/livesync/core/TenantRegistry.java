package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the tenants known to this process. Confined to the owning event loop.
 */
public final class TenantRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(TenantRegistry.class);

  private final TenantSource source;
  private Map<String, Tenant> tenants = new LinkedHashMap<>();

  public TenantRegistry(TenantSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public List<Tenant> list() {
    return Collections.unmodifiableList(new ArrayList<>(tenants.values()));
  }

  public Optional<Tenant> find(String tenantId) {
    if (tenantId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tenants.get(tenantId));
  }

  /**
   * Re-reads the tenant configuration and swaps it in. Malformed entries are skipped. When the
   * source itself fails the current tenants stay as they are.
   */
  public Future<TenantDiff> reload() {
    Future<JsonArray> loaded;
    try {
      loaded = source.load();
    } catch (RuntimeException e) {
      loaded = Future.failedFuture(e);
    }
    return loaded
      .onFailure(err -> LOG.warn("Could not load tenant configuration, keeping {} tenants", tenants.size(), err))
      .map(this::apply);
  }

  private TenantDiff apply(JsonArray entries) {
    Map<String, Tenant> next = parse(entries);
    List<Tenant> added = new ArrayList<>();
    List<Tenant> removed = new ArrayList<>();

    for (Tenant current : tenants.values()) {
      Tenant replacement = next.get(current.id());
      if (replacement == null) {
        removed.add(current);
      } else if (!current.sameConfiguration(replacement)) {
        removed.add(current);
        added.add(replacement);
      } else {
        next.put(current.id(), current);
      }
    }
    for (Tenant candidate : next.values()) {
      if (!tenants.containsKey(candidate.id())) {
        added.add(candidate);
      }
    }

    tenants = next;
    TenantDiff diff = new TenantDiff(added, removed);
    if (!diff.isEmpty()) {
      LOG.info("Tenants reloaded: added={} removed={}", ids(added), ids(removed));
    }
    return diff;
  }

  static Map<String, Tenant> parse(JsonArray entries) {
    Map<String, Tenant> parsed = new LinkedHashMap<>();
    if (entries == null) {
      return parsed;
    }
    for (int idx = 0; idx < entries.size(); idx++) {
      try {
        Tenant tenant = parseEntry(idx, entries.getValue(idx));
        if (tenant == null) {
          continue;
        }
        if (parsed.containsKey(tenant.id())) {
          throw new TenantConfigException(idx, "duplicate tenant id '" + tenant.id() + "'");
        }
        parsed.put(tenant.id(), tenant);
      } catch (TenantConfigException e) {
        LOG.warn("Skipping tenant: {}", e.getMessage());
      }
    }
    return parsed;
  }

  private static Tenant parseEntry(int idx, Object raw) {
    if (!(raw instanceof JsonObject)) {
      throw new TenantConfigException(idx, "expected an object but got " + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }
    JsonObject entry = (JsonObject) raw;
    if (Boolean.FALSE.equals(entry.getValue("enabled"))) {
      return null;
    }
    Object id = entry.containsKey("id") ? entry.getValue("id") : entry.getValue("database");
    if (!(id instanceof String) || ((String) id).isBlank()) {
      throw new TenantConfigException(idx, "missing tenant id");
    }
    return new Tenant((String) id, entry);
  }

  private static List<String> ids(List<Tenant> list) {
    List<String> out = new ArrayList<>(list.size());
    for (Tenant tenant : list) {
      out.add(tenant.id());
    }
    return out;
  }
}
