/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.livesync.pg;

import dev.henneberger.vertx.livesync.core.LiveSyncOptions;
import dev.henneberger.vertx.livesync.core.TenantSource;
import io.vertx.core.json.JsonArray;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node configuration read from the environment. Every tenant is a database on the same server.
 */
public final class LiveSyncAppConfig {

  private final String pgHost;
  private final int pgPort;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final List<String> tenants;
  private final String channel;
  private final String nodeId;

  private LiveSyncAppConfig(String pgHost,
                            int pgPort,
                            String pgUser,
                            String pgPasswordEnv,
                            boolean ssl,
                            List<String> tenants,
                            String channel,
                            String nodeId) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.tenants = Collections.unmodifiableList(tenants);
    this.channel = channel;
    this.nodeId = nodeId;
  }

  public static LiveSyncAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static LiveSyncAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String host = envOrDefault(env, "PGHOST", PostgresTenantOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PostgresTenantOptions.DEFAULT_PORT);
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    List<String> tenants = listEnvOrDefault(env, "LIVESYNC_TENANTS", envOrDefault(env, "PGDATABASE", "postgres"));
    String channel = envOrDefault(env, "LIVESYNC_CHANNEL", PostgresTenantOptions.DEFAULT_CHANNEL);
    String nodeId = envOrDefault(env, "LIVESYNC_NODE_ID", null);

    return new LiveSyncAppConfig(host, port, user, passwordEnv, ssl, tenants, channel, nodeId);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public List<String> tenants() {
    return tenants;
  }

  public String channel() {
    return channel;
  }

  /**
   * Configured node id, or {@code null} to generate one.
   */
  public String nodeId() {
    return nodeId;
  }

  /**
   * Connection settings shared by every tenant; the database is left unset.
   */
  public PostgresTenantOptions toTenantTemplate() {
    return new PostgresTenantOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setChannel(channel);
  }

  public JsonArray toTenantConfig() {
    JsonArray out = new JsonArray();
    for (String database : tenants) {
      out.add(toTenantTemplate().setDatabase(database).toJson().put("id", database));
    }
    return out;
  }

  public TenantSource toTenantSource() {
    return TenantSource.of(toTenantConfig());
  }

  public LiveSyncOptions toLiveSyncOptions() {
    LiveSyncOptions options = new LiveSyncOptions();
    if (nodeId != null) {
      options.setNodeId(nodeId);
    }
    return options;
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }

  private static List<String> listEnvOrDefault(Map<String, String> env, String key, String defaultValue) {
    List<String> out = new ArrayList<>();
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      out.add(defaultValue);
      return out;
    }
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty() && !out.contains(trimmed)) {
        out.add(trimmed);
      }
    }
    return out;
  }
}
