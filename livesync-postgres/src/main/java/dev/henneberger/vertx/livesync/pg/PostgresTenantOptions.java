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

import dev.henneberger.vertx.livesync.core.ReconnectPolicy;
import dev.henneberger.vertx.livesync.core.Tenant;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection and channel settings of one tenant database.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PostgresTenantOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_CHANNEL = "livesync";
  public static final Duration DEFAULT_NOTIFICATION_POLL_INTERVAL = Duration.ofMillis(500);

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String channel;
  private Duration notificationPollInterval;
  private ReconnectPolicy reconnectPolicy;

  public PostgresTenantOptions() {
    init();
  }

  public PostgresTenantOptions(JsonObject json) {
    init();
    PostgresTenantOptionsConverter.fromJson(json, this);
  }

  public PostgresTenantOptions(PostgresTenantOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.channel = other.channel;
    this.notificationPollInterval = other.notificationPollInterval;
    this.reconnectPolicy = other.reconnectPolicy == null ? null : other.reconnectPolicy.copy();
  }

  /**
   * Reads a tenant's options; the database defaults to the tenant id.
   */
  public static PostgresTenantOptions forTenant(Tenant tenant) {
    Objects.requireNonNull(tenant, "tenant");
    PostgresTenantOptions options = new PostgresTenantOptions(tenant.options());
    if (options.getDatabase() == null || options.getDatabase().isBlank()) {
      options.setDatabase(tenant.id());
    }
    return options;
  }

  public String getHost() {
    return host;
  }

  public PostgresTenantOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresTenantOptions setPort(Integer port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresTenantOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresTenantOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresTenantOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  /**
   * Environment variable to read the password from when none is set directly.
   */
  public PostgresTenantOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresTenantOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getChannel() {
    return channel;
  }

  public PostgresTenantOptions setChannel(String channel) {
    this.channel = channel;
    return this;
  }

  @GenIgnore
  public Duration getNotificationPollInterval() {
    return notificationPollInterval;
  }

  /**
   * Longest time the listener blocks waiting for notifications before checking for shutdown.
   */
  @GenIgnore
  public PostgresTenantOptions setNotificationPollInterval(Duration notificationPollInterval) {
    this.notificationPollInterval = notificationPollInterval;
    return this;
  }

  /**
   * Reconnect policy of this tenant, or {@code null} to use the node default.
   */
  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public PostgresTenantOptions setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = reconnectPolicy;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresTenantOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresTenantOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresTenantOptions(json);
  }

  String jdbcUrl() {
    return "jdbc:postgresql://" + host + ':' + port + '/' + database;
  }

  String resolvePassword() {
    String resolved = password;
    if (resolved == null || resolved.isBlank()) {
      if (passwordEnv != null && !passwordEnv.isBlank()) {
        resolved = System.getenv(passwordEnv);
      }
    }
    return resolved;
  }

  void validate() {
    require("host", host);
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    require("database", database);
    require("user", user);
    require("channel", channel);
    if (notificationPollInterval == null || notificationPollInterval.isNegative() || notificationPollInterval.isZero()) {
      throw new IllegalArgumentException("notificationPollInterval must be > 0");
    }
    if (reconnectPolicy != null) {
      reconnectPolicy.validate();
    }
  }

  private static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    channel = DEFAULT_CHANNEL;
    notificationPollInterval = DEFAULT_NOTIFICATION_POLL_INTERVAL;
    reconnectPolicy = null;
  }
}
