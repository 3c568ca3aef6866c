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
import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class PostgresTenantOptionsConverter {

  private PostgresTenantOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresTenantOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("channel")) {
      options.setChannel(json.getString("channel"));
    }
    if (json.containsKey("notificationPollIntervalMs")) {
      options.setNotificationPollInterval(Duration.ofMillis(json.getLong("notificationPollIntervalMs")));
    }

    JsonObject reconnectJson = json.getJsonObject("reconnectPolicy");
    if (reconnectJson != null) {
      options.setReconnectPolicy(ReconnectPolicy.fromJson(reconnectJson));
    }
  }

  static void toJson(PostgresTenantOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("channel", options.getChannel());
    if (options.getNotificationPollInterval() != null) {
      json.put("notificationPollIntervalMs", options.getNotificationPollInterval().toMillis());
    }

    ReconnectPolicy reconnectPolicy = options.getReconnectPolicy();
    if (reconnectPolicy != null) {
      json.put("reconnectPolicy", reconnectPolicy.toJson());
    }
  }
}
