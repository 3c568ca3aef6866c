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

import dev.henneberger.vertx.livesync.core.ChangeKind;
import dev.henneberger.vertx.livesync.core.ChangeMessage;
import io.vertx.core.json.JsonObject;

/**
 * Turns a {@code NOTIFY} payload into a {@link ChangeMessage}.
 *
 * <p>Record changes look like {@code {"table","id","change","data"}} and metadata changes like
 * {@code {"stream","change","data"}}. Either may carry {@code "subscription": {"id","eventKey"}}
 * to address a single session. A bare table name is mapped to its feather name,
 * {@code sales_order} to {@code SalesOrder}.
 */
final class NotificationDecoder {

  private NotificationDecoder() {
  }

  /**
   * @return the message, or {@code null} when the payload is not a change this node handles
   * @throws io.vertx.core.json.DecodeException when the payload is not JSON
   */
  static ChangeMessage decode(String tenantId, String payload) {
    if (payload == null || payload.isBlank()) {
      return null;
    }

    JsonObject json = new JsonObject(payload);
    ChangeKind kind = ChangeKind.fromWire(json.getString("change"));
    if (kind == null) {
      return null;
    }
    JsonObject data = json.getValue("data") instanceof JsonObject ? json.getJsonObject("data") : new JsonObject();

    ChangeMessage message;
    String stream = json.getString("stream");
    if (stream != null && !stream.isBlank()) {
      message = ChangeMessage.metadata(tenantId, stream, kind, data);
    } else {
      String feather = featherName(json);
      String id = recordId(json, data);
      if (feather == null || id == null) {
        return null;
      }
      message = ChangeMessage.record(tenantId, feather, id, kind, data);
    }

    JsonObject subscription = json.getValue("subscription") instanceof JsonObject
      ? json.getJsonObject("subscription")
      : null;
    if (subscription != null) {
      String subscriptionId = subscription.getString("id");
      String eventKey = subscription.getString("eventKey");
      if (subscriptionId != null && eventKey != null) {
        message = message.addressedTo(subscriptionId, eventKey);
      }
    }
    return message;
  }

  private static String featherName(JsonObject json) {
    String feather = json.getString("feather");
    if (feather != null && !feather.isBlank()) {
      return feather;
    }
    String table = json.getString("table");
    if (table == null || table.isBlank()) {
      return null;
    }
    int dot = table.lastIndexOf('.');
    return FeatherNames.fromTable(dot < 0 ? table : table.substring(dot + 1));
  }

  private static String recordId(JsonObject json, JsonObject data) {
    Object id = json.getValue("id");
    if (id == null) {
      id = data.getValue("id");
    }
    return id == null ? null : String.valueOf(id);
  }
}
