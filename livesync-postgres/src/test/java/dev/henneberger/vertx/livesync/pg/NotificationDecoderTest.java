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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.livesync.core.ChangeKind;
import dev.henneberger.vertx.livesync.core.ChangeMessage;
import dev.henneberger.vertx.livesync.core.EventSessionRegistry;
import dev.henneberger.vertx.livesync.core.FetchCoalescer;
import dev.henneberger.vertx.livesync.core.Notification;
import dev.henneberger.vertx.livesync.core.SubscribeOptions;
import dev.henneberger.vertx.livesync.core.SubscriptionManager;
import dev.henneberger.vertx.livesync.core.SubscriptionTarget;
import dev.henneberger.vertx.livesync.core.TenantRegistry;
import dev.henneberger.vertx.livesync.core.TenantSource;
import io.vertx.core.Future;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class NotificationDecoderTest {

  @Test
  void decodesTriggerPayload() {
    ChangeMessage message = NotificationDecoder.decode("acme",
      "{\"table\":\"public.contact\",\"id\":42,\"change\":\"update\",\"data\":{\"id\":42,\"name\":\"Ann\"}}");

    assertTrue(message.isRecord());
    assertEquals("acme", message.tenantId());
    assertEquals("Contact", message.feather());
    assertEquals("42", message.recordId());
    assertEquals(ChangeKind.UPDATE, message.kind());
    assertEquals("Ann", message.data().getString("name"));
    assertFalse(message.isAddressed());
  }

  @Test
  void snakeCaseTableReachesQueriesOnItsFeather() {
    ChangeMessage message = NotificationDecoder.decode("acme",
      "{\"table\":\"public.sales_order\",\"id\":7,\"change\":\"insert\",\"data\":{\"id\":7}}");
    assertEquals("SalesOrder", message.feather());

    EventSessionRegistry sessions = new EventSessionRegistry();
    List<Notification> received = new ArrayList<>();
    sessions.register("key-1", "s1", "acme", received::add, true);
    SubscriptionManager subscriptions = new SubscriptionManager(sessions,
      new FetchCoalescer((feather, id, tenant) -> Future.failedFuture("unused")),
      new TenantRegistry(TenantSource.of(new JsonArray())));
    String subscriptionId = subscriptions.subscribe("acme", "key-1",
      SubscriptionTarget.query("SalesOrder", Collections.emptyList()), SubscribeOptions.defaults().setMerge(true));

    subscriptions.receive(message);

    assertEquals(1, received.size());
    assertEquals(subscriptionId, received.get(0).subscriptionId());
    assertTrue(subscriptions.find(subscriptionId).members().contains("7"));
  }

  @Test
  void featherFieldWinsOverTable() {
    ChangeMessage message = NotificationDecoder.decode("acme",
      "{\"feather\":\"Contact\",\"table\":\"contact\",\"change\":\"insert\",\"data\":{\"id\":\"c1\"}}");

    assertEquals("Contact", message.feather());
    assertEquals("c1", message.recordId());
    assertEquals(ChangeKind.CREATE, message.kind());
  }

  @Test
  void streamPayloadBecomesMetadata() {
    ChangeMessage message = NotificationDecoder.decode("acme",
      "{\"stream\":\"Feather\",\"change\":\"delete\",\"data\":{\"name\":\"Contact\"}}");

    assertTrue(message.isMetadata());
    assertEquals("Feather", message.stream());
    assertEquals(ChangeKind.DELETE, message.kind());
  }

  @Test
  void subscriptionAddressesTheMessage() {
    ChangeMessage message = NotificationDecoder.decode("acme",
      "{\"table\":\"contact\",\"id\":\"c1\",\"change\":\"update\","
        + "\"subscription\":{\"id\":\"sub-1\",\"eventKey\":\"key-1\"}}");

    assertTrue(message.isAddressed());
    assertEquals("sub-1", message.subscriptionId());
    assertEquals("key-1", message.eventKey());
    assertTrue(message.data().isEmpty());
  }

  @Test
  void ignoresPayloadsItCannotRoute() {
    assertNull(NotificationDecoder.decode("acme", null));
    assertNull(NotificationDecoder.decode("acme", " "));
    assertNull(NotificationDecoder.decode("acme", "{\"table\":\"contact\",\"id\":1,\"change\":\"truncate\"}"));
    assertNull(NotificationDecoder.decode("acme", "{\"change\":\"update\",\"id\":1}"));
    assertNull(NotificationDecoder.decode("acme", "{\"table\":\"contact\",\"change\":\"update\"}"));
  }

  @Test
  void rejectsMalformedJson() {
    assertThrows(DecodeException.class, () -> NotificationDecoder.decode("acme", "not json"));
  }
}
