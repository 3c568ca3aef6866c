package dev.henneberger.vertx.livesync.core;

import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide table of active event sessions keyed by event key.
 *
 * <p>Confined to the owning event loop. Sinks are called inline and must not block; any further
 * asynchronous work has to be scheduled by the sink itself.
 */
public final class EventSessionRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(EventSessionRegistry.class);

  private final Map<String, EventSession> sessions = new LinkedHashMap<>();
  private final Map<String, IssuedKey> issued = new LinkedHashMap<>();
  private final List<SessionTeardownListener> teardownListeners = new CopyOnWriteArrayList<>();
  private final Supplier<String> keyGenerator;

  public EventSessionRegistry() {
    this(() -> UUID.randomUUID().toString());
  }

  public EventSessionRegistry(Supplier<String> keyGenerator) {
    this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
  }

  /**
   * Hands out a fresh event key bound to a transport session and tenant. The client presents it
   * when it opens its duplex channel.
   */
  public String issueKey(String sessionId, String tenantId) {
    Objects.requireNonNull(sessionId, "sessionId");
    String key = keyGenerator.get();
    issued.put(key, new IssuedKey(sessionId, tenantId));
    return key;
  }

  /**
   * Claims a previously issued key for a newly opened channel.
   */
  public Future<EventSession> connect(String eventKey, NotificationSink sink) {
    IssuedKey key = eventKey == null ? null : issued.get(eventKey);
    if (key == null) {
      return Future.failedFuture(new UnknownEventKeyException(eventKey));
    }
    EventSession session = register(eventKey, key.sessionId, key.tenantId, sink, true);
    LOG.debug("Listening for events {}", eventKey);
    return Future.succeededFuture(session);
  }

  public EventSession register(String eventKey,
                               String sessionId,
                               String tenantId,
                               NotificationSink sink,
                               boolean fetch) {
    EventSession session = new EventSession(eventKey, sessionId, tenantId, sink, fetch);
    EventSession previous = sessions.put(eventKey, session);
    if (previous != null) {
      LOG.debug("Replaced handler for event key {}", eventKey);
    }
    return session;
  }

  /**
   * Installs a server-internal handler, one without a transport session. It never receives
   * broadcasts.
   */
  public EventSession registerInternal(String eventKey, NotificationSink sink, boolean fetch) {
    return register(eventKey, null, null, sink, fetch);
  }

  /**
   * Removes the session for {@code eventKey}. Safe to call repeatedly; teardown listeners only
   * hear about the first call.
   */
  public boolean unregister(String eventKey) {
    if (eventKey == null) {
      return false;
    }
    EventSession session = sessions.remove(eventKey);
    IssuedKey key = issued.remove(eventKey);
    if (session == null && key == null) {
      return false;
    }
    String tenantId = session != null ? session.tenantId() : key.tenantId;
    for (SessionTeardownListener listener : teardownListeners) {
      try {
        listener.onTeardown(eventKey, tenantId);
      } catch (RuntimeException e) {
        LOG.warn("Teardown listener failed for event key {}", eventKey, e);
      }
    }
    LOG.info("Closed instance {}", eventKey);
    return true;
  }

  /**
   * Delivers to the session if it is still registered. An unknown key is a no-op; the session
   * may have gone away while a notification was in flight.
   */
  public boolean dispatch(String eventKey, Notification notification) {
    EventSession session = eventKey == null ? null : sessions.get(eventKey);
    if (session == null) {
      LOG.debug("Dropping notification for unknown event key {}", eventKey);
      return false;
    }
    deliver(session, notification);
    return true;
  }

  /**
   * Delivers to every client session.
   */
  public int broadcast(Notification notification) {
    return broadcast(notification, Collections.emptySet());
  }

  /**
   * Delivers to every client session whose event key is not in {@code excluded}.
   */
  public int broadcast(Notification notification, Collection<String> excluded) {
    int delivered = 0;
    for (EventSession session : new ArrayList<>(sessions.values())) {
      if (session.isClient() && !excluded.contains(session.eventKey())) {
        deliver(session, notification);
        delivered++;
      }
    }
    return delivered;
  }

  /**
   * Tells every channel opened by the transport session that it has signed out.
   */
  public int signOut(String sessionId) {
    int delivered = 0;
    for (EventSession session : sessionsOf(sessionId)) {
      deliver(session, Notification.signedOut());
      delivered++;
    }
    return delivered;
  }

  public List<EventSession> sessionsOf(String sessionId) {
    List<EventSession> out = new ArrayList<>();
    if (sessionId == null) {
      return out;
    }
    for (EventSession session : sessions.values()) {
      if (sessionId.equals(session.sessionId())) {
        out.add(session);
      }
    }
    return out;
  }

  public Optional<EventSession> find(String eventKey) {
    return Optional.ofNullable(eventKey == null ? null : sessions.get(eventKey));
  }

  public boolean isIssued(String eventKey) {
    return eventKey != null && (issued.containsKey(eventKey) || sessions.containsKey(eventKey));
  }

  public int size() {
    return sessions.size();
  }

  public Registration addTeardownListener(SessionTeardownListener listener) {
    SessionTeardownListener resolved = Objects.requireNonNull(listener, "listener");
    teardownListeners.add(resolved);
    return () -> teardownListeners.remove(resolved);
  }

  private static void deliver(EventSession session, Notification notification) {
    try {
      session.sink().deliver(notification);
    } catch (RuntimeException e) {
      LOG.warn("Delivery to event key {} failed", session.eventKey(), e);
    }
  }

  private static final class IssuedKey {
    private final String sessionId;
    private final String tenantId;

    private IssuedKey(String sessionId, String tenantId) {
      this.sessionId = sessionId;
      this.tenantId = tenantId;
    }
  }
}
