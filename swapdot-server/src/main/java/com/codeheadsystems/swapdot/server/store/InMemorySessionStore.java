package com.codeheadsystems.swapdot.server.store;

import com.codeheadsystems.swapdot.server.model.AuthSession;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on server restart, which only forces clients to re-authenticate with
 * the card. Capacity is bounded so that abandoned handshakes cannot grow the map without limit.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, AuthSession> store = new ConcurrentHashMap<>();
  private final int maxSessions;
  private final Clock clock;

  public InMemorySessionStore(int maxSessions, Clock clock) {
    this.maxSessions = maxSessions;
    this.clock = clock;
    log.info("InMemorySessionStore(maxSessions={})", maxSessions);
  }

  @Override
  public void store(AuthSession session) {
    if (!store.containsKey(session.sessionId()) && store.size() >= maxSessions) {
      evictExpired();
      if (store.size() >= maxSessions) {
        throw new IllegalStateException("Too many pending sessions");
      }
    }
    store.put(session.sessionId(), session);
    log.debug("Stored session id={} phase={}", session.sessionId(), session.phase());
  }

  @Override
  public Optional<AuthSession> load(String sessionId) {
    return Optional.ofNullable(store.get(sessionId));
  }

  @Override
  public void revoke(String sessionId) {
    if (store.remove(sessionId) != null) {
      log.debug("Revoked session id={}", sessionId);
    }
  }

  @Override
  public int evictExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Iterator<AuthSession> it = store.values().iterator(); it.hasNext(); ) {
      if (it.next().isExpired(now)) {
        it.remove();
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Evicted {} expired session(s)", removed);
    }
    return removed;
  }

  @Override
  public int size() {
    return store.size();
  }
}
