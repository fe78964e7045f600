package com.codeheadsystems.swapdot.server.store;

import com.codeheadsystems.swapdot.server.model.AuthSession;
import java.util.Optional;

/**
 * Storage abstraction for card authentication sessions.
 * <p>
 * Implementations must be thread-safe. {@link #load(String)} returns a session even after its
 * deadline so that callers can tell an expired session from an unknown one; callers enforce
 * expiry and {@link #evictExpired()} reclaims the space.
 */
public interface SessionStore {

  /**
   * Stores or replaces a session.
   *
   * @param session the session
   * @throws IllegalStateException if a new session would exceed the store's capacity
   */
  void store(AuthSession session);

  /**
   * Loads a session by id.
   *
   * @param sessionId the session id
   * @return the session, or empty if unknown
   */
  Optional<AuthSession> load(String sessionId);

  /**
   * Removes a session. Unknown ids are ignored.
   *
   * @param sessionId the session id
   */
  void revoke(String sessionId);

  /**
   * Removes every session past its deadline.
   *
   * @return the number of sessions removed
   */
  int evictExpired();

  /**
   * Number of stored sessions, expired ones included.
   *
   * @return the size
   */
  int size();
}
