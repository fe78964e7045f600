package com.codeheadsystems.swapdot.server.model;

import com.codeheadsystems.swapdot.desfire.DesKey;
import java.time.Instant;

/**
 * Ephemeral state of one card authentication. Holds key material, so it never leaves the
 * server and is never logged.
 *
 * @param sessionId      session id
 * @param tokenId        the token being authenticated
 * @param userId         the caller
 * @param keyNo          card key number
 * @param phase          phase
 * @param rndA           reader challenge, set in CHALLENGE_SENT
 * @param rndB           card challenge, set in CHALLENGE_SENT
 * @param chainedIv      IV for the card's proof, set in CHALLENGE_SENT
 * @param sessionKey     derived key, set once AUTHENTICATED
 * @param leaseId        lease held on the token, or null when none was taken
 * @param pendingKeyHash SHA-256 hex of a key produced by ChangeKey, or null
 * @param expiresAt      deadline
 */
public record AuthSession(
    String sessionId,
    String tokenId,
    String userId,
    int keyNo,
    AuthPhase phase,
    byte[] rndA,
    byte[] rndB,
    byte[] chainedIv,
    DesKey sessionKey,
    String leaseId,
    String pendingKeyHash,
    Instant expiresAt) {

  public static AuthSession start(String sessionId, String tokenId, String userId, int keyNo, String leaseId,
                                  Instant expiresAt) {
    return new AuthSession(sessionId, tokenId, userId, keyNo, AuthPhase.INIT, null, null, null, null, leaseId,
        null, expiresAt);
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public AuthSession challengeSent(byte[] newRndA, byte[] newRndB, byte[] newChainedIv) {
    return new AuthSession(sessionId, tokenId, userId, keyNo, AuthPhase.CHALLENGE_SENT, newRndA, newRndB,
        newChainedIv, null, leaseId, pendingKeyHash, expiresAt);
  }

  /**
   * AUTHENTICATED with the derived key; the challenges are dropped.
   *
   * @param key the session key
   * @return the session
   */
  public AuthSession authenticated(DesKey key) {
    return new AuthSession(sessionId, tokenId, userId, keyNo, AuthPhase.AUTHENTICATED, null, null, null, key,
        leaseId, pendingKeyHash, expiresAt);
  }

  public AuthSession withPendingKeyHash(String keyHash) {
    return new AuthSession(sessionId, tokenId, userId, keyNo, phase, rndA, rndB, chainedIv, sessionKey, leaseId,
        keyHash, expiresAt);
  }

  @Override
  public String toString() {
    return "AuthSession[sessionId=" + sessionId + ", tokenId=" + tokenId + ", phase=" + phase + "]";
  }
}
