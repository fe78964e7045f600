package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.desfire.CardResponse;
import com.codeheadsystems.swapdot.desfire.DesKey;
import com.codeheadsystems.swapdot.desfire.DesfireCommands;
import com.codeheadsystems.swapdot.desfire.IsoAuthentication;
import com.codeheadsystems.swapdot.desfire.MalformedFrameException;
import com.codeheadsystems.swapdot.desfire.StatusWord;
import com.codeheadsystems.swapdot.desfire.WeakKeyException;
import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.exception.ProtocolException;
import com.codeheadsystems.swapdot.server.model.AuthPhase;
import com.codeheadsystems.swapdot.server.model.AuthSession;
import com.codeheadsystems.swapdot.server.model.Lease;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.store.LedgerStore;
import com.codeheadsystems.swapdot.server.store.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of the DESFire legacy mutual authentication.
 * <p>
 * The card transport only relays frames; RndA, RndB and the session key never leave this
 * class and the {@link SessionStore}. While a handshake is in flight the token carries a short
 * lease so that two devices cannot authenticate the same token at once.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException} for bad request data</li>
 *   <li>{@link ProtocolException} for a malformed or unexpected card response; the session is gone</li>
 *   <li>{@link ExpiredException} when the session passed its deadline; the session is gone</li>
 *   <li>{@link WeakKeyException} when the derived key is degenerate; the session is gone</li>
 *   <li>{@link IllegalStateException} when the session store is at capacity</li>
 * </ul>
 */
public class AuthProtocolManager {

  private static final Logger log = LoggerFactory.getLogger(AuthProtocolManager.class);

  private final SessionStore sessionStore;
  private final LedgerStore ledgerStore;
  private final IsoAuthentication isoAuthentication;
  private final DesKey masterKey;
  private final LedgerSettings settings;
  private final Clock clock;

  public AuthProtocolManager(SessionStore sessionStore,
                             LedgerStore ledgerStore,
                             IsoAuthentication isoAuthentication,
                             DesKey masterKey,
                             LedgerSettings settings,
                             Clock clock) {
    this.sessionStore = sessionStore;
    this.ledgerStore = ledgerStore;
    this.isoAuthentication = isoAuthentication;
    this.masterKey = masterKey;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * First frame to send to the card, with the session that tracks the exchange.
   *
   * @param sessionId the new session
   * @param apdu      authenticate command
   * @param expiresAt session deadline
   */
  public record BeginResult(String sessionId, byte[] apdu, Instant expiresAt) {
  }

  /**
   * Outcome of one round.
   *
   * @param sessionId the session
   * @param phase     phase after the round
   * @param apdu      next frame for the card, or null once authenticated
   */
  public record ContinueResult(String sessionId, AuthPhase phase, byte[] apdu) {

    public boolean authenticated() {
      return phase == AuthPhase.AUTHENTICATED;
    }
  }

  /**
   * Starts authenticating {@code tokenId} for {@code userId}.
   * <p>
   * The caller must own the token. {@code allowUnowned} lets a caller authenticate a token that
   * has no ledger entry yet, for first registration; it never bypasses the owner check of an
   * existing token. Existing tokens get a lease for the length of the handshake.
   *
   * @param tokenId      the token
   * @param userId       the caller
   * @param keyNo        card key number
   * @param allowUnowned bootstrap mode
   * @return the session and the first APDU
   */
  public BeginResult begin(String tokenId, String userId, int keyNo, boolean allowUnowned) {
    if (keyNo < 0 || keyNo > 0x0D) {
      throw new IllegalArgumentException("Invalid key number: " + keyNo);
    }
    String sessionId = UUID.randomUUID().toString();
    Instant now = clock.instant();
    Lease lease = new Lease(UUID.randomUUID().toString(), sessionId, now.plus(settings.tokenLease()));

    String leaseId = ledgerStore.runInTransaction(tx -> {
      Optional<Token> existing = tx.token(tokenId);
      if (existing.isEmpty()) {
        if (!allowUnowned) {
          throw new NotFoundException("Token not found: " + tokenId);
        }
        return null;
      }
      Token token = existing.get();
      if (!token.isOwnedBy(userId)) {
        throw new PermissionException("Caller does not own token " + tokenId);
      }
      if (token.hasLiveLease(now)) {
        throw new ConflictException("Token " + tokenId + " is being authenticated by another session");
      }
      tx.putToken(token.withLease(lease));
      return lease.leaseId();
    });

    AuthSession session = AuthSession.start(sessionId, tokenId, userId, keyNo, leaseId,
        now.plus(settings.authSessionTtl()));
    try {
      sessionStore.store(session);
    } catch (IllegalStateException e) {
      releaseLease(session);
      throw e;
    }
    log.debug("begin(tokenId={}, sessionId={}, leased={})", tokenId, sessionId, leaseId != null);
    return new BeginResult(sessionId, DesfireCommands.authenticate(keyNo), session.expiresAt());
  }

  /**
   * Feeds one card response into the session. A malformed or failing response ends the session;
   * a response sent after authentication completed is rejected and the session is kept.
   *
   * @param sessionId    the session
   * @param userId       the caller, who must have started the session
   * @param cardResponse raw card response, status word included
   * @return the next step
   */
  public ContinueResult continueAuth(String sessionId, String userId, byte[] cardResponse) {
    AuthSession session = loadLive(sessionId, userId);
    if (session.phase() == AuthPhase.AUTHENTICATED) {
      throw new ConflictException("Session " + sessionId + " is already authenticated");
    }
    try {
      return session.phase() == AuthPhase.INIT
          ? answerChallenge(session, cardResponse)
          : verifyCard(session, cardResponse);
    } catch (ProtocolException | WeakKeyException e) {
      destroy(session);
      throw e;
    } catch (MalformedFrameException e) {
      destroy(session);
      throw new ProtocolException(e.getMessage(), e);
    }
  }

  private ContinueResult answerChallenge(AuthSession session, byte[] cardResponse) {
    byte[] encryptedRndB = expect(CardResponse.parse(cardResponse), StatusWord.ADDITIONAL_FRAME);
    IsoAuthentication.ChallengeAnswer answer = isoAuthentication.answerChallenge(masterKey, encryptedRndB);
    sessionStore.store(session.challengeSent(answer.rndA(), answer.rndB(), answer.chainedIv()));
    log.debug("continueAuth(sessionId={}) INIT -> CHALLENGE_SENT", session.sessionId());
    return new ContinueResult(session.sessionId(), AuthPhase.CHALLENGE_SENT,
        DesfireCommands.additionalFrame(answer.payload()));
  }

  private ContinueResult verifyCard(AuthSession session, byte[] cardResponse) {
    byte[] proof = expect(CardResponse.parse(cardResponse), StatusWord.OPERATION_OK);
    if (!isoAuthentication.verifyCardProof(masterKey, session.chainedIv(), proof, session.rndA())) {
      throw new ProtocolException("Card failed to prove knowledge of the key");
    }
    DesKey sessionKey = isoAuthentication.deriveSessionKey(masterKey, session.rndA(), session.rndB());
    sessionStore.store(session.authenticated(sessionKey));
    releaseLease(session);
    log.debug("continueAuth(sessionId={}) CHALLENGE_SENT -> AUTHENTICATED", session.sessionId());
    return new ContinueResult(session.sessionId(), AuthPhase.AUTHENTICATED, null);
  }

  private static byte[] expect(CardResponse response, StatusWord expected) {
    if (response.isFailure()) {
      throw new ProtocolException("Card returned " + response.describe());
    }
    if (response.status() != expected) {
      throw new ProtocolException("Unexpected card status: " + response.describe());
    }
    return response.data();
  }

  /**
   * An authenticated session owned by {@code userId}.
   *
   * @param sessionId the session
   * @param userId    the caller
   * @return the session
   * @throws PermissionException if the session is not yet authenticated
   */
  public AuthSession requireAuthenticated(String sessionId, String userId) {
    AuthSession session = loadLive(sessionId, userId);
    if (session.phase() != AuthPhase.AUTHENTICATED) {
      throw new PermissionException("Session " + sessionId + " is not authenticated");
    }
    return session;
  }

  /**
   * Replaces a stored session, keeping it within the store.
   *
   * @param session the updated session
   */
  public void update(AuthSession session) {
    sessionStore.store(session);
  }

  /**
   * Removes a session and releases any lease it still holds.
   *
   * @param session the session
   */
  public void destroy(AuthSession session) {
    sessionStore.revoke(session.sessionId());
    releaseLease(session);
    log.debug("Destroyed auth session id={}", session.sessionId());
  }

  private AuthSession loadLive(String sessionId, String userId) {
    AuthSession session = sessionStore.load(sessionId)
        .orElseThrow(() -> new NotFoundException("Unknown auth session: " + sessionId));
    if (session.isExpired(clock.instant())) {
      destroy(session);
      throw new ExpiredException("Auth session " + sessionId + " expired");
    }
    if (!session.userId().equals(userId)) {
      throw new PermissionException("Auth session " + sessionId + " belongs to another caller");
    }
    return session;
  }

  private void releaseLease(AuthSession session) {
    if (session.leaseId() == null) {
      return;
    }
    ledgerStore.runInTransaction(tx -> {
      tx.token(session.tokenId())
          .filter(t -> t.lease() != null && t.lease().leaseId().equals(session.leaseId()))
          .ifPresent(t -> tx.putToken(t.withLease(null)));
      return null;
    });
  }
}
