package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.desfire.RandomProvider;
import com.codeheadsystems.swapdot.server.crypto.KeyHashes;
import com.codeheadsystems.swapdot.server.crypto.TransferProof;
import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.AuditType;
import com.codeheadsystems.swapdot.server.model.AuthSession;
import com.codeheadsystems.swapdot.server.model.PendingState;
import com.codeheadsystems.swapdot.server.model.StagedState;
import com.codeheadsystems.swapdot.server.model.StagedTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TokenSnapshot;
import com.codeheadsystems.swapdot.server.model.TokenStatus;
import com.codeheadsystems.swapdot.server.model.TransferEvent;
import com.codeheadsystems.swapdot.server.model.TransferProtocol;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import com.codeheadsystems.swapdot.server.model.TransferSessionState;
import com.codeheadsystems.swapdot.server.store.LedgerStore;
import com.codeheadsystems.swapdot.server.store.LedgerTransaction;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-phase transfer for flows that rewrite the card between ledger steps.
 * <p>
 * Sequence: open a transfer session, prove the card key server-side, stage the ownership
 * change, write the card, then commit. If the card write fails the client rolls back. The token
 * is mutated only by {@link #commit(String, String)}; staging and rollback touch the session
 * and the staged record alone, so a rollback can never leave the token in a different state.
 */
public class TwoPhaseTransferManager {

  private static final Logger log = LoggerFactory.getLogger(TwoPhaseTransferManager.class);

  /**
   * Length of the random challenge bound to a transfer session.
   */
  public static final int CHALLENGE_LENGTH = 16;

  /**
   * Bytes of card data that hold the token key.
   */
  public static final int CARD_KEY_LENGTH = 32;

  private final LedgerStore ledgerStore;
  private final AuthProtocolManager authProtocolManager;
  private final RandomProvider randomProvider;
  private final LedgerSettings settings;
  private final Clock clock;

  public TwoPhaseTransferManager(LedgerStore ledgerStore,
                                 AuthProtocolManager authProtocolManager,
                                 RandomProvider randomProvider,
                                 LedgerSettings settings,
                                 Clock clock) {
    this.ledgerStore = ledgerStore;
    this.authProtocolManager = authProtocolManager;
    this.randomProvider = randomProvider;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Outcome of a successful card key check.
   *
   * @param session the validated session
   * @param keyHash fingerprint of the key that matched
   * @param proof   HMAC binding the key to the session challenge and token
   */
  public record KeyValidation(TransferSession session, String keyHash, byte[] proof) {
  }

  /**
   * Opens a transfer session for a token the caller owns.
   *
   * @param tokenId   the token
   * @param callerUid the owner
   * @param toUid     intended receiver, or null
   * @return the session
   */
  public TransferSession openSession(String tokenId, String callerUid, String toUid) {
    String challengeHex = Hex.toHexString(randomProvider.randomBytes(CHALLENGE_LENGTH));
    TransferSession session = ledgerStore.runInTransaction(tx -> {
      Instant now = clock.instant();
      Token token = tx.token(tokenId).orElseThrow(() -> new NotFoundException("Token not found: " + tokenId));
      if (!token.isOwnedBy(callerUid)) {
        throw new PermissionException("Only the current owner can open a transfer session");
      }
      requireNoLegacyTransfer(tx, tokenId, now);
      boolean live = tx.transferSessionsForToken(tokenId).stream()
          .anyMatch(s -> s.state() == TransferSessionState.PENDING && !s.isExpired(now));
      if (live) {
        throw new ConflictException("A transfer session is already open for token " + tokenId);
      }
      TransferSession created = new TransferSession(UUID.randomUUID().toString(), tokenId, callerUid, toUid,
          challengeHex, false, null, null, TransferSessionState.PENDING, null,
          now.plus(settings.transferSessionTtl()), now);
      tx.putTransferSession(created);
      return created;
    });
    log.debug("openSession(tokenId={}) -> sessionId={}", tokenId, session.sessionId());
    return session;
  }

  /**
   * Checks the key read from the card against the ledger and marks the session validated.
   * <p>
   * The first {@value #CARD_KEY_LENGTH} bytes of {@code cardData} are the token key. It must
   * match the key written during this session if there was one, otherwise the token's
   * registered key.
   *
   * @param authSessionId     authenticated session for the same token
   * @param transferSessionId the transfer session
   * @param callerUid         the caller
   * @param cardData          bytes read from the card
   * @return the validation
   */
  public KeyValidation validateCardKey(String authSessionId, String transferSessionId, String callerUid,
                                       byte[] cardData) {
    if (cardData.length < CARD_KEY_LENGTH) {
      throw new IllegalArgumentException("Card returned fewer than " + CARD_KEY_LENGTH + " bytes: "
          + cardData.length);
    }
    AuthSession auth = authProtocolManager.requireAuthenticated(authSessionId, callerUid);
    byte[] key = Arrays.copyOf(cardData, CARD_KEY_LENGTH);
    String keyHash = KeyHashes.sha256Hex(key);

    KeyValidation validation = ledgerStore.runInTransaction(tx -> {
      TransferSession session = tx.transferSession(transferSessionId)
          .orElseThrow(() -> new NotFoundException("Unknown transfer session: " + transferSessionId));
      if (!session.tokenId().equals(auth.tokenId())) {
        throw new PermissionException("Auth session and transfer session are for different tokens");
      }
      if (session.state() == TransferSessionState.PENDING && session.isExpired(clock.instant())) {
        tx.putTransferSession(session.withState(TransferSessionState.EXPIRED));
        return tx.failAfterCommit(new ExpiredException("Transfer session " + transferSessionId + " expired"));
      }
      if (session.state() != TransferSessionState.PENDING) {
        throw new ConflictException("Transfer session " + transferSessionId + " is " + session.state());
      }
      Token token = tx.token(session.tokenId())
          .orElseThrow(() -> new NotFoundException("Token not found: " + session.tokenId()));
      String expected = session.pendingKeyHash() != null ? session.pendingKeyHash() : token.keyHash();
      if (!KeyHashes.matches(keyHash, expected)) {
        throw new PermissionException("Card key does not match the ledger");
      }
      byte[] proof = TransferProof.compute(key, Hex.decode(session.challengeHex()), session.tokenId());
      TransferSession validated = session.validated(keyHash);
      tx.putTransferSession(validated);
      return new KeyValidation(validated, keyHash, proof);
    });
    log.debug("validateCardKey(transferSessionId={}) validated", transferSessionId);
    return validation;
  }

  /**
   * Prepares an ownership change without touching the token.
   *
   * @param sessionId  a validated PENDING transfer session
   * @param callerUid  the owner or the receiver
   * @param newKeyHash fingerprint of the key the card will hold after the write
   * @param toUid      receiver, defaulting to the session's receiver and then the caller
   * @return the staged transfer
   */
  public StagedTransfer stage(String sessionId, String callerUid, String newKeyHash, String toUid) {
    String normalizedHash = KeyHashes.requireSha256Hex("newKeyHash", newKeyHash);
    StagedTransfer staged = ledgerStore.runInTransaction(tx -> {
      Instant now = clock.instant();
      TransferSession session = tx.transferSession(sessionId)
          .orElseThrow(() -> new NotFoundException("Unknown transfer session: " + sessionId));
      if (session.state() == TransferSessionState.PENDING && session.isExpired(now)) {
        tx.putTransferSession(session.withState(TransferSessionState.EXPIRED));
        return tx.failAfterCommit(new ExpiredException("Transfer session " + sessionId + " expired"));
      }
      if (session.state() != TransferSessionState.PENDING) {
        throw new ConflictException("Transfer session " + sessionId + " is " + session.state() + ", not PENDING");
      }
      if (!session.challengeValidated()) {
        throw new PermissionException("Card key has not been validated for session " + sessionId);
      }
      String receiver = toUid != null ? toUid : session.toUid() != null ? session.toUid() : callerUid;
      if (!callerUid.equals(session.fromUid()) && !callerUid.equals(receiver)) {
        throw new PermissionException("Caller is not a party to transfer session " + sessionId);
      }
      Token token = tx.token(session.tokenId())
          .orElseThrow(() -> new NotFoundException("Token not found: " + session.tokenId()));
      if (!token.isOwnedBy(session.fromUid())) {
        throw new ConflictException("Token ownership changed since the session was opened");
      }
      requireNoLegacyTransfer(tx, token.tokenId(), now);
      List<String> proposedHistory = new ArrayList<>(token.previousOwners());
      proposedHistory.add(session.fromUid());
      OwnershipHistory.requireAppendOnly(token.previousOwners(), proposedHistory, receiver);

      StagedTransfer created = new StagedTransfer(
          Hex.toHexString(randomProvider.randomBytes(16)),
          sessionId,
          token.tokenId(),
          session.fromUid(),
          receiver,
          token.snapshot(),
          new TokenSnapshot(receiver, proposedHistory, normalizedHash, token.counter() + 1),
          StagedState.STAGED,
          now.plus(settings.stagedTransferTtl()),
          now,
          null);
      tx.putStagedTransfer(created);
      tx.putTransferSession(session.staged(created.stagedId()));
      return created;
    });
    log.info("Staged transfer id={} token={} from={} to={}", staged.stagedId(), staged.tokenId(),
        staged.fromUid(), staged.toUid());
    return staged;
  }

  /**
   * Applies a staged post-image to the token. An OPEN legacy pending transfer left on the token
   * is canceled in the same transaction.
   *
   * @param stagedId  the staged transfer
   * @param callerUid the sender or the receiver
   * @return the token after the transfer
   */
  public Token commit(String stagedId, String callerUid) {
    Token committed = ledgerStore.runInTransaction(tx -> {
      Instant now = clock.instant();
      StagedTransfer staged = tx.stagedTransfer(stagedId)
          .orElseThrow(() -> new NotFoundException("Unknown staged transfer: " + stagedId));
      if (staged.state() != StagedState.STAGED) {
        throw new ConflictException("Staged transfer " + stagedId + " is " + staged.state());
      }
      requireParty(staged, callerUid);
      if (staged.isExpired(now)) {
        expire(tx, staged);
        return tx.failAfterCommit(new ExpiredException("Staged transfer " + stagedId + " expired"));
      }
      Token token = tx.token(staged.tokenId())
          .orElseThrow(() -> new NotFoundException("Token not found: " + staged.tokenId()));
      TokenSnapshot original = staged.original();
      if (!token.isOwnedBy(original.ownerUid()) || token.counter() != original.counter()) {
        throw new ConflictException("Token changed since the transfer was staged");
      }
      TokenSnapshot proposed = staged.proposed();
      OwnershipHistory.requireAppendOnly(token.previousOwners(), proposed.previousOwners(), proposed.ownerUid());

      Token updated = new Token(token.tokenId(), proposed.ownerUid(), proposed.previousOwners(), proposed.keyHash(),
          proposed.counter(), TokenStatus.OK, token.lease(), token.tagUid());
      tx.putToken(updated);
      tx.putStagedTransfer(staged.withState(StagedState.COMMITTED));
      tx.pendingTransfer(token.tokenId())
          .filter(p -> p.state() == PendingState.OPEN)
          .ifPresent(p -> tx.putPendingTransfer(p.withState(PendingState.CANCELED)));
      tx.transferSession(staged.sessionId())
          .ifPresent(s -> tx.putTransferSession(s.withState(TransferSessionState.COMPLETED)));
      tx.appendEvent(new TransferEvent(token.tokenId(), staged.fromUid(), staged.toUid(), updated.counter(), now,
          TransferProtocol.TWO_PHASE));
      TransferLedgerManager.recordTransferStats(tx, staged.fromUid(), staged.toUid());
      return updated;
    });
    log.info("Committed staged transfer id={} token={} owner={} counter={}", stagedId, committed.tokenId(),
        committed.ownerUid(), committed.counter());
    return committed;
  }

  /**
   * Abandons a staged transfer after a failed card write. The session goes back to PENDING so
   * the transfer can be staged again; the token is not touched.
   *
   * @param stagedId  the staged transfer
   * @param callerUid the sender or the receiver
   * @param reason    why the write failed
   * @return the rolled back record
   */
  public StagedTransfer rollback(String stagedId, String callerUid, String reason) {
    StagedTransfer rolledBack = ledgerStore.runInTransaction(tx -> {
      StagedTransfer staged = tx.stagedTransfer(stagedId)
          .orElseThrow(() -> new NotFoundException("Unknown staged transfer: " + stagedId));
      if (staged.state() != StagedState.STAGED) {
        throw new ConflictException("Staged transfer " + stagedId + " is " + staged.state());
      }
      requireParty(staged, callerUid);
      StagedTransfer updated = staged.rolledBack(reason);
      tx.putStagedTransfer(updated);
      tx.transferSession(staged.sessionId()).ifPresent(s -> tx.putTransferSession(s.reopened()));
      tx.appendAudit(new AuditEntry(AuditType.ROLLBACK, staged.tokenId(), callerUid,
          "staged=" + stagedId + " reason=" + reason, clock.instant()));
      return updated;
    });
    log.info("Rolled back staged transfer id={} reason={}", stagedId, reason);
    return rolledBack;
  }

  /**
   * Flips a PENDING session past its deadline to EXPIRED.
   *
   * @param sessionId the session
   * @return true if it was expired
   */
  public boolean expireSession(String sessionId) {
    return ledgerStore.runInTransaction(tx -> {
      Optional<TransferSession> session = tx.transferSession(sessionId)
          .filter(s -> s.state() == TransferSessionState.PENDING && s.isExpired(clock.instant()));
      session.ifPresent(s -> tx.putTransferSession(s.withState(TransferSessionState.EXPIRED)));
      return session.isPresent();
    });
  }

  /**
   * Flips a STAGED transfer past its deadline to EXPIRED and reopens its session.
   *
   * @param stagedId the staged transfer
   * @return true if it was expired
   */
  public boolean expireStaged(String stagedId) {
    boolean expired = ledgerStore.runInTransaction(tx -> {
      Optional<StagedTransfer> staged = tx.stagedTransfer(stagedId)
          .filter(s -> s.state() == StagedState.STAGED && s.isExpired(clock.instant()));
      staged.ifPresent(s -> expire(tx, s));
      return staged.isPresent();
    });
    if (expired) {
      log.warn("Expired staged transfer id={}", stagedId);
    }
    return expired;
  }

  private static void requireNoLegacyTransfer(LedgerTransaction tx, String tokenId, Instant now) {
    if (tx.pendingTransfer(tokenId).filter(p -> p.isLiveOpen(now)).isPresent()) {
      throw new ConflictException("A legacy transfer is pending for token " + tokenId);
    }
  }

  private static void expire(LedgerTransaction tx, StagedTransfer staged) {
    tx.putStagedTransfer(staged.withState(StagedState.EXPIRED));
    tx.transferSession(staged.sessionId())
        .filter(s -> s.state() == TransferSessionState.STAGED)
        .ifPresent(s -> tx.putTransferSession(s.reopened()));
  }

  private static void requireParty(StagedTransfer staged, String callerUid) {
    if (!callerUid.equals(staged.fromUid()) && !callerUid.equals(staged.toUid())) {
      throw new PermissionException("Caller is not a party to staged transfer " + staged.stagedId());
    }
  }
}
