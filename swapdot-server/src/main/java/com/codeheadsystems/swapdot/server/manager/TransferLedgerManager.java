package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.AuditType;
import com.codeheadsystems.swapdot.server.model.PendingState;
import com.codeheadsystems.swapdot.server.model.PendingTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
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
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The legacy two-step transfer: the owner initiates, the receiver finalizes, and ownership flips
 * in one transaction.
 * <p>
 * A token has at most one pending transfer, stored under the token id. Finalize deletes it in
 * the same transaction that moves ownership, so a COMMITTED pending record is never written by
 * this class. Records in that state can still appear from older writers; {@link
 * #reconcileCommitted(String)} repairs them wherever they are met.
 */
public class TransferLedgerManager {

  private static final Logger log = LoggerFactory.getLogger(TransferLedgerManager.class);

  private final LedgerStore ledgerStore;
  private final LedgerSettings settings;
  private final Clock clock;

  public TransferLedgerManager(LedgerStore ledgerStore, LedgerSettings settings, Clock clock) {
    this.ledgerStore = ledgerStore;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Opens a pending transfer for a token the caller owns. An unexpired OPEN transfer of another
   * caller blocks it; the caller's own OPEN transfer is replaced. Pending two-phase sessions
   * for the token are canceled.
   *
   * @param tokenId   the token
   * @param callerUid the owner
   * @return the new pending transfer
   */
  public PendingTransfer initiate(String tokenId, String callerUid) {
    PendingTransfer result = ledgerStore.runInTransaction(tx -> {
      Instant now = clock.instant();
      Token token = tx.token(tokenId).orElseThrow(() -> new NotFoundException("Token not found: " + tokenId));
      Optional<PendingTransfer> existing = tx.pendingTransfer(tokenId);
      if (existing.isPresent() && existing.get().state() == PendingState.COMMITTED) {
        token = reconcile(tx, token, existing.get(), now);
        existing = Optional.empty();
        if (!token.isOwnedBy(callerUid)) {
          return tx.failAfterCommit(new PermissionException("Only the current owner can initiate a transfer"));
        }
      }
      if (!token.isOwnedBy(callerUid)) {
        throw new PermissionException("Only the current owner can initiate a transfer");
      }
      if (existing.isPresent() && existing.get().isLiveOpen(now) && !existing.get().fromUid().equals(callerUid)) {
        throw new ConflictException("Another transfer is active for token " + tokenId);
      }
      PendingTransfer pending = new PendingTransfer(tokenId, callerUid, null, token.counter() + 1,
          now.plus(settings.pendingTransferTtl()), PendingState.OPEN, now);
      tx.putPendingTransfer(pending);
      tx.putToken(token.withStatus(TokenStatus.PENDING));
      cancelPendingSessions(tx, tokenId);
      return pending;
    });
    log.info("Initiated transfer of token id={} from={} nextCounter={}", tokenId, callerUid, result.nextCounter());
    return result;
  }

  /**
   * Completes the pending transfer, making the caller (or the bound receiver) the owner.
   *
   * @param tokenId   the token
   * @param callerUid the receiver
   * @param tagUid    UID of the tag the receiver tapped, or null
   * @return the token after the transfer
   */
  public Token finalizeTransfer(String tokenId, String callerUid, String tagUid) {
    Token result = ledgerStore.runInTransaction(tx -> {
      Instant now = clock.instant();
      Token token = tx.token(tokenId).orElseThrow(() -> new NotFoundException("Token not found: " + tokenId));
      PendingTransfer pending = tx.pendingTransfer(tokenId)
          .orElseThrow(() -> new NotFoundException("No pending transfer for token " + tokenId));
      if (pending.state() == PendingState.COMMITTED) {
        return reconcile(tx, token, pending, now);
      }
      if (pending.state() != PendingState.OPEN) {
        throw new ConflictException("Pending transfer is " + pending.state() + ", expected OPEN");
      }
      if (pending.isExpired(now)) {
        tx.putPendingTransfer(pending.withState(PendingState.EXPIRED));
        tx.putToken(token.withStatus(TokenStatus.OK));
        return tx.failAfterCommit(new ExpiredException("Pending transfer for token " + tokenId + " expired"));
      }
      if (!pending.fromUid().equals(token.ownerUid())) {
        throw new ConflictException("Owner changed; pending transfer is invalid");
      }
      if (token.tagUid() != null && tagUid != null && !token.tagUid().equals(tagUid)) {
        throw new PermissionException("Tag UID mismatch");
      }
      if (pending.toUid() != null && !pending.toUid().equals(callerUid)) {
        throw new PermissionException("Pending transfer is bound to a different receiver");
      }
      String toUid = pending.toUid() != null ? pending.toUid() : callerUid;
      String fromUid = token.ownerUid();
      List<String> proposed = OwnershipHistory.appendIfNotLast(token.previousOwners(), fromUid);
      OwnershipHistory.requireAppendOnly(token.previousOwners(), proposed, toUid);

      Token transferred = token.transferredTo(toUid, proposed, pending.nextCounter());
      tx.putToken(transferred);
      tx.deletePendingTransfer(tokenId);
      tx.appendEvent(new TransferEvent(tokenId, fromUid, toUid, transferred.counter(), now, TransferProtocol.LEGACY));
      recordTransferStats(tx, fromUid, toUid);
      cancelPendingSessions(tx, tokenId);
      return transferred;
    });
    log.info("Finalized transfer of token id={} owner={} counter={}", tokenId, result.ownerUid(), result.counter());
    return result;
  }

  /**
   * Repairs a COMMITTED pending record: moves ownership to its receiver if that has not
   * happened, audits the correction, and deletes the record. Safe to repeat.
   *
   * @param tokenId the token
   * @return true if a record was repaired
   */
  public boolean reconcileCommitted(String tokenId) {
    return ledgerStore.runInTransaction(tx -> {
      Optional<PendingTransfer> pending = tx.pendingTransfer(tokenId)
          .filter(p -> p.state() == PendingState.COMMITTED);
      if (pending.isEmpty()) {
        return false;
      }
      Optional<Token> token = tx.token(tokenId);
      if (token.isEmpty()) {
        log.error("COMMITTED pending transfer for missing token id={}, deleting", tokenId);
        tx.deletePendingTransfer(tokenId);
        return true;
      }
      reconcile(tx, token.get(), pending.get(), clock.instant());
      return true;
    });
  }

  /**
   * Flips an OPEN pending transfer past its deadline to EXPIRED and clears the token's PENDING
   * status. Re-checked inside the transaction, so a racing finalize wins cleanly.
   *
   * @param tokenId the token
   * @return true if it was expired
   */
  public boolean expireOpenPending(String tokenId) {
    boolean expired = ledgerStore.runInTransaction(tx -> {
      Instant now = clock.instant();
      Optional<PendingTransfer> pending = tx.pendingTransfer(tokenId)
          .filter(p -> p.state() == PendingState.OPEN && p.isExpired(now));
      if (pending.isEmpty()) {
        return false;
      }
      tx.putPendingTransfer(pending.get().withState(PendingState.EXPIRED));
      tx.token(tokenId).ifPresent(t -> tx.putToken(t.withStatus(TokenStatus.OK)));
      return true;
    });
    if (expired) {
      log.warn("Expired pending transfer for token id={}", tokenId);
    }
    return expired;
  }

  private Token reconcile(LedgerTransaction tx, Token token, PendingTransfer pending, Instant now) {
    Token repaired = token;
    boolean ownershipFixed = false;
    if (pending.toUid() != null && !token.isOwnedBy(pending.toUid())) {
      List<String> history = new ArrayList<>(token.previousOwners());
      if (!history.contains(pending.fromUid())) {
        history.add(pending.fromUid());
      }
      OwnershipHistory.requireAppendOnly(token.previousOwners(), history, pending.toUid());
      repaired = token.transferredTo(pending.toUid(), history, Math.max(token.counter(), pending.nextCounter()));
      ownershipFixed = true;
    } else if (token.status() != TokenStatus.OK) {
      repaired = token.withStatus(TokenStatus.OK);
    }
    if (repaired != token) {
      tx.putToken(repaired);
    }
    tx.deletePendingTransfer(token.tokenId());
    tx.appendAudit(new AuditEntry(AuditType.AUTO_CLEANUP_COMMITTED, token.tokenId(), AuditEntry.SYSTEM_ACTOR,
        "from=" + pending.fromUid() + " to=" + pending.toUid() + " ownershipCorrected=" + ownershipFixed, now));
    log.warn("Reconciled COMMITTED pending transfer for token id={} ownershipCorrected={}",
        token.tokenId(), ownershipFixed);
    return repaired;
  }

  static void recordTransferStats(LedgerTransaction tx, String fromUid, String toUid) {
    tx.putUserStats(tx.userStats(fromUid).transferredOut());
    tx.putUserStats(tx.userStats(toUid).received());
  }

  private static void cancelPendingSessions(LedgerTransaction tx, String tokenId) {
    for (TransferSession session : tx.transferSessionsForToken(tokenId)) {
      if (session.state() == TransferSessionState.PENDING) {
        tx.putTransferSession(session.withState(TransferSessionState.CANCELED));
      }
    }
  }
}
