package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.server.crypto.KeyHashes;
import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.AuditType;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TokenStatus;
import com.codeheadsystems.swapdot.server.store.LedgerStore;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates ledger entries for tokens and reads them back.
 */
public class TokenRegistryManager {

  private static final Logger log = LoggerFactory.getLogger(TokenRegistryManager.class);

  private final LedgerStore ledgerStore;
  private final Clock clock;

  public TokenRegistryManager(LedgerStore ledgerStore, Clock clock) {
    this.ledgerStore = ledgerStore;
    this.clock = clock;
  }

  /**
   * Registers {@code tokenId} to {@code callerUid}.
   * <p>
   * With {@code forceOverwrite} an existing entry is taken over: its history is kept, the
   * displaced owner is appended to it and loses the token from their count, and the overwrite is
   * audited. The counter is kept since no transfer took place.
   *
   * @param tokenId        the token
   * @param callerUid      the new owner
   * @param keyHash        SHA-256 hex of the card key
   * @param tagUid         physical tag UID, or null
   * @param forceOverwrite take over an existing entry
   * @return the registered token
   */
  public Token register(String tokenId, String callerUid, String keyHash, String tagUid, boolean forceOverwrite) {
    String normalizedHash = KeyHashes.requireSha256Hex("keyHash", keyHash);
    Token registered = ledgerStore.runInTransaction(tx -> {
      Optional<Token> existing = tx.token(tokenId);
      Token token;
      if (existing.isEmpty()) {
        token = Token.register(tokenId, callerUid, normalizedHash, tagUid);
      } else if (!forceOverwrite) {
        throw new ConflictException("Token already registered: " + tokenId);
      } else {
        Token previous = existing.get();
        List<String> proposed = previous.isOwnedBy(callerUid)
            ? previous.previousOwners()
            : OwnershipHistory.appendIfNotLast(previous.previousOwners(), previous.ownerUid());
        OwnershipHistory.requireAppendOnly(previous.previousOwners(), proposed, callerUid);
        token = new Token(tokenId, callerUid, proposed, normalizedHash, previous.counter(),
            TokenStatus.OK, null, tagUid != null ? tagUid : previous.tagUid());
        tx.appendAudit(new AuditEntry(AuditType.FORCE_OVERWRITE, tokenId, callerUid,
            "previous owner " + previous.ownerUid(), clock.instant()));
        if (!previous.isOwnedBy(callerUid)) {
          tx.putUserStats(tx.userStats(previous.ownerUid()).displaced());
        }
      }
      if (existing.isEmpty() || !existing.get().isOwnedBy(callerUid)) {
        tx.putUserStats(tx.userStats(callerUid).registered());
      }
      tx.putToken(token);
      return token;
    });
    log.info("Registered token id={} owner={} overwrite={}", tokenId, callerUid, forceOverwrite);
    return registered;
  }

  /**
   * Reads a token.
   *
   * @param tokenId the token
   * @return the token
   */
  public Token get(String tokenId) {
    return ledgerStore.runInTransaction(tx -> tx.token(tokenId))
        .orElseThrow(() -> new NotFoundException("Token not found: " + tokenId));
  }
}
