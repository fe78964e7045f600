package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Canonical token record. Legacy document shapes are normalized into this type once, at the
 * store boundary.
 *
 * @param tokenId        the token identifier
 * @param ownerUid       current owner
 * @param previousOwners ownership history, oldest first, append-only
 * @param keyHash        SHA-256 hex of the key on the card
 * @param counter        completed transfers
 * @param status         ledger status
 * @param lease          active authentication lease, or null
 * @param tagUid         physical tag UID, or null
 */
public record Token(
    String tokenId,
    String ownerUid,
    List<String> previousOwners,
    String keyHash,
    long counter,
    TokenStatus status,
    Lease lease,
    String tagUid) {

  public Token {
    Objects.requireNonNull(tokenId, "tokenId");
    previousOwners = previousOwners == null ? List.of() : List.copyOf(previousOwners);
    status = status == null ? TokenStatus.OK : status;
  }

  /**
   * A freshly registered token.
   *
   * @param tokenId  the token id
   * @param ownerUid the first owner
   * @param keyHash  SHA-256 hex of the card key
   * @param tagUid   tag UID or null
   * @return the token
   */
  public static Token register(String tokenId, String ownerUid, String keyHash, String tagUid) {
    return new Token(tokenId, ownerUid, List.of(), keyHash, 0, TokenStatus.OK, null, tagUid);
  }

  public boolean isOwnedBy(String uid) {
    return ownerUid != null && ownerUid.equals(uid);
  }

  public boolean hasLiveLease(Instant now) {
    return lease != null && lease.isLive(now);
  }

  public Token withStatus(TokenStatus newStatus) {
    return new Token(tokenId, ownerUid, previousOwners, keyHash, counter, newStatus, lease, tagUid);
  }

  public Token withLease(Lease newLease) {
    return new Token(tokenId, ownerUid, previousOwners, keyHash, counter, status, newLease, tagUid);
  }

  public Token withKeyHash(String newKeyHash) {
    return new Token(tokenId, ownerUid, previousOwners, newKeyHash, counter, status, lease, tagUid);
  }

  /**
   * The token after an ownership change. Status returns to OK.
   *
   * @param newOwner          the new owner
   * @param newPreviousOwners the validated history
   * @param newCounter        the new counter
   * @return the token
   */
  public Token transferredTo(String newOwner, List<String> newPreviousOwners, long newCounter) {
    return new Token(tokenId, newOwner, newPreviousOwners, keyHash, newCounter, TokenStatus.OK, lease, tagUid);
  }

  public TokenSnapshot snapshot() {
    return new TokenSnapshot(ownerUid, previousOwners, keyHash, counter);
  }
}
