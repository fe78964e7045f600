package com.codeheadsystems.swapdot.server.store;

import com.codeheadsystems.swapdot.server.model.Lease;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TokenStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Persisted JSON shape of a token.
 * <p>
 * Documents written by older clients use snake_case names ({@code current_owner_id},
 * {@code previous_owners}, {@code key_hash}, {@code lock}) and may lack {@code counter} and
 * {@code status}. {@link #toToken(String)} is the only place those shapes are reconciled; new
 * writes always use the canonical fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenDocument(
    @JsonProperty("ownerUid") String ownerUid,
    @JsonProperty("previousOwners") List<String> previousOwners,
    @JsonProperty("keyHash") String keyHash,
    @JsonProperty("counter") Long counter,
    @JsonProperty("status") String status,
    @JsonProperty("tagUid") String tagUid,
    @JsonProperty("lease") LeaseDocument lease,
    @JsonProperty("current_owner_id") String legacyOwnerId,
    @JsonProperty("previous_owners") List<String> legacyPreviousOwners,
    @JsonProperty("key_hash") String legacyKeyHash,
    @JsonProperty("lock") LeaseDocument legacyLock) {

  /**
   * Canonical document for a token.
   *
   * @param token the token
   * @return the document
   */
  public static TokenDocument fromToken(Token token) {
    return new TokenDocument(
        token.ownerUid(),
        token.previousOwners(),
        token.keyHash(),
        token.counter(),
        token.status().name(),
        token.tagUid(),
        token.lease() == null ? null : LeaseDocument.fromLease(token.lease()),
        null, null, null, null);
  }

  /**
   * Normalizes either document shape into a {@link Token}. Canonical fields win.
   *
   * @param tokenId the document id
   * @return the token
   */
  public Token toToken(String tokenId) {
    LeaseDocument leaseDoc = lease != null ? lease : legacyLock;
    return new Token(
        tokenId,
        ownerUid != null ? ownerUid : legacyOwnerId,
        previousOwners != null ? previousOwners : legacyPreviousOwners,
        keyHash != null ? keyHash : legacyKeyHash,
        counter == null ? 0L : counter,
        "PENDING".equals(status) ? TokenStatus.PENDING : TokenStatus.OK,
        leaseDoc == null ? null : leaseDoc.toLease(),
        tagUid);
  }

  /**
   * Persisted lease. Expiry is epoch milliseconds, matching the legacy {@code lock} field.
   *
   * @param leaseId   lease id
   * @param sessionId holding session
   * @param expiresAt epoch milliseconds
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record LeaseDocument(
      @JsonProperty("leaseId") String leaseId,
      @JsonProperty("sessionId") String sessionId,
      @JsonProperty("expiresAt") Long expiresAt) {

    static LeaseDocument fromLease(Lease lease) {
      return new LeaseDocument(lease.leaseId(), lease.sessionId(), lease.expiresAt().toEpochMilli());
    }

    Lease toLease() {
      return new Lease(leaseId, sessionId, Instant.ofEpochMilli(expiresAt == null ? 0L : expiresAt));
    }
  }
}
