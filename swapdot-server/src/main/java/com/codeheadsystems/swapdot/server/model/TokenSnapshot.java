package com.codeheadsystems.swapdot.server.model;

import java.util.List;

/**
 * The ownership-bearing fields of a token, captured as the pre- and post-image of a staged
 * transfer.
 *
 * @param ownerUid       owner
 * @param previousOwners ownership history
 * @param keyHash        SHA-256 hex of the card key
 * @param counter        transfer counter
 */
public record TokenSnapshot(String ownerUid, List<String> previousOwners, String keyHash, long counter) {

  public TokenSnapshot {
    previousOwners = previousOwners == null ? List.of() : List.copyOf(previousOwners);
  }
}
