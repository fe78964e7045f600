package com.codeheadsystems.swapdot.server.model;

/**
 * Per-user aggregate counters, updated in the same transaction as the ownership change.
 *
 * @param uid                  the user
 * @param tokensOwned          tokens currently owned
 * @param tokensTransferredOut completed transfers away from the user
 * @param tokensReceived       completed transfers to the user
 */
public record UserStats(String uid, long tokensOwned, long tokensTransferredOut, long tokensReceived) {

  public static UserStats empty(String uid) {
    return new UserStats(uid, 0, 0, 0);
  }

  public UserStats registered() {
    return new UserStats(uid, tokensOwned + 1, tokensTransferredOut, tokensReceived);
  }

  /**
   * The user lost a token to a forced re-registration. Not a transfer, so only the owned count moves.
   */
  public UserStats displaced() {
    return new UserStats(uid, tokensOwned - 1, tokensTransferredOut, tokensReceived);
  }

  public UserStats transferredOut() {
    return new UserStats(uid, tokensOwned - 1, tokensTransferredOut + 1, tokensReceived);
  }

  public UserStats received() {
    return new UserStats(uid, tokensOwned + 1, tokensTransferredOut, tokensReceived + 1);
  }
}
