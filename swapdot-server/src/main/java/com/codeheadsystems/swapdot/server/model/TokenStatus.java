package com.codeheadsystems.swapdot.server.model;

/**
 * Ledger status of a token.
 */
public enum TokenStatus {
  OK,
  /** A legacy pending transfer is open. */
  PENDING
}
