package com.codeheadsystems.swapdot.server.model;

/**
 * State of a legacy pending transfer.
 */
public enum PendingState {
  OPEN,
  /**
   * Never written by this service. Older writers left it behind after a crash; it is healed by
   * reconciliation whenever it is seen.
   */
  COMMITTED,
  EXPIRED,
  CANCELED
}
