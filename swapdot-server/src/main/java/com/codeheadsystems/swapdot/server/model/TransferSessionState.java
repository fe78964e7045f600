package com.codeheadsystems.swapdot.server.model;

/**
 * State of a two-phase transfer session.
 */
public enum TransferSessionState {
  PENDING,
  STAGED,
  COMPLETED,
  EXPIRED,
  /** Superseded by a legacy transfer on the same token. */
  CANCELED
}
