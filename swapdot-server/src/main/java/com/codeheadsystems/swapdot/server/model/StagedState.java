package com.codeheadsystems.swapdot.server.model;

/**
 * State of a staged transfer.
 */
public enum StagedState {
  STAGED,
  COMMITTED,
  ROLLED_BACK,
  EXPIRED
}
