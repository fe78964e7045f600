package com.codeheadsystems.swapdot.server.model;

/**
 * Which flow completed a transfer.
 */
public enum TransferProtocol {
  LEGACY,
  TWO_PHASE
}
