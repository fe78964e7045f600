package com.codeheadsystems.swapdot.server.model;

/**
 * Phase of a card authentication session.
 */
public enum AuthPhase {
  INIT,
  CHALLENGE_SENT,
  AUTHENTICATED
}
