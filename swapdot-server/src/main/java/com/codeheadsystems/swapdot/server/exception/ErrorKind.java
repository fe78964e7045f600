package com.codeheadsystems.swapdot.server.exception;

/**
 * Failure categories shared by every service. Each maps to one HTTP status at the edge.
 */
public enum ErrorKind {
  /** Malformed frame, wrong status word or failed verification; the auth session is gone. */
  PROTOCOL,
  /** A derived session key has a weak DES block; re-authenticate. */
  WEAK_KEY,
  /** Not the owner, caller mismatch or an ownership history violation. */
  PERMISSION,
  /** Another transfer is active or the state changed underneath the caller. */
  CONFLICT,
  /** A session, pending or staged record passed its deadline. */
  EXPIRED,
  NOT_FOUND,
  INVALID_ARGUMENT,
  INTERNAL
}
