package com.codeheadsystems.swapdot.server.model;

/**
 * Kinds of audit log entries.
 */
public enum AuditType {
  /** A COMMITTED pending transfer was reconciled and removed. */
  AUTO_CLEANUP_COMMITTED,
  /** A staged transfer was rolled back. */
  ROLLBACK,
  /** A registered token was overwritten by a new registration. */
  FORCE_OVERWRITE
}
