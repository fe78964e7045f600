package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;

/**
 * Append-only audit log entry.
 *
 * @param type      entry type
 * @param tokenId   the token
 * @param actorUid  user who caused it, or "system"
 * @param detail    free-text detail
 * @param timestamp when it was written
 */
public record AuditEntry(AuditType type, String tokenId, String actorUid, String detail, Instant timestamp) {

  public static final String SYSTEM_ACTOR = "system";
}
