package com.codeheadsystems.swapdot.server.manager;

import java.time.Duration;

/**
 * Timing and sizing knobs shared by the services. Framework layers build one from their own
 * configuration.
 *
 * @param authSessionTtl         lifetime of a card authentication session
 * @param tokenLease             lifetime of the lease taken on a token during authentication
 * @param pendingTransferTtl     lifetime of a legacy pending transfer
 * @param stagedTransferTtl      time allowed between stage and commit
 * @param transferSessionTtl     lifetime of a two-phase transfer session while PENDING
 * @param janitorBatchSize       max documents per janitor step
 * @param maxPendingAuthSessions auth session store capacity
 * @param transactionMaxAttempts ledger transaction attempts before giving up
 */
public record LedgerSettings(
    Duration authSessionTtl,
    Duration tokenLease,
    Duration pendingTransferTtl,
    Duration stagedTransferTtl,
    Duration transferSessionTtl,
    int janitorBatchSize,
    int maxPendingAuthSessions,
    int transactionMaxAttempts) {

  public static LedgerSettings defaults() {
    return new LedgerSettings(
        Duration.ofSeconds(60),
        Duration.ofSeconds(15),
        Duration.ofMinutes(10),
        Duration.ofMinutes(10),
        Duration.ofMinutes(5),
        100,
        10_000,
        5);
  }
}
