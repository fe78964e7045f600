package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.server.exception.SwapDotException;
import com.codeheadsystems.swapdot.server.store.LedgerStore;
import com.codeheadsystems.swapdot.server.store.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic cleanup of records whose deadline passed without anyone touching them.
 * <p>
 * Every deadline is also enforced when the record is next used, so the sweep only reclaims
 * state and clears stale token status. Each record is handled in its own transaction and
 * re-checked there; a failure on one record is logged and the sweep moves on.
 */
public class LedgerJanitor {

  private static final Logger log = LoggerFactory.getLogger(LedgerJanitor.class);

  private final LedgerStore ledgerStore;
  private final SessionStore sessionStore;
  private final TransferLedgerManager transferLedgerManager;
  private final TwoPhaseTransferManager twoPhaseTransferManager;
  private final LedgerSettings settings;
  private final Clock clock;

  public LedgerJanitor(LedgerStore ledgerStore,
                       SessionStore sessionStore,
                       TransferLedgerManager transferLedgerManager,
                       TwoPhaseTransferManager twoPhaseTransferManager,
                       LedgerSettings settings,
                       Clock clock) {
    this.ledgerStore = ledgerStore;
    this.sessionStore = sessionStore;
    this.transferLedgerManager = transferLedgerManager;
    this.twoPhaseTransferManager = twoPhaseTransferManager;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Counts from one sweep.
   *
   * @param expiredPendings        OPEN pending transfers flipped to EXPIRED
   * @param reconciledCommitted    COMMITTED pending transfers repaired
   * @param expiredSessions        PENDING transfer sessions flipped to EXPIRED
   * @param expiredStaged          STAGED transfers flipped to EXPIRED
   * @param evictedAuthSessions    auth sessions removed
   */
  public record SweepResult(int expiredPendings,
                            int reconciledCommitted,
                            int expiredSessions,
                            int expiredStaged,
                            int evictedAuthSessions) {
  }

  /**
   * Runs every cleanup step once, each bounded by the batch size.
   *
   * @return what was done
   */
  public SweepResult sweep() {
    Instant now = clock.instant();
    int batch = settings.janitorBatchSize();
    SweepResult result = new SweepResult(
        each(ledgerStore.findExpiredOpenPendings(now, batch), transferLedgerManager::expireOpenPending),
        each(ledgerStore.findCommittedPendings(batch), transferLedgerManager::reconcileCommitted),
        each(ledgerStore.findExpiredPendingSessions(now, batch), twoPhaseTransferManager::expireSession),
        each(ledgerStore.findExpiredStagedTransfers(now, batch), twoPhaseTransferManager::expireStaged),
        sessionStore.evictExpired());
    log.info("Janitor sweep: {}", result);
    return result;
  }

  private static int each(List<String> ids, Predicate<String> action) {
    int handled = 0;
    for (String id : ids) {
      try {
        if (action.test(id)) {
          handled++;
        }
      } catch (SwapDotException e) {
        log.error("Janitor could not process id={}: {}", id, e.getMessage(), e);
      }
    }
    return handled;
  }
}
