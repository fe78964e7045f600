package com.codeheadsystems.swapdot.server.store;

import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.TransferEvent;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Transactional document store holding tokens, transfer records, the event log, the audit log
 * and per-user aggregates.
 * <p>
 * <strong>Transaction contract:</strong> {@link #runInTransaction} runs {@code work} against a
 * {@link LedgerTransaction}. If any document read during the attempt changed before commit, the
 * attempt is discarded and {@code work} runs again, up to a bounded number of attempts, after
 * which a {@code ConflictException} is thrown. An exception thrown by {@code work} aborts the
 * attempt without writing anything, except through
 * {@link LedgerTransaction#failAfterCommit}. Consequently {@code work} must be free of side
 * effects outside the transaction.
 * <p>
 * Implementations must be thread-safe.
 */
public interface LedgerStore {

  /**
   * Runs {@code work} atomically.
   *
   * @param work the transaction body
   * @param <T>  the result type
   * @return the result of the successful attempt
   */
  <T> T runInTransaction(Function<LedgerTransaction, T> work);

  /**
   * Token ids whose pending transfer is OPEN and past its deadline.
   *
   * @param now   the current time
   * @param limit max results
   * @return token ids
   */
  List<String> findExpiredOpenPendings(Instant now, int limit);

  /**
   * Token ids whose pending transfer is in the COMMITTED crash-artifact state.
   *
   * @param limit max results
   * @return token ids
   */
  List<String> findCommittedPendings(int limit);

  /**
   * Ids of PENDING transfer sessions past their deadline.
   *
   * @param now   the current time
   * @param limit max results
   * @return session ids
   */
  List<String> findExpiredPendingSessions(Instant now, int limit);

  /**
   * Ids of STAGED transfers past their deadline.
   *
   * @param now   the current time
   * @param limit max results
   * @return staged ids
   */
  List<String> findExpiredStagedTransfers(Instant now, int limit);

  /**
   * Committed transfer events for a token, oldest first.
   *
   * @param tokenId the token
   * @return the events
   */
  List<TransferEvent> events(String tokenId);

  /**
   * Committed audit entries for a token, oldest first.
   *
   * @param tokenId the token
   * @return the entries
   */
  List<AuditEntry> auditEntries(String tokenId);

  /**
   * Cheap liveness probe for health checks.
   *
   * @return true if the store can serve transactions
   */
  boolean isHealthy();
}
