package com.codeheadsystems.swapdot.server.store;

import com.codeheadsystems.swapdot.server.exception.SwapDotException;
import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.PendingTransfer;
import com.codeheadsystems.swapdot.server.model.StagedTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TransferEvent;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import com.codeheadsystems.swapdot.server.model.UserStats;
import java.util.List;
import java.util.Optional;

/**
 * One attempt of a ledger transaction. Reads observe a consistent view plus this attempt's own
 * writes; writes are buffered until the attempt commits.
 */
public interface LedgerTransaction {

  Optional<Token> token(String tokenId);

  void putToken(Token token);

  Optional<PendingTransfer> pendingTransfer(String tokenId);

  void putPendingTransfer(PendingTransfer pending);

  void deletePendingTransfer(String tokenId);

  Optional<TransferSession> transferSession(String sessionId);

  void putTransferSession(TransferSession session);

  /**
   * All transfer sessions for a token, in any state. Concurrent inserts for any token abort the
   * attempt at commit.
   *
   * @param tokenId the token
   * @return the sessions
   */
  List<TransferSession> transferSessionsForToken(String tokenId);

  Optional<StagedTransfer> stagedTransfer(String stagedId);

  void putStagedTransfer(StagedTransfer staged);

  /**
   * Aggregates for a user, zeroed when the user has none yet.
   *
   * @param uid the user
   * @return the stats
   */
  UserStats userStats(String uid);

  void putUserStats(UserStats stats);

  void appendEvent(TransferEvent event);

  void appendAudit(AuditEntry entry);

  /**
   * Commits the writes buffered so far and then throws {@code failure} to the caller of
   * {@link LedgerStore#runInTransaction}. Used when a failure must leave corrected state behind,
   * such as flipping an expired record. The transaction function should return the result of
   * this call immediately.
   *
   * @param failure the exception to surface after commit
   * @param <T>     the transaction's result type
   * @return always null
   */
  <T> T failAfterCommit(SwapDotException failure);
}
