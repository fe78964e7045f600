package com.codeheadsystems.swapdot.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.exception.SwapDotException;
import com.codeheadsystems.swapdot.server.model.AuditEntry;
import com.codeheadsystems.swapdot.server.model.AuditType;
import com.codeheadsystems.swapdot.server.model.PendingState;
import com.codeheadsystems.swapdot.server.model.PendingTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TokenStatus;
import com.codeheadsystems.swapdot.server.model.TransferProtocol;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import com.codeheadsystems.swapdot.server.model.TransferSessionState;
import com.codeheadsystems.swapdot.server.testing.LedgerHarness;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransferLedgerManagerTest {

  private static final String TOKEN = "token-1";
  private static final String KEY_HASH = "ef".repeat(32);

  private LedgerHarness harness;

  @BeforeEach
  void setUp() {
    harness = new LedgerHarness();
    harness.ledgerStore.runInTransaction(tx -> {
      tx.putToken(new Token(TOKEN, "A", List.of("X", "Y"), KEY_HASH, 5, TokenStatus.OK, null, "04AABBCC"));
      return null;
    });
  }

  private Token token() {
    return harness.ledgerStore.runInTransaction(tx -> tx.token(TOKEN)).orElseThrow();
  }

  private PendingTransfer pending() {
    return harness.ledgerStore.runInTransaction(tx -> tx.pendingTransfer(TOKEN)).orElseThrow();
  }

  @Test
  void initiateThenFinalize_movesOwnership() {
    PendingTransfer initiated = harness.legacy.initiate(TOKEN, "A");
    assertThat(initiated.nextCounter()).isEqualTo(6);
    assertThat(token().status()).isEqualTo(TokenStatus.PENDING);

    Token result = harness.legacy.finalizeTransfer(TOKEN, "B", "04AABBCC");

    assertThat(result.ownerUid()).isEqualTo("B");
    assertThat(result.previousOwners()).containsExactly("X", "Y", "A");
    assertThat(result.counter()).isEqualTo(6);
    assertThat(result.status()).isEqualTo(TokenStatus.OK);
    assertThat(token()).isEqualTo(result);
    Optional<PendingTransfer> leftover = harness.ledgerStore.runInTransaction(tx -> tx.pendingTransfer(TOKEN));
    assertThat(leftover).isEmpty();
    assertThat(harness.ledgerStore.events(TOKEN)).singleElement()
        .satisfies(e -> {
          assertThat(e.fromOwner()).isEqualTo("A");
          assertThat(e.toOwner()).isEqualTo("B");
          assertThat(e.counter()).isEqualTo(6);
          assertThat(e.protocol()).isEqualTo(TransferProtocol.LEGACY);
        });
    harness.ledgerStore.runInTransaction(tx -> {
      assertThat(tx.userStats("A").tokensTransferredOut()).isEqualTo(1);
      assertThat(tx.userStats("B").tokensReceived()).isEqualTo(1);
      return null;
    });
  }

  @Test
  void secondFinalize_findsNoPendingTransfer() {
    harness.legacy.initiate(TOKEN, "A");
    harness.legacy.finalizeTransfer(TOKEN, "B", null);

    assertThatThrownBy(() -> harness.legacy.finalizeTransfer(TOKEN, "B", null))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("No pending transfer");
    assertThat(token().counter()).isEqualTo(6);
  }

  @Test
  void initiate_byNonOwner_isRejected() {
    assertThatThrownBy(() -> harness.legacy.initiate(TOKEN, "B"))
        .isInstanceOf(PermissionException.class);
  }

  @Test
  void initiate_byOwnerAgain_replacesOwnPending() {
    harness.legacy.initiate(TOKEN, "A");
    harness.clock.advance(Duration.ofMinutes(1));

    PendingTransfer second = harness.legacy.initiate(TOKEN, "A");

    assertThat(pending()).isEqualTo(second);
  }

  @Test
  void initiate_whileAnotherCallersTransferIsOpen_conflicts() {
    harness.legacy.initiate(TOKEN, "A");
    harness.tokens.register(TOKEN, "C", KEY_HASH, null, true);

    assertThatThrownBy(() -> harness.legacy.initiate(TOKEN, "C"))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void finalize_afterOwnerChanged_conflicts() {
    harness.legacy.initiate(TOKEN, "A");
    harness.tokens.register(TOKEN, "C", KEY_HASH, null, true);

    assertThatThrownBy(() -> harness.legacy.finalizeTransfer(TOKEN, "B", null))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void finalize_afterDeadline_expiresPending() {
    harness.legacy.initiate(TOKEN, "A");
    harness.clock.advance(harness.settings.pendingTransferTtl());

    assertThatThrownBy(() -> harness.legacy.finalizeTransfer(TOKEN, "B", null))
        .isInstanceOf(ExpiredException.class);
    assertThat(pending().state()).isEqualTo(PendingState.EXPIRED);
    assertThat(token().status()).isEqualTo(TokenStatus.OK);
    assertThat(token().ownerUid()).isEqualTo("A");
  }

  @Test
  void finalize_withWrongTag_isRejected() {
    harness.legacy.initiate(TOKEN, "A");

    assertThatThrownBy(() -> harness.legacy.finalizeTransfer(TOKEN, "B", "04FFFFFF"))
        .isInstanceOf(PermissionException.class);
    assertThat(pending().state()).isEqualTo(PendingState.OPEN);
  }

  @Test
  void initiate_cancelsPendingTwoPhaseSessions() {
    TransferSession session = harness.twoPhase.openSession(TOKEN, "A", null);

    harness.legacy.initiate(TOKEN, "A");

    assertThat(harness.ledgerStore.runInTransaction(tx -> tx.transferSession(session.sessionId()))
        .orElseThrow().state()).isEqualTo(TransferSessionState.CANCELED);
  }

  @Test
  void reconcileCommitted_completesInterruptedTransfer() {
    harness.ledgerStore.runInTransaction(tx -> {
      tx.putPendingTransfer(new PendingTransfer(TOKEN, "A", "B", 6, harness.clock.instant().plusSeconds(60),
          PendingState.COMMITTED, harness.clock.instant()));
      return null;
    });

    assertThat(harness.legacy.reconcileCommitted(TOKEN)).isTrue();

    assertThat(token().ownerUid()).isEqualTo("B");
    assertThat(token().previousOwners()).containsExactly("X", "Y", "A");
    assertThat(token().counter()).isEqualTo(6);
    assertThat(harness.ledgerStore.auditEntries(TOKEN)).extracting(AuditEntry::type)
        .containsExactly(AuditType.AUTO_CLEANUP_COMMITTED);
    assertThat(harness.legacy.reconcileCommitted(TOKEN)).isFalse();
  }

  @Test
  void initiate_onCommittedPending_reconcilesFirst() {
    harness.ledgerStore.runInTransaction(tx -> {
      tx.putPendingTransfer(new PendingTransfer(TOKEN, "A", "B", 6, harness.clock.instant().plusSeconds(60),
          PendingState.COMMITTED, harness.clock.instant()));
      return null;
    });

    assertThatThrownBy(() -> harness.legacy.initiate(TOKEN, "A"))
        .isInstanceOf(PermissionException.class);
    assertThat(token().ownerUid()).isEqualTo("B");

    PendingTransfer next = harness.legacy.initiate(TOKEN, "B");
    assertThat(next.nextCounter()).isEqualTo(7);
  }

  @Test
  void concurrentFinalize_hasExactlyOneWinner() throws Exception {
    harness.legacy.initiate(TOKEN, "A");
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Token>> futures = new ArrayList<>();
      for (String receiver : List.of("B", "C")) {
        Callable<Token> task = () -> {
          start.await();
          return harness.legacy.finalizeTransfer(TOKEN, receiver, null);
        };
        futures.add(executor.submit(task));
      }
      start.countDown();

      int winners = 0;
      int losers = 0;
      for (Future<Token> future : futures) {
        try {
          future.get(10, TimeUnit.SECONDS);
          winners++;
        } catch (ExecutionException e) {
          assertThat(e.getCause()).isInstanceOf(SwapDotException.class);
          losers++;
        }
      }
      assertThat(winners).isEqualTo(1);
      assertThat(losers).isEqualTo(1);
      assertThat(token().counter()).isEqualTo(6);
      assertThat(token().previousOwners()).containsExactly("X", "Y", "A");
      assertThat(harness.ledgerStore.events(TOKEN)).hasSize(1);
    } finally {
      executor.shutdownNow();
    }
  }
}
