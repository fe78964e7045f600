package com.codeheadsystems.swapdot.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.model.PendingState;
import com.codeheadsystems.swapdot.server.model.PendingTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TokenStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryLedgerStoreTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final String KEY_HASH = "ab".repeat(32);

  private InMemoryLedgerStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryLedgerStore(new ObjectMapper(), 3);
  }

  private void put(Token token) {
    store.runInTransaction(tx -> {
      tx.putToken(token);
      return null;
    });
  }

  private Token read(String tokenId) {
    return store.runInTransaction(tx -> tx.token(tokenId)).orElseThrow();
  }

  @Test
  void transaction_seesItsOwnWrites() {
    Token token = Token.register("t1", "alice", KEY_HASH, null);

    Token seen = store.runInTransaction(tx -> {
      tx.putToken(token);
      return tx.token("t1").orElseThrow();
    });

    assertThat(seen).isEqualTo(token);
    assertThat(read("t1")).isEqualTo(token);
  }

  @Test
  void failedWork_writesNothing() {
    assertThatThrownBy(() -> store.runInTransaction(tx -> {
      tx.putToken(Token.register("t1", "alice", KEY_HASH, null));
      throw new NotFoundException("nope");
    })).isInstanceOf(NotFoundException.class);

    Optional<Token> stored = store.runInTransaction(tx -> tx.token("t1"));
    assertThat(stored).isEmpty();
  }

  @Test
  void failAfterCommit_persistsThenThrows() {
    put(Token.register("t1", "alice", KEY_HASH, null));

    assertThatThrownBy(() -> store.runInTransaction(tx -> {
      tx.putToken(tx.token("t1").orElseThrow().withStatus(TokenStatus.PENDING));
      return tx.failAfterCommit(new ExpiredException("flipped"));
    })).isInstanceOf(ExpiredException.class);

    assertThat(read("t1").status()).isEqualTo(TokenStatus.PENDING);
  }

  @Test
  void concurrentWrite_causesRetry() {
    put(Token.register("t1", "alice", KEY_HASH, null));
    AtomicInteger attempts = new AtomicInteger();

    Token result = store.runInTransaction(tx -> {
      Token current = tx.token("t1").orElseThrow();
      if (attempts.incrementAndGet() == 1) {
        put(current.withStatus(TokenStatus.PENDING));
      }
      return current;
    });

    assertThat(attempts.get()).isEqualTo(2);
    assertThat(result.status()).isEqualTo(TokenStatus.PENDING);
  }

  @Test
  void persistentContention_givesUpWithConflict() {
    put(Token.register("t1", "alice", KEY_HASH, null));
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(() -> store.runInTransaction(tx -> {
      Token current = tx.token("t1").orElseThrow();
      attempts.incrementAndGet();
      put(current.withKeyHash("cd".repeat(32)));
      tx.putToken(current.withStatus(TokenStatus.PENDING));
      return null;
    })).isInstanceOf(ConflictException.class);

    assertThat(attempts.get()).isEqualTo(3);
    assertThat(read("t1").status()).isEqualTo(TokenStatus.OK);
  }

  @Test
  void legacyDocument_isNormalizedOnRead() {
    store.putRawTokenDocument("t1", """
        {"current_owner_id":"alice","previous_owners":["x","y"],"key_hash":"%s",
         "lock":{"leaseId":"l1","sessionId":"s1","expiresAt":%d}}
        """.formatted(KEY_HASH, NOW.toEpochMilli()));

    Token token = read("t1");

    assertThat(token.ownerUid()).isEqualTo("alice");
    assertThat(token.previousOwners()).containsExactly("x", "y");
    assertThat(token.keyHash()).isEqualTo(KEY_HASH);
    assertThat(token.counter()).isZero();
    assertThat(token.status()).isEqualTo(TokenStatus.OK);
    assertThat(token.lease().expiresAt()).isEqualTo(NOW);
  }

  @Test
  void writes_useCanonicalFieldNames() {
    store.putRawTokenDocument("t1", "{\"current_owner_id\":\"alice\",\"key_hash\":\"" + KEY_HASH + "\"}");
    put(read("t1").withStatus(TokenStatus.PENDING));

    String json = store.rawTokenDocument("t1").orElseThrow();
    assertThat(json).contains("\"ownerUid\":\"alice\"").contains("\"counter\":0").doesNotContain("current_owner_id");
  }

  @Test
  void finders_filterByStateAndDeadline() {
    store.runInTransaction(tx -> {
      tx.putPendingTransfer(new PendingTransfer("old", "a", null, 1, NOW.minusSeconds(1), PendingState.OPEN, NOW));
      tx.putPendingTransfer(new PendingTransfer("live", "a", null, 1, NOW.plusSeconds(60), PendingState.OPEN, NOW));
      tx.putPendingTransfer(new PendingTransfer("done", "a", "b", 1, NOW.minusSeconds(1), PendingState.COMMITTED,
          NOW));
      return null;
    });

    assertThat(store.findExpiredOpenPendings(NOW, 10)).containsExactly("old");
    assertThat(store.findCommittedPendings(10)).containsExactly("done");
    assertThat(store.findExpiredOpenPendings(NOW, 0)).isEmpty();
  }

  @Test
  void deletePendingTransfer_removesIt() {
    store.runInTransaction(tx -> {
      tx.putPendingTransfer(new PendingTransfer("t1", "a", null, 1, NOW, PendingState.OPEN, NOW));
      return null;
    });
    store.runInTransaction(tx -> {
      tx.deletePendingTransfer("t1");
      assertThat(tx.pendingTransfer("t1")).isEmpty();
      return null;
    });

    Optional<PendingTransfer> stored = store.runInTransaction(tx -> tx.pendingTransfer("t1"));
    assertThat(stored).isEmpty();
    assertThat(store.isHealthy()).isTrue();
  }

  @Test
  void maxAttempts_mustBePositive() {
    assertThatThrownBy(() -> new InMemoryLedgerStore(new ObjectMapper(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
