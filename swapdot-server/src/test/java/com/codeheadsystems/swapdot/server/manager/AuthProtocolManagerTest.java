package com.codeheadsystems.swapdot.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.swapdot.desfire.DesfireCommands;
import com.codeheadsystems.swapdot.desfire.WeakKeyException;
import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.exception.ProtocolException;
import com.codeheadsystems.swapdot.server.model.AuthPhase;
import com.codeheadsystems.swapdot.server.model.AuthSession;
import com.codeheadsystems.swapdot.server.testing.CardSimulator;
import com.codeheadsystems.swapdot.server.testing.FixedRandom;
import com.codeheadsystems.swapdot.server.testing.LedgerHarness;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthProtocolManagerTest {

  private static final String TOKEN = "token-1";
  private static final String ALICE = "alice";
  private static final String KEY_HASH = "ab".repeat(32);

  private LedgerHarness harness;
  private CardSimulator card;

  @BeforeEach
  void setUp() {
    harness = new LedgerHarness();
    harness.tokens.register(TOKEN, ALICE, KEY_HASH, null, false);
    card = new CardSimulator(LedgerHarness.MASTER_KEY, LedgerHarness.CARD_RND_B);
  }

  @Test
  void handshake_reachesAuthenticated_withCardSessionKey() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);
    assertThat(begin.apdu()).isEqualTo(DesfireCommands.authenticate(0));
    assertThat(harness.ledgerStore.runInTransaction(tx -> tx.token(TOKEN)).orElseThrow().lease()).isNotNull();

    AuthProtocolManager.ContinueResult first = harness.auth.continueAuth(begin.sessionId(), ALICE, card.challenge());
    assertThat(first.phase()).isEqualTo(AuthPhase.CHALLENGE_SENT);
    assertThat(first.apdu()).hasSize(5 + 16 + 1);

    AuthProtocolManager.ContinueResult second = harness.auth.continueAuth(begin.sessionId(), ALICE,
        card.answer(first.apdu()));
    assertThat(second.authenticated()).isTrue();
    assertThat(second.apdu()).isNull();

    AuthSession session = harness.auth.requireAuthenticated(begin.sessionId(), ALICE);
    assertThat(session.sessionKey()).isEqualTo(card.sessionKey());
    assertThat(harness.ledgerStore.runInTransaction(tx -> tx.token(TOKEN)).orElseThrow().lease()).isNull();
  }

  @Test
  void tamperedProof_destroysSession() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);
    AuthProtocolManager.ContinueResult first = harness.auth.continueAuth(begin.sessionId(), ALICE, card.challenge());
    byte[] proof = card.answer(first.apdu());
    proof[0] ^= 0x01;

    assertThatThrownBy(() -> harness.auth.continueAuth(begin.sessionId(), ALICE, proof))
        .isInstanceOf(ProtocolException.class);
    assertThat(harness.sessionStore.load(begin.sessionId())).isEmpty();
    assertThat(harness.ledgerStore.runInTransaction(tx -> tx.token(TOKEN)).orElseThrow().lease()).isNull();
  }

  @Test
  void cardError_isProtocolFailure() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);

    assertThatThrownBy(() -> harness.auth.continueAuth(begin.sessionId(), ALICE, new byte[]{(byte) 0x91, (byte) 0xAE}))
        .isInstanceOf(ProtocolException.class)
        .hasMessageContaining("Authentication error");
    assertThat(harness.sessionStore.load(begin.sessionId())).isEmpty();
  }

  @Test
  void shortChallenge_isProtocolFailure() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);

    assertThatThrownBy(() -> harness.auth.continueAuth(begin.sessionId(), ALICE,
        new byte[]{1, 2, 3, (byte) 0x91, (byte) 0xAF}))
        .isInstanceOf(ProtocolException.class);
  }

  @Test
  void expiredSession_isRejectedAndRemoved() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);
    harness.clock.advance(harness.settings.authSessionTtl().plusSeconds(1));

    assertThatThrownBy(() -> harness.auth.continueAuth(begin.sessionId(), ALICE, card.challenge()))
        .isInstanceOf(ExpiredException.class);
    assertThat(harness.sessionStore.load(begin.sessionId())).isEmpty();
  }

  @Test
  void liveLease_blocksSecondHandshake() {
    harness.auth.begin(TOKEN, ALICE, 0, false);

    assertThatThrownBy(() -> harness.auth.begin(TOKEN, ALICE, 0, false))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void expiredLease_allowsNewHandshake() {
    harness.auth.begin(TOKEN, ALICE, 0, false);
    harness.clock.advance(harness.settings.tokenLease().plus(Duration.ofSeconds(1)));

    assertThat(harness.auth.begin(TOKEN, ALICE, 0, false).sessionId()).isNotBlank();
  }

  @Test
  void begin_requiresOwner() {
    assertThatThrownBy(() -> harness.auth.begin(TOKEN, "mallory", 0, false))
        .isInstanceOf(PermissionException.class);
  }

  @Test
  void begin_unknownToken() {
    assertThatThrownBy(() -> harness.auth.begin("missing", ALICE, 0, false))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void begin_allowUnowned_onlyForUnknownTokens() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin("fresh", "bob", 0, true);
    assertThat(harness.sessionStore.load(begin.sessionId()).orElseThrow().leaseId()).isNull();

    assertThatThrownBy(() -> harness.auth.begin(TOKEN, "bob", 0, true))
        .isInstanceOf(PermissionException.class);
  }

  @Test
  void begin_rejectsBadKeyNumber() {
    assertThatThrownBy(() -> harness.auth.begin(TOKEN, ALICE, 0x0E, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void continue_byAnotherCaller_isRejected() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);

    assertThatThrownBy(() -> harness.auth.continueAuth(begin.sessionId(), "mallory", card.challenge()))
        .isInstanceOf(PermissionException.class);
    assertThat(harness.sessionStore.load(begin.sessionId())).isPresent();
  }

  @Test
  void requireAuthenticated_beforeHandshakeCompletes() {
    AuthProtocolManager.BeginResult begin = harness.auth.begin(TOKEN, ALICE, 0, false);

    assertThatThrownBy(() -> harness.auth.requireAuthenticated(begin.sessionId(), ALICE))
        .isInstanceOf(PermissionException.class);
  }

  @Test
  void fullStore_releasesLease() {
    LedgerHarness small = new LedgerHarness(FixedRandom.counting(1), 1);
    small.tokens.register("t1", ALICE, KEY_HASH, null, false);
    small.tokens.register("t2", ALICE, KEY_HASH, null, false);
    small.auth.begin("t1", ALICE, 0, false);

    assertThatThrownBy(() -> small.auth.begin("t2", ALICE, 0, false))
        .isInstanceOf(IllegalStateException.class);
    assertThat(small.ledgerStore.runInTransaction(tx -> tx.token("t2")).orElseThrow().lease()).isNull();
  }

  @Test
  void repeatedFinalFrame_conflictsAndKeepsSession() {
    String sessionId = harness.authenticate(TOKEN, ALICE, card, false);

    assertThatThrownBy(() -> harness.auth.continueAuth(sessionId, ALICE, new byte[]{(byte) 0x91, 0x00}))
        .isInstanceOf(ConflictException.class)
        .hasMessageContaining("already authenticated");

    AuthSession session = harness.auth.requireAuthenticated(sessionId, ALICE);
    assertThat(session.sessionKey()).isEqualTo(card.sessionKey());
  }

  @Test
  void weakDerivedSessionKey_endsHandshake() {
    LedgerHarness weak = new LedgerHarness(FixedRandom.zeros(), 10);
    weak.tokens.register(TOKEN, ALICE, KEY_HASH, null, false);
    CardSimulator zeroCard = new CardSimulator(LedgerHarness.MASTER_KEY, new byte[8]);
    AuthProtocolManager.BeginResult begin = weak.auth.begin(TOKEN, ALICE, 0, false);
    AuthProtocolManager.ContinueResult first = weak.auth.continueAuth(begin.sessionId(), ALICE, zeroCard.challenge());

    assertThatThrownBy(() -> weak.auth.continueAuth(begin.sessionId(), ALICE, zeroCard.answer(first.apdu())))
        .isInstanceOf(WeakKeyException.class);
    assertThat(weak.sessionStore.load(begin.sessionId())).isEmpty();
    assertThat(weak.ledgerStore.runInTransaction(tx -> tx.token(TOKEN)).orElseThrow().lease()).isNull();
  }
}
