package com.codeheadsystems.swapdot.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.swapdot.desfire.ByteUtils;
import com.codeheadsystems.swapdot.desfire.CommMode;
import com.codeheadsystems.swapdot.desfire.DesKey;
import com.codeheadsystems.swapdot.desfire.DesfireCommands;
import com.codeheadsystems.swapdot.desfire.WeakKeyException;
import com.codeheadsystems.swapdot.server.crypto.KeyHashes;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.model.AuthSession;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import com.codeheadsystems.swapdot.server.model.TransferSessionState;
import com.codeheadsystems.swapdot.server.testing.CardSimulator;
import com.codeheadsystems.swapdot.server.testing.LedgerHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CardCommandManagerTest {

  private static final String TOKEN = "token-1";
  private static final String ALICE = "alice";
  private static final String KEY_HASH = "cd".repeat(32);

  private LedgerHarness harness;
  private CardSimulator card;
  private String authSessionId;

  @BeforeEach
  void setUp() {
    harness = new LedgerHarness();
    harness.tokens.register(TOKEN, ALICE, KEY_HASH, null, false);
    card = new CardSimulator(LedgerHarness.MASTER_KEY, LedgerHarness.CARD_RND_B);
    authSessionId = harness.authenticate(TOKEN, ALICE, card, false);
  }

  @Test
  void changeKey_cryptogramCarriesNewKeyForTheCard() {
    CardCommandManager.CardFrames frames = harness.cards.changeKey(authSessionId, ALICE, 0, 1);

    assertThat(frames.frames()).hasSize(1);
    byte[] frame = frames.frames().get(0);
    assertThat(frame[1]).isEqualTo(DesfireCommands.INS_CHANGE_KEY);
    assertThat(frame[5]).isEqualTo((byte) 0);

    byte[] cryptogram = ByteUtils.slice(frame, 6, 24);
    byte[] plain = CardSimulator.decipher(card.sessionKey(), cryptogram);
    byte[] newMaterial = ByteUtils.xor(ByteUtils.slice(plain, 0, 16), LedgerHarness.MASTER_KEY.material());
    assertThat(plain[18]).isEqualTo((byte) 1);

    byte[] expectedRaw = new byte[16];
    for (int i = 0; i < 16; i++) {
      expectedRaw[i] = (byte) (0x80 + i);
    }
    assertThat(newMaterial).isEqualTo(DesKey.of(expectedRaw).material());
    assertThat(frames.keyHash()).isEqualTo(KeyHashes.sha256Hex(expectedRaw));
    assertThat(harness.sessionStore.load(authSessionId).orElseThrow().pendingKeyHash())
        .isEqualTo(frames.keyHash());
  }

  @Test
  void changeKey_requiresAuthenticatedSession() {
    assertThatThrownBy(() -> harness.cards.changeKey(authSessionId, "mallory", 0, 1))
        .isInstanceOf(PermissionException.class);
  }

  @Test
  void storedWeakSessionKey_forcesReauthentication() {
    AuthSession stored = AuthSession.start("weak-session", TOKEN, ALICE, 0, null,
            harness.clock.instant().plusSeconds(60))
        .challengeSent(new byte[8], new byte[8], new byte[8])
        .authenticated(DesKey.of(new byte[16]));
    harness.sessionStore.store(stored);

    assertThatThrownBy(() -> harness.cards.changeKey("weak-session", ALICE, 0, 1))
        .isInstanceOf(WeakKeyException.class);
    assertThat(harness.sessionStore.load("weak-session")).isEmpty();
  }

  @Test
  void writeTransferData_recordsKeyOnTransferSession() {
    TransferSession transfer = harness.twoPhase.openSession(TOKEN, ALICE, "bob");

    CardCommandManager.CardFrames frames = harness.cards.writeTransferData(authSessionId, transfer.sessionId(), ALICE,
        CommMode.MACED);

    assertThat(frames.frames()).isNotEmpty();
    assertThat(frames.frames().get(0)[1]).isEqualTo(DesfireCommands.INS_WRITE_DATA);
    TransferSession stored = harness.ledgerStore.runInTransaction(tx -> tx.transferSession(transfer.sessionId()))
        .orElseThrow();
    assertThat(stored.pendingKeyHash()).isEqualTo(frames.keyHash());
  }

  @Test
  void writeTransferData_rejectsAnotherCallersSession() {
    TransferSession transfer = harness.twoPhase.openSession(TOKEN, ALICE, null);
    harness.tokens.register("token-2", "bob", KEY_HASH, null, false);
    String bobSession = harness.authenticate("token-2", "bob");

    assertThatThrownBy(() -> harness.cards.writeTransferData(bobSession, transfer.sessionId(), "bob", CommMode.PLAIN))
        .isInstanceOf(PermissionException.class);
  }

  @Test
  void writeTransferData_expiredTransferSession_isFlipped() {
    TransferSession transfer = harness.twoPhase.openSession(TOKEN, ALICE, null);
    harness.clock.advance(harness.settings.transferSessionTtl());
    String fresh = harness.authenticate(TOKEN, ALICE);

    assertThatThrownBy(() -> harness.cards.writeTransferData(fresh, transfer.sessionId(), ALICE, CommMode.MACED))
        .isInstanceOf(ExpiredException.class);
    assertThat(harness.ledgerStore.runInTransaction(tx -> tx.transferSession(transfer.sessionId()))
        .orElseThrow().state()).isEqualTo(TransferSessionState.EXPIRED);
  }

  @Test
  void readFile_buildsRequestAndContinuation() {
    CardCommandManager.ReadFrames frames = harness.cards.readFile(1, 32);

    assertThat(frames.apdu()).isEqualTo(DesfireCommands.readData(1, 0, 32));
    assertThat(frames.continuation()).isEqualTo(DesfireCommands.readContinuation());
  }

  @Test
  void readFile_rejectsBadArguments() {
    assertThatThrownBy(() -> harness.cards.readFile(0x20, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> harness.cards.readFile(1, -1)).isInstanceOf(IllegalArgumentException.class);
  }
}
