package com.codeheadsystems.swapdot.server.manager;

import com.codeheadsystems.swapdot.desfire.CommMode;
import com.codeheadsystems.swapdot.desfire.DesKey;
import com.codeheadsystems.swapdot.desfire.DesfireCommands;
import com.codeheadsystems.swapdot.desfire.RandomProvider;
import com.codeheadsystems.swapdot.desfire.SecureMessaging;
import com.codeheadsystems.swapdot.desfire.WeakKeyException;
import com.codeheadsystems.swapdot.server.crypto.KeyHashes;
import com.codeheadsystems.swapdot.server.exception.ConflictException;
import com.codeheadsystems.swapdot.server.exception.ExpiredException;
import com.codeheadsystems.swapdot.server.exception.NotFoundException;
import com.codeheadsystems.swapdot.server.exception.PermissionException;
import com.codeheadsystems.swapdot.server.model.AuthSession;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import com.codeheadsystems.swapdot.server.model.TransferSessionState;
import com.codeheadsystems.swapdot.server.store.LedgerStore;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the secure-messaging frames a client relays to an authenticated card.
 * <p>
 * Fresh keys are generated here and only their SHA-256 fingerprints are kept. A weak derived
 * session key destroys the auth session, so the client has to authenticate again.
 */
public class CardCommandManager {

  private static final Logger log = LoggerFactory.getLogger(CardCommandManager.class);

  /**
   * File holding the token key written during a transfer.
   */
  public static final int TRANSFER_FILE_NO = 0x01;

  /**
   * Length of the token key stored in the transfer file.
   */
  public static final int TOKEN_KEY_LENGTH = 32;

  private final AuthProtocolManager authProtocolManager;
  private final LedgerStore ledgerStore;
  private final SecureMessaging secureMessaging;
  private final RandomProvider randomProvider;
  private final DesKey masterKey;
  private final Clock clock;

  public CardCommandManager(AuthProtocolManager authProtocolManager,
                            LedgerStore ledgerStore,
                            SecureMessaging secureMessaging,
                            RandomProvider randomProvider,
                            DesKey masterKey,
                            Clock clock) {
    this.authProtocolManager = authProtocolManager;
    this.ledgerStore = ledgerStore;
    this.secureMessaging = secureMessaging;
    this.randomProvider = randomProvider;
    this.masterKey = masterKey;
    this.clock = clock;
  }

  /**
   * Frames for the card plus the fingerprint of the key they install.
   *
   * @param frames  command frames in send order
   * @param keyHash SHA-256 hex of the new key
   */
  public record CardFrames(List<byte[]> frames, String keyHash) {
  }

  /**
   * A read request and the frame that fetches each further chunk.
   *
   * @param apdu         ReadData command
   * @param continuation additional-frame command
   */
  public record ReadFrames(byte[] apdu, byte[] continuation) {
  }

  /**
   * Rotates a card key from the master key to a fresh random key of the same length. The new
   * key's fingerprint is kept on the auth session.
   *
   * @param authSessionId authenticated session
   * @param userId        the caller
   * @param keyNo         key number to change
   * @param keyVersion    new key version
   * @return the frames and the new key's fingerprint
   */
  public CardFrames changeKey(String authSessionId, String userId, int keyNo, int keyVersion) {
    AuthSession session = authProtocolManager.requireAuthenticated(authSessionId, userId);
    byte[] oldKey = masterKey.material();
    byte[] newKey = randomProvider.randomBytes(oldKey.length);
    List<byte[]> frames = withSessionKey(session,
        () -> secureMessaging.buildChangeKeyFrames(keyNo, oldKey, newKey, session.sessionKey(), keyVersion));
    String keyHash = KeyHashes.sha256Hex(newKey);
    authProtocolManager.update(session.withPendingKeyHash(keyHash));
    log.debug("changeKey(sessionId={}, keyNo={}) -> {} frame(s)", authSessionId, keyNo, frames.size());
    return new CardFrames(frames, keyHash);
  }

  /**
   * Writes a fresh random token key into the transfer file and records its fingerprint on the
   * transfer session, where key validation will look for it.
   *
   * @param authSessionId     authenticated session for the same token
   * @param transferSessionId the caller's PENDING transfer session
   * @param userId            the caller
   * @param mode              communication mode of the file
   * @return the frames and the token key's fingerprint
   */
  public CardFrames writeTransferData(String authSessionId, String transferSessionId, String userId, CommMode mode) {
    AuthSession session = authProtocolManager.requireAuthenticated(authSessionId, userId);
    byte[] tokenKey = randomProvider.randomBytes(TOKEN_KEY_LENGTH);
    List<byte[]> frames = withSessionKey(session,
        () -> secureMessaging.buildWriteFrames(TRANSFER_FILE_NO, 0, tokenKey, session.sessionKey(), mode));
    String keyHash = KeyHashes.sha256Hex(tokenKey);

    ledgerStore.runInTransaction(tx -> {
      TransferSession transfer = tx.transferSession(transferSessionId)
          .orElseThrow(() -> new NotFoundException("Unknown transfer session: " + transferSessionId));
      if (!transfer.fromUid().equals(userId)) {
        throw new PermissionException("Transfer session " + transferSessionId + " belongs to another caller");
      }
      if (!transfer.tokenId().equals(session.tokenId())) {
        throw new PermissionException("Auth session and transfer session are for different tokens");
      }
      if (transfer.state() != TransferSessionState.PENDING) {
        throw new ConflictException("Transfer session " + transferSessionId + " is " + transfer.state());
      }
      if (transfer.isExpired(clock.instant())) {
        tx.putTransferSession(transfer.withState(TransferSessionState.EXPIRED));
        return tx.failAfterCommit(new ExpiredException("Transfer session " + transferSessionId + " expired"));
      }
      tx.putTransferSession(transfer.withPendingKeyHash(keyHash));
      return null;
    });
    log.debug("writeTransferData(sessionId={}, mode={}) -> {} frame(s)", authSessionId, mode, frames.size());
    return new CardFrames(frames, keyHash);
  }

  /**
   * ReadData from offset 0. A length of zero reads the whole file.
   *
   * @param fileNo the file
   * @param length bytes to read
   * @return the frames
   */
  public ReadFrames readFile(int fileNo, int length) {
    if (fileNo < 0 || fileNo > 0x1F) {
      throw new IllegalArgumentException("Invalid file number: " + fileNo);
    }
    if (length < 0 || length > 0xFFFFFF) {
      throw new IllegalArgumentException("Invalid read length: " + length);
    }
    return new ReadFrames(DesfireCommands.readData(fileNo, 0, length), DesfireCommands.readContinuation());
  }

  private List<byte[]> withSessionKey(AuthSession session, Supplier<List<byte[]>> builder) {
    try {
      return builder.get();
    } catch (WeakKeyException e) {
      log.warn("Weak session key for session id={}, forcing re-authentication", session.sessionId());
      authProtocolManager.destroy(session);
      throw e;
    }
  }
}
