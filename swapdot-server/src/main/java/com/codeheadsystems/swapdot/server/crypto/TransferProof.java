package com.codeheadsystems.swapdot.server.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Proof that the holder of a token key saw a specific transfer challenge.
 * <p>
 * {@code HMAC-SHA256(key, "SwapDotz/transfer/v1" || len32(challenge) || challenge || len32(uid) || uid)}
 * with big-endian 32-bit lengths.
 */
public final class TransferProof {

  /**
   * Domain separation label.
   */
  public static final byte[] LABEL = "SwapDotz/transfer/v1".getBytes(StandardCharsets.UTF_8);

  private TransferProof() {
  }

  /**
   * Computes the proof.
   *
   * @param tokenKey  the key read from the card
   * @param challenge the session challenge
   * @param tagUid    the token id
   * @return 32-byte MAC
   */
  public static byte[] compute(byte[] tokenKey, byte[] challenge, String tagUid) {
    byte[] uid = tagUid.getBytes(StandardCharsets.UTF_8);
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(tokenKey));
    hmac.update(LABEL, 0, LABEL.length);
    update(hmac, lengthPrefix(challenge.length));
    update(hmac, challenge);
    update(hmac, lengthPrefix(uid.length));
    update(hmac, uid);
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return out;
  }

  private static byte[] lengthPrefix(int length) {
    return ByteBuffer.allocate(4).putInt(length).array();
  }

  private static void update(HMac hmac, byte[] data) {
    hmac.update(data, 0, data.length);
  }
}
