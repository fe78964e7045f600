package com.codeheadsystems.swapdot.desfire;

import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.engines.DESedeEngine;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.params.DESParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

/**
 * Raw 3DES-CBC without padding, backed by the BouncyCastle DESede engine.
 * <p>
 * {@link #SESSION} rejects keys containing a weak or semi-weak DES block with a
 * {@link WeakKeyException}; it is used for everything keyed by a derived session key.
 * {@link #CARD} accepts them, because factory-default card keys (all zero) are weak by
 * construction and must still authenticate.
 */
public final class DesCipher {

  /**
   * DES block size in bytes.
   */
  public static final int BLOCK_SIZE = 8;

  /**
   * Cipher for session-key operations; refuses weak keys.
   */
  public static final DesCipher SESSION = new DesCipher(true);

  /**
   * Cipher for static card keys.
   */
  public static final DesCipher CARD = new DesCipher(false);

  private static final byte[] ZERO_IV = new byte[BLOCK_SIZE];

  private final boolean rejectWeakKeys;

  private DesCipher(boolean rejectWeakKeys) {
    this.rejectWeakKeys = rejectWeakKeys;
  }

  /**
   * Returns a fresh all-zero IV.
   *
   * @return the byte [ ]
   */
  public static byte[] zeroIv() {
    return ZERO_IV.clone();
  }

  /**
   * Rejects a key with any weak or semi-weak DES block.
   *
   * @param key the key
   * @throws WeakKeyException if a block is weak
   */
  public static void requireStrong(DesKey key) {
    byte[] material = key.material();
    for (int offset = 0; offset < material.length; offset += DESParameters.DES_KEY_LENGTH) {
      if (DESParameters.isWeakKey(material, offset)) {
        throw new WeakKeyException("Key block at offset " + offset + " is a weak DES key");
      }
    }
  }

  /**
   * CBC-encrypts block-aligned data.
   *
   * @param key  the key
   * @param iv   8-byte IV
   * @param data block-aligned plaintext
   * @return the ciphertext
   */
  public byte[] encrypt(DesKey key, byte[] iv, byte[] data) {
    return process(true, key, iv, data);
  }

  /**
   * CBC-decrypts block-aligned data.
   *
   * @param key  the key
   * @param iv   8-byte IV
   * @param data block-aligned ciphertext
   * @return the plaintext
   */
  public byte[] decrypt(DesKey key, byte[] iv, byte[] data) {
    return process(false, key, iv, data);
  }

  private byte[] process(boolean encrypt, DesKey key, byte[] iv, byte[] data) {
    if (data.length % BLOCK_SIZE != 0) {
      throw new IllegalArgumentException("Data must be a multiple of " + BLOCK_SIZE + " bytes: " + data.length);
    }
    if (iv.length != BLOCK_SIZE) {
      throw new IllegalArgumentException("IV must be " + BLOCK_SIZE + " bytes: " + iv.length);
    }
    if (rejectWeakKeys) {
      requireStrong(key);
    }
    byte[] material = key.material();
    BlockCipher cipher = CBCBlockCipher.newInstance(new DESedeEngine());
    cipher.init(encrypt, new ParametersWithIV(new KeyParameter(material), iv));
    byte[] out = new byte[data.length];
    for (int offset = 0; offset < data.length; offset += BLOCK_SIZE) {
      cipher.processBlock(data, offset, out, offset);
    }
    return out;
  }
}
