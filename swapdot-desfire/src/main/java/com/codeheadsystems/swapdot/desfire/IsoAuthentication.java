package com.codeheadsystems.swapdot.desfire;

import java.security.MessageDigest;

/**
 * Cryptographic steps of the legacy DES/3DES mutual authentication ({@code 0x1A}).
 * <p>
 * The reader side of the exchange:
 * <ol>
 *   <li>card sends {@code ek(RndB)} under a zero IV</li>
 *   <li>reader answers {@code ek(RndA || rotl(RndB))}, chained on the card's ciphertext</li>
 *   <li>card proves itself with {@code ek(rotl(RndA))}, chained on the last block of step 2</li>
 * </ol>
 * Static card keys go through {@link DesCipher#CARD}, since factory keys are weak.
 */
public class IsoAuthentication {

  /**
   * Length of RndA, RndB and every card challenge block.
   */
  public static final int CHALLENGE_LENGTH = 8;

  private final RandomProvider randomProvider;

  public IsoAuthentication(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Answers the card's encrypted challenge.
   *
   * @param cardKey       the card's static key
   * @param encryptedRndB the 8-byte challenge from the card
   * @return the reader's answer and the state needed to verify the card
   * @throws MalformedFrameException if the challenge is not 8 bytes
   */
  public ChallengeAnswer answerChallenge(DesKey cardKey, byte[] encryptedRndB) {
    requireBlock(encryptedRndB, "card challenge");
    byte[] rndB = DesCipher.CARD.decrypt(cardKey, DesCipher.zeroIv(), encryptedRndB);
    byte[] rndA = randomProvider.randomBytes(CHALLENGE_LENGTH);
    byte[] encrypted = DesCipher.CARD.encrypt(cardKey, encryptedRndB,
        ByteUtils.concat(rndA, ByteUtils.rotateLeft(rndB)));
    byte[] chainedIv = ByteUtils.slice(encrypted, encrypted.length - CHALLENGE_LENGTH, CHALLENGE_LENGTH);
    return new ChallengeAnswer(rndA, rndB, encrypted, chainedIv);
  }

  /**
   * Checks the card's proof of RndA.
   *
   * @param cardKey        the card's static key
   * @param chainedIv      last ciphertext block of the reader's answer
   * @param encryptedProof the 8-byte proof from the card
   * @param rndA           the reader's challenge
   * @return true if the card decrypted RndA correctly
   * @throws MalformedFrameException if the proof is not 8 bytes
   */
  public boolean verifyCardProof(DesKey cardKey, byte[] chainedIv, byte[] encryptedProof, byte[] rndA) {
    requireBlock(encryptedProof, "card proof");
    byte[] proof = DesCipher.CARD.decrypt(cardKey, chainedIv, encryptedProof);
    return MessageDigest.isEqual(proof, ByteUtils.rotateLeft(rndA));
  }

  /**
   * Derives the session key. Single DES: {@code A0..3 || B0..3}. 3DES:
   * {@code A0..3 || B0..3 || A4..7 || B4..7}.
   *
   * @param cardKey the key authentication ran under, which fixes the variant
   * @param rndA    reader challenge
   * @param rndB    card challenge
   * @return the session key
   * @throws WeakKeyException if the derived key has a weak DES block
   */
  public DesKey deriveSessionKey(DesKey cardKey, byte[] rndA, byte[] rndB) {
    byte[] head = ByteUtils.concat(ByteUtils.slice(rndA, 0, 4), ByteUtils.slice(rndB, 0, 4));
    DesKey sessionKey = cardKey.isSingleDes()
        ? DesKey.of(head)
        : DesKey.of(ByteUtils.concat(head, ByteUtils.slice(rndA, 4, 4), ByteUtils.slice(rndB, 4, 4)));
    DesCipher.requireStrong(sessionKey);
    return sessionKey;
  }

  private static void requireBlock(byte[] data, String what) {
    if (data == null || data.length != CHALLENGE_LENGTH) {
      throw new MalformedFrameException("Expected " + CHALLENGE_LENGTH + "-byte " + what + ", got "
          + (data == null ? 0 : data.length));
    }
  }

  /**
   * Reader state after answering the card challenge.
   *
   * @param rndA      reader challenge
   * @param rndB      decrypted card challenge
   * @param payload   the 16 bytes to send in the additional frame
   * @param chainedIv IV for decrypting the card's proof
   */
  public record ChallengeAnswer(byte[] rndA, byte[] rndB, byte[] payload, byte[] chainedIv) {
  }
}
