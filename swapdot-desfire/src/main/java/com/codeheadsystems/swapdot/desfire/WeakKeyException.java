package com.codeheadsystems.swapdot.desfire;

/**
 * The block cipher refused a key because one of its DES blocks is weak or semi-weak.
 * <p>
 * Session keys are derived from random challenges, so the only remedy is to discard the
 * session and authenticate again to derive a new key.
 */
public class WeakKeyException extends DesfireException {

  public WeakKeyException(String message) {
    super(message);
  }
}
