package com.codeheadsystems.swapdot.desfire;

/**
 * Base type for failures raised while building or interpreting DESFire frames.
 */
public abstract class DesfireException extends RuntimeException {

  protected DesfireException(String message) {
    super(message);
  }

  protected DesfireException(String message, Throwable cause) {
    super(message, cause);
  }
}
