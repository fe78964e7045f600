package com.codeheadsystems.swapdot.desfire;

/**
 * A card response or command frame does not have the shape the protocol requires.
 */
public class MalformedFrameException extends DesfireException {

  public MalformedFrameException(String message) {
    super(message);
  }
}
