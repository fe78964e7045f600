package com.codeheadsystems.swapdot.server.exception;

/**
 * The card exchange failed. The session has been destroyed and must not be reused.
 */
public class ProtocolException extends SwapDotException {

  public ProtocolException(String message) {
    super(ErrorKind.PROTOCOL, message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(ErrorKind.PROTOCOL, message, cause);
  }
}
