package com.codeheadsystems.swapdot.server.exception;

/**
 * A session or transfer record passed its deadline. Its state has already been corrected.
 */
public class ExpiredException extends SwapDotException {

  public ExpiredException(String message) {
    super(ErrorKind.EXPIRED, message);
  }

  public ExpiredException(String message, Throwable cause) {
    super(ErrorKind.EXPIRED, message, cause);
  }
}
