package com.codeheadsystems.swapdot.server.exception;

/**
 * A token, session or transfer record does not exist.
 */
public class NotFoundException extends SwapDotException {

  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(ErrorKind.NOT_FOUND, message, cause);
  }
}
