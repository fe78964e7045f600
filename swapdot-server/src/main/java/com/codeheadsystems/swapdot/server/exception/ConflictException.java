package com.codeheadsystems.swapdot.server.exception;

/**
 * The operation raced another one or found an active transfer. Re-read and retry.
 */
public class ConflictException extends SwapDotException {

  public ConflictException(String message) {
    super(ErrorKind.CONFLICT, message);
  }

  public ConflictException(String message, Throwable cause) {
    super(ErrorKind.CONFLICT, message, cause);
  }
}
