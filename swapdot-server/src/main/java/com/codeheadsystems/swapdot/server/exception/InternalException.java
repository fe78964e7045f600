package com.codeheadsystems.swapdot.server.exception;

/**
 * The ledger store failed or an invariant broke. Nothing was written.
 */
public class InternalException extends SwapDotException {

  public InternalException(String message) {
    super(ErrorKind.INTERNAL, message);
  }

  public InternalException(String message, Throwable cause) {
    super(ErrorKind.INTERNAL, message, cause);
  }
}
