package com.codeheadsystems.swapdot.server.exception;

/**
 * The caller may not perform this operation on the token.
 */
public class PermissionException extends SwapDotException {

  public PermissionException(String message) {
    super(ErrorKind.PERMISSION, message);
  }

  public PermissionException(String message, Throwable cause) {
    super(ErrorKind.PERMISSION, message, cause);
  }
}
