package com.codeheadsystems.swapdot.server.exception;

/**
 * Base type for every domain failure. Services throw these before any write is made; the
 * JAX-RS layer maps {@link #kind()} to a status code.
 */
public abstract class SwapDotException extends RuntimeException {

  private final ErrorKind kind;

  protected SwapDotException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected SwapDotException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
