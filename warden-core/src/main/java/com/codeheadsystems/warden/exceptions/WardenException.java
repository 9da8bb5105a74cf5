package com.codeheadsystems.warden.exceptions;

/**
 * Root of every failure raised by Warden.
 * <p>
 * Messages are safe to return to an untrusted caller; they never name which check failed beyond
 * what the {@link ErrorCode} already says.
 */
public abstract class WardenException extends RuntimeException {

  private final ErrorCode errorCode;

  /**
   * Instantiates a new Warden exception.
   *
   * @param errorCode the error code
   * @param message   the user-safe message
   */
  protected WardenException(final ErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Instantiates a new Warden exception.
   *
   * @param errorCode the error code
   * @param message   the user-safe message
   * @param cause     the cause
   */
  protected WardenException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * Error code.
   *
   * @return the error code
   */
  public ErrorCode errorCode() {
    return errorCode;
  }
}
