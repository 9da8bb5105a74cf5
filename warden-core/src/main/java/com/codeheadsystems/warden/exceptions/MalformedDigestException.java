package com.codeheadsystems.warden.exceptions;

/**
 * A stored password digest could not be parsed.
 */
public class MalformedDigestException extends WardenException {

  /**
   * Instantiates a new Malformed digest exception.
   *
   * @param message the message
   */
  public MalformedDigestException(final String message) {
    super(ErrorCode.MALFORMED_DIGEST, message);
  }

  /**
   * Instantiates a new Malformed digest exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedDigestException(final String message, final Throwable cause) {
    super(ErrorCode.MALFORMED_DIGEST, message, cause);
  }
}
