package com.codeheadsystems.warden.exceptions;

/**
 * A credential or password failed verification: bad signature, wrong algorithm, wrong kind,
 * expired, not yet valid, structurally malformed, or a password that does not match.
 */
public class InvalidCredentialException extends WardenException {

  /**
   * Instantiates a new Invalid credential exception for a bearer token.
   *
   * @param cause the cause
   */
  public InvalidCredentialException(final Throwable cause) {
    super(ErrorCode.INVALID_TOKEN, "Invalid or expired token", cause);
  }

  /**
   * Instantiates a new Invalid credential exception for a bearer token.
   */
  public InvalidCredentialException() {
    super(ErrorCode.INVALID_TOKEN, "Invalid or expired token");
  }

  private InvalidCredentialException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  /**
   * The single failure returned for a username/password login, whether the subject is unknown or
   * the password is wrong.
   *
   * @return the exception
   */
  public static InvalidCredentialException invalidPassword() {
    return new InvalidCredentialException(ErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
  }
}
