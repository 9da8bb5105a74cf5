package com.codeheadsystems.warden.exceptions;

/**
 * A new password was rejected by the password policy.
 */
public class WeakPasswordException extends WardenException {

  /**
   * Instantiates a new Weak password exception.
   *
   * @param message the message
   */
  public WeakPasswordException(final String message) {
    super(ErrorCode.WEAK_PASSWORD, message);
  }
}
