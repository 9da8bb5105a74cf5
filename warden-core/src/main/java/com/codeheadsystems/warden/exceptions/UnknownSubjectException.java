package com.codeheadsystems.warden.exceptions;

/**
 * The subject named by a valid credential no longer exists.
 */
public class UnknownSubjectException extends WardenException {

  /**
   * Instantiates a new Unknown subject exception.
   */
  public UnknownSubjectException() {
    super(ErrorCode.USER_NOT_FOUND, "User not found");
  }
}
