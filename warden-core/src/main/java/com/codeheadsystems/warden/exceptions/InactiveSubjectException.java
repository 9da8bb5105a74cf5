package com.codeheadsystems.warden.exceptions;

/**
 * The subject exists but has been deactivated.
 */
public class InactiveSubjectException extends WardenException {

  /**
   * Instantiates a new Inactive subject exception.
   */
  public InactiveSubjectException() {
    super(ErrorCode.USER_INACTIVE, "User account is inactive");
  }
}
