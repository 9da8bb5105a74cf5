package com.codeheadsystems.warden.exceptions;

/**
 * A subject or denylist store call failed. The cause is kept for logging only.
 */
public class StoreUnavailableException extends WardenException {

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param cause the cause
   */
  public StoreUnavailableException(final Throwable cause) {
    super(ErrorCode.STORAGE_ERROR, "Credential store unavailable", cause);
  }
}
