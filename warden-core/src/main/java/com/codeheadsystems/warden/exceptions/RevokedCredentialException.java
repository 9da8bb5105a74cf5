package com.codeheadsystems.warden.exceptions;

/**
 * The credential is signature-valid but has been revoked, either by id or by a subject-wide
 * revocation.
 */
public class RevokedCredentialException extends WardenException {

  /**
   * Instantiates a new Revoked credential exception.
   */
  public RevokedCredentialException() {
    super(ErrorCode.TOKEN_REVOKED, "Token has been revoked");
  }
}
