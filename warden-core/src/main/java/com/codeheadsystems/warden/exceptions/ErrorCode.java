package com.codeheadsystems.warden.exceptions;

/**
 * Stable, externally visible error codes.
 * <p>
 * The code string and the suggested HTTP status are what a transport adapter should expose to an
 * untrusted caller. Anything more specific belongs in the server log.
 */
public enum ErrorCode {

  INVALID_TOKEN("INVALID_TOKEN", 401),
  INVALID_CREDENTIALS("INVALID_CREDENTIALS", 401),
  TOKEN_REVOKED("TOKEN_REVOKED", 401),
  USER_NOT_FOUND("USER_NOT_FOUND", 404),
  USER_INACTIVE("USER_INACTIVE", 403),
  WEAK_PASSWORD("WEAK_PASSWORD", 400),
  MALFORMED_DIGEST("INTERNAL_ERROR", 500),
  CONFIG_ERROR("CONFIG_ERROR", 500),
  STORAGE_ERROR("STORAGE_ERROR", 503);

  private final String code;
  private final int httpStatus;

  ErrorCode(String code, int httpStatus) {
    this.code = code;
    this.httpStatus = httpStatus;
  }

  /**
   * The wire code.
   *
   * @return the code string
   */
  public String code() {
    return code;
  }

  /**
   * Suggested HTTP status for transport adapters.
   *
   * @return the status code
   */
  public int httpStatus() {
    return httpStatus;
  }
}
