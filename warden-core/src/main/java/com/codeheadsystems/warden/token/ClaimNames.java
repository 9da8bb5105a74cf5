package com.codeheadsystems.warden.token;

import java.util.Set;

/**
 * Payload keys written into every credential.
 */
public final class ClaimNames {

  public static final String ISSUER = "iss";
  public static final String SUBJECT = "sub";
  public static final String ISSUED_AT = "iat";
  public static final String NOT_BEFORE = "nbf";
  public static final String EXPIRES_AT = "exp";
  public static final String TOKEN_ID = "jti";
  public static final String TOKEN_TYPE = "token_type";

  /**
   * Issue time in epoch milliseconds; {@code iat} holds only whole seconds.
   */
  public static final String ISSUED_AT_MILLIS = "iat_ms";

  /**
   * Keys a caller can never set through custom claims.
   */
  public static final Set<String> RESERVED = Set.of(
      ISSUER, SUBJECT, ISSUED_AT, NOT_BEFORE, EXPIRES_AT, TOKEN_ID, TOKEN_TYPE, ISSUED_AT_MILLIS);

  private ClaimNames() {
  }
}
