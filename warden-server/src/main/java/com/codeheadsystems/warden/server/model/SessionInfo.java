package com.codeheadsystems.warden.server.model;

import com.codeheadsystems.warden.token.ClaimSet;
import com.codeheadsystems.warden.token.TokenKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive view of a credential for session listings. Carries no authorisation decision.
 *
 * @param tokenId   the {@code jti}
 * @param subjectId the {@code sub}
 * @param tokenType access or refresh
 * @param issuedAt  epoch seconds
 * @param expiresAt epoch seconds
 */
public record SessionInfo(
    @JsonProperty("token_id") String tokenId,
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("issued_at") long issuedAt,
    @JsonProperty("expires_at") long expiresAt) {

  /**
   * Builds the view from verified claims.
   *
   * @param claims the claims
   * @return the session info
   */
  public static SessionInfo from(ClaimSet claims) {
    return new SessionInfo(
        claims.tokenId(),
        claims.subjectId(),
        claims.kind().claimValue(),
        claims.issuedAt().getEpochSecond(),
        claims.expiresAt().getEpochSecond());
  }

  /**
   * The token kind.
   *
   * @return the kind
   */
  @JsonIgnore
  public TokenKind kind() {
    return TokenKind.fromClaimValue(tokenType).orElseThrow();
  }
}
