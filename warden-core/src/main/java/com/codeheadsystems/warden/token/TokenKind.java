package com.codeheadsystems.warden.token;

import java.util.Optional;

/**
 * Whether a credential is an access or a refresh credential. Each kind has its own signing
 * secret.
 */
public enum TokenKind {

  ACCESS("access"),
  REFRESH("refresh");

  private final String claimValue;

  TokenKind(String claimValue) {
    this.claimValue = claimValue;
  }

  /**
   * Value carried in the {@code token_type} claim.
   *
   * @return the claim value
   */
  public String claimValue() {
    return claimValue;
  }

  /**
   * Resolves a {@code token_type} claim value.
   *
   * @param value the claim value
   * @return the kind, or empty if unknown
   */
  public static Optional<TokenKind> fromClaimValue(String value) {
    for (TokenKind kind : values()) {
      if (kind.claimValue.equals(value)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
