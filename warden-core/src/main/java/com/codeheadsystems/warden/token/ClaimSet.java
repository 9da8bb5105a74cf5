package com.codeheadsystems.warden.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verified content of a credential.
 *
 * @param issuer        the {@code iss} claim
 * @param subjectId     the {@code sub} claim
 * @param issuedAt      the {@code iat} claim
 * @param issuedAtExact the {@code iat_ms} claim, millisecond precision, within the {@code iat} second
 * @param notBefore     the {@code nbf} claim
 * @param expiresAt     the {@code exp} claim
 * @param tokenId       the {@code jti} claim, the denylist key
 * @param kind          the {@code token_type} claim
 * @param customClaims  every other claim; never contains a reserved key
 */
public record ClaimSet(
    String issuer,
    String subjectId,
    Instant issuedAt,
    Instant issuedAtExact,
    Instant notBefore,
    Instant expiresAt,
    String tokenId,
    TokenKind kind,
    Map<String, Object> customClaims
) {

  public ClaimSet {
    customClaims = customClaims == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(customClaims));
  }

  /**
   * A custom claim.
   *
   * @param name the claim name
   * @return the value, if present
   */
  public Optional<Object> claim(String name) {
    return Optional.ofNullable(customClaims.get(name));
  }

  /**
   * Flat view of every claim, timestamps as epoch seconds, as it appears in the payload.
   *
   * @return an unmodifiable map
   */
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>(customClaims);
    map.put(ClaimNames.ISSUER, issuer);
    map.put(ClaimNames.SUBJECT, subjectId);
    map.put(ClaimNames.ISSUED_AT, issuedAt.getEpochSecond());
    map.put(ClaimNames.ISSUED_AT_MILLIS, issuedAtExact.toEpochMilli());
    map.put(ClaimNames.NOT_BEFORE, notBefore.getEpochSecond());
    map.put(ClaimNames.EXPIRES_AT, expiresAt.getEpochSecond());
    map.put(ClaimNames.TOKEN_ID, tokenId);
    map.put(ClaimNames.TOKEN_TYPE, kind.claimValue());
    return Collections.unmodifiableMap(map);
  }
}
