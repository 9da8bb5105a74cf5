package com.codeheadsystems.warden.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.warden.exceptions.InvalidCredentialException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses and verifies credentials.
 * <p>
 * The secret and the accepted algorithm come from the caller-requested {@link TokenKind} and the
 * {@link SigningContext}, never from the token. On top of the signature the verifier requires:
 * <ul>
 *   <li>{@code iss} equal to the configured issuer,</li>
 *   <li>{@code token_type} equal to the requested kind,</li>
 *   <li>{@code sub} and {@code jti} present,</li>
 *   <li>{@code nbf <= now < exp}; a token whose {@code exp} equals now is expired.</li>
 * </ul>
 * Every failure is reported as {@link InvalidCredentialException} with no further detail.
 */
public class CredentialVerifier {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE =
      new TypeReference<>() {
      };

  private final Clock clock;
  private final JWTVerifier accessVerifier;
  private final JWTVerifier refreshVerifier;

  /**
   * Creates a verifier using the system clock.
   *
   * @param context the signing context
   */
  public CredentialVerifier(SigningContext context) {
    this(context, Clock.systemUTC());
  }

  /**
   * Creates a verifier.
   *
   * @param context the signing context
   * @param clock   time source for expiry checks
   */
  public CredentialVerifier(SigningContext context, Clock clock) {
    this.clock = clock;
    this.accessVerifier = buildVerifier(context, TokenKind.ACCESS, clock);
    this.refreshVerifier = buildVerifier(context, TokenKind.REFRESH, clock);
  }

  private static JWTVerifier buildVerifier(SigningContext context, TokenKind kind, Clock clock) {
    JWTVerifier.BaseVerification verification = (JWTVerifier.BaseVerification)
        JWT.require(context.algorithmFor(kind))
            .withIssuer(context.issuer())
            .withClaim(ClaimNames.TOKEN_TYPE, kind.claimValue())
            .withClaimPresence(ClaimNames.SUBJECT)
            .withClaimPresence(ClaimNames.TOKEN_ID)
            .withClaimPresence(ClaimNames.ISSUED_AT)
            .withClaimPresence(ClaimNames.NOT_BEFORE)
            .withClaimPresence(ClaimNames.EXPIRES_AT)
            .withClaimPresence(ClaimNames.ISSUED_AT_MILLIS);
    return verification.build(clock);
  }

  /**
   * Verifies a credential as the given kind.
   *
   * @param token        the credential
   * @param expectedKind the kind the caller expects
   * @return the claims
   * @throws InvalidCredentialException if the credential is not valid as that kind
   */
  public ClaimSet verify(String token, TokenKind expectedKind) {
    if (token == null || token.isBlank()) {
      throw new InvalidCredentialException();
    }
    DecodedJWT decoded;
    try {
      decoded = (expectedKind == TokenKind.ACCESS ? accessVerifier : refreshVerifier).verify(token);
    } catch (JWTVerificationException e) {
      throw new InvalidCredentialException(e);
    }
    Instant expiresAt = decoded.getExpiresAtAsInstant();
    if (!clock.instant().isBefore(expiresAt)) {
      throw new InvalidCredentialException();
    }
    String subjectId = decoded.getSubject();
    String tokenId = decoded.getId();
    if (subjectId == null || subjectId.isBlank() || tokenId == null || tokenId.isBlank()) {
      throw new InvalidCredentialException();
    }
    Instant issuedAt = decoded.getIssuedAtAsInstant();
    Long issuedAtMillis = decoded.getClaim(ClaimNames.ISSUED_AT_MILLIS).asLong();
    if (issuedAtMillis == null
        || Math.floorDiv(issuedAtMillis, 1000L) != issuedAt.getEpochSecond()) {
      throw new InvalidCredentialException();
    }
    return new ClaimSet(
        decoded.getIssuer(),
        subjectId,
        issuedAt,
        Instant.ofEpochMilli(issuedAtMillis),
        decoded.getNotBeforeAsInstant(),
        expiresAt,
        tokenId,
        expectedKind,
        customClaims(decoded));
  }

  /**
   * Verifies a credential of either kind, trying access first.
   *
   * @param token the credential
   * @return the claims, whose {@link ClaimSet#kind()} tells which secret verified it
   * @throws InvalidCredentialException if the credential is valid as neither kind
   */
  public ClaimSet verifyAnyKind(String token) {
    try {
      return verify(token, TokenKind.ACCESS);
    } catch (InvalidCredentialException notAccess) {
      return verify(token, TokenKind.REFRESH);
    }
  }

  private static Map<String, Object> customClaims(DecodedJWT decoded) {
    Map<String, Object> payload;
    try {
      payload = MAPPER.readValue(Base64.getUrlDecoder().decode(decoded.getPayload()), PAYLOAD_TYPE);
    } catch (IOException | IllegalArgumentException e) {
      throw new InvalidCredentialException(e);
    }
    payload.keySet().removeAll(ClaimNames.RESERVED);
    return payload;
  }
}
