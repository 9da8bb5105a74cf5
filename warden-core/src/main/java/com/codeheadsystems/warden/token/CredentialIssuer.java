package com.codeheadsystems.warden.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.warden.common.RandomProvider;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds and signs access and refresh credentials.
 * <p>
 * Every credential gets a fresh token id and the current time; both sources are injectable so
 * tests can pin them. Caller claims go into access credentials only, and never replace a
 * {@linkplain ClaimNames#RESERVED reserved} claim.
 */
public class CredentialIssuer {

  private final SigningContext context;
  private final Algorithm accessAlgorithm;
  private final Algorithm refreshAlgorithm;
  private final Clock clock;
  private final Supplier<String> tokenIdSource;

  /**
   * Creates an issuer using the system clock and random token ids.
   *
   * @param context the signing context
   */
  public CredentialIssuer(SigningContext context) {
    this(context, Clock.systemUTC(), new RandomProvider()::randomTokenId);
  }

  /**
   * Creates an issuer.
   *
   * @param context       the signing context
   * @param clock         time source for {@code iat}, {@code nbf} and {@code exp}
   * @param tokenIdSource source of {@code jti} values
   */
  public CredentialIssuer(SigningContext context, Clock clock, Supplier<String> tokenIdSource) {
    this.context = context;
    this.accessAlgorithm = context.algorithmFor(TokenKind.ACCESS);
    this.refreshAlgorithm = context.algorithmFor(TokenKind.REFRESH);
    this.clock = clock;
    this.tokenIdSource = tokenIdSource;
  }

  /**
   * Issues an access credential.
   *
   * @param subjectId    the subject
   * @param customClaims extra claims, may be null; values must be JSON scalars, lists or maps
   * @return the signed credential
   * @throws IllegalArgumentException if the subject is blank or a claim value is unsupported
   */
  public String issueAccess(String subjectId, Map<String, ?> customClaims) {
    return issue(TokenKind.ACCESS, subjectId, customClaims);
  }

  /**
   * Issues a refresh credential. Refresh credentials never carry custom claims.
   *
   * @param subjectId the subject
   * @return the signed credential
   * @throws IllegalArgumentException if the subject is blank
   */
  public String issueRefresh(String subjectId) {
    return issue(TokenKind.REFRESH, subjectId, null);
  }

  private String issue(TokenKind kind, String subjectId, Map<String, ?> customClaims) {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("Subject id must not be blank");
    }
    // JWT timestamps are whole seconds; iat_ms keeps the exact issue time for revocation checks.
    Instant issued = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Instant now = issued.truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(context.ttlFor(kind));

    JWTCreator.Builder builder = JWT.create();
    if (customClaims != null && !customClaims.isEmpty()) {
      Map<String, Object> extra = new LinkedHashMap<>();
      customClaims.forEach((name, value) -> {
        if (!ClaimNames.RESERVED.contains(name)) {
          extra.put(name, value);
        }
      });
      builder.withPayload(extra);
    }
    return builder
        .withIssuer(context.issuer())
        .withSubject(subjectId)
        .withIssuedAt(now)
        .withNotBefore(now)
        .withExpiresAt(expiresAt)
        .withJWTId(tokenIdSource.get())
        .withClaim(ClaimNames.TOKEN_TYPE, kind.claimValue())
        .withClaim(ClaimNames.ISSUED_AT_MILLIS, issued.toEpochMilli())
        .sign(kind == TokenKind.ACCESS ? accessAlgorithm : refreshAlgorithm);
  }
}
