package com.codeheadsystems.warden.token;

import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.warden.exceptions.ConfigurationException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Static signing configuration shared by the issuer and the verifier.
 * <p>
 * Construction fails with {@link ConfigurationException} when a secret is missing, shorter than
 * the algorithm's hash size, or shared between the two kinds, or when the TTLs are not positive
 * with the access TTL shorter than the refresh TTL, or when either TTL exceeds {@link #MAX_TTL}.
 * A context that exists is therefore usable.
 * <p>
 * Secrets are copied on the way in and out; equality compares their contents.
 *
 * @param accessSecret  HMAC secret for access credentials
 * @param refreshSecret HMAC secret for refresh credentials
 * @param issuer        value of the {@code iss} claim
 * @param accessTtl     lifetime of access credentials
 * @param refreshTtl    lifetime of refresh credentials
 * @param algorithm     signing algorithm
 */
public record SigningContext(
    byte[] accessSecret,
    byte[] refreshSecret,
    String issuer,
    Duration accessTtl,
    Duration refreshTtl,
    SigningAlgorithm algorithm
) {

  /**
   * Longest accepted lifetime for either kind.
   */
  public static final Duration MAX_TTL = Duration.ofDays(3650);

  public SigningContext {
    if (algorithm == null) {
      throw new ConfigurationException("Signing algorithm must be configured");
    }
    checkSecret(accessSecret, "access", algorithm);
    checkSecret(refreshSecret, "refresh", algorithm);
    if (Arrays.equals(accessSecret, refreshSecret)) {
      throw new ConfigurationException("Access and refresh secrets must differ");
    }
    if (issuer == null || issuer.isBlank()) {
      throw new ConfigurationException("Issuer must be configured");
    }
    if (accessTtl == null || accessTtl.isZero() || accessTtl.isNegative()) {
      throw new ConfigurationException("Access token TTL must be positive");
    }
    if (refreshTtl == null || refreshTtl.isZero() || refreshTtl.isNegative()) {
      throw new ConfigurationException("Refresh token TTL must be positive");
    }
    if (accessTtl.compareTo(MAX_TTL) > 0) {
      throw new ConfigurationException("Access token TTL must not exceed " + MAX_TTL.toDays() + " days");
    }
    if (refreshTtl.compareTo(MAX_TTL) > 0) {
      throw new ConfigurationException("Refresh token TTL must not exceed " + MAX_TTL.toDays() + " days");
    }
    if (accessTtl.compareTo(refreshTtl) >= 0) {
      throw new ConfigurationException("Access token TTL must be less than refresh token TTL");
    }
    accessSecret = accessSecret.clone();
    refreshSecret = refreshSecret.clone();
  }

  @Override
  public byte[] accessSecret() {
    return accessSecret.clone();
  }

  @Override
  public byte[] refreshSecret() {
    return refreshSecret.clone();
  }

  private static void checkSecret(byte[] secret, String kind, SigningAlgorithm algorithm) {
    if (secret == null || secret.length == 0) {
      throw new ConfigurationException("JWT " + kind + " secret must not be empty");
    }
    if (secret.length < algorithm.minimumSecretLength()) {
      throw new ConfigurationException("JWT " + kind + " secret must be at least "
          + algorithm.minimumSecretLength() + " bytes for " + algorithm);
    }
  }

  /**
   * Lifetime of credentials of the given kind.
   *
   * @param kind the kind
   * @return the TTL
   */
  public Duration ttlFor(TokenKind kind) {
    return kind == TokenKind.ACCESS ? accessTtl : refreshTtl;
  }

  /**
   * Signing algorithm keyed with the secret of the given kind.
   *
   * @param kind the kind
   * @return the keyed algorithm
   */
  public Algorithm algorithmFor(TokenKind kind) {
    return algorithm.forSecret(kind == TokenKind.ACCESS ? accessSecret : refreshSecret);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SigningContext other)) {
      return false;
    }
    return Arrays.equals(accessSecret, other.accessSecret)
        && Arrays.equals(refreshSecret, other.refreshSecret)
        && issuer.equals(other.issuer)
        && accessTtl.equals(other.accessTtl)
        && refreshTtl.equals(other.refreshTtl)
        && algorithm == other.algorithm;
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(issuer, accessTtl, refreshTtl, algorithm);
    result = 31 * result + Arrays.hashCode(accessSecret);
    return 31 * result + Arrays.hashCode(refreshSecret);
  }

  @Override
  public String toString() {
    return "SigningContext[issuer=" + issuer + ", algorithm=" + algorithm
        + ", accessTtl=" + accessTtl + ", refreshTtl=" + refreshTtl + "]";
  }
}
