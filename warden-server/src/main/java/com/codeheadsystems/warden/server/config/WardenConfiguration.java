package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.digest.DigestParameters;
import com.codeheadsystems.warden.exceptions.ConfigurationException;
import com.codeheadsystems.warden.server.manager.PasswordPolicy;
import com.codeheadsystems.warden.token.SigningAlgorithm;
import com.codeheadsystems.warden.token.SigningContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Supplier;

/**
 * Configuration for a Warden deployment, bindable from YAML.
 * <p>
 * Both {@code jwtAccessSecretHex} and {@code jwtRefreshSecretHex} are required and must differ.
 * Each must decode to at least as many bytes as the signing algorithm's hash size (32 for HS256).
 * <p>
 * Generate secrets with: {@code openssl rand -hex 32}
 */
public class WardenConfiguration {

  /**
   * Name of the profile the values were shaped by. Informational.
   */
  private String environment = ConfigProfile.DEVELOPMENT.profileName();

  /**
   * Hex-encoded HMAC secret for access tokens.
   */
  private String jwtAccessSecretHex = "";

  /**
   * Hex-encoded HMAC secret for refresh tokens.
   */
  private String jwtRefreshSecretHex = "";

  /**
   * JWT issuer claim, checked on every verification.
   */
  private String jwtIssuer = "warden";

  /**
   * Signing algorithm. Valid values: {@code HS256} (default), {@code HS384}, {@code HS512}.
   */
  private String jwtSigningAlgorithm = "HS256";

  /**
   * Access token time-to-live in seconds. Must be less than the refresh TTL.
   */
  private long accessTokenTtlSeconds = 900;

  /**
   * Refresh token time-to-live in seconds.
   */
  private long refreshTokenTtlSeconds = 604_800;

  /**
   * Argon2id memory cost in kibibytes.
   */
  private int argon2MemoryKib = DigestParameters.DEFAULT.memoryKib();

  /**
   * Argon2id iteration count.
   */
  private int argon2Iterations = DigestParameters.DEFAULT.iterations();

  /**
   * Argon2id parallelism.
   */
  private int argon2Parallelism = DigestParameters.DEFAULT.parallelism();

  /**
   * Minimum length of new passwords, between 4 and 128.
   */
  private int passwordMinLength = PasswordPolicy.DEFAULT_MIN_LENGTH;

  /**
   * Checks every setting, reporting all problems at once.
   *
   * @throws ConfigurationException listing each problem found
   */
  public void validate() {
    List<String> problems = new ArrayList<>();
    byte[] access = decodeSecret("jwtAccessSecretHex", jwtAccessSecretHex, problems);
    byte[] refresh = decodeSecret("jwtRefreshSecretHex", jwtRefreshSecretHex, problems);
    if (access != null && refresh != null && Arrays.equals(access, refresh)) {
      problems.add("jwtAccessSecretHex and jwtRefreshSecretHex must differ");
    }
    if (jwtIssuer == null || jwtIssuer.isBlank()) {
      problems.add("jwtIssuer is required");
    }
    collect(problems, () -> SigningAlgorithm.fromName(jwtSigningAlgorithm));
    if (accessTokenTtlSeconds <= 0) {
      problems.add("accessTokenTtlSeconds must be positive");
    }
    if (refreshTokenTtlSeconds <= 0) {
      problems.add("refreshTokenTtlSeconds must be positive");
    }
    long maxTtlSeconds = SigningContext.MAX_TTL.getSeconds();
    if (accessTokenTtlSeconds > maxTtlSeconds) {
      problems.add("accessTokenTtlSeconds must not exceed " + maxTtlSeconds);
    }
    if (refreshTokenTtlSeconds > maxTtlSeconds) {
      problems.add("refreshTokenTtlSeconds must not exceed " + maxTtlSeconds);
    }
    if (accessTokenTtlSeconds >= refreshTokenTtlSeconds) {
      problems.add("accessTokenTtlSeconds must be less than refreshTokenTtlSeconds");
    }
    if (passwordMinLength < 4 || passwordMinLength > PasswordPolicy.MAX_LENGTH) {
      problems.add("passwordMinLength must be between 4 and " + PasswordPolicy.MAX_LENGTH);
    }
    collect(problems, this::toDigestParameters);
    if (problems.isEmpty()) {
      collect(problems, this::toSigningContext);
    }
    if (!problems.isEmpty()) {
      throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
    }
  }

  /**
   * Builds the signing context.
   *
   * @return the context
   * @throws ConfigurationException if the settings are invalid
   */
  public SigningContext toSigningContext() {
    return new SigningContext(
        parseHex("jwtAccessSecretHex", jwtAccessSecretHex),
        parseHex("jwtRefreshSecretHex", jwtRefreshSecretHex),
        jwtIssuer,
        Duration.ofSeconds(accessTokenTtlSeconds),
        Duration.ofSeconds(refreshTokenTtlSeconds),
        SigningAlgorithm.fromName(jwtSigningAlgorithm));
  }

  /**
   * Builds the Argon2id parameters.
   *
   * @return the parameters
   */
  public DigestParameters toDigestParameters() {
    return DigestParameters.of(argon2MemoryKib, argon2Iterations, argon2Parallelism);
  }

  /**
   * Builds the password policy.
   *
   * @return the policy
   */
  public PasswordPolicy toPasswordPolicy() {
    return PasswordPolicy.withMinLength(passwordMinLength);
  }

  /**
   * One-line summary safe for logs. Secrets are reduced to whether they are set and their size.
   *
   * @return the summary
   */
  public String describe() {
    return "environment=" + environment
        + ", jwtAccessSecret=" + mask(jwtAccessSecretHex)
        + ", jwtRefreshSecret=" + mask(jwtRefreshSecretHex)
        + ", jwtIssuer=" + jwtIssuer
        + ", jwtSigningAlgorithm=" + jwtSigningAlgorithm
        + ", accessTokenTtlSeconds=" + accessTokenTtlSeconds
        + ", refreshTokenTtlSeconds=" + refreshTokenTtlSeconds
        + ", argon2=m=" + argon2MemoryKib + ",t=" + argon2Iterations + ",p=" + argon2Parallelism
        + ", passwordMinLength=" + passwordMinLength;
  }

  @Override
  public String toString() {
    return "WardenConfiguration[" + describe() + "]";
  }

  private static String mask(String hex) {
    if (hex == null || hex.isEmpty()) {
      return "<unset>";
    }
    return "***(" + hex.length() / 2 + " bytes)";
  }

  private static byte[] decodeSecret(String name, String hex, List<String> problems) {
    if (hex == null || hex.isBlank()) {
      problems.add(name + " is required");
      return null;
    }
    try {
      return parseHex(name, hex);
    } catch (ConfigurationException e) {
      problems.add(e.getMessage());
      return null;
    }
  }

  private static byte[] parseHex(String name, String hex) {
    try {
      return HexFormat.of().parseHex(hex == null ? "" : hex.trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(name + " is not valid hex", e);
    }
  }

  private static void collect(List<String> problems, Supplier<?> check) {
    try {
      check.get();
    } catch (ConfigurationException e) {
      problems.add(e.getMessage());
    }
  }

  /**
   * Gets environment.
   *
   * @return the environment
   */
  @JsonProperty
  public String getEnvironment() {
    return environment;
  }

  /**
   * Sets environment.
   *
   * @param environment the environment
   */
  @JsonProperty
  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  /**
   * Gets jwt access secret hex.
   *
   * @return the jwt access secret hex
   */
  @JsonProperty
  public String getJwtAccessSecretHex() {
    return jwtAccessSecretHex;
  }

  /**
   * Sets jwt access secret hex.
   *
   * @param jwtAccessSecretHex the jwt access secret hex
   */
  @JsonProperty
  public void setJwtAccessSecretHex(String jwtAccessSecretHex) {
    this.jwtAccessSecretHex = jwtAccessSecretHex;
  }

  /**
   * Gets jwt refresh secret hex.
   *
   * @return the jwt refresh secret hex
   */
  @JsonProperty
  public String getJwtRefreshSecretHex() {
    return jwtRefreshSecretHex;
  }

  /**
   * Sets jwt refresh secret hex.
   *
   * @param jwtRefreshSecretHex the jwt refresh secret hex
   */
  @JsonProperty
  public void setJwtRefreshSecretHex(String jwtRefreshSecretHex) {
    this.jwtRefreshSecretHex = jwtRefreshSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets jwt signing algorithm.
   *
   * @return the jwt signing algorithm
   */
  @JsonProperty
  public String getJwtSigningAlgorithm() {
    return jwtSigningAlgorithm;
  }

  /**
   * Sets jwt signing algorithm.
   *
   * @param jwtSigningAlgorithm the jwt signing algorithm
   */
  @JsonProperty
  public void setJwtSigningAlgorithm(String jwtSigningAlgorithm) {
    this.jwtSigningAlgorithm = jwtSigningAlgorithm;
  }

  /**
   * Gets access token ttl seconds.
   *
   * @return the access token ttl seconds
   */
  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  /**
   * Sets access token ttl seconds.
   *
   * @param accessTokenTtlSeconds the access token ttl seconds
   */
  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  /**
   * Gets refresh token ttl seconds.
   *
   * @return the refresh token ttl seconds
   */
  @JsonProperty
  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  /**
   * Sets refresh token ttl seconds.
   *
   * @param refreshTokenTtlSeconds the refresh token ttl seconds
   */
  @JsonProperty
  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  /**
   * Gets argon 2 memory kib.
   *
   * @return the argon 2 memory kib
   */
  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  /**
   * Sets argon 2 memory kib.
   *
   * @param argon2MemoryKib the argon 2 memory kib
   */
  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  /**
   * Gets argon 2 iterations.
   *
   * @return the argon 2 iterations
   */
  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  /**
   * Sets argon 2 iterations.
   *
   * @param argon2Iterations the argon 2 iterations
   */
  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  /**
   * Gets argon 2 parallelism.
   *
   * @return the argon 2 parallelism
   */
  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  /**
   * Sets argon 2 parallelism.
   *
   * @param argon2Parallelism the argon 2 parallelism
   */
  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets password min length.
   *
   * @return the password min length
   */
  @JsonProperty
  public int getPasswordMinLength() {
    return passwordMinLength;
  }

  /**
   * Sets password min length.
   *
   * @param passwordMinLength the password min length
   */
  @JsonProperty
  public void setPasswordMinLength(int passwordMinLength) {
    this.passwordMinLength = passwordMinLength;
  }
}
