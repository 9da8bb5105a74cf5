package com.codeheadsystems.warden.token;

import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.warden.exceptions.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;

/**
 * The closed set of supported signing algorithms. A configured name is resolved once, when the
 * {@link SigningContext} is built; the algorithm named inside a token header is never consulted.
 */
public enum SigningAlgorithm {

  HS256(32) {
    @Override
    Algorithm forSecret(byte[] secret) {
      return Algorithm.HMAC256(secret);
    }
  },
  HS384(48) {
    @Override
    Algorithm forSecret(byte[] secret) {
      return Algorithm.HMAC384(secret);
    }
  },
  HS512(64) {
    @Override
    Algorithm forSecret(byte[] secret) {
      return Algorithm.HMAC512(secret);
    }
  };

  private final int minimumSecretLength;

  SigningAlgorithm(int minimumSecretLength) {
    this.minimumSecretLength = minimumSecretLength;
  }

  /**
   * Shortest secret accepted for this algorithm, equal to its hash output size.
   *
   * @return length in bytes
   */
  public int minimumSecretLength() {
    return minimumSecretLength;
  }

  abstract Algorithm forSecret(byte[] secret);

  /**
   * Resolves a configured algorithm name, case-insensitively.
   *
   * @param name the name, e.g. {@code HS256}
   * @return the algorithm
   * @throws ConfigurationException if the name is not supported
   */
  public static SigningAlgorithm fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new ConfigurationException("Signing algorithm must be configured");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unsupported signing algorithm: " + name
          + ", must be one of " + Arrays.toString(values()), e);
    }
  }
}
