package com.codeheadsystems.warden.common;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Source of salts and token identifiers. Wraps a {@link SecureRandom} so tests can substitute a
 * seeded instance.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final int TOKEN_ID_BYTES = 16;

  /**
   * Creates a provider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * A fresh 128-bit token identifier, base64url encoded without padding.
   *
   * @return the identifier
   */
  public String randomTokenId() {
    return URL_ENCODER.encodeToString(randomBytes(TOKEN_ID_BYTES));
  }
}
