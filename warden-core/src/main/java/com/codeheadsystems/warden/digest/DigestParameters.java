package com.codeheadsystems.warden.digest;

import com.codeheadsystems.warden.exceptions.ConfigurationException;

/**
 * Argon2id cost parameters used when producing new digests. Verification always uses the
 * parameters embedded in the digest instead.
 *
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost (passes over memory)
 * @param parallelism number of lanes
 * @param saltLength  salt length in bytes
 * @param keyLength   derived key length in bytes
 */
public record DigestParameters(
    int memoryKib,
    int iterations,
    int parallelism,
    int saltLength,
    int keyLength
) {

  /**
   * 64 MiB, one pass, four lanes, 16-byte salt, 32-byte key.
   */
  public static final DigestParameters DEFAULT = new DigestParameters(65536, 1, 4, 16, 32);

  /**
   * Minimum salt length accepted for new digests.
   */
  public static final int MIN_SALT_LENGTH = 16;

  public DigestParameters {
    if (parallelism < 1) {
      throw new ConfigurationException("Argon2 parallelism must be at least 1");
    }
    if (iterations < 1) {
      throw new ConfigurationException("Argon2 iterations must be at least 1");
    }
    if (memoryKib < 8 * parallelism) {
      throw new ConfigurationException("Argon2 memory must be at least 8 KiB per lane");
    }
    if (saltLength < MIN_SALT_LENGTH) {
      throw new ConfigurationException("Salt length must be at least " + MIN_SALT_LENGTH + " bytes");
    }
    if (keyLength < 16) {
      throw new ConfigurationException("Derived key length must be at least 16 bytes");
    }
  }

  /**
   * Cheap parameters for unit tests. Never use outside tests.
   *
   * @return the parameters
   */
  public static DigestParameters forTesting() {
    return new DigestParameters(1024, 1, 1, 16, 32);
  }

  /**
   * Default lengths with the given cost.
   *
   * @param memoryKib   memory cost in KiB
   * @param iterations  time cost
   * @param parallelism lanes
   * @return the parameters
   */
  public static DigestParameters of(int memoryKib, int iterations, int parallelism) {
    return new DigestParameters(memoryKib, iterations, parallelism,
        DEFAULT.saltLength(), DEFAULT.keyLength());
  }
}
