package com.codeheadsystems.warden.digest;

import com.codeheadsystems.warden.exceptions.MalformedDigestException;
import java.util.Arrays;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of the stored digest string
 * {@code $argon2id$v=19$m=<kib>,t=<iterations>,p=<lanes>$<salt>$<key>}.
 * <p>
 * Salt and key are standard base64 without padding, which is what other Argon2 implementations
 * emit. Decoding also accepts padded input. Salt and key are copied on the way in and out;
 * equality compares their contents.
 *
 * @param version     Argon2 version number (19)
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost
 * @param parallelism lanes
 * @param salt        the salt
 * @param key         the derived key
 */
public record PasswordDigest(
    int version,
    int memoryKib,
    int iterations,
    int parallelism,
    byte[] salt,
    byte[] key
) {

  public static final String ALGORITHM_ID = "argon2id";
  public static final int VERSION = 0x13;
  public static final String PREFIX = "$" + ALGORITHM_ID + "$";

  private static final Base64.Encoder ENCODER = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getDecoder();
  private static final Pattern VERSION_FIELD = Pattern.compile("v=(\\d{1,9})");
  private static final Pattern COST_FIELD = Pattern.compile("m=(\\d{1,10}),t=(\\d{1,10}),p=(\\d{1,8})");
  private static final int MAX_PARALLELISM = 0xFFFFFF;
  private static final int MIN_SALT_LENGTH = 8;
  private static final int MIN_KEY_LENGTH = 4;

  public PasswordDigest {
    if (salt == null || key == null) {
      throw new IllegalArgumentException("Salt and key must not be null");
    }
    salt = salt.clone();
    key = key.clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] key() {
    return key.clone();
  }

  /**
   * Parses a stored digest string.
   *
   * @param encoded the digest string
   * @return the parsed digest
   * @throws MalformedDigestException if any field is missing or invalid
   */
  public static PasswordDigest parse(String encoded) {
    if (encoded == null) {
      throw new MalformedDigestException("Digest is null");
    }
    String[] fields = encoded.split("\\$", -1);
    if (fields.length != 6 || !fields[0].isEmpty()) {
      throw new MalformedDigestException("Invalid digest format: expected 5 '$'-separated fields");
    }
    if (!ALGORITHM_ID.equals(fields[1])) {
      throw new MalformedDigestException("Unsupported digest algorithm: " + fields[1]);
    }

    Matcher versionMatcher = VERSION_FIELD.matcher(fields[2]);
    if (!versionMatcher.matches()) {
      throw new MalformedDigestException("Invalid version field");
    }
    int version = Integer.parseInt(versionMatcher.group(1));
    if (version != VERSION) {
      throw new MalformedDigestException("Unsupported Argon2 version: " + version);
    }

    Matcher costMatcher = COST_FIELD.matcher(fields[3]);
    if (!costMatcher.matches()) {
      throw new MalformedDigestException("Invalid cost parameters");
    }
    int memory;
    int iterations;
    int parallelism;
    try {
      memory = Integer.parseInt(costMatcher.group(1));
      iterations = Integer.parseInt(costMatcher.group(2));
      parallelism = Integer.parseInt(costMatcher.group(3));
    } catch (NumberFormatException e) {
      throw new MalformedDigestException("Cost parameter out of range", e);
    }
    if (parallelism < 1 || parallelism > MAX_PARALLELISM || iterations < 1
        || memory < 8 * parallelism) {
      throw new MalformedDigestException("Cost parameters out of range");
    }

    byte[] salt = decode(fields[4], "salt");
    byte[] key = decode(fields[5], "key");
    if (salt.length < MIN_SALT_LENGTH) {
      throw new MalformedDigestException("Salt too short");
    }
    if (key.length < MIN_KEY_LENGTH) {
      throw new MalformedDigestException("Derived key too short");
    }
    return new PasswordDigest(version, memory, iterations, parallelism, salt, key);
  }

  private static byte[] decode(String field, String name) {
    if (field.isEmpty()) {
      throw new MalformedDigestException("Empty " + name);
    }
    try {
      return DECODER.decode(field);
    } catch (IllegalArgumentException e) {
      throw new MalformedDigestException("Undecodable " + name, e);
    }
  }

  /**
   * Encodes this digest to its storable string form.
   *
   * @return the digest string
   */
  public String encode() {
    return PREFIX + "v=" + version
        + "$m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
        + "$" + ENCODER.encodeToString(salt)
        + "$" + ENCODER.encodeToString(key);
  }

  /**
   * Whether this digest was produced with exactly the given parameters.
   *
   * @param parameters the current parameters
   * @return true if cost, salt length and key length all match
   */
  public boolean matches(DigestParameters parameters) {
    return memoryKib == parameters.memoryKib()
        && iterations == parameters.iterations()
        && parallelism == parameters.parallelism()
        && salt.length == parameters.saltLength()
        && key.length == parameters.keyLength();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PasswordDigest other
        && version == other.version
        && memoryKib == other.memoryKib
        && iterations == other.iterations
        && parallelism == other.parallelism
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(key, other.key);
  }

  @Override
  public int hashCode() {
    int result = 31 * version + memoryKib;
    result = 31 * result + iterations;
    result = 31 * result + parallelism;
    result = 31 * result + Arrays.hashCode(salt);
    return 31 * result + Arrays.hashCode(key);
  }

  @Override
  public String toString() {
    return "PasswordDigest[v=" + version + ", m=" + memoryKib + ", t=" + iterations
        + ", p=" + parallelism + "]";
  }
}
