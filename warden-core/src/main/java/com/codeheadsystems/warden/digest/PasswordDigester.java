package com.codeheadsystems.warden.digest;

import com.codeheadsystems.warden.common.RandomProvider;
import com.codeheadsystems.warden.exceptions.MalformedDigestException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Derives and verifies Argon2id password digests.
 * <p>
 * Digests are self-describing: {@link #verify} reads the cost parameters from the digest, so
 * changing {@link DigestParameters} never breaks existing digests. Use {@link #needsRehash} after a
 * successful login to find digests worth upgrading.
 * <p>
 * Thread-safe; each call uses its own generator.
 */
public class PasswordDigester {

  private final DigestParameters parameters;
  private final RandomProvider randomProvider;

  /**
   * Creates a digester with {@link DigestParameters#DEFAULT}.
   */
  public PasswordDigester() {
    this(DigestParameters.DEFAULT, new RandomProvider());
  }

  /**
   * Creates a digester.
   *
   * @param parameters     parameters for new digests
   * @param randomProvider salt source
   */
  public PasswordDigester(DigestParameters parameters, RandomProvider randomProvider) {
    this.parameters = parameters;
    this.randomProvider = randomProvider;
  }

  /**
   * Parameters used for new digests.
   *
   * @return the parameters
   */
  public DigestParameters parameters() {
    return parameters;
  }

  /**
   * Hashes a password with a fresh random salt.
   *
   * @param password the password, may be empty
   * @return the encoded digest
   */
  public String hash(String password) {
    byte[] salt = randomProvider.randomBytes(parameters.saltLength());
    byte[] key = derive(password, salt, parameters.memoryKib(), parameters.iterations(),
        parameters.parallelism(), parameters.keyLength());
    return new PasswordDigest(PasswordDigest.VERSION, parameters.memoryKib(),
        parameters.iterations(), parameters.parallelism(), salt, key).encode();
  }

  /**
   * Checks a candidate password against a stored digest.
   *
   * @param password the candidate password
   * @param encoded  the stored digest
   * @return true if the password matches
   * @throws MalformedDigestException if the digest cannot be parsed
   */
  public boolean verify(String password, String encoded) {
    PasswordDigest digest = PasswordDigest.parse(encoded);
    byte[] expected = digest.key();
    byte[] candidate = derive(password, digest.salt(), digest.memoryKib(), digest.iterations(),
        digest.parallelism(), expected.length);
    return MessageDigest.isEqual(candidate, expected);
  }

  /**
   * Whether a stored digest should be regenerated with the current parameters.
   *
   * @param encoded the stored digest
   * @return true if its parameters differ from the current ones or it cannot be parsed
   */
  public boolean needsRehash(String encoded) {
    try {
      return !PasswordDigest.parse(encoded).matches(parameters);
    } catch (MalformedDigestException e) {
      return true;
    }
  }

  private static byte[] derive(String password, byte[] salt, int memoryKib, int iterations,
                               int parallelism, int keyLength) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memoryKib)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] out = new byte[keyLength];
    generator.generateBytes(password.getBytes(StandardCharsets.UTF_8), out, 0, out.length);
    return out;
  }
}
