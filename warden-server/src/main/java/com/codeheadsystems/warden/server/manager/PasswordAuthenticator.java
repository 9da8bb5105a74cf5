package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.digest.PasswordDigester;
import com.codeheadsystems.warden.exceptions.InactiveSubjectException;
import com.codeheadsystems.warden.exceptions.InvalidCredentialException;
import com.codeheadsystems.warden.exceptions.MalformedDigestException;
import com.codeheadsystems.warden.exceptions.StoreUnavailableException;
import com.codeheadsystems.warden.server.model.LoginResult;
import com.codeheadsystems.warden.server.store.Subject;
import com.codeheadsystems.warden.server.store.SubjectStore;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password boundary: checks a password against the stored digest, then issues credentials or
 * digests a replacement password.
 * <p>
 * An unknown subject, a subject without a password and a wrong password all fail with the same
 * {@link InvalidCredentialException#invalidPassword()} after one Argon2 derivation. Lookups of
 * unknown subjects are verified against a decoy digest built at construction.
 */
public class PasswordAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(PasswordAuthenticator.class);

  private final PasswordDigester digester;
  private final PasswordPolicy policy;
  private final SubjectStore subjectStore;
  private final CredentialLifecycleManager lifecycleManager;
  private final String decoyDigest;

  public PasswordAuthenticator(PasswordDigester digester,
                               PasswordPolicy policy,
                               SubjectStore subjectStore,
                               CredentialLifecycleManager lifecycleManager) {
    this.digester = digester;
    this.policy = policy;
    this.subjectStore = subjectStore;
    this.lifecycleManager = lifecycleManager;
    this.decoyDigest = digester.hash(UUID.randomUUID().toString());
  }

  /**
   * Applies the password policy and digests a new password for storage.
   *
   * @param password the new password
   * @return the encoded digest
   * @throws com.codeheadsystems.warden.exceptions.WeakPasswordException if the policy rejects it
   */
  public String hashNewPassword(String password) {
    policy.check(password);
    return digester.hash(password);
  }

  /**
   * Authenticates with a password and issues a token pair.
   *
   * @param subjectId    the subject
   * @param password     the presented password
   * @param customClaims claims for the access credential
   * @return the pair plus a rehash hint
   * @throws InvalidCredentialException if the subject or password is wrong
   * @throws InactiveSubjectException   if the password is right but the subject is inactive
   */
  public LoginResult login(String subjectId, String password, Map<String, ?> customClaims) {
    String storedDigest = authenticate(subjectId, password, "Login").passwordDigest();
    boolean needsRehash = digester.needsRehash(storedDigest);
    if (needsRehash) {
      log.info("Stored digest for subject={} uses outdated parameters", subjectId);
    }
    log.info("Login succeeded for subject={}", subjectId);
    return new LoginResult(lifecycleManager.issueTokens(subjectId, customClaims), needsRehash);
  }

  /**
   * Checks the current password and digests a replacement for storage. Storing the returned
   * digest is left to the caller; credentials already issued stay valid until revoked.
   *
   * @param subjectId   the subject
   * @param oldPassword the current password
   * @param newPassword the replacement
   * @return the encoded digest of the replacement
   * @throws InvalidCredentialException if the subject or current password is wrong
   * @throws InactiveSubjectException   if the current password is right but the subject is inactive
   * @throws com.codeheadsystems.warden.exceptions.WeakPasswordException if the policy rejects the
   *                                    replacement
   */
  public String changePassword(String subjectId, String oldPassword, String newPassword) {
    authenticate(subjectId, oldPassword, "Password change");
    String digest = hashNewPassword(newPassword);
    log.info("Password changed for subject={}", subjectId);
    return digest;
  }

  private Subject authenticate(String subjectId, String password, String action) {
    Optional<Subject> subject = lookup(subjectId);
    String storedDigest = subject.map(Subject::passwordDigest).orElse(null);
    boolean matches = matches(subjectId, password, storedDigest);

    if (subject.isEmpty() || storedDigest == null || !matches) {
      log.warn("{} failed for subject={}", action, subjectId);
      throw InvalidCredentialException.invalidPassword();
    }
    if (!subject.get().active()) {
      log.warn("{} rejected for inactive subject={}", action, subjectId);
      throw new InactiveSubjectException();
    }
    return subject.get();
  }

  private Optional<Subject> lookup(String subjectId) {
    if (subjectId == null || subjectId.isBlank()) {
      return Optional.empty();
    }
    try {
      return subjectStore.findById(subjectId);
    } catch (RuntimeException e) {
      log.error("Store call failed: subject lookup", e);
      throw new StoreUnavailableException(e);
    }
  }

  private boolean matches(String subjectId, String password, String storedDigest) {
    String candidate = password == null ? "" : password;
    if (storedDigest == null) {
      digester.verify(candidate, decoyDigest);
      return false;
    }
    try {
      return digester.verify(candidate, storedDigest);
    } catch (MalformedDigestException e) {
      log.error("Stored digest for subject={} is malformed: {}", subjectId, e.getMessage());
      digester.verify(candidate, decoyDigest);
      return false;
    }
  }
}
