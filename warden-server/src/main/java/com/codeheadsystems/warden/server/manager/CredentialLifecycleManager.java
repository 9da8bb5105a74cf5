package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.common.RandomProvider;
import com.codeheadsystems.warden.exceptions.InactiveSubjectException;
import com.codeheadsystems.warden.exceptions.InvalidCredentialException;
import com.codeheadsystems.warden.exceptions.RevokedCredentialException;
import com.codeheadsystems.warden.exceptions.StoreUnavailableException;
import com.codeheadsystems.warden.exceptions.UnknownSubjectException;
import com.codeheadsystems.warden.exceptions.WardenException;
import com.codeheadsystems.warden.server.model.AuthenticatedSubject;
import com.codeheadsystems.warden.server.model.SessionInfo;
import com.codeheadsystems.warden.server.model.TokenPair;
import com.codeheadsystems.warden.server.model.ValidationResult;
import com.codeheadsystems.warden.server.store.DenylistStore;
import com.codeheadsystems.warden.server.store.Subject;
import com.codeheadsystems.warden.server.store.SubjectStore;
import com.codeheadsystems.warden.token.ClaimSet;
import com.codeheadsystems.warden.token.CredentialIssuer;
import com.codeheadsystems.warden.token.CredentialVerifier;
import com.codeheadsystems.warden.token.SigningContext;
import com.codeheadsystems.warden.token.TokenKind;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service owning the credential lifecycle: issue, validate, rotate, revoke.
 * <p>
 * Holds no mutable state of its own; all state lives in the {@link SubjectStore} and
 * {@link DenylistStore}, so the manager is thread-safe whenever they are.
 * <p>
 * <strong>Exception contract</strong> (callers should map these via
 * {@link WardenException#errorCode()}):
 * <ul>
 *   <li>{@link InvalidCredentialException}: malformed, forged, expired or wrong-kind credential</li>
 *   <li>{@link RevokedCredentialException}: denylisted, revoked via {@link #revokeAll}, or a
 *       refresh credential that was already rotated</li>
 *   <li>{@link UnknownSubjectException} / {@link InactiveSubjectException}: subject checks</li>
 *   <li>{@link StoreUnavailableException}: a store threw; never retried here</li>
 * </ul>
 */
public class CredentialLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialLifecycleManager.class);

  private final CredentialIssuer issuer;
  private final CredentialVerifier verifier;
  private final SubjectStore subjectStore;
  private final DenylistStore denylistStore;
  private final Clock clock;
  private final Function<Subject, Map<String, ?>> refreshClaims;

  /**
   * Creates a manager using the system clock and random token ids. Access credentials issued by
   * {@link #refresh} carry no custom claims.
   *
   * @param context       signing configuration
   * @param subjectStore  subject lookups
   * @param denylistStore revocation state
   */
  public CredentialLifecycleManager(SigningContext context,
                                    SubjectStore subjectStore,
                                    DenylistStore denylistStore) {
    this(context, subjectStore, denylistStore, Clock.systemUTC(),
        new RandomProvider()::randomTokenId, subject -> Map.of());
  }

  /**
   * Creates a manager.
   *
   * @param context       signing configuration
   * @param subjectStore  subject lookups
   * @param denylistStore revocation state
   * @param clock         time source shared by issuing and verification
   * @param tokenIds      source of {@code jti} values
   * @param refreshClaims custom claims for the access credential issued on refresh; the claims of
   *                      the original access credential are not carried over
   */
  public CredentialLifecycleManager(SigningContext context,
                                    SubjectStore subjectStore,
                                    DenylistStore denylistStore,
                                    Clock clock,
                                    Supplier<String> tokenIds,
                                    Function<Subject, Map<String, ?>> refreshClaims) {
    this.issuer = new CredentialIssuer(context, clock, tokenIds);
    this.verifier = new CredentialVerifier(context, clock);
    this.subjectStore = subjectStore;
    this.denylistStore = denylistStore;
    this.clock = clock;
    this.refreshClaims = refreshClaims;
  }

  // ── Issue ────────────────────────────────────────────────────────────────

  /**
   * Issues a fresh access/refresh pair. Callers are expected to have authenticated the subject.
   *
   * @param subjectId    the subject
   * @param customClaims claims for the access credential; reserved names are dropped
   * @return the pair
   */
  public TokenPair issueTokens(String subjectId, Map<String, ?> customClaims) {
    TokenPair pair = new TokenPair(
        issuer.issueAccess(subjectId, customClaims),
        issuer.issueRefresh(subjectId));
    log.debug("Issued token pair for subject={}", subjectId);
    return pair;
  }

  // ── Validate ─────────────────────────────────────────────────────────────

  /**
   * Validates an access credential and the subject behind it.
   *
   * @param token the access credential
   * @return the subject and the verified claims
   */
  public AuthenticatedSubject validate(String token) {
    ClaimSet claims = verify(token, TokenKind.ACCESS, "validate");
    Subject subject = checkUsable(claims, "validate");
    return new AuthenticatedSubject(subject, claims);
  }

  /**
   * Quick check wrapping {@link #validate(String)}.
   *
   * @param token the access credential
   * @return true if {@link #validate(String)} would succeed
   */
  public boolean isValid(String token) {
    try {
      validate(token);
      return true;
    } catch (WardenException e) {
      return false;
    }
  }

  /**
   * Validates each credential independently. One failure does not affect the others.
   *
   * @param tokens access credentials
   * @return one result per input, in input order
   */
  public List<ValidationResult> validateBatch(List<String> tokens) {
    List<ValidationResult> results = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      try {
        results.add(ValidationResult.valid(validate(token)));
      } catch (WardenException e) {
        results.add(ValidationResult.invalid(e));
      }
    }
    log.debug("Validated batch of {} token(s)", tokens.size());
    return results;
  }

  /**
   * Describes a credential of either kind. Checks signature and expiry only: a revoked credential
   * or one belonging to an inactive subject is still described.
   *
   * @param token the credential
   * @return the session info
   */
  public SessionInfo sessionInfo(String token) {
    return SessionInfo.from(verifyAnyKind(token, "sessionInfo"));
  }

  // ── Rotate ───────────────────────────────────────────────────────────────

  /**
   * Exchanges a refresh credential for a new pair. The presented credential is retired with an
   * atomic denylist insert after the new pair is built, so of two concurrent refreshes with the
   * same credential exactly one succeeds.
   * <p>
   * If the retiring insert itself fails the error is logged and the new pair is still returned;
   * the old credential then stays usable until it expires.
   *
   * @param refreshToken the refresh credential
   * @return the new pair
   */
  public TokenPair refresh(String refreshToken) {
    ClaimSet claims = verify(refreshToken, TokenKind.REFRESH, "refresh");
    Subject subject = checkUsable(claims, "refresh");
    TokenPair pair = issueTokens(subject.id(), refreshClaims.apply(subject));

    boolean retired;
    try {
      retired = denylistStore.insert(claims.tokenId(), claims.expiresAt());
    } catch (RuntimeException e) {
      log.error("Failed to retire refresh token jti={} for subject={}; it remains usable until expiry",
          claims.tokenId(), claims.subjectId(), e);
      return pair;
    }
    if (!retired) {
      log.warn("Refresh token jti={} for subject={} was already used (replay or concurrent refresh)",
          claims.tokenId(), claims.subjectId());
      throw new RevokedCredentialException();
    }
    log.info("Rotated refresh token jti={} for subject={}", claims.tokenId(), claims.subjectId());
    return pair;
  }

  // ── Revoke ───────────────────────────────────────────────────────────────

  /**
   * Revokes a single credential of either kind. Revoking twice is a no-op.
   *
   * @param token the credential; must carry a valid signature and not be expired
   */
  public void revoke(String token) {
    ClaimSet claims = verifyAnyKind(token, "revoke");
    boolean inserted = store("denylist insert",
        () -> denylistStore.insert(claims.tokenId(), claims.expiresAt()));
    if (inserted) {
      log.info("Revoked {} token jti={} for subject={}",
          claims.kind().claimValue(), claims.tokenId(), claims.subjectId());
    } else {
      log.debug("Token jti={} was already revoked", claims.tokenId());
    }
  }

  /**
   * Revokes every credential of a subject issued before now, access and refresh alike.
   * Issue times are compared to the millisecond, so a credential issued later in the same second
   * (for example by a login right after this call) stays valid.
   *
   * @param subjectId the subject
   */
  public void revokeAll(String subjectId) {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId must not be blank");
    }
    Instant now = clock.instant();
    store("subject revocation", () -> {
      denylistStore.revokeSubject(subjectId, now);
      return null;
    });
    log.info("Revoked all tokens for subject={} issued before {}", subjectId, now);
  }

  /**
   * Drops denylist entries for credentials that have expired.
   *
   * @return the number of entries removed
   */
  public int cleanupExpired() {
    int removed = store("denylist purge", denylistStore::purgeExpired);
    log.info("Purged {} expired denylist entr(ies)", removed);
    return removed;
  }

  // ── Internals ────────────────────────────────────────────────────────────

  private ClaimSet verify(String token, TokenKind kind, String operation) {
    try {
      return verifier.verify(token, kind);
    } catch (InvalidCredentialException e) {
      log.debug("{}: {} token rejected: {}", operation, kind.claimValue(), reason(e));
      throw e;
    }
  }

  private ClaimSet verifyAnyKind(String token, String operation) {
    try {
      return verifier.verifyAnyKind(token);
    } catch (InvalidCredentialException e) {
      log.debug("{}: token rejected: {}", operation, reason(e));
      throw e;
    }
  }

  private Subject checkUsable(ClaimSet claims, String operation) {
    if (store("denylist lookup", () -> denylistStore.contains(claims.tokenId()))) {
      log.debug("{}: token jti={} is denylisted", operation, claims.tokenId());
      throw new RevokedCredentialException();
    }
    Optional<Instant> revokedAt = store("subject revocation lookup",
        () -> denylistStore.subjectRevokedAt(claims.subjectId()));
    if (revokedAt.isPresent()
        && claims.issuedAtExact().isBefore(revokedAt.get().truncatedTo(ChronoUnit.MILLIS))) {
      log.debug("{}: token jti={} predates revocation of subject={}",
          operation, claims.tokenId(), claims.subjectId());
      throw new RevokedCredentialException();
    }
    Subject subject = store("subject lookup", () -> subjectStore.findById(claims.subjectId()))
        .orElseThrow(() -> {
          log.debug("{}: subject={} not found", operation, claims.subjectId());
          return new UnknownSubjectException();
        });
    if (!subject.active()) {
      log.debug("{}: subject={} is inactive", operation, claims.subjectId());
      throw new InactiveSubjectException();
    }
    return subject;
  }

  private <T> T store(String what, Supplier<T> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      log.error("Store call failed: {}", what, e);
      throw new StoreUnavailableException(e);
    }
  }

  private static String reason(InvalidCredentialException e) {
    return e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
  }
}
