package com.codeheadsystems.warden.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistent record of credentials rejected before their natural expiry.
 * <p>
 * Implementations must be thread-safe. Any {@link RuntimeException} thrown is reported to callers
 * as {@link com.codeheadsystems.warden.exceptions.StoreUnavailableException}.
 * <p>
 * <strong>Atomic insert contract:</strong> {@link #insert} is a unique-key insert. When two callers
 * insert the same token id concurrently exactly one of them must see {@code true}. Refresh-token
 * rotation relies on this to let only one of two concurrent refreshes succeed; an implementation
 * that silently overwrites existing rows allows a refresh token to be replayed.
 * <p>
 * Besides token ids the store keeps one marker per subject recording the instant of the latest
 * "revoke everything" request; credentials issued at or before it are rejected.
 */
public interface DenylistStore {

  /**
   * Adds a token id.
   *
   * @param tokenId   the {@code jti}
   * @param expiresAt when the credential expires; the entry may be purged after that
   * @return true if inserted, false if the id was already present (the existing row is kept)
   */
  boolean insert(String tokenId, Instant expiresAt);

  /**
   * Whether a token id has been revoked.
   *
   * @param tokenId the {@code jti}
   * @return true if present
   */
  boolean contains(String tokenId);

  /**
   * Removes entries whose credential has expired.
   *
   * @return the number of entries removed
   */
  int purgeExpired();

  /**
   * Records that every credential of a subject issued at or before {@code revokedAt} is revoked.
   * A later marker replaces an earlier one; an earlier marker never replaces a later one.
   *
   * @param subjectId the subject
   * @param revokedAt the revocation instant
   */
  void revokeSubject(String subjectId, Instant revokedAt);

  /**
   * The latest subject-wide revocation, if any.
   *
   * @param subjectId the subject
   * @return the revocation instant
   */
  Optional<Instant> subjectRevokedAt(String subjectId);
}
