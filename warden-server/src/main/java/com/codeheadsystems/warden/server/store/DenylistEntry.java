package com.codeheadsystems.warden.server.store;

import java.time.Instant;

/**
 * A revoked token id, kept until the token would have expired anyway.
 *
 * @param tokenId   the {@code jti} of the revoked credential
 * @param expiresAt the credential's own expiry
 */
public record DenylistEntry(String tokenId, Instant expiresAt) {

  /**
   * Whether the entry can be dropped.
   *
   * @param now the current time
   * @return true once {@code expiresAt <= now}
   */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
