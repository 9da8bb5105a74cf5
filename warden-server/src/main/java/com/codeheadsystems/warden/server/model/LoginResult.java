package com.codeheadsystems.warden.server.model;

/**
 * Outcome of a successful password login.
 *
 * @param tokens            the issued pair
 * @param digestNeedsRehash true when the stored digest uses outdated parameters; the caller may
 *                          store a fresh digest of the password it still holds
 */
public record LoginResult(TokenPair tokens, boolean digestNeedsRehash) {
}
