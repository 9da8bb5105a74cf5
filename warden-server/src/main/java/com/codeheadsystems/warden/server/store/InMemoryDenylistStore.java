package com.codeheadsystems.warden.server.store;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DenylistStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * {@link #insert} uses {@code putIfAbsent}, which gives the atomic unique-key behaviour the
 * contract requires. Revocations are lost on restart, so previously revoked tokens become usable
 * again until they expire. Suitable for development and testing only.
 */
public class InMemoryDenylistStore implements DenylistStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDenylistStore.class);

  private final ConcurrentHashMap<String, DenylistEntry> entries = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Instant> subjectMarkers = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryDenylistStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory denylist store.
   *
   * @param clock time source for {@link #purgeExpired()}
   */
  public InMemoryDenylistStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryDenylistStore: revocations will NOT survive restarts. "
        + "Replace with a persistent DenylistStore for production.");
  }

  @Override
  public boolean insert(String tokenId, Instant expiresAt) {
    boolean inserted = entries.putIfAbsent(tokenId, new DenylistEntry(tokenId, expiresAt)) == null;
    log.debug("Denylist insert jti={} inserted={}", tokenId, inserted);
    return inserted;
  }

  @Override
  public boolean contains(String tokenId) {
    return entries.containsKey(tokenId);
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    AtomicInteger removed = new AtomicInteger();
    entries.values().removeIf(entry -> {
      boolean expired = entry.isExpired(now);
      if (expired) {
        removed.incrementAndGet();
      }
      return expired;
    });
    log.debug("Purged {} expired denylist entr(ies)", removed.get());
    return removed.get();
  }

  @Override
  public void revokeSubject(String subjectId, Instant revokedAt) {
    subjectMarkers.merge(subjectId, revokedAt,
        (existing, candidate) -> candidate.isAfter(existing) ? candidate : existing);
    log.debug("Revoked all tokens for subject={} issued at or before {}", subjectId, revokedAt);
  }

  @Override
  public Optional<Instant> subjectRevokedAt(String subjectId) {
    return Optional.ofNullable(subjectMarkers.get(subjectId));
  }

  /**
   * Number of token ids currently held.
   *
   * @return the size
   */
  public int size() {
    return entries.size();
  }
}
