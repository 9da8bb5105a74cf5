package com.codeheadsystems.warden.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.common.RandomProvider;
import com.codeheadsystems.warden.exceptions.ErrorCode;
import com.codeheadsystems.warden.exceptions.InactiveSubjectException;
import com.codeheadsystems.warden.exceptions.InvalidCredentialException;
import com.codeheadsystems.warden.exceptions.RevokedCredentialException;
import com.codeheadsystems.warden.exceptions.UnknownSubjectException;
import com.codeheadsystems.warden.server.MutableClock;
import com.codeheadsystems.warden.server.model.AuthenticatedSubject;
import com.codeheadsystems.warden.server.model.SessionInfo;
import com.codeheadsystems.warden.server.model.TokenPair;
import com.codeheadsystems.warden.server.model.ValidationResult;
import com.codeheadsystems.warden.server.store.InMemoryDenylistStore;
import com.codeheadsystems.warden.server.store.InMemorySubjectStore;
import com.codeheadsystems.warden.server.store.Subject;
import com.codeheadsystems.warden.token.SigningAlgorithm;
import com.codeheadsystems.warden.token.SigningContext;
import com.codeheadsystems.warden.token.TokenKind;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialLifecycleManagerTest {

  static final byte[] ACCESS_SECRET =
      "access-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  static final byte[] REFRESH_SECRET =
      "refresh-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);
  static final SigningContext CONTEXT = new SigningContext(ACCESS_SECRET, REFRESH_SECRET,
      "warden-test", Duration.ofMinutes(15), Duration.ofDays(7), SigningAlgorithm.HS256);
  static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

  private MutableClock clock;
  private InMemorySubjectStore subjects;
  private InMemoryDenylistStore denylist;
  private CredentialLifecycleManager manager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    subjects = new InMemorySubjectStore();
    subjects.save(Subject.active("alice"));
    denylist = new InMemoryDenylistStore(clock);
    manager = newManager(subject -> Map.of());
  }

  private CredentialLifecycleManager newManager(
      Function<Subject, Map<String, ?>> refreshClaims) {
    return new CredentialLifecycleManager(CONTEXT, subjects, denylist, clock,
        new RandomProvider()::randomTokenId, refreshClaims);
  }

  // ── validate ──────────────────────────────────────────────────────────────

  @Test
  void issueThenValidate_returnsSubjectAndCustomClaims() {
    TokenPair pair = manager.issueTokens("alice", Map.of("role", "admin"));

    AuthenticatedSubject result = manager.validate(pair.accessToken());

    assertThat(result.subject().id()).isEqualTo("alice");
    assertThat(result.claims().subjectId()).isEqualTo("alice");
    assertThat(result.claims().kind()).isEqualTo(TokenKind.ACCESS);
    assertThat(result.claims().claim("role")).contains("admin");
    assertThat(manager.isValid(pair.accessToken())).isTrue();
  }

  @Test
  void validate_refreshToken_isRejected() {
    TokenPair pair = manager.issueTokens("alice", Map.of());

    assertThatThrownBy(() -> manager.validate(pair.refreshToken()))
        .isInstanceOf(InvalidCredentialException.class);
    assertThat(manager.isValid(pair.refreshToken())).isFalse();
  }

  @Test
  void validate_garbage_isRejected() {
    assertThatThrownBy(() -> manager.validate("not.a.token"))
        .isInstanceOf(InvalidCredentialException.class);
    assertThat(manager.isValid(null)).isFalse();
  }

  @Test
  void validate_expiryIsInclusive() {
    TokenPair pair = manager.issueTokens("alice", Map.of());

    clock.advance(Duration.ofMinutes(15).minusSeconds(1));
    assertThat(manager.isValid(pair.accessToken())).isTrue();

    clock.advance(Duration.ofSeconds(1));
    assertThatThrownBy(() -> manager.validate(pair.accessToken()))
        .isInstanceOf(InvalidCredentialException.class);
  }

  @Test
  void validate_unknownSubject_isRejected() {
    TokenPair pair = manager.issueTokens("ghost", Map.of());

    assertThatThrownBy(() -> manager.validate(pair.accessToken()))
        .isInstanceOf(UnknownSubjectException.class);
  }

  @Test
  void validate_deactivatedSubject_isRejected() {
    TokenPair pair = manager.issueTokens("alice", Map.of());
    subjects.save(Subject.active("alice").withActive(false));

    assertThatThrownBy(() -> manager.validate(pair.accessToken()))
        .isInstanceOf(InactiveSubjectException.class);
    assertThatThrownBy(() -> manager.refresh(pair.refreshToken()))
        .isInstanceOf(InactiveSubjectException.class);
  }

  // ── refresh ───────────────────────────────────────────────────────────────

  /**
   * A refresh credential works exactly once; its replacement works in turn.
   */
  @Test
  void refresh_rotatesAndIsSingleUse() {
    TokenPair first = manager.issueTokens("alice", Map.of());
    clock.advance(Duration.ofMinutes(1));

    TokenPair second = manager.refresh(first.refreshToken());

    assertThat(second.accessToken()).isNotEqualTo(first.accessToken());
    assertThat(second.refreshToken()).isNotEqualTo(first.refreshToken());
    assertThat(manager.validate(second.accessToken()).subject().id()).isEqualTo("alice");
    assertThatThrownBy(() -> manager.refresh(first.refreshToken()))
        .isInstanceOf(RevokedCredentialException.class);

    TokenPair third = manager.refresh(second.refreshToken());
    assertThat(manager.isValid(third.accessToken())).isTrue();
  }

  @Test
  void refresh_doesNotRevokeTheOldAccessToken() {
    TokenPair first = manager.issueTokens("alice", Map.of());

    manager.refresh(first.refreshToken());

    assertThat(manager.isValid(first.accessToken())).isTrue();
  }

  @Test
  void refresh_withAccessToken_isRejected() {
    TokenPair pair = manager.issueTokens("alice", Map.of());

    assertThatThrownBy(() -> manager.refresh(pair.accessToken()))
        .isInstanceOf(InvalidCredentialException.class);
  }

  @Test
  void refresh_expiredRefreshToken_isRejected() {
    TokenPair pair = manager.issueTokens("alice", Map.of());
    clock.advance(Duration.ofDays(7));

    assertThatThrownBy(() -> manager.refresh(pair.refreshToken()))
        .isInstanceOf(InvalidCredentialException.class);
  }

  @Test
  void refresh_dropsOriginalCustomClaims() {
    TokenPair pair = manager.issueTokens("alice", Map.of("role", "admin"));

    TokenPair refreshed = manager.refresh(pair.refreshToken());

    assertThat(manager.validate(refreshed.accessToken()).claims().customClaims()).isEmpty();
  }

  @Test
  void refresh_appliesRefreshClaimsProvider() {
    CredentialLifecycleManager withClaims = newManager(subject -> Map.of("role", "user:" + subject.id()));
    TokenPair pair = withClaims.issueTokens("alice", Map.of());

    TokenPair refreshed = withClaims.refresh(pair.refreshToken());

    assertThat(withClaims.validate(refreshed.accessToken()).claims().claim("role"))
        .contains("user:alice");
  }

  // ── revoke ────────────────────────────────────────────────────────────────

  @Test
  void revoke_accessToken_isIdempotentAndLeavesRefreshUsable() {
    TokenPair pair = manager.issueTokens("alice", Map.of());

    manager.revoke(pair.accessToken());
    assertThatCode(() -> manager.revoke(pair.accessToken())).doesNotThrowAnyException();

    assertThatThrownBy(() -> manager.validate(pair.accessToken()))
        .isInstanceOf(RevokedCredentialException.class);
    assertThat(manager.refresh(pair.refreshToken())).isNotNull();
  }

  @Test
  void revoke_refreshToken_blocksRefresh() {
    TokenPair pair = manager.issueTokens("alice", Map.of());

    manager.revoke(pair.refreshToken());

    assertThatThrownBy(() -> manager.refresh(pair.refreshToken()))
        .isInstanceOf(RevokedCredentialException.class);
    assertThat(manager.isValid(pair.accessToken())).isTrue();
  }

  @Test
  void revoke_invalidToken_isRejected() {
    assertThatThrownBy(() -> manager.revoke("garbage"))
        .isInstanceOf(InvalidCredentialException.class);
    assertThat(denylist.size()).isZero();
  }

  @Test
  void revokeAll_rejectsEveryEarlierTokenButNotLaterOnes() {
    TokenPair first = manager.issueTokens("alice", Map.of());
    clock.advance(Duration.ofMinutes(1));
    TokenPair second = manager.issueTokens("alice", Map.of());
    subjects.save(Subject.active("bob"));
    TokenPair bob = manager.issueTokens("bob", Map.of());
    clock.advance(Duration.ofMillis(1));

    manager.revokeAll("alice");

    assertThatThrownBy(() -> manager.validate(first.accessToken()))
        .isInstanceOf(RevokedCredentialException.class);
    assertThatThrownBy(() -> manager.validate(second.accessToken()))
        .isInstanceOf(RevokedCredentialException.class);
    assertThatThrownBy(() -> manager.refresh(second.refreshToken()))
        .isInstanceOf(RevokedCredentialException.class);
    assertThat(manager.isValid(bob.accessToken())).isTrue();

    clock.advance(Duration.ofSeconds(1));
    TokenPair fresh = manager.issueTokens("alice", Map.of());
    assertThat(manager.isValid(fresh.accessToken())).isTrue();
  }

  @Test
  void revokeAll_splitsTheSecondAtTheMillisecond() {
    clock.set(START.plusMillis(100));
    TokenPair before = manager.issueTokens("alice", Map.of());
    clock.set(START.plusMillis(499));
    TokenPair justBefore = manager.issueTokens("alice", Map.of());

    clock.set(START.plusMillis(500));
    manager.revokeAll("alice");
    TokenPair atMarker = manager.issueTokens("alice", Map.of());
    clock.set(START.plusMillis(900));
    TokenPair after = manager.issueTokens("alice", Map.of());

    assertThat(manager.isValid(before.accessToken())).isFalse();
    assertThat(manager.isValid(justBefore.accessToken())).isFalse();
    assertThatThrownBy(() -> manager.refresh(justBefore.refreshToken()))
        .isInstanceOf(RevokedCredentialException.class);

    assertThat(manager.isValid(atMarker.accessToken())).isTrue();
    assertThat(manager.isValid(after.accessToken())).isTrue();
    assertThat(manager.refresh(after.refreshToken()).accessToken()).isNotBlank();
  }

  @Test
  void revokeAll_thenImmediateLogin_newTokensAreUsable() {
    TokenPair old = manager.issueTokens("alice", Map.of());
    clock.advance(Duration.ofMillis(250));

    manager.revokeAll("alice");
    clock.advance(Duration.ofMillis(1));
    TokenPair relogin = manager.issueTokens("alice", Map.of());

    assertThat(manager.isValid(old.accessToken())).isFalse();
    assertThat(manager.validate(relogin.accessToken()).subject().id()).isEqualTo("alice");
    TokenPair rotated = manager.refresh(relogin.refreshToken());
    assertThat(manager.isValid(rotated.accessToken())).isTrue();
  }

  @Test
  void revokeAll_blankSubject_isRejected() {
    assertThatThrownBy(() -> manager.revokeAll(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ── batch / session info / cleanup ───────────────────────────────────────

  @Test
  void validateBatch_isIndependentAndOrderPreserving() {
    TokenPair good = manager.issueTokens("alice", Map.of("role", "admin"));
    TokenPair revoked = manager.issueTokens("alice", Map.of());
    manager.revoke(revoked.accessToken());

    List<ValidationResult> results = manager.validateBatch(
        Arrays.asList(good.accessToken(), "garbage", revoked.accessToken(), null));

    assertThat(results).hasSize(4);
    assertThat(results.get(0).valid()).isTrue();
    assertThat(results.get(0).subject().id()).isEqualTo("alice");
    assertThat(results.get(0).claims()).containsEntry("role", "admin").containsEntry("sub", "alice");
    assertThat(results.get(1).valid()).isFalse();
    assertThat(results.get(1).errorCode()).isEqualTo(ErrorCode.INVALID_TOKEN.code());
    assertThat(results.get(2).valid()).isFalse();
    assertThat(results.get(2).errorCode()).isEqualTo(ErrorCode.TOKEN_REVOKED.code());
    assertThat(results.get(3).valid()).isFalse();
  }

  @Test
  void validateBatch_empty_returnsEmpty() {
    assertThat(manager.validateBatch(List.of())).isEmpty();
  }

  @Test
  void sessionInfo_describesEitherKindIgnoringRevocation() {
    TokenPair pair = manager.issueTokens("alice", Map.of());
    manager.revoke(pair.accessToken());
    subjects.save(Subject.active("alice").withActive(false));

    SessionInfo access = manager.sessionInfo(pair.accessToken());
    SessionInfo refresh = manager.sessionInfo(pair.refreshToken());

    assertThat(access.subjectId()).isEqualTo("alice");
    assertThat(access.kind()).isEqualTo(TokenKind.ACCESS);
    assertThat(access.issuedAt()).isEqualTo(START.getEpochSecond());
    assertThat(access.expiresAt()).isEqualTo(START.plus(Duration.ofMinutes(15)).getEpochSecond());
    assertThat(refresh.kind()).isEqualTo(TokenKind.REFRESH);
    assertThat(refresh.tokenId()).isNotEqualTo(access.tokenId());
  }

  @Test
  void sessionInfo_expiredToken_isRejected() {
    TokenPair pair = manager.issueTokens("alice", Map.of());
    clock.advance(Duration.ofMinutes(15));

    assertThatThrownBy(() -> manager.sessionInfo(pair.accessToken()))
        .isInstanceOf(InvalidCredentialException.class);
  }

  @Test
  void cleanupExpired_purgesEntriesPastExpiry() {
    TokenPair pair = manager.issueTokens("alice", Map.of());
    manager.revoke(pair.accessToken());
    manager.revoke(pair.refreshToken());

    assertThat(manager.cleanupExpired()).isZero();

    clock.advance(Duration.ofMinutes(15));
    assertThat(manager.cleanupExpired()).isEqualTo(1);
    assertThat(denylist.size()).isEqualTo(1);
    assertThat(manager.isValid(pair.accessToken())).isFalse();
  }
}
