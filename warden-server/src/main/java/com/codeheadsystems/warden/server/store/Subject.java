package com.codeheadsystems.warden.server.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The authenticated party as seen by Warden. Profile data lives elsewhere.
 *
 * @param id             stable subject identifier, the {@code sub} claim
 * @param active         false once the subject has been deactivated
 * @param passwordDigest Argon2id digest, or null for subjects that never log in with a password
 */
public record Subject(
    @JsonProperty("id") String id,
    @JsonProperty("active") boolean active,
    @JsonIgnore String passwordDigest) {

  /**
   * An active subject without a password.
   *
   * @param id the id
   * @return the subject
   */
  public static Subject active(String id) {
    return new Subject(id, true, null);
  }

  /**
   * Copy with a different active flag.
   *
   * @param newActive the flag
   * @return the copy
   */
  public Subject withActive(boolean newActive) {
    return new Subject(id, newActive, passwordDigest);
  }

  /**
   * Copy with a different password digest.
   *
   * @param newDigest the digest
   * @return the copy
   */
  public Subject withPasswordDigest(String newDigest) {
    return new Subject(id, active, newDigest);
  }

  @Override
  public String toString() {
    return "Subject[id=" + id + ", active=" + active + "]";
  }
}
