package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.exceptions.ConfigurationException;
import com.codeheadsystems.warden.exceptions.WeakPasswordException;

/**
 * Length rules applied to new passwords. Length is counted in Unicode code points.
 *
 * @param minLength minimum length, inclusive
 * @param maxLength maximum length, inclusive
 */
public record PasswordPolicy(int minLength, int maxLength) {

  public static final int DEFAULT_MIN_LENGTH = 8;
  public static final int MAX_LENGTH = 128;
  public static final PasswordPolicy DEFAULT = new PasswordPolicy(DEFAULT_MIN_LENGTH, MAX_LENGTH);

  public PasswordPolicy {
    if (minLength < 1) {
      throw new ConfigurationException("minLength must be at least 1: " + minLength);
    }
    if (maxLength < minLength) {
      throw new ConfigurationException("maxLength must be >= minLength: " + maxLength);
    }
  }

  /**
   * A policy with the given minimum and the standard maximum.
   *
   * @param minLength the minimum
   * @return the policy
   */
  public static PasswordPolicy withMinLength(int minLength) {
    return new PasswordPolicy(minLength, MAX_LENGTH);
  }

  /**
   * Checks a candidate password.
   *
   * @param password the candidate
   * @throws WeakPasswordException if it is missing, too short or too long
   */
  public void check(String password) {
    if (password == null || password.isEmpty()) {
      throw new WeakPasswordException("Password is required");
    }
    int length = password.codePointCount(0, password.length());
    if (length < minLength) {
      throw new WeakPasswordException("Password must be at least " + minLength + " characters");
    }
    if (length > maxLength) {
      throw new WeakPasswordException("Password must be at most " + maxLength + " characters");
    }
  }
}
