package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.exceptions.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Named presets applied before YAML and environment overrides.
 */
public enum ConfigProfile {

  DEVELOPMENT("development", 3600, 86_400, 6),
  STAGING("staging", 1800, 259_200, 8),
  PRODUCTION("production", 900, 604_800, 10);

  private final String profileName;
  private final long accessTokenTtlSeconds;
  private final long refreshTokenTtlSeconds;
  private final int passwordMinLength;

  ConfigProfile(String profileName,
                long accessTokenTtlSeconds,
                long refreshTokenTtlSeconds,
                int passwordMinLength) {
    this.profileName = profileName;
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
    this.passwordMinLength = passwordMinLength;
  }

  public String profileName() {
    return profileName;
  }

  /**
   * Resolves a profile by name, ignoring case.
   *
   * @param name the name
   * @return the profile
   * @throws ConfigurationException for unknown names
   */
  public static ConfigProfile fromName(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(p -> p.profileName.equals(normalized))
        .findFirst()
        .orElseThrow(() -> new ConfigurationException("Unknown profile: " + name));
  }

  /**
   * Writes this profile's presets into the configuration.
   *
   * @param configuration the target
   */
  public void applyTo(WardenConfiguration configuration) {
    configuration.setEnvironment(profileName);
    configuration.setAccessTokenTtlSeconds(accessTokenTtlSeconds);
    configuration.setRefreshTokenTtlSeconds(refreshTokenTtlSeconds);
    configuration.setPasswordMinLength(passwordMinLength);
  }
}
