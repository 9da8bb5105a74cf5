package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.exceptions.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a validated {@link WardenConfiguration}.
 * <p>
 * Sources are applied in order, each overriding the previous one:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>the profile named by {@code WARDEN_PROFILE}, or the one passed explicitly</li>
 *   <li>the YAML document, if any</li>
 *   <li>{@code WARDEN_*} environment variables</li>
 * </ol>
 * The result is validated before it is returned.
 */
public class WardenConfigurationLoader {

  private static final Logger log = LoggerFactory.getLogger(WardenConfigurationLoader.class);

  public static final String PROFILE_VARIABLE = "WARDEN_PROFILE";

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final Map<String, String> environment;

  public WardenConfigurationLoader() {
    this(System.getenv());
  }

  /**
   * Instantiates a new loader reading overrides from the given variables.
   *
   * @param environment the environment variables
   */
  public WardenConfigurationLoader(Map<String, String> environment) {
    this.environment = Map.copyOf(environment);
  }

  /**
   * Defaults, profile and environment only.
   *
   * @return the validated configuration
   */
  public WardenConfiguration load() {
    return finish(base(null));
  }

  /**
   * Defaults, the given profile and environment. {@code WARDEN_PROFILE} is ignored.
   *
   * @param profile the profile
   * @return the validated configuration
   */
  public WardenConfiguration load(ConfigProfile profile) {
    return finish(base(profile));
  }

  /**
   * Loads from a YAML file.
   *
   * @param yamlFile the file
   * @return the validated configuration
   */
  public WardenConfiguration load(Path yamlFile) {
    try (InputStream in = Files.newInputStream(yamlFile)) {
      return load(in, yamlFile.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read configuration file " + yamlFile, e);
    }
  }

  /**
   * Loads from a YAML stream. The stream is not closed.
   *
   * @param yaml       the document
   * @param sourceName name used in error messages
   * @return the validated configuration
   */
  public WardenConfiguration load(InputStream yaml, String sourceName) {
    WardenConfiguration configuration = base(null);
    try {
      yamlMapper.readerForUpdating(configuration).readValue(yaml);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to parse configuration " + sourceName + ": "
          + e.getMessage(), e);
    }
    log.debug("Applied configuration from {}", sourceName);
    return finish(configuration);
  }

  private WardenConfiguration base(ConfigProfile explicitProfile) {
    WardenConfiguration configuration = new WardenConfiguration();
    ConfigProfile profile = explicitProfile;
    String profileName = environment.get(PROFILE_VARIABLE);
    if (profile == null && profileName != null && !profileName.isBlank()) {
      profile = ConfigProfile.fromName(profileName);
    }
    if (profile != null) {
      profile.applyTo(configuration);
      log.debug("Applied profile {}", profile.profileName());
    }
    return configuration;
  }

  private WardenConfiguration finish(WardenConfiguration configuration) {
    applyEnvironment(configuration);
    configuration.validate();
    log.info("Loaded configuration: {}", configuration.describe());
    return configuration;
  }

  private void applyEnvironment(WardenConfiguration c) {
    string("WARDEN_JWT_ACCESS_SECRET_HEX", c::setJwtAccessSecretHex);
    string("WARDEN_JWT_REFRESH_SECRET_HEX", c::setJwtRefreshSecretHex);
    string("WARDEN_JWT_ISSUER", c::setJwtIssuer);
    string("WARDEN_JWT_SIGNING_ALGORITHM", c::setJwtSigningAlgorithm);
    longValue("WARDEN_ACCESS_TOKEN_TTL_SECONDS", c::setAccessTokenTtlSeconds);
    longValue("WARDEN_REFRESH_TOKEN_TTL_SECONDS", c::setRefreshTokenTtlSeconds);
    intValue("WARDEN_ARGON2_MEMORY_KIB", c::setArgon2MemoryKib);
    intValue("WARDEN_ARGON2_ITERATIONS", c::setArgon2Iterations);
    intValue("WARDEN_ARGON2_PARALLELISM", c::setArgon2Parallelism);
    intValue("WARDEN_PASSWORD_MIN_LENGTH", c::setPasswordMinLength);
  }

  private void string(String name, Consumer<String> setter) {
    String value = environment.get(name);
    if (value != null && !value.isEmpty()) {
      setter.accept(value);
    }
  }

  private void longValue(String name, LongConsumer setter) {
    string(name, value -> {
      try {
        setter.accept(Long.parseLong(value.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid " + name + ": " + value, e);
      }
    });
  }

  private void intValue(String name, IntConsumer setter) {
    string(name, value -> {
      try {
        setter.accept(Integer.parseInt(value.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid " + name + ": " + value, e);
      }
    });
  }
}
