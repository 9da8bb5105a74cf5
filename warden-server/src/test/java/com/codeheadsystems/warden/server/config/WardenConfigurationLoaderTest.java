package com.codeheadsystems.warden.server.config;

import static com.codeheadsystems.warden.server.config.WardenConfigurationTest.ACCESS_HEX;
import static com.codeheadsystems.warden.server.config.WardenConfigurationTest.REFRESH_HEX;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.exceptions.ConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WardenConfigurationLoaderTest {

  private static final Map<String, String> SECRETS = Map.of(
      "WARDEN_JWT_ACCESS_SECRET_HEX", ACCESS_HEX,
      "WARDEN_JWT_REFRESH_SECRET_HEX", REFRESH_HEX);

  private static Map<String, String> env(String... keyValues) {
    Map<String, String> env = new HashMap<>(SECRETS);
    for (int i = 0; i < keyValues.length; i += 2) {
      env.put(keyValues[i], keyValues[i + 1]);
    }
    return env;
  }

  private static InputStream yaml(String document) {
    return new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void load_environmentOnly() {
    WardenConfiguration configuration = new WardenConfigurationLoader(env(
        "WARDEN_JWT_ISSUER", "env-issuer",
        "WARDEN_ACCESS_TOKEN_TTL_SECONDS", "120",
        "WARDEN_ARGON2_MEMORY_KIB", "2048")).load();

    assertThat(configuration.getJwtIssuer()).isEqualTo("env-issuer");
    assertThat(configuration.getAccessTokenTtlSeconds()).isEqualTo(120);
    assertThat(configuration.getRefreshTokenTtlSeconds()).isEqualTo(604_800);
    assertThat(configuration.getArgon2MemoryKib()).isEqualTo(2048);
  }

  @Test
  void load_withoutSecrets_fails() {
    WardenConfigurationLoader loader = new WardenConfigurationLoader(Map.of());

    assertThatThrownBy(loader::load)
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("jwtAccessSecretHex is required");
  }

  @Test
  void load_profileFromEnvironment() {
    WardenConfiguration configuration =
        new WardenConfigurationLoader(env("WARDEN_PROFILE", "Production")).load();

    assertThat(configuration.getEnvironment()).isEqualTo("production");
    assertThat(configuration.getAccessTokenTtlSeconds()).isEqualTo(900);
    assertThat(configuration.getRefreshTokenTtlSeconds()).isEqualTo(604_800);
    assertThat(configuration.getPasswordMinLength()).isEqualTo(10);
  }

  @Test
  void load_explicitProfile_winsOverEnvironmentProfile_butNotOverEnvironmentValues() {
    WardenConfiguration configuration = new WardenConfigurationLoader(env(
        "WARDEN_PROFILE", "production",
        "WARDEN_PASSWORD_MIN_LENGTH", "12")).load(ConfigProfile.DEVELOPMENT);

    assertThat(configuration.getEnvironment()).isEqualTo("development");
    assertThat(configuration.getAccessTokenTtlSeconds()).isEqualTo(3600);
    assertThat(configuration.getRefreshTokenTtlSeconds()).isEqualTo(86_400);
    assertThat(configuration.getPasswordMinLength()).isEqualTo(12);
  }

  @Test
  void load_unknownProfile_fails() {
    WardenConfigurationLoader loader = new WardenConfigurationLoader(env("WARDEN_PROFILE", "qa"));

    assertThatThrownBy(loader::load)
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Unknown profile: qa");
  }

  @Test
  void load_invalidNumber_fails() {
    WardenConfigurationLoader loader =
        new WardenConfigurationLoader(env("WARDEN_REFRESH_TOKEN_TTL_SECONDS", "7d"));

    assertThatThrownBy(loader::load)
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("WARDEN_REFRESH_TOKEN_TTL_SECONDS");
  }

  @Test
  void load_yamlResource() throws IOException {
    try (InputStream in = getClass().getResourceAsStream("/warden-test.yml")) {
      WardenConfiguration configuration = new WardenConfigurationLoader(Map.of())
          .load(in, "warden-test.yml");

      assertThat(configuration.getJwtIssuer()).isEqualTo("warden-test");
      assertThat(configuration.getAccessTokenTtlSeconds()).isEqualTo(600);
      assertThat(configuration.getArgon2MemoryKib()).isEqualTo(1024);
      assertThat(configuration.toSigningContext().accessSecret()).hasSize(32);
    }
  }

  @Test
  void load_yamlOverridesProfile_environmentOverridesYaml() {
    WardenConfiguration configuration = new WardenConfigurationLoader(env(
        "WARDEN_PROFILE", "staging",
        "WARDEN_JWT_ISSUER", "from-env")).load(yaml("""
            jwtIssuer: from-yaml
            accessTokenTtlSeconds: 600
            """), "inline");

    assertThat(configuration.getEnvironment()).isEqualTo("staging");
    assertThat(configuration.getAccessTokenTtlSeconds()).isEqualTo(600);
    assertThat(configuration.getRefreshTokenTtlSeconds()).isEqualTo(259_200);
    assertThat(configuration.getJwtIssuer()).isEqualTo("from-env");
  }

  @Test
  void load_yamlUnknownProperty_fails() {
    WardenConfigurationLoader loader = new WardenConfigurationLoader(SECRETS);

    assertThatThrownBy(() -> loader.load(yaml("jwtSecret: abc\n"), "inline"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("inline");
  }

  @Test
  void load_yamlFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("warden.yml");
    Files.writeString(file, "jwtAccessSecretHex: " + ACCESS_HEX + "\n"
        + "jwtRefreshSecretHex: " + REFRESH_HEX + "\n"
        + "jwtSigningAlgorithm: hs256\n");

    WardenConfiguration configuration = new WardenConfigurationLoader(Map.of()).load(file);

    assertThat(configuration.getJwtSigningAlgorithm()).isEqualTo("hs256");
    assertThat(configuration.toSigningContext().issuer()).isEqualTo("warden");
  }

  @Test
  void load_missingFile_fails(@TempDir Path dir) {
    WardenConfigurationLoader loader = new WardenConfigurationLoader(SECRETS);

    assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("absent.yml");
  }
}
