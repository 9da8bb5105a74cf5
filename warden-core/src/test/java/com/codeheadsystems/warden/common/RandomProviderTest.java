package com.codeheadsystems.warden.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  private final RandomProvider provider = new RandomProvider();

  @Test
  void randomBytes_hasRequestedLength() {
    assertThat(provider.randomBytes(0)).isEmpty();
    assertThat(provider.randomBytes(16)).hasSize(16);
  }

  @Test
  void randomTokenId_isUrlSafeAndUnique() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      String id = provider.randomTokenId();
      assertThat(id).hasSize(22).matches("[A-Za-z0-9_-]+");
      seen.add(id);
    }
    assertThat(seen).hasSize(1000);
  }
}
