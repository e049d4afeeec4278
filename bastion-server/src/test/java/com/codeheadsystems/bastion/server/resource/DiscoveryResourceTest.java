package com.codeheadsystems.bastion.server.resource;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.bastion.model.discovery.JsonWebKey;
import com.codeheadsystems.bastion.model.discovery.OpenIdConfiguration;
import com.codeheadsystems.bastion.server.key.KeyManager;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DiscoveryResourceTest {

  @TempDir
  static Path keysDir;

  private static KeyManager keyManager;

  @BeforeAll
  static void setUp() {
    keyManager = new KeyManager(keysDir);
    keyManager.ensureKeys();
  }

  @Test
  void jwks_publishesSingleSigningKey() {
    DiscoveryResource resource =
        new DiscoveryResource(keyManager, "http://localhost:8080", List.of("read"));

    List<JsonWebKey> keys = resource.jwks().keys();

    assertThat(keys).hasSize(1);
    assertThat(keys.get(0).kid()).isEqualTo(KeyManager.DEFAULT_KEY_ID);
    assertThat(keys.get(0).e()).isEqualTo("AQAB");
  }

  @Test
  void openIdConfiguration_stripsTrailingSlash() {
    DiscoveryResource resource =
        new DiscoveryResource(keyManager, "https://id.example.com/", List.of("read", "write"));

    OpenIdConfiguration configuration = resource.openIdConfiguration();

    assertThat(configuration.issuer()).isEqualTo("https://id.example.com");
    assertThat(configuration.jwksUri()).isEqualTo("https://id.example.com/.well-known/jwks.json");
    assertThat(configuration.scopesSupported()).containsExactly("read", "write");
  }
}
