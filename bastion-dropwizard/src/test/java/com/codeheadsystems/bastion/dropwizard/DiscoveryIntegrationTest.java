package com.codeheadsystems.bastion.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.fasterxml.jackson.databind.JsonNode;
import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.math.BigInteger;
import java.net.http.HttpResponse;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * JWKS and discovery endpoints, and offline verification of issued tokens from the JWKS alone.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class DiscoveryIntegrationTest {

  static final DropwizardAppExtension<BastionConfiguration> APP =
      new DropwizardAppExtension<>(
          BastionApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("keysDirectory", BastionHttp.tempKeysDirectory()));

  private BastionHttp http;

  @BeforeEach
  void setUp() {
    http = new BastionHttp(APP.getLocalPort());
  }

  @Test
  void jwks_publishesRs256SigningKey() throws Exception {
    HttpResponse<String> response = http.get("/.well-known/jwks.json", null);

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode key = BastionHttp.json(response).get("keys").get(0);
    assertThat(key.get("kty").asText()).isEqualTo("RSA");
    assertThat(key.get("use").asText()).isEqualTo("sig");
    assertThat(key.get("alg").asText()).isEqualTo("RS256");
    assertThat(key.get("kid").asText()).isEqualTo("bastion-test-key");
    assertThat(key.get("e").asText()).isEqualTo("AQAB");
    assertThat(key.has("d")).isFalse();
  }

  @Test
  void jwks_isStableAcrossRequests() throws Exception {
    String first = http.get("/.well-known/jwks.json", null).body();
    String second = http.get("/.well-known/jwks.json", null).body();

    assertThat(second).isEqualTo(first);
  }

  @Test
  void openIdConfiguration_pointsAtJwks() throws Exception {
    JsonNode document = BastionHttp.json(http.get("/.well-known/openid-configuration", null));

    assertThat(document.get("issuer").asText()).isEqualTo("http://localhost:8080");
    assertThat(document.get("jwks_uri").asText())
        .isEqualTo("http://localhost:8080/.well-known/jwks.json");
    assertThat(document.get("grant_types_supported").toString()).contains("password", "refresh_token");
  }

  @Test
  void issuedToken_verifiesAgainstPublishedKey() throws Exception {
    String accessToken = http.login("testuser", "test123").get("access_token").asText();
    JsonNode key = BastionHttp.json(http.get("/.well-known/jwks.json", null)).get("keys").get(0);

    RSAPublicKey publicKey = (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(
        new RSAPublicKeySpec(unsigned(key.get("n").asText()), unsigned(key.get("e").asText())));
    DecodedJWT jwt = JWT.require(Algorithm.RSA256(publicKey, null))
        .withIssuer("http://localhost:8080")
        .build()
        .verify(accessToken);

    assertThat(jwt.getKeyId()).isEqualTo(key.get("kid").asText());
    assertThat(jwt.getClaim("username").asString()).isEqualTo("testuser");
    assertThat(jwt.getClaim("type").asString()).isEqualTo("access_token");
  }

  private static BigInteger unsigned(String base64Url) {
    return new BigInteger(1, Base64.getUrlDecoder().decode(base64Url));
  }
}
