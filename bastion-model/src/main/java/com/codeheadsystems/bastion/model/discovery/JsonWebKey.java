package com.codeheadsystems.bastion.model.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * RSA public key in JWK form (RFC 7517). Modulus and exponent are unsigned big-endian
 * integers, base64url-encoded without padding.
 *
 * @param kty key type, always {@code RSA}
 * @param use intended use, always {@code sig}
 * @param kid key identifier, matches the {@code kid} header of issued tokens
 * @param alg algorithm, always {@code RS256}
 * @param n   modulus
 * @param e   public exponent
 */
@JsonPropertyOrder({"kty", "use", "kid", "alg", "n", "e"})
public record JsonWebKey(@JsonProperty("kty") String kty,
                         @JsonProperty("use") String use,
                         @JsonProperty("kid") String kid,
                         @JsonProperty("alg") String alg,
                         @JsonProperty("n") String n,
                         @JsonProperty("e") String e) {

  /**
   * Builds a signing key entry for an RS256 key.
   *
   * @param kid the key id
   * @param n   base64url modulus
   * @param e   base64url exponent
   * @return the jwk
   */
  public static JsonWebKey rs256(String kid, String n, String e) {
    return new JsonWebKey("RSA", "sig", kid, "RS256", n, e);
  }
}
