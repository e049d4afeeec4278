package com.codeheadsystems.bastion.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Dropwizard configuration for the bastion identity provider.
 * <p>
 * For production, point {@code keysDirectory} at durable storage so the signing key survives
 * restarts; every token issued before a key change fails verification afterwards. Relying
 * services fetch the public key from {@code /.well-known/jwks.json}.
 */
public class BastionConfiguration extends Configuration {

  /**
   * Directory holding {@code private_key.pem} and {@code public_key.pem}. A key pair is
   * generated there on first start when either file is missing.
   */
  @NotEmpty
  private String keysDirectory = "keys";

  /**
   * RSA modulus size in bits used when a key pair has to be generated.
   */
  @Min(2048)
  private int rsaKeySize = 2048;

  /**
   * Key identifier published as {@code kid} in the JWKS and in every token header.
   */
  @NotEmpty
  private String keyId = "bastion-key-1";

  /**
   * Issuer claim, also the base URL advertised in the discovery document.
   */
  @NotEmpty
  private String issuer = "http://localhost:8080";

  /**
   * Access token time-to-live in seconds.
   */
  @Min(1)
  private long accessTokenTtlSeconds = 1800;

  /**
   * Refresh token time-to-live in seconds.
   */
  @Min(1)
  private long refreshTokenTtlSeconds = 604800;

  /**
   * Scopes granted to every access token.
   */
  @NotEmpty
  private List<String> defaultScopes = List.of("read", "write");

  /**
   * Argon2id memory cost in kibibytes for new password hashes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count for new password hashes.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism for new password hashes.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Principals registered at startup, e.g. the first administrator. Entries whose username
   * or email is already taken are skipped.
   */
  @Valid
  private List<BootstrapPrincipal> bootstrapPrincipals = List.of();

  /**
   * Gets keys directory.
   *
   * @return the keys directory
   */
  @JsonProperty
  public String getKeysDirectory() {
    return keysDirectory;
  }

  /**
   * Sets keys directory.
   *
   * @param keysDirectory the keys directory
   */
  @JsonProperty
  public void setKeysDirectory(String keysDirectory) {
    this.keysDirectory = keysDirectory;
  }

  /**
   * Gets rsa key size.
   *
   * @return the rsa key size
   */
  @JsonProperty
  public int getRsaKeySize() {
    return rsaKeySize;
  }

  /**
   * Sets rsa key size.
   *
   * @param rsaKeySize the rsa key size
   */
  @JsonProperty
  public void setRsaKeySize(int rsaKeySize) {
    this.rsaKeySize = rsaKeySize;
  }

  /**
   * Gets key id.
   *
   * @return the key id
   */
  @JsonProperty
  public String getKeyId() {
    return keyId;
  }

  /**
   * Sets key id.
   *
   * @param keyId the key id
   */
  @JsonProperty
  public void setKeyId(String keyId) {
    this.keyId = keyId;
  }

  /**
   * Gets issuer.
   *
   * @return the issuer
   */
  @JsonProperty
  public String getIssuer() {
    return issuer;
  }

  /**
   * Sets issuer.
   *
   * @param issuer the issuer
   */
  @JsonProperty
  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  /**
   * Gets access token ttl seconds.
   *
   * @return the access token ttl seconds
   */
  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  /**
   * Sets access token ttl seconds.
   *
   * @param accessTokenTtlSeconds the access token ttl seconds
   */
  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  /**
   * Gets refresh token ttl seconds.
   *
   * @return the refresh token ttl seconds
   */
  @JsonProperty
  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  /**
   * Sets refresh token ttl seconds.
   *
   * @param refreshTokenTtlSeconds the refresh token ttl seconds
   */
  @JsonProperty
  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  /**
   * Gets default scopes.
   *
   * @return the default scopes
   */
  @JsonProperty
  public List<String> getDefaultScopes() {
    return defaultScopes;
  }

  /**
   * Sets default scopes.
   *
   * @param defaultScopes the default scopes
   */
  @JsonProperty
  public void setDefaultScopes(List<String> defaultScopes) {
    this.defaultScopes = defaultScopes;
  }

  /**
   * Gets argon 2 memory kib.
   *
   * @return the argon 2 memory kib
   */
  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  /**
   * Sets argon 2 memory kib.
   *
   * @param argon2MemoryKib the argon 2 memory kib
   */
  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  /**
   * Gets argon 2 iterations.
   *
   * @return the argon 2 iterations
   */
  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  /**
   * Sets argon 2 iterations.
   *
   * @param argon2Iterations the argon 2 iterations
   */
  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  /**
   * Gets argon 2 parallelism.
   *
   * @return the argon 2 parallelism
   */
  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  /**
   * Sets argon 2 parallelism.
   *
   * @param argon2Parallelism the argon 2 parallelism
   */
  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets bootstrap principals.
   *
   * @return the bootstrap principals
   */
  @JsonProperty
  public List<BootstrapPrincipal> getBootstrapPrincipals() {
    return bootstrapPrincipals;
  }

  /**
   * Sets bootstrap principals.
   *
   * @param bootstrapPrincipals the bootstrap principals
   */
  @JsonProperty
  public void setBootstrapPrincipals(List<BootstrapPrincipal> bootstrapPrincipals) {
    this.bootstrapPrincipals = bootstrapPrincipals;
  }
}
