package com.codeheadsystems.bastion.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.bastion.server.key.KeyManager;
import java.security.interfaces.RSAPublicKey;

/**
 * Health check that verifies the signing key pair is on disk and the public half is usable.
 */
public class SigningKeyHealthCheck extends HealthCheck {

  private final KeyManager keyManager;

  /**
   * Instantiates a new Signing key health check.
   *
   * @param keyManager the key manager
   */
  public SigningKeyHealthCheck(KeyManager keyManager) {
    this.keyManager = keyManager;
  }

  @Override
  protected Result check() {
    if (!keyManager.hasKeys()) {
      return Result.unhealthy("Signing key pair is missing from storage");
    }
    RSAPublicKey publicKey = keyManager.publicKey();
    int bits = publicKey.getModulus().bitLength();
    if (bits < KeyManager.MIN_KEY_SIZE) {
      return Result.unhealthy("Signing key modulus is too short: %d bits", bits);
    }
    return Result.healthy("kid=%s, modulus=%d bits", keyManager.keyId(), bits);
  }
}
