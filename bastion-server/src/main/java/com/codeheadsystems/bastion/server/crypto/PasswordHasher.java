package com.codeheadsystems.bastion.server.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Salted Argon2id password hashing.
 * <p>
 * Hashes are encoded in the PHC string format
 * {@code $argon2id$v=19$m=<kib>,t=<iterations>,p=<parallelism>$<salt>$<hash>} with unpadded
 * standard base64. The cost parameters used to hash are fixed at construction; verification
 * always uses the parameters embedded in the stored hash, so raising the cost does not
 * invalidate existing hashes. Embedded costs above four times the configured cost are rejected.
 */
public class PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

  public static final int DEFAULT_MEMORY_KIB = 65536;
  public static final int DEFAULT_ITERATIONS = 3;
  public static final int DEFAULT_PARALLELISM = 1;

  private static final String ALGORITHM = "argon2id";
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;
  private static final int MIN_SALT_LENGTH = 8;
  private static final int MIN_HASH_LENGTH = 4;
  private static final int MAX_HASH_LENGTH = 64;
  // Stored costs above this multiple of the configured cost are treated as corrupt.
  private static final int MAX_COST_FACTOR = 4;
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final int memoryKib;
  private final int iterations;
  private final int parallelism;
  private final SecureRandom random;

  /**
   * Creates a hasher with the default cost (64 MiB, 3 iterations, 1 lane).
   */
  public PasswordHasher() {
    this(DEFAULT_MEMORY_KIB, DEFAULT_ITERATIONS, DEFAULT_PARALLELISM);
  }

  /**
   * Creates a hasher.
   *
   * @param memoryKib   memory cost in kibibytes, at least {@code 8 * parallelism}
   * @param iterations  time cost, at least 1
   * @param parallelism lanes, at least 1
   */
  public PasswordHasher(int memoryKib, int iterations, int parallelism) {
    if (parallelism < 1 || iterations < 1 || memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("Invalid Argon2id cost: m=" + memoryKib
          + ", t=" + iterations + ", p=" + parallelism);
    }
    this.memoryKib = memoryKib;
    this.iterations = iterations;
    this.parallelism = parallelism;
    this.random = new SecureRandom();
  }

  /**
   * Hashes a secret with a fresh random salt.
   *
   * @param secret the plaintext secret
   * @return the PHC-encoded hash
   */
  public String hash(String secret) {
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    byte[] hash = derive(secret, salt, memoryKib, iterations, parallelism, HASH_LENGTH);
    return "$" + ALGORITHM + "$v=" + Argon2Parameters.ARGON2_VERSION_13
        + "$m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
        + "$" + B64.encodeToString(salt) + "$" + B64.encodeToString(hash);
  }

  /**
   * Verifies a secret against a stored hash in constant time.
   *
   * @param secret the plaintext secret
   * @param stored the PHC-encoded hash
   * @return true on match; false on mismatch or a malformed stored hash
   */
  public boolean verify(String secret, String stored) {
    if (secret == null || stored == null) {
      return false;
    }
    String[] parts = stored.split("\\$");
    // "", algorithm, version, params, salt, hash
    if (parts.length != 6 || !ALGORITHM.equals(parts[1])
        || !("v=" + Argon2Parameters.ARGON2_VERSION_13).equals(parts[2])) {
      log.debug("Stored hash is not an argon2id v19 PHC string");
      return false;
    }
    try {
      int m = 0;
      int t = 0;
      int p = 0;
      for (String param : parts[3].split(",")) {
        String[] kv = param.split("=", 2);
        if (kv.length != 2) {
          return false;
        }
        int value = Integer.parseInt(kv[1]);
        switch (kv[0]) {
          case "m" -> m = value;
          case "t" -> t = value;
          case "p" -> p = value;
          default -> {
            return false;
          }
        }
      }
      if (p < 1 || t < 1 || m < 8 * p || !withinCostCeiling(m, t, p)) {
        log.debug("Stored hash cost out of range: m={}, t={}, p={}", m, t, p);
        return false;
      }
      byte[] salt = B64D.decode(parts[4]);
      byte[] expected = B64D.decode(parts[5]);
      if (salt.length < MIN_SALT_LENGTH
          || expected.length < MIN_HASH_LENGTH || expected.length > MAX_HASH_LENGTH) {
        log.debug("Stored hash has unusable salt or digest length");
        return false;
      }
      byte[] actual = derive(secret, salt, m, t, p, expected.length);
      return Arrays.constantTimeAreEqual(expected, actual);
    } catch (IllegalArgumentException | IllegalStateException e) {
      // NumberFormatException, bad base64, or parameters the generator refuses
      log.debug("Malformed stored hash: {}", e.getMessage());
      return false;
    }
  }

  private boolean withinCostCeiling(int m, int t, int p) {
    return (long) m <= (long) memoryKib * MAX_COST_FACTOR
        && (long) t <= (long) iterations * MAX_COST_FACTOR
        && (long) p <= (long) parallelism * MAX_COST_FACTOR;
  }

  private static byte[] derive(String secret, byte[] salt, int m, int t, int p, int length) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(m)
        .withIterations(t)
        .withParallelism(p)
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] output = new byte[length];
    generator.generateBytes(secret.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }
}
