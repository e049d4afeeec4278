package com.codeheadsystems.bastion.server.key;

import com.codeheadsystems.bastion.model.discovery.JsonWebKey;
import com.codeheadsystems.bastion.model.discovery.JsonWebKeySet;
import com.codeheadsystems.bastion.server.exception.KeyStorageException;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the RSA signing key pair: generation, durable PEM storage, loading and JWK derivation.
 * <p>
 * The pair lives in a directory as {@code private_key.pem} (PKCS#8) and {@code public_key.pem}
 * (X.509 SubjectPublicKeyInfo). A directory holding only one of the two files is treated as
 * holding no key pair and is regenerated, unless this manager has already loaded a pair. Both
 * halves are written to temporary files and then moved into place, so a reader never sees a
 * half-written key.
 * <p>
 * Generation is mutually exclusive per key directory within the process: concurrent callers of
 * {@link #ensureKeys()} observe exactly one generated pair.
 */
public class KeyManager {

  private static final Logger log = LoggerFactory.getLogger(KeyManager.class);

  public static final String PRIVATE_KEY_FILE = "private_key.pem";
  public static final String PUBLIC_KEY_FILE = "public_key.pem";
  public static final int MIN_KEY_SIZE = 2048;
  public static final String DEFAULT_KEY_ID = "bastion-key-1";

  private static final String PRIVATE_PEM_TYPE = "PRIVATE KEY";
  private static final String PUBLIC_PEM_TYPE = "PUBLIC KEY";
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final ConcurrentHashMap<Path, Object> DIRECTORY_LOCKS = new ConcurrentHashMap<>();

  private final Path directory;
  private final int keySize;
  private final String keyId;
  private final SecureRandom random;
  private final Object lock;

  private volatile ParsedKeys parsedKeys;

  /**
   * Creates a key manager with the default 2048-bit modulus and key id.
   *
   * @param directory directory holding the PEM files, created on demand
   */
  public KeyManager(Path directory) {
    this(directory, MIN_KEY_SIZE, DEFAULT_KEY_ID, new SecureRandom());
  }

  /**
   * Creates a key manager.
   *
   * @param directory directory holding the PEM files, created on demand
   * @param keySize   RSA modulus size in bits, at least 2048
   * @param keyId     identifier published as {@code kid}
   * @param random    randomness source for key generation
   */
  public KeyManager(Path directory, int keySize, String keyId, SecureRandom random) {
    if (keySize < MIN_KEY_SIZE) {
      throw new IllegalArgumentException("RSA key size must be at least " + MIN_KEY_SIZE + " bits");
    }
    if (keyId == null || keyId.isBlank()) {
      throw new IllegalArgumentException("keyId must not be blank");
    }
    this.directory = directory.toAbsolutePath().normalize();
    this.keySize = keySize;
    this.keyId = keyId;
    this.random = random;
    this.lock = DIRECTORY_LOCKS.computeIfAbsent(this.directory, d -> new Object());
  }

  /**
   * Generates and persists a key pair unless a complete one is already stored. Idempotent.
   * <p>
   * Once this manager has loaded its keys it never replaces them: tokens are already signed
   * with the loaded pair, so a pair that vanished from storage is an error, not a reason to
   * generate a new one.
   *
   * @throws KeyStorageException if the pair cannot be generated or written, or if the loaded
   *                             pair has been removed from storage
   */
  public void ensureKeys() {
    synchronized (lock) {
      if (hasKeys()) {
        return;
      }
      if (parsedKeys != null) {
        log.error("Signing key pair in use was removed from {}; refusing to regenerate", directory);
        throw new KeyStorageException("Signing key pair in use was removed from " + directory);
      }
      log.info("No complete signing key pair in {}; generating {}-bit RSA key pair",
          directory, keySize);
      KeyPair pair = generate();
      try {
        Files.createDirectories(directory);
        Path privateTmp = writeTemp(PRIVATE_PEM_TYPE, pair.getPrivate().getEncoded());
        restrictToOwner(privateTmp);
        Path publicTmp = writeTemp(PUBLIC_PEM_TYPE, pair.getPublic().getEncoded());
        moveIntoPlace(privateTmp, privateKeyPath());
        moveIntoPlace(publicTmp, publicKeyPath());
      } catch (IOException e) {
        throw new KeyStorageException("Unable to persist signing key pair in " + directory, e);
      }
      log.info("Signing key pair written to {}", directory);
    }
  }

  /**
   * Whether both halves of the key pair are present.
   *
   * @return true if both PEM files exist
   */
  public boolean hasKeys() {
    return Files.isRegularFile(privateKeyPath()) && Files.isRegularFile(publicKeyPath());
  }

  /**
   * Loads the private key PEM text, generating the pair first if absent.
   *
   * @return PKCS#8 PEM text
   */
  public String loadPrivateKey() {
    ensureKeys();
    return read(privateKeyPath());
  }

  /**
   * Loads the public key PEM text, generating the pair first if absent.
   *
   * @return SubjectPublicKeyInfo PEM text
   */
  public String loadPublicKey() {
    ensureKeys();
    return read(publicKeyPath());
  }

  /**
   * Private key.
   *
   * @return the parsed signing key
   */
  public RSAPrivateKey privateKey() {
    return parsed().privateKey();
  }

  /**
   * Public key.
   *
   * @return the parsed verification key
   */
  public RSAPublicKey publicKey() {
    return parsed().publicKey();
  }

  /**
   * Gets the key id published as {@code kid}.
   *
   * @return the key id
   */
  public String keyId() {
    return keyId;
  }

  /**
   * Derives the public JWK. The result depends only on the stored public key and the key id.
   *
   * @return the jwk
   */
  public JsonWebKey publicJwk() {
    RSAPublicKey publicKey = publicKey();
    return JsonWebKey.rs256(keyId, base64Url(publicKey.getModulus()),
        base64Url(publicKey.getPublicExponent()));
  }

  /**
   * The key set published at the JWKS endpoint.
   *
   * @return a set containing the single current key
   */
  public JsonWebKeySet jwks() {
    return new JsonWebKeySet(List.of(publicJwk()));
  }

  Path privateKeyPath() {
    return directory.resolve(PRIVATE_KEY_FILE);
  }

  Path publicKeyPath() {
    return directory.resolve(PUBLIC_KEY_FILE);
  }

  private ParsedKeys parsed() {
    ParsedKeys current = parsedKeys;
    if (current == null) {
      synchronized (lock) {
        current = parsedKeys;
        if (current == null) {
          current = new ParsedKeys(
              parsePrivate(loadPrivateKey()),
              parsePublic(loadPublicKey()));
          parsedKeys = current;
        }
      }
    }
    return current;
  }

  private KeyPair generate() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(new RSAKeyGenParameterSpec(keySize, RSAKeyGenParameterSpec.F4), random);
      return generator.generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new KeyStorageException("RSA key generation unavailable", e);
    }
  }

  private Path writeTemp(String type, byte[] der) throws IOException {
    StringWriter out = new StringWriter();
    try (PemWriter writer = new PemWriter(out)) {
      writer.writeObject(new PemObject(type, der));
    }
    Path tmp = Files.createTempFile(directory, ".key-", ".tmp");
    Files.writeString(tmp, out.toString(), StandardCharsets.US_ASCII);
    return tmp;
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void restrictToOwner(Path path) throws IOException {
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
    }
  }

  private static String read(Path path) {
    try {
      return Files.readString(path, StandardCharsets.US_ASCII);
    } catch (IOException e) {
      throw new KeyStorageException("Unable to read key file " + path.getFileName(), e);
    }
  }

  private static RSAPrivateKey parsePrivate(String pem) {
    try {
      byte[] der = pemContent(pem, PRIVATE_PEM_TYPE);
      return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
    } catch (GeneralSecurityException e) {
      throw new KeyStorageException("Stored private key is not a valid RSA PKCS#8 key", e);
    }
  }

  private static RSAPublicKey parsePublic(String pem) {
    try {
      byte[] der = pemContent(pem, PUBLIC_PEM_TYPE);
      return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
    } catch (GeneralSecurityException e) {
      throw new KeyStorageException("Stored public key is not a valid RSA key", e);
    }
  }

  private static byte[] pemContent(String pem, String expectedType) {
    try (PemReader reader = new PemReader(new StringReader(pem))) {
      PemObject object = reader.readPemObject();
      if (object == null || !expectedType.equals(object.getType())) {
        throw new KeyStorageException("Stored key is not a PEM '" + expectedType + "' block");
      }
      return object.getContent();
    } catch (IOException | IllegalStateException e) {
      // BouncyCastle reports bad base64 bodies as DecoderException, an IllegalStateException.
      throw new KeyStorageException("Stored key PEM is corrupt", e);
    }
  }

  private static String base64Url(BigInteger value) {
    return B64URL.encodeToString(BigIntegers.asUnsignedByteArray(value));
  }

  private record ParsedKeys(RSAPrivateKey privateKey, RSAPublicKey publicKey) {
  }
}
