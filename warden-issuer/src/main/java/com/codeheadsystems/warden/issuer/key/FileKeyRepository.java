package com.codeheadsystems.warden.issuer.key;

import com.codeheadsystems.warden.core.key.KeyRing;
import com.codeheadsystems.warden.core.key.PublicKeyCodec;
import com.codeheadsystems.warden.core.key.SigningKeyPair;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists signing keys as PEM files, one pair per version:
 * {@code v{N}-private.pem} (PKCS#8) and {@code v{N}-public.pem} (SubjectPublicKeyInfo).
 * <p>
 * Private key files are created owner-readable only where the file system supports POSIX
 * permissions. The public files alone are enough to build a verifier's {@link KeyRing}.
 */
public class FileKeyRepository {

  private static final Logger log = LoggerFactory.getLogger(FileKeyRepository.class);
  private static final String PRIVATE_TYPE = "PRIVATE KEY";
  private static final Pattern PRIVATE_FILE = Pattern.compile("^v(\\d+)-private\\.pem$");
  private static final Pattern PUBLIC_FILE = Pattern.compile("^v(\\d+)-public\\.pem$");

  private final Path directory;

  /**
   * Instantiates a new File key repository.
   *
   * @param directory the key directory; created if missing
   */
  public FileKeyRepository(Path directory) {
    this.directory = directory;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new KeyRepositoryException("Unable to create key directory " + directory, e);
    }
    log.info("FileKeyRepository({})", directory);
  }

  public Path privateKeyPath(int keyVersion) {
    return directory.resolve("v" + keyVersion + "-private.pem");
  }

  public Path publicKeyPath(int keyVersion) {
    return directory.resolve("v" + keyVersion + "-public.pem");
  }

  /**
   * Writes both halves of a key pair. Existing files for the version are never overwritten.
   *
   * @param keyPair the key pair
   */
  public void save(SigningKeyPair keyPair) {
    Path privatePath = privateKeyPath(keyPair.keyVersion());
    Path publicPath = publicKeyPath(keyPair.keyVersion());
    if (Files.exists(privatePath) || Files.exists(publicPath)) {
      throw new KeyRepositoryException("Key version " + keyPair.keyVersion() + " already exists in " + directory);
    }
    try {
      if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
        Files.createFile(privatePath,
            PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
      }
      Files.writeString(privatePath, pem(PRIVATE_TYPE, keyPair.privateKey().getEncoded()), StandardCharsets.US_ASCII);
      Files.writeString(publicPath, PublicKeyCodec.toPem(keyPair.publicKey()), StandardCharsets.US_ASCII);
    } catch (IOException e) {
      throw new KeyRepositoryException("Unable to write key version " + keyPair.keyVersion(), e);
    }
    log.info("Saved key version {} to {}", keyPair.keyVersion(), directory);
  }

  /**
   * Loads every private key pair, ascending by version.
   *
   * @return the key pairs
   */
  public List<SigningKeyPair> loadAll() {
    List<SigningKeyPair> pairs = new ArrayList<>();
    for (int version : versions(PRIVATE_FILE)) {
      pairs.add(load(version));
    }
    pairs.sort(Comparator.comparingInt(SigningKeyPair::keyVersion));
    return pairs;
  }

  /**
   * Loads one key pair and checks that its halves belong together.
   *
   * @param keyVersion the key version
   * @return the signing key pair
   */
  public SigningKeyPair load(int keyVersion) {
    RSAPublicKey publicKey = loadPublic(keyVersion);
    RSAPrivateCrtKey privateKey;
    try {
      byte[] der = readPem(privateKeyPath(keyVersion), PRIVATE_TYPE);
      privateKey = (RSAPrivateCrtKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
    } catch (GeneralSecurityException | ClassCastException e) {
      throw new KeyRepositoryException("Invalid private key for version " + keyVersion, e);
    }
    if (!privateKey.getModulus().equals(publicKey.getModulus())) {
      throw new KeyRepositoryException("Public and private key files for version " + keyVersion + " do not match");
    }
    return new SigningKeyPair(keyVersion, new KeyPair(publicKey, privateKey));
  }

  /**
   * Loads one public key.
   *
   * @param keyVersion the key version
   * @return the rsa public key
   */
  public RSAPublicKey loadPublic(int keyVersion) {
    Path path = publicKeyPath(keyVersion);
    try {
      return PublicKeyCodec.fromPem(Files.readString(path, StandardCharsets.US_ASCII));
    } catch (IOException e) {
      throw new KeyRepositoryException("Unable to read " + path, e);
    }
  }

  /**
   * Builds a key ring from the public key files, keeping the newest {@code retention + 1}
   * versions.
   *
   * @param retention how many versions before the newest to keep
   * @return the key ring
   */
  public KeyRing loadKeyRing(int retention) {
    TreeMap<Integer, RSAPublicKey> keys = new TreeMap<>();
    for (int version : versions(PUBLIC_FILE)) {
      keys.put(version, loadPublic(version));
    }
    if (keys.isEmpty()) {
      throw new KeyRepositoryException("No public keys in " + directory);
    }
    while (keys.size() > retention + 1) {
      keys.pollFirstEntry();
    }
    return KeyRing.of(keys);
  }

  private List<Integer> versions(Pattern pattern) {
    List<Integer> versions = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
      for (Path file : files) {
        Matcher matcher = pattern.matcher(file.getFileName().toString());
        if (matcher.matches()) {
          versions.add(Integer.parseInt(matcher.group(1)));
        }
      }
    } catch (IOException e) {
      throw new KeyRepositoryException("Unable to list " + directory, e);
    }
    versions.sort(null);
    return versions;
  }

  private static String pem(String type, byte[] der) throws IOException {
    StringWriter out = new StringWriter();
    try (PemWriter writer = new PemWriter(out)) {
      writer.writeObject(new PemObject(type, der));
    }
    return out.toString();
  }

  private static byte[] readPem(Path path, String type) {
    try (PemReader reader = new PemReader(new StringReader(Files.readString(path, StandardCharsets.US_ASCII)))) {
      PemObject object = reader.readPemObject();
      if (object == null || !type.equals(object.getType())) {
        throw new KeyRepositoryException(path + " does not contain a " + type);
      }
      return object.getContent();
    } catch (IOException e) {
      throw new KeyRepositoryException("Unable to read " + path, e);
    }
  }
}
