package io.netguard.infrastructure.intercept;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Writer;
import java.math.BigInteger;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Local root certificate authority that issues per-host leaf certificates for TLS
 * interception.
 * <p><strong>Why:</strong> The proxy can only read HTTPS traffic when the browser accepts the certificates it
 * presents; the user installs this root once and every leaf chains to it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the root key pair and certificate on first use and keep them in a PKCS#12 keystore.</li>
 *   <li>Export the root certificate as PEM for installation in the browser or OS trust store.</li>
 *   <li>Issue and cache a server {@link SSLContext} per host name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Issued contexts are cached in a concurrent map; concurrent first requests
 * for one host may both sign a leaf, and the first stored wins.</p>
 *
 * @since 0.1.0
 */
public final class CertificateAuthority {
  private static final Logger log = LoggerFactory.getLogger(CertificateAuthority.class);

  public static final String KEYSTORE_FILE = "netguard-ca.p12";
  public static final String PEM_FILE = "netguard-ca.pem";
  static final String ROOT_ALIAS = "netguard-root";
  private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
  private static final Duration ROOT_VALIDITY = Duration.ofDays(3650);
  private static final Duration LEAF_VALIDITY = Duration.ofDays(397);
  private static final Duration BACKDATE = Duration.ofDays(1);
  private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

  private final X509Certificate rootCertificate;
  private final PrivateKey rootKey;
  private final KeyPair leafKeys;
  private final Path pemFile;
  private final SecureRandom random = new SecureRandom();
  private final Map<String, SSLContext> contexts = new ConcurrentHashMap<>();

  private CertificateAuthority(X509Certificate rootCertificate, PrivateKey rootKey, Path pemFile)
      throws GeneralSecurityException {
    this.rootCertificate = rootCertificate;
    this.rootKey = rootKey;
    this.leafKeys = generateKeyPair();
    this.pemFile = pemFile;
  }

  /**
   * Loads the authority from {@code directory}, creating the root keystore and PEM export when absent.
   *
   * @param directory directory holding {@value #KEYSTORE_FILE} and {@value #PEM_FILE}
   * @param password keystore password
   * @return ready authority
   * @throws IOException if the keystore cannot be read or written
   * @throws GeneralSecurityException if key generation, signing or keystore decoding fails
   */
  public static CertificateAuthority loadOrCreate(Path directory, char[] password)
      throws IOException, GeneralSecurityException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(password, "password");
    Files.createDirectories(directory);
    Path keystoreFile = directory.resolve(KEYSTORE_FILE);
    Path pemFile = directory.resolve(PEM_FILE);
    KeyStore keyStore = KeyStore.getInstance("PKCS12");
    if (Files.exists(keystoreFile)) {
      try (InputStream in = Files.newInputStream(keystoreFile)) {
        keyStore.load(in, password);
      }
      Certificate certificate = keyStore.getCertificate(ROOT_ALIAS);
      PrivateKey key = (PrivateKey) keyStore.getKey(ROOT_ALIAS, password);
      if (!(certificate instanceof X509Certificate root) || key == null) {
        throw new GeneralSecurityException("Keystore " + keystoreFile + " has no " + ROOT_ALIAS + " entry");
      }
      CertificateAuthority ca = new CertificateAuthority(root, key, pemFile);
      if (!Files.exists(pemFile)) {
        ca.writePem();
      }
      log.info("Loaded interception root CA {} (expires {})",
          root.getSubjectX500Principal().getName(), root.getNotAfter().toInstant());
      return ca;
    }

    KeyPair rootKeys = generateKeyPair();
    X509Certificate root = createRoot(rootKeys);
    keyStore.load(null, password);
    keyStore.setKeyEntry(ROOT_ALIAS, rootKeys.getPrivate(), password, new Certificate[] {root});
    try (OutputStream out = Files.newOutputStream(keystoreFile)) {
      keyStore.store(out, password);
    }
    CertificateAuthority ca = new CertificateAuthority(root, rootKeys.getPrivate(), pemFile);
    ca.writePem();
    log.info("Created interception root CA; install {} in the browser trust store", pemFile);
    return ca;
  }

  /**
   * Returns a source that runs {@link #loadOrCreate(Path, char[])} on first use and reuses the result.
   *
   * @param directory keystore directory
   * @param password keystore password
   * @return memoizing source
   */
  public static Source lazy(Path directory, char[] password) {
    Objects.requireNonNull(directory, "directory");
    char[] secret = Objects.requireNonNull(password, "password").clone();
    return new Source() {
      private CertificateAuthority loaded;

      @Override
      public synchronized CertificateAuthority get() throws IOException, GeneralSecurityException {
        if (loaded == null) {
          loaded = loadOrCreate(directory, secret);
        }
        return loaded;
      }
    };
  }

  public X509Certificate rootCertificate() {
    return rootCertificate;
  }

  public Path pemFile() {
    return pemFile;
  }

  /**
   * Returns a server-side TLS context presenting a leaf certificate for {@code host}.
   *
   * @param host host name or IP literal from the CONNECT request
   * @return cached or newly issued context
   * @throws GeneralSecurityException if the leaf cannot be signed
   */
  public SSLContext serverContext(String host) throws GeneralSecurityException {
    String key = Objects.requireNonNull(host, "host").toLowerCase(Locale.ROOT);
    SSLContext existing = contexts.get(key);
    if (existing != null) {
      return existing;
    }
    SSLContext created = buildContext(issueLeaf(key));
    SSLContext raced = contexts.putIfAbsent(key, created);
    return raced == null ? created : raced;
  }

  /**
   * Signs a leaf certificate for {@code host} with the root key.
   *
   * @param host DNS name or IP literal placed in the subject alternative name
   * @return leaf certificate
   * @throws GeneralSecurityException if signing fails
   */
  public X509Certificate issueLeaf(String host) throws GeneralSecurityException {
    Instant now = Instant.now();
    X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        X500Name.getInstance(rootCertificate.getSubjectX500Principal().getEncoded()),
        new BigInteger(64, random).abs().add(BigInteger.ONE),
        Date.from(now.minus(BACKDATE)),
        Date.from(now.plus(LEAF_VALIDITY)),
        new X500Name("CN=" + host + ", O=NetGuard Interception"),
        leafKeys.getPublic());
    try {
      JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();
      GeneralName name = isIpLiteral(host)
          ? new GeneralName(GeneralName.iPAddress, host)
          : new GeneralName(GeneralName.dNSName, host);
      builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
      builder.addExtension(Extension.keyUsage, true,
          new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));
      builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth));
      builder.addExtension(Extension.subjectAlternativeName, false, new GeneralNames(name));
      builder.addExtension(Extension.subjectKeyIdentifier, false,
          utils.createSubjectKeyIdentifier(leafKeys.getPublic()));
      builder.addExtension(Extension.authorityKeyIdentifier, false,
          utils.createAuthorityKeyIdentifier(rootCertificate));
      return sign(builder, rootKey);
    } catch (IOException ex) {
      throw new GeneralSecurityException("Failed to encode certificate extensions for " + host, ex);
    }
  }

  private static X509Certificate createRoot(KeyPair keys) throws GeneralSecurityException {
    Instant now = Instant.now();
    X500Name subject = new X500Name("CN=NetGuard Local Root CA, O=NetGuard");
    X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        subject,
        BigInteger.valueOf(now.toEpochMilli()),
        Date.from(now.minus(BACKDATE)),
        Date.from(now.plus(ROOT_VALIDITY)),
        subject,
        keys.getPublic());
    try {
      JcaX509ExtensionUtils utils = new JcaX509ExtensionUtils();
      builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(0));
      builder.addExtension(Extension.keyUsage, true,
          new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature));
      builder.addExtension(Extension.subjectKeyIdentifier, false,
          utils.createSubjectKeyIdentifier(keys.getPublic()));
      return sign(builder, keys.getPrivate());
    } catch (IOException ex) {
      throw new GeneralSecurityException("Failed to encode root certificate extensions", ex);
    }
  }

  private static X509Certificate sign(X509v3CertificateBuilder builder, PrivateKey key)
      throws GeneralSecurityException {
    try {
      ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(key);
      return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    } catch (OperatorCreationException ex) {
      throw new GeneralSecurityException("Unable to create " + SIGNATURE_ALGORITHM + " signer", ex);
    }
  }

  private SSLContext buildContext(X509Certificate leaf) throws GeneralSecurityException {
    char[] transientPassword = "netguard-leaf".toCharArray();
    KeyStore store = KeyStore.getInstance("PKCS12");
    try {
      store.load(null, transientPassword);
    } catch (IOException ex) {
      throw new GeneralSecurityException("Unable to initialise in-memory keystore", ex);
    }
    store.setKeyEntry("leaf", leafKeys.getPrivate(), transientPassword, new Certificate[] {leaf, rootCertificate});
    KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    kmf.init(store, transientPassword);
    SSLContext context = SSLContext.getInstance("TLS");
    context.init(kmf.getKeyManagers(), null, random);
    return context;
  }

  private void writePem() throws IOException {
    try (Writer writer = Files.newBufferedWriter(pemFile, StandardCharsets.US_ASCII);
         JcaPEMWriter pem = new JcaPEMWriter(writer)) {
      pem.writeObject(rootCertificate);
    }
  }

  private static KeyPair generateKeyPair() throws GeneralSecurityException {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    return generator.generateKeyPair();
  }

  private static boolean isIpLiteral(String host) {
    if (IPV4.matcher(host).matches()) {
      return true;
    }
    if (host.indexOf(':') < 0) {
      return false;
    }
    try {
      InetAddress.getByName(host);
      return true;
    } catch (IOException ex) {
      return false;
    }
  }

  /** Supplies the authority when the proxy starts. */
  @FunctionalInterface
  public interface Source {
    CertificateAuthority get() throws IOException, GeneralSecurityException;
  }
}
