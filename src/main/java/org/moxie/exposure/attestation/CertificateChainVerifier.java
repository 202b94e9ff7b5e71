package org.moxie.exposure.attestation;

import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;
import java.io.ByteArrayInputStream;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.CertificateParsingException;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static org.moxie.exposure.attestation.AttestationException.Reason.EXPIRED_CERTIFICATE;
import static org.moxie.exposure.attestation.AttestationException.Reason.IDENTITY_MISMATCH;
import static org.moxie.exposure.attestation.AttestationException.Reason.MALFORMED_STATEMENT;
import static org.moxie.exposure.attestation.AttestationException.Reason.REVOKED_CERTIFICATE;
import static org.moxie.exposure.attestation.AttestationException.Reason.SIGNATURE_INVALID;
import static org.moxie.exposure.attestation.AttestationException.Reason.UNSUPPORTED_ALGORITHM;
import static org.moxie.exposure.attestation.AttestationException.Reason.UNTRUSTED_CHAIN;

/**
 * Establishes that a signed statement was produced by the attestation service: the {@code x5c}
 * chain leads to a trusted root, the leaf certificate is issued to the expected hostname, and the
 * leaf key signed the statement.
 * <p>
 * Checks run cheapest first, so a statement with a bad chain or identity never reaches the
 * signature verification.
 */
public class CertificateChainVerifier {

  private static final Logger log = LoggerFactory.getLogger(CertificateChainVerifier.class);

  public static final String DEFAULT_HOSTNAME = "attest.android.com";

  private static final int SAN_DNS_NAME                = 2;
  private static final int KEY_USAGE_DIGITAL_SIGNATURE = 0;
  private static final int KEY_USAGE_CERT_SIGN         = 5;

  private final TrustedRoots trustedRoots;
  private final String       hostname;

  public CertificateChainVerifier(TrustedRoots trustedRoots) {
    this(trustedRoots, DEFAULT_HOSTNAME);
  }

  public CertificateChainVerifier(TrustedRoots trustedRoots, String hostname) {
    this.trustedRoots = Objects.requireNonNull(trustedRoots, "Trusted roots cannot be null");
    this.hostname     = Objects.requireNonNull(hostname, "Hostname cannot be null").toLowerCase(Locale.ROOT);
  }

  /**
   * Verify the statement's certificate chain, signer identity and signature.
   *
   * @param statement parsed statement
   * @param now       instant at which every certificate must be valid
   * @return the leaf certificate that signed the statement
   */
  public X509Certificate verify(SignedStatement statement, Instant now) throws AttestationException {
    List<X509Certificate> chain = decodeChain(statement.certificateChain());

    Date            date     = Date.from(now);
    AnchoredPath    anchored = verifyChain(chain, date);

    validatePath(anchored, date);

    X509Certificate leaf = chain.get(0);

    checkSigner(leaf);
    verifyIdentity(leaf);
    verifySignature(statement, leaf);

    log.debug("Attestation signed by {}", leaf.getSubjectX500Principal());
    return leaf;
  }

  private List<X509Certificate> decodeChain(List<byte[]> encoded) throws AttestationException {
    List<X509Certificate> chain = new ArrayList<>(encoded.size());

    try {
      CertificateFactory certFactory = CertificateFactory.getInstance("X.509");

      for (byte[] der : encoded) {
        chain.add((X509Certificate) certFactory.generateCertificate(new ByteArrayInputStream(der)));
      }
    } catch (CertificateException e) {
      throw new AttestationException(MALFORMED_STATEMENT, "unable to parse attestation certificate chain", e);
    }

    return chain;
  }

  /**
   * Certificates from the leaf up to, but excluding, the trust anchor that issued the last of them.
   */
  private record AnchoredPath(List<X509Certificate> certificates, X509Certificate anchor) {}

  private AnchoredPath verifyChain(List<X509Certificate> chain, Date now) throws AttestationException {
    for (int i = 0; i < chain.size(); i++) {
      X509Certificate cert = chain.get(i);

      checkValidity(cert, now);

      if (trustedRoots.anchors().contains(cert)) {
        log.debug("Certificate chain terminates at trusted root {}", cert.getSubjectX500Principal());
        return new AnchoredPath(List.copyOf(chain.subList(0, i)), cert);
      }

      Optional<X509Certificate> anchor = findIssuingAnchor(cert);

      if (anchor.isPresent()) {
        checkValidity(anchor.get(), now);
        checkRevocation(cert, anchor.get());
        log.debug("Certificate chain anchored at trusted root {}", anchor.get().getSubjectX500Principal());
        return new AnchoredPath(List.copyOf(chain.subList(0, i + 1)), anchor.get());
      }

      if (i + 1 >= chain.size()) {
        throw new AttestationException(UNTRUSTED_CHAIN,
                                       "certificate chain does not lead to a trusted root, last issuer: " + cert.getIssuerX500Principal());
      }

      X509Certificate issuer = chain.get(i + 1);

      if (!issuer.getSubjectX500Principal().equals(cert.getIssuerX500Principal())) {
        throw new AttestationException(UNTRUSTED_CHAIN, "certificate " + i + " was not issued by certificate " + (i + 1));
      }

      try {
        cert.verify(issuer.getPublicKey());
      } catch (GeneralSecurityException e) {
        throw new AttestationException(UNTRUSTED_CHAIN, "certificate " + i + " is not signed by certificate " + (i + 1), e);
      }

      checkIssuerConstraints(issuer, i);
      checkRevocation(cert, issuer);
    }

    throw new AttestationException(UNTRUSTED_CHAIN, "certificate chain does not lead to a trusted root");
  }

  /**
   * Run the anchored path through the PKIX validator, which also enforces name constraints and
   * rejects unrecognized critical extensions. Revocation stays with {@link #checkRevocation}.
   */
  private static void validatePath(AnchoredPath anchored, Date now) throws AttestationException {
    if (anchored.certificates().isEmpty()) {
      return;
    }

    try {
      CertPath       certPath = CertificateFactory.getInstance("X.509").generateCertPath(anchored.certificates());
      PKIXParameters params   = new PKIXParameters(Set.of(new TrustAnchor(anchored.anchor(), null)));

      params.setDate(now);
      params.setRevocationEnabled(false);

      CertPathValidator.getInstance("PKIX").validate(certPath, params);
    } catch (CertPathValidatorException e) {
      if (e.getReason() == CertPathValidatorException.BasicReason.EXPIRED
          || e.getReason() == CertPathValidatorException.BasicReason.NOT_YET_VALID)
      {
        throw new AttestationException(EXPIRED_CERTIFICATE, "certificate path is not valid at " + now.toInstant() + ": " + e.getMessage(), e);
      }

      throw new AttestationException(UNTRUSTED_CHAIN, "certificate path rejected: " + e.getMessage(), e);
    } catch (GeneralSecurityException e) {
      throw new AttestationException(UNTRUSTED_CHAIN, "unable to validate certificate path", e);
    }
  }

  private static void checkSigner(X509Certificate leaf) throws AttestationException {
    if (leaf.getBasicConstraints() >= 0) {
      throw new AttestationException(UNTRUSTED_CHAIN, "attestation signer " + leaf.getSubjectX500Principal() + " is a CA certificate");
    }

    boolean[] keyUsage = leaf.getKeyUsage();

    if (keyUsage != null && (keyUsage.length <= KEY_USAGE_DIGITAL_SIGNATURE || !keyUsage[KEY_USAGE_DIGITAL_SIGNATURE])) {
      throw new AttestationException(UNTRUSTED_CHAIN, "attestation signer " + leaf.getSubjectX500Principal() + " may not sign data");
    }
  }

  private Optional<X509Certificate> findIssuingAnchor(X509Certificate cert) {
    for (X509Certificate anchor : trustedRoots.anchors()) {
      if (!anchor.getSubjectX500Principal().equals(cert.getIssuerX500Principal())) {
        continue;
      }

      try {
        cert.verify(anchor.getPublicKey());
        return Optional.of(anchor);
      } catch (GeneralSecurityException e) {
        log.debug("Trusted root {} shares the issuer name but did not sign the certificate: {}",
                  anchor.getSubjectX500Principal(), e.getMessage());
      }
    }

    return Optional.empty();
  }

  /**
   * @param issuer         CA certificate
   * @param intermediates  number of intermediate CA certificates between the issuer and the leaf
   */
  private static void checkIssuerConstraints(X509Certificate issuer, int intermediates) throws AttestationException {
    int pathLength = issuer.getBasicConstraints();

    if (pathLength < 0) {
      throw new AttestationException(UNTRUSTED_CHAIN, "issuer " + issuer.getSubjectX500Principal() + " is not a CA");
    }

    if (intermediates > pathLength) {
      throw new AttestationException(UNTRUSTED_CHAIN, "path length constraint of " + issuer.getSubjectX500Principal() + " exceeded");
    }

    boolean[] keyUsage = issuer.getKeyUsage();

    if (keyUsage != null && (keyUsage.length <= KEY_USAGE_CERT_SIGN || !keyUsage[KEY_USAGE_CERT_SIGN])) {
      throw new AttestationException(UNTRUSTED_CHAIN, "issuer " + issuer.getSubjectX500Principal() + " may not sign certificates");
    }
  }

  private static void checkValidity(X509Certificate cert, Date now) throws AttestationException {
    try {
      cert.checkValidity(now);
    } catch (CertificateExpiredException | CertificateNotYetValidException e) {
      throw new AttestationException(EXPIRED_CERTIFICATE,
                                     "certificate " + cert.getSubjectX500Principal() + " is not valid at " + now.toInstant(), e);
    }
  }

  private void checkRevocation(X509Certificate cert, X509Certificate issuer) throws AttestationException {
    for (X509CRL crl : trustedRoots.crls()) {
      if (!crl.getIssuerX500Principal().equals(issuer.getSubjectX500Principal())) {
        continue;
      }

      try {
        crl.verify(issuer.getPublicKey());
      } catch (GeneralSecurityException e) {
        log.warn("Ignoring CRL for {} that does not verify against its issuer", crl.getIssuerX500Principal(), e);
        continue;
      }

      if (crl.isRevoked(cert)) {
        throw new AttestationException(REVOKED_CERTIFICATE,
                                       "certificate " + cert.getSubjectX500Principal() + " serial " + cert.getSerialNumber() + " is revoked");
      }
    }
  }

  private void verifyIdentity(X509Certificate leaf) throws AttestationException {
    List<String> names = dnsNames(leaf);

    if (names.isEmpty()) {
      commonName(leaf).ifPresent(names::add);
    }

    for (String name : names) {
      if (matchesHostname(name.toLowerCase(Locale.ROOT))) {
        return;
      }
    }

    throw new AttestationException(IDENTITY_MISMATCH, "attestation certificate is not issued to " + hostname + ", got " + names);
  }

  private boolean matchesHostname(String pattern) {
    if (pattern.startsWith("*.")) {
      String suffix = pattern.substring(1);
      String label  = hostname.endsWith(suffix) ? hostname.substring(0, hostname.length() - suffix.length()) : "";

      return !label.isEmpty() && label.indexOf('.') == -1;
    }

    return pattern.equals(hostname);
  }

  private static List<String> dnsNames(X509Certificate leaf) throws AttestationException {
    List<String> names = new ArrayList<>();

    try {
      Collection<List<?>> altNames = leaf.getSubjectAlternativeNames();

      if (altNames != null) {
        for (List<?> altName : altNames) {
          if (altName.size() >= 2 && Integer.valueOf(SAN_DNS_NAME).equals(altName.get(0)) && altName.get(1) instanceof String dnsName) {
            names.add(dnsName);
          }
        }
      }
    } catch (CertificateParsingException e) {
      throw new AttestationException(MALFORMED_STATEMENT, "unable to read attestation certificate subject alternative names", e);
    }

    return names;
  }

  private static Optional<String> commonName(X509Certificate leaf) throws AttestationException {
    try {
      LdapName subject = new LdapName(leaf.getSubjectX500Principal().getName(X500Principal.RFC2253));

      for (Rdn rdn : subject.getRdns()) {
        if ("CN".equalsIgnoreCase(rdn.getType())) {
          return Optional.of(rdn.getValue().toString());
        }
      }

      return Optional.empty();
    } catch (InvalidNameException e) {
      throw new AttestationException(MALFORMED_STATEMENT, "unable to read attestation certificate subject", e);
    }
  }

  private static void verifySignature(SignedStatement statement, X509Certificate leaf) throws AttestationException {
    Algorithm algorithm = algorithmFor(statement.algorithm(), leaf.getPublicKey());

    try {
      algorithm.verify(statement.decoded());
    } catch (SignatureVerificationException e) {
      throw new AttestationException(SIGNATURE_INVALID, "attestation signature does not verify", e);
    }
  }

  private static Algorithm algorithmFor(String alg, PublicKey key) throws AttestationException {
    return switch (alg) {
      case "RS256" -> Algorithm.RSA256(rsaKey(alg, key));
      case "RS384" -> Algorithm.RSA384(rsaKey(alg, key));
      case "RS512" -> Algorithm.RSA512(rsaKey(alg, key));
      case "ES256" -> Algorithm.ECDSA256(ecKey(alg, key));
      case "ES384" -> Algorithm.ECDSA384(ecKey(alg, key));
      case "ES512" -> Algorithm.ECDSA512(ecKey(alg, key));
      default      -> throw new AttestationException(UNSUPPORTED_ALGORITHM, "unsupported attestation signing algorithm: " + alg);
    };
  }

  private static RSAPublicKey rsaKey(String alg, PublicKey key) throws AttestationException {
    if (key instanceof RSAPublicKey rsaKey) {
      return rsaKey;
    }

    throw new AttestationException(SIGNATURE_INVALID, alg + " statement signed by a " + key.getAlgorithm() + " certificate");
  }

  private static ECPublicKey ecKey(String alg, PublicKey key) throws AttestationException {
    if (key instanceof ECPublicKey ecKey) {
      return ecKey;
    }

    throw new AttestationException(SIGNATURE_INVALID, alg + " statement signed by a " + key.getAlgorithm() + " certificate");
  }
}
