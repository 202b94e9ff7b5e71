package org.moxie.exposure.attestation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CRL;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.CRLException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable set of certificates trusted to anchor attestation certificate chains,
 * plus any revocation lists available for the certificates they issue.
 * Loaded once and shared read-only between verifications.
 */
public final class TrustedRoots {

  private static final Logger log = LoggerFactory.getLogger(TrustedRoots.class);

  private final List<X509Certificate> anchors;
  private final List<X509CRL>         crls;

  public TrustedRoots(Collection<X509Certificate> anchors, Collection<X509CRL> crls) {
    if (anchors == null || anchors.isEmpty()) {
      throw new IllegalStateException("At least one trusted root certificate is required");
    }

    this.anchors = List.copyOf(anchors);
    this.crls    = crls == null ? List.of() : List.copyOf(crls);
  }

  public static TrustedRoots of(X509Certificate... anchors) {
    return new TrustedRoots(List.of(anchors), List.of());
  }

  /**
   * Load root certificates from a PEM (or DER) bundle.
   */
  public static TrustedRoots fromPem(InputStream certificates) throws CertificateException {
    return new TrustedRoots(readCertificates(certificates), List.of());
  }

  public static TrustedRoots fromPath(Path certificates) throws IOException, CertificateException {
    try (InputStream is = Files.newInputStream(certificates)) {
      return fromPem(is);
    }
  }

  public static TrustedRoots fromClasspath(String resource) throws IOException, CertificateException {
    try (InputStream is = TrustedRoots.class.getResourceAsStream(resource)) {
      if (is == null) {
        throw new IOException("Trusted root resource not found: " + resource);
      }

      return fromPem(is);
    }
  }

  /**
   * Return a copy of this root set with additional revocation lists.
   */
  public TrustedRoots withCrls(InputStream crlData) throws CRLException, CertificateException {
    List<X509CRL> combined = new ArrayList<>(crls);

    for (CRL crl : CertificateFactory.getInstance("X.509").generateCRLs(crlData)) {
      if (crl instanceof X509CRL x509Crl) {
        combined.add(x509Crl);
        log.debug("Loaded CRL from: {}", x509Crl.getIssuerX500Principal());
      }
    }

    return new TrustedRoots(anchors, combined);
  }

  public List<X509Certificate> anchors() {
    return anchors;
  }

  public List<X509CRL> crls() {
    return crls;
  }

  private static List<X509Certificate> readCertificates(InputStream is) throws CertificateException {
    List<X509Certificate> certificates = new ArrayList<>();

    for (Certificate cert : CertificateFactory.getInstance("X.509").generateCertificates(is)) {
      if (cert instanceof X509Certificate x509Cert) {
        certificates.add(x509Cert);
        log.debug("Loaded root certificate: {}", x509Cert.getSubjectX500Principal());
      }
    }

    if (certificates.isEmpty()) {
      throw new IllegalStateException("No root certificates loaded from resource");
    }

    return certificates;
  }
}
