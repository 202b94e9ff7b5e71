package org.moxie.exposure.producers;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.moxie.exposure.attestation.AttestationClaimsDecoder;
import org.moxie.exposure.attestation.AttestationValidator;
import org.moxie.exposure.attestation.CertificateChainVerifier;
import org.moxie.exposure.attestation.TrustedRoots;
import org.moxie.exposure.config.Config;
import org.moxie.exposure.publish.PublishAttestationVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Optional;

/**
 * CDI producer for the device attestation validator and its trusted root store.
 * Fails closed: the application does not start without a usable root store.
 */
@ApplicationScoped
public class AttestationValidatorProducer {

  private static final Logger log = LoggerFactory.getLogger(AttestationValidatorProducer.class);

  @Inject
  Config config;

  @Inject
  ObjectMapper mapper;

  @Inject
  Clock clock;

  /**
   * Loads the trusted roots from the configured path, or the bundled roots when none is configured.
   *
   * @return Trusted root store
   * @throws IllegalStateException if the roots or revocation lists cannot be loaded
   */
  @Produces
  @ApplicationScoped
  public TrustedRoots produceTrustedRoots() {
    try {
      Optional<String> rootsPath = config.getTrustedRootsPath();
      TrustedRoots     roots     = rootsPath.isPresent()
                                   ? TrustedRoots.fromPath(Path.of(rootsPath.get()))
                                   : TrustedRoots.fromClasspath(Config.DEFAULT_TRUSTED_ROOTS_RESOURCE);

      log.info("Loaded {} attestation root certificate(s) from {}",
               roots.anchors().size(), rootsPath.orElse(Config.DEFAULT_TRUSTED_ROOTS_RESOURCE));

      if (config.getCrlPath().isPresent()) {
        try (InputStream is = Files.newInputStream(Path.of(config.getCrlPath().get()))) {
          roots = roots.withCrls(is);
        }

        log.info("Loaded {} attestation CRL(s) from {}", roots.crls().size(), config.getCrlPath().get());
      }

      return roots;
    } catch (IOException | GeneralSecurityException e) {
      throw new IllegalStateException("Unable to load attestation trusted roots", e);
    }
  }

  @Produces
  @ApplicationScoped
  public AttestationValidator produceAttestationValidator(TrustedRoots trustedRoots) {
    CertificateChainVerifier chainVerifier = new CertificateChainVerifier(trustedRoots, config.getAttestationHostname());
    AttestationClaimsDecoder claimsDecoder = new AttestationClaimsDecoder(mapper);

    log.info("Device attestation validator expecting signer {}", config.getAttestationHostname());
    return new AttestationValidator(chainVerifier, claimsDecoder, clock);
  }

  @Produces
  @ApplicationScoped
  public PublishAttestationVerifier producePublishAttestationVerifier(AttestationValidator validator) {
    return new PublishAttestationVerifier(validator, clock);
  }
}
