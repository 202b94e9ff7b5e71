package org.moxie.exposure.config;


import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class Config {

  public static final String DEFAULT_TRUSTED_ROOTS_RESOURCE = "/attestation_roots.pem";

  @Inject
  @ConfigProperty(name = "attestation.hostname", defaultValue = "attest.android.com")
  private String attestationHostname;

  @Inject
  @ConfigProperty(name = "attestation.trusted_roots.path")
  private Optional<String> trustedRootsPath;

  @Inject
  @ConfigProperty(name = "attestation.crl.path")
  private Optional<String> crlPath;

  public String getAttestationHostname() {
    return attestationHostname;
  }

  /**
   * PEM bundle of trusted roots. When absent the bundled {@value #DEFAULT_TRUSTED_ROOTS_RESOURCE} is used.
   */
  public Optional<String> getTrustedRootsPath() {
    return trustedRootsPath == null ? Optional.empty() : trustedRootsPath;
  }

  public Optional<String> getCrlPath() {
    return crlPath == null ? Optional.empty() : crlPath;
  }
}
