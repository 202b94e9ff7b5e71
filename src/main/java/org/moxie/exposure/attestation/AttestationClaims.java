package org.moxie.exposure.attestation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Claims asserted by a device attestation statement.
 *
 * @param nonce                      base64 of the nonce the device was asked to bind
 * @param timestampMs                when the attestation was produced, in Unix milliseconds
 * @param apkPackageName             package name of the calling app
 * @param apkDigestSha256            base64 SHA-256 of the calling APK
 * @param apkCertificateDigestSha256 base64 SHA-256 digests of the APK signing certificates
 * @param ctsProfileMatch            device passed the stricter compatibility profile check
 * @param basicIntegrity             device passed the basic integrity check
 * @param evaluationType             how the verdict was evaluated, e.g. {@code BASIC} or {@code HARDWARE_BACKED}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AttestationClaims(
  @JsonProperty("nonce") String nonce,
  @JsonProperty("timestampMs") long timestampMs,
  @JsonProperty("apkPackageName") String apkPackageName,
  @JsonProperty("apkDigestSha256") String apkDigestSha256,
  @JsonProperty("apkCertificateDigestSha256") List<String> apkCertificateDigestSha256,
  @JsonProperty("ctsProfileMatch") boolean ctsProfileMatch,
  @JsonProperty("basicIntegrity") boolean basicIntegrity,
  @JsonProperty("evaluationType") String evaluationType
) {
  public AttestationClaims {
    nonce                      = nonce == null ? "" : nonce;
    apkPackageName             = apkPackageName == null ? "" : apkPackageName;
    apkDigestSha256            = apkDigestSha256 == null ? "" : apkDigestSha256;
    apkCertificateDigestSha256 = apkCertificateDigestSha256 == null ? List.of() : List.copyOf(apkCertificateDigestSha256);
    evaluationType             = evaluationType == null ? "" : evaluationType;
  }

  /**
   * @return attestation time truncated to whole Unix seconds
   */
  @JsonIgnore
  public long timestampSeconds() {
    return timestampMs / 1000;
  }
}
