package org.moxie.exposure.attestation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

import static org.moxie.exposure.attestation.AttestationException.Reason.APP_MISMATCH;
import static org.moxie.exposure.attestation.AttestationException.Reason.DIGEST_MISMATCH;
import static org.moxie.exposure.attestation.AttestationException.Reason.INTEGRITY_FAILED;
import static org.moxie.exposure.attestation.AttestationException.Reason.MISSING_NONCE;
import static org.moxie.exposure.attestation.AttestationException.Reason.MISSING_TIME_BOUNDS;
import static org.moxie.exposure.attestation.AttestationException.Reason.NONCE_MISMATCH;
import static org.moxie.exposure.attestation.AttestationException.Reason.PROFILE_MISMATCH;
import static org.moxie.exposure.attestation.AttestationException.Reason.TOO_NEW;
import static org.moxie.exposure.attestation.AttestationException.Reason.TOO_OLD;

/**
 * Validates a device attestation statement against a {@link VerifyOptions} policy.
 * <p>
 * Checks run in a fixed order and stop at the first failure: statement format, certificate chain
 * and signature, claims format, nonce, time window, app identity, then integrity verdicts.
 * Instances hold no per-call state and may be shared between threads.
 */
public class AttestationValidator {

  private static final Logger log = LoggerFactory.getLogger(AttestationValidator.class);

  private final CertificateChainVerifier chainVerifier;
  private final AttestationClaimsDecoder claimsDecoder;
  private final Clock                    clock;

  public AttestationValidator(CertificateChainVerifier chainVerifier, AttestationClaimsDecoder claimsDecoder, Clock clock) {
    this.chainVerifier = Objects.requireNonNull(chainVerifier, "Chain verifier cannot be null");
    this.claimsDecoder = Objects.requireNonNull(claimsDecoder, "Claims decoder cannot be null");
    this.clock         = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  /**
   * Verify that a statement is authentic and return its claims, without applying any policy.
   *
   * @param rawStatement statement text as received from the device
   * @return decoded claims of an authentic statement
   * @throws AttestationException if the statement is malformed or not trusted
   */
  public AttestationClaims verifyAttestation(String rawStatement) throws AttestationException {
    return verifyAttestation(rawStatement, clock.instant());
  }

  /**
   * Verify a statement and check its claims against the given policy.
   *
   * @param rawStatement statement text as received from the device
   * @param options      policy to enforce
   * @throws AttestationException describing the first failed check
   */
  public void validate(String rawStatement, VerifyOptions options) throws AttestationException {
    Objects.requireNonNull(options, "Verify options cannot be null");

    Instant           now    = clock.instant();
    AttestationClaims claims = verifyAttestation(rawStatement, now);

    checkNonce(claims, options);
    checkTimestamp(claims, options);
    checkIdentity(claims, options);
    checkIntegrity(claims, options);

    log.debug("Attestation accepted for {} at {}", claims.apkPackageName(), claims.timestampSeconds());
  }

  private AttestationClaims verifyAttestation(String rawStatement, Instant now) throws AttestationException {
    SignedStatement statement = SignedStatement.parse(rawStatement);

    chainVerifier.verify(statement, now);

    return claimsDecoder.decode(statement.payloadSegment());
  }

  private static void checkNonce(AttestationClaims claims, VerifyOptions options) throws AttestationException {
    String expected = options.nonce().map(Nonce::nonce).orElse("");

    if (expected.isEmpty()) {
      throw new AttestationException(MISSING_NONCE, "missing nonce");
    }

    // The device hashes the nonce string itself, so the claim is base64 of the base64 digest
    byte[] expectedClaim = Base64.getEncoder().encode(expected.getBytes(StandardCharsets.UTF_8));

    if (!MessageDigest.isEqual(expectedClaim, claims.nonce().getBytes(StandardCharsets.UTF_8))) {
      throw new AttestationException(NONCE_MISMATCH,
                                     "nonce mismatch: expected " + new String(expectedClaim, StandardCharsets.UTF_8) + ", got " + claims.nonce());
    }
  }

  private static void checkTimestamp(AttestationClaims claims, VerifyOptions options) throws AttestationException {
    if (options.minValidTime().isEmpty() || options.maxValidTime().isEmpty()) {
      throw new AttestationException(MISSING_TIME_BOUNDS, "missing timestamp bounds for attestation");
    }

    Instant minValidTime = options.minValidTime().get();
    Instant maxValidTime = options.maxValidTime().get();
    long    claimSeconds = claims.timestampSeconds();
    Instant claimTime    = Instant.ofEpochSecond(claimSeconds);

    if (claimTime.isBefore(minValidTime)) {
      throw new AttestationException(TOO_OLD,
                                     String.format("attestation is too old, must be newer than %d, was %d",
                                                   minValidTime.getEpochSecond(), claimSeconds));
    }

    if (claimTime.isAfter(maxValidTime)) {
      throw new AttestationException(TOO_NEW,
                                     String.format("attestation is in the future, must be older than %d, was %d",
                                                   maxValidTime.getEpochSecond(), claimSeconds));
    }
  }

  private static void checkIdentity(AttestationClaims claims, VerifyOptions options) throws AttestationException {
    if (!options.appPkgName().isEmpty() && !options.appPkgName().equals(claims.apkPackageName())) {
      throw new AttestationException(APP_MISMATCH,
                                     "attestation app package name mismatch, expected " + options.appPkgName() + ", got " + claims.apkPackageName());
    }

    String apkDigest = options.apkDigest();

    if (!apkDigest.isEmpty()
        && !apkDigest.equals(claims.apkDigestSha256())
        && !claims.apkCertificateDigestSha256().contains(apkDigest))
    {
      throw new AttestationException(DIGEST_MISMATCH,
                                     "attestation APK digest mismatch, expected " + apkDigest + ", got " + claims.apkCertificateDigestSha256());
    }
  }

  private static void checkIntegrity(AttestationClaims claims, VerifyOptions options) throws AttestationException {
    if (options.basicIntegrity() && !claims.basicIntegrity()) {
      throw new AttestationException(INTEGRITY_FAILED, "attestation failed basic integrity check");
    }

    if (options.ctsProfileMatch() && !claims.ctsProfileMatch()) {
      throw new AttestationException(PROFILE_MISMATCH, "attestation failed CTS profile match check");
    }
  }
}
