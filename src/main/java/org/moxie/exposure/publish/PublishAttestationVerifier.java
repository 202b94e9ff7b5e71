package org.moxie.exposure.publish;

import org.moxie.exposure.attestation.AttestationException;
import org.moxie.exposure.attestation.AttestationValidator;
import org.moxie.exposure.attestation.Nonce;
import org.moxie.exposure.attestation.VerifyOptions;
import org.moxie.exposure.model.AuthorizedApp;
import org.moxie.exposure.model.Publish;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import static org.moxie.exposure.attestation.AttestationException.Reason.APP_MISMATCH;

/**
 * Gate run before a publish request is accepted: checks that the request carries a device
 * attestation satisfying the policy registered for the publishing app, bound to this request.
 */
public class PublishAttestationVerifier {

  private static final Logger log = LoggerFactory.getLogger(PublishAttestationVerifier.class);

  private final AttestationValidator validator;
  private final Clock                clock;

  public PublishAttestationVerifier(AttestationValidator validator, Clock clock) {
    this.validator = Objects.requireNonNull(validator, "Attestation validator cannot be null");
    this.clock     = Objects.requireNonNull(clock, "Clock cannot be null");
  }

  /**
   * Verify the device attestation of a publish request.
   *
   * @param app     policy of the app the request claims to come from
   * @param publish the request
   * @throws AttestationException if the request must be rejected
   */
  public void verify(AuthorizedApp app, Publish publish) throws AttestationException {
    if (app.safetyNetDisabled()) {
      log.debug("Device attestation disabled for {}, skipping", app.appPackageName());
      return;
    }

    try {
      if (!app.appPackageName().equals(publish.appPackageName())) {
        throw new AttestationException(APP_MISMATCH,
                                       "publish app package name " + publish.appPackageName() + " does not match authorized app " + app.appPackageName());
      }

      validator.validate(publish.deviceVerificationPayload(), optionsFor(app, publish, clock.instant()));
      log.debug("Device attestation accepted for {}", app.appPackageName());
    } catch (AttestationException e) {
      logRejection(app, e);
      throw e;
    }
  }

  static VerifyOptions optionsFor(AuthorizedApp app, Publish publish, Instant now) {
    return VerifyOptions.builder()
                        .appPkgName(app.appPackageName())
                        .apkDigest(app.apkDigestSha256())
                        .nonce(Nonce.of(publish))
                        .basicIntegrity(app.basicIntegrity())
                        .ctsProfileMatch(app.ctsProfileMatch())
                        .minValidTime(bound(now, app.pastTime().negated(), app.pastTime()))
                        .maxValidTime(bound(now, app.futureTime(), app.futureTime()))
                        .build();
  }

  private static Instant bound(Instant now, Duration offset, Duration window) {
    // a non-positive window leaves the bound unset, which the validator rejects as a policy defect
    return window.isZero() || window.isNegative() ? null : now.plus(offset);
  }

  private static void logRejection(AuthorizedApp app, AttestationException e) {
    switch (e.getCategory()) {
      case TRUST         -> log.warn("[ALERT] Untrusted device attestation for {}: {}", app.appPackageName(), e.getMessage());
      case CONFIGURATION -> log.error("Attestation policy for {} is misconfigured: {}", app.appPackageName(), e.getMessage());
      default            -> log.info("Device attestation rejected for {} ({}): {}", app.appPackageName(), e.getReason(), e.getMessage());
    }
  }
}
