package org.moxie.exposure.attestation;

import java.util.Objects;

/**
 * Exception thrown when a device attestation is rejected.
 * Every rejection carries exactly one {@link Reason}: the first check that failed.
 */
public class AttestationException extends Exception {

  /**
   * Broad kind of a rejection, used to route logging and alerting.
   */
  public enum Category {
    /** The statement or its claims could not be decoded. Corrupt or incompatible client. */
    FORMAT,
    /** The statement is not backed by a trusted, valid signer. Possible forgery. */
    TRUST,
    /** The statement is authentic but does not satisfy the requested policy. */
    POLICY,
    /** The caller supplied an unusable policy. */
    CONFIGURATION
  }

  public enum Reason {
    MALFORMED_STATEMENT(Category.FORMAT),
    MISSING_CERTIFICATE_CHAIN(Category.FORMAT),
    UNSUPPORTED_ALGORITHM(Category.FORMAT),
    MALFORMED_CLAIMS(Category.FORMAT),

    UNTRUSTED_CHAIN(Category.TRUST),
    EXPIRED_CERTIFICATE(Category.TRUST),
    REVOKED_CERTIFICATE(Category.TRUST),
    IDENTITY_MISMATCH(Category.TRUST),
    SIGNATURE_INVALID(Category.TRUST),

    MISSING_NONCE(Category.POLICY),
    NONCE_MISMATCH(Category.POLICY),
    TOO_OLD(Category.POLICY),
    TOO_NEW(Category.POLICY),
    APP_MISMATCH(Category.POLICY),
    DIGEST_MISMATCH(Category.POLICY),
    INTEGRITY_FAILED(Category.POLICY),
    PROFILE_MISMATCH(Category.POLICY),

    MISSING_TIME_BOUNDS(Category.CONFIGURATION);

    private final Category category;

    Reason(Category category) {
      this.category = category;
    }

    public Category category() {
      return category;
    }
  }

  private final Reason reason;

  public AttestationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason);
  }

  public AttestationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason);
  }

  public Reason getReason() {
    return reason;
  }

  public Category getCategory() {
    return reason.category();
  }
}
