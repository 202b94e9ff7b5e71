package org.moxie.exposure.attestation;

import java.time.Instant;
import java.util.Optional;

/**
 * Policy a device attestation is checked against. Built per verification by the caller.
 * <p>
 * The nonce and both time bounds are required; leaving any of them unset makes validation fail
 * rather than silently accept an unbound or unbounded attestation.
 */
public final class VerifyOptions {

  private final String            appPkgName;
  private final String            apkDigest;
  private final Optional<Nonce>   nonce;
  private final boolean           ctsProfileMatch;
  private final boolean           basicIntegrity;
  private final Optional<Instant> minValidTime;
  private final Optional<Instant> maxValidTime;

  private VerifyOptions(Builder builder) {
    this.appPkgName      = builder.appPkgName;
    this.apkDigest       = builder.apkDigest;
    this.nonce           = Optional.ofNullable(builder.nonce);
    this.ctsProfileMatch = builder.ctsProfileMatch;
    this.basicIntegrity  = builder.basicIntegrity;
    this.minValidTime    = Optional.ofNullable(builder.minValidTime);
    this.maxValidTime    = Optional.ofNullable(builder.maxValidTime);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Expected package name, empty to skip the check. */
  public String appPkgName() {
    return appPkgName;
  }

  /** Expected APK or APK signing certificate digest, empty to skip the check. */
  public String apkDigest() {
    return apkDigest;
  }

  public Optional<Nonce> nonce() {
    return nonce;
  }

  public boolean ctsProfileMatch() {
    return ctsProfileMatch;
  }

  public boolean basicIntegrity() {
    return basicIntegrity;
  }

  /** Earliest accepted attestation time, inclusive. */
  public Optional<Instant> minValidTime() {
    return minValidTime;
  }

  /** Latest accepted attestation time, inclusive. */
  public Optional<Instant> maxValidTime() {
    return maxValidTime;
  }

  public static final class Builder {
    private String  appPkgName = "";
    private String  apkDigest  = "";
    private Nonce   nonce;
    private boolean ctsProfileMatch;
    private boolean basicIntegrity;
    private Instant minValidTime;
    private Instant maxValidTime;

    private Builder() {}

    public Builder appPkgName(String appPkgName) {
      this.appPkgName = appPkgName == null ? "" : appPkgName;
      return this;
    }

    public Builder apkDigest(String apkDigest) {
      this.apkDigest = apkDigest == null ? "" : apkDigest;
      return this;
    }

    public Builder nonce(Nonce nonce) {
      this.nonce = nonce;
      return this;
    }

    public Builder ctsProfileMatch(boolean ctsProfileMatch) {
      this.ctsProfileMatch = ctsProfileMatch;
      return this;
    }

    public Builder basicIntegrity(boolean basicIntegrity) {
      this.basicIntegrity = basicIntegrity;
      return this;
    }

    public Builder minValidTime(Instant minValidTime) {
      this.minValidTime = minValidTime;
      return this;
    }

    public Builder maxValidTime(Instant maxValidTime) {
      this.maxValidTime = maxValidTime;
      return this;
    }

    public VerifyOptions build() {
      return new VerifyOptions(this);
    }
  }
}
