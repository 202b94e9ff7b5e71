package org.moxie.exposure.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Device attestation policy registered for an application allowed to publish keys.
 *
 * @param appPackageName    package name the attestation must report
 * @param safetyNetDisabled skip device attestation entirely for this app
 * @param apkDigestSha256   expected APK signing certificate digest, empty to skip
 * @param basicIntegrity    require the basic integrity verdict
 * @param ctsProfileMatch   require the CTS profile match verdict
 * @param pastTime          how far in the past an attestation may have been produced
 * @param futureTime        how far in the future an attestation timestamp may be (clock skew)
 */
public record AuthorizedApp(
  String appPackageName,
  boolean safetyNetDisabled,
  String apkDigestSha256,
  boolean basicIntegrity,
  boolean ctsProfileMatch,
  Duration pastTime,
  Duration futureTime
) {
  public AuthorizedApp {
    Objects.requireNonNull(appPackageName, "App package name cannot be null");
    apkDigestSha256 = apkDigestSha256 == null ? "" : apkDigestSha256;
    pastTime        = pastTime == null ? Duration.ZERO : pastTime;
    futureTime      = futureTime == null ? Duration.ZERO : futureTime;
  }
}
