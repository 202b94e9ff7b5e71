package org.moxie.exposure.attestation;

import org.moxie.exposure.model.ExposureKey;
import org.moxie.exposure.model.Publish;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * A SafetyNet attestation captured from a test device, and the publish request it was bound to.
 * <p>
 * This is not a secret value. The statement is fixed in the past, its certificates have long
 * expired, so it is only accepted with a clock pinned to its generation time and the issuing
 * intermediate (GTS CA 1O1) as the trusted root.
 */
public final class Fixtures {

  public static final String  APP_PACKAGE            = "com.google.android.apps.exposurenotification";
  public static final String  APK_CERTIFICATE_DIGEST = "jqmYEqi9qUvpUe11qMf3v2o6VEQM+5NDee2bz0xdzWc=";
  public static final long    GENERATE_TIME_MS       = 1589154006495L;
  public static final Instant GENERATE_TIME          = Instant.ofEpochSecond(GENERATE_TIME_MS / 1000);

  private Fixtures() {}

  public static String safetyNetStatement() throws IOException {
    try (InputStream is = Fixtures.class.getResourceAsStream("/safetynet_attestation.jws")) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8).trim();
    }
  }

  public static TrustedRoots gtsRoots() throws Exception {
    return TrustedRoots.fromClasspath("/gts_ca_1o1.pem");
  }

  public static Clock generateTimeClock() {
    return Clock.fixed(GENERATE_TIME, ZoneOffset.UTC);
  }

  public static Publish safetyNetPublish() {
    return new Publish(List.of(new ExposureKey("HKXVlIO+vDmQNJ2M1MVtHQ==", 2647872, 144),
                               new ExposureKey("JjEtCT9Lcyw5oPiaNcWC/Q==", 2648016, 144),
                               new ExposureKey("cLTwDu9onEv/N6FMV3Uy4Q==", 2648160, 144),
                               new ExposureKey("ko6TsgPP8Wvu+ijpSLbY3A==", 2648304, 144),
                               new ExposureKey("9kMgBy7qdG3o6eh3vAD3mQ==", 2648448, 144)),
                       List.of("GB"),
                       APP_PACKAGE,
                       1,
                       "PUBLIC_HEALTH_AUTHORITY",
                       "");
  }
}
