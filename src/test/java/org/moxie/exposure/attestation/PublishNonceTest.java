package org.moxie.exposure.attestation;

import org.junit.jupiter.api.Test;
import org.moxie.exposure.model.ExposureKey;
import org.moxie.exposure.model.Publish;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PublishNonceTest {

  // Data from these tests was generated by the Android reference application.
  private static Publish referencePublish() {
    return new Publish(List.of(new ExposureKey("x21Goi8X9m/glOZ0+wz8fA", 263123, 144),
                               new ExposureKey("2mvFSmRsFmJR5r07dxGSjg", 263267, 144),
                               new ExposureKey("6bAd3dv7p+VEuaJVkVItaQ", 263411, 27)),
                       List.of("GB", "US"),
                       Fixtures.APP_PACKAGE,
                       4,
                       "QRTH-ROWO-LOLO-FOOB",
                       "");
  }

  @Test
  void nonce_referenceVector_matches() {
    assertEquals("xH8QNR09EKuCCuNitam1RgjPaGHO/9p54VikqFdirVY=", Nonce.of(referencePublish()).nonce());
  }

  @Test
  void nonce_mixedCaseRegionsVector_matches() {
    Publish publish = new Publish(List.of(new ExposureKey("zdCW5HrOKbirxmQVc0L/eA", 263123, 144),
                                          new ExposureKey("t+k51ifogJo9jq3GH9LWGQ", 263267, 144),
                                          new ExposureKey("3uXRrSlcv1+OMI3oFtdaUw", 263411, 27)),
                                  List.of("gB", "us"),
                                  Fixtures.APP_PACKAGE,
                                  7,
                                  "BREA-KMEO-FFAP-IECE",
                                  "");

    assertEquals("LHSwWAjTf3nMVTk7LBwMx9Wg7jEPRjEJf1zRtoxQI64=", Nonce.of(publish).nonce());
  }

  @Test
  void nonce_safetyNetFixture_matchesAttestedNonce() {
    assertEquals("vtahfsLtYDEImsinerZRqk+p8PuXfoz8hmPCshlSzgw=", Nonce.of(Fixtures.safetyNetPublish()).nonce());
  }

  @Test
  void nonce_calledTwice_isDeterministic() {
    Nonce nonce = Nonce.of(referencePublish());

    assertEquals(nonce.nonce(), nonce.nonce());
    assertEquals(nonce.nonce(), Nonce.of(referencePublish()).nonce());
  }

  @Test
  void nonce_isBase64OfSha256() {
    String nonce = Nonce.of(referencePublish()).nonce();

    assertEquals(44, nonce.length());
    assertTrue(nonce.endsWith("="));
  }

  @Test
  void nonce_regionCaseAndOrder_ignored() {
    Publish reference = referencePublish();
    Publish lowered   = new Publish(reference.keys(), List.of("us", "gb"), reference.appPackageName(),
                                    reference.transmissionRisk(), reference.verificationAuthorityName(), "");

    assertEquals(Nonce.of(reference).nonce(), Nonce.of(lowered).nonce());
  }

  @Test
  void nonce_keyOrder_ignored() {
    Publish reference = referencePublish();
    Publish reordered = new Publish(List.of(reference.keys().get(2), reference.keys().get(0), reference.keys().get(1)),
                                    reference.regions(), reference.appPackageName(),
                                    reference.transmissionRisk(), reference.verificationAuthorityName(), "");

    assertEquals(Nonce.of(reference).nonce(), Nonce.of(reordered).nonce());
  }

  @Test
  void nonce_deviceVerificationPayload_notBound() {
    Publish reference = referencePublish();
    Publish attested  = new Publish(reference.keys(), reference.regions(), reference.appPackageName(),
                                    reference.transmissionRisk(), reference.verificationAuthorityName(), "a.b.c");

    assertEquals(Nonce.of(reference).nonce(), Nonce.of(attested).nonce());
  }

  @Test
  void nonce_anyFieldChanged_changes() {
    Publish reference = referencePublish();
    String  expected  = Nonce.of(reference).nonce();

    List<ExposureKey> otherKey = List.of(new ExposureKey("AAAAAAAAAAAAAAAAAAAAAA", 263123, 144),
                                         reference.keys().get(1), reference.keys().get(2));
    List<ExposureKey> otherInterval = List.of(new ExposureKey("x21Goi8X9m/glOZ0+wz8fA", 263124, 144),
                                              reference.keys().get(1), reference.keys().get(2));
    List<ExposureKey> otherCount = List.of(new ExposureKey("x21Goi8X9m/glOZ0+wz8fA", 263123, 143),
                                           reference.keys().get(1), reference.keys().get(2));

    List<Publish> variants = List.of(
        new Publish(otherKey, reference.regions(), reference.appPackageName(), 4, "QRTH-ROWO-LOLO-FOOB", ""),
        new Publish(otherInterval, reference.regions(), reference.appPackageName(), 4, "QRTH-ROWO-LOLO-FOOB", ""),
        new Publish(otherCount, reference.regions(), reference.appPackageName(), 4, "QRTH-ROWO-LOLO-FOOB", ""),
        new Publish(reference.keys(), List.of("GB", "CA"), reference.appPackageName(), 4, "QRTH-ROWO-LOLO-FOOB", ""),
        new Publish(reference.keys(), reference.regions(), "com.example.other", 4, "QRTH-ROWO-LOLO-FOOB", ""),
        new Publish(reference.keys(), reference.regions(), reference.appPackageName(), 5, "QRTH-ROWO-LOLO-FOOB", ""),
        new Publish(reference.keys(), reference.regions(), reference.appPackageName(), 4, "QRTH-ROWO-LOLO-FOOC", ""),
        new Publish(reference.keys(), reference.regions(), reference.appPackageName(), 4, "", ""));

    for (Publish variant : variants) {
      assertNotEquals(expected, Nonce.of(variant).nonce(), () -> "nonce did not change for " + variant);
    }
  }

  @Test
  void empty_rendersEmptyString() {
    assertEquals("", Nonce.empty().nonce());
    assertSame(Nonce.empty(), Nonce.empty());
  }

  @Test
  void constructor_nullPublish_throws() {
    assertThrows(NullPointerException.class, () -> new PublishNonce(null));
  }
}
