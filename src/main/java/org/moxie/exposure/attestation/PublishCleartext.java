package org.moxie.exposure.attestation;

import org.moxie.exposure.model.ExposureKey;
import org.moxie.exposure.model.Publish;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Canonical text form of a publish request, as hashed by devices when requesting an attestation:
 *
 * <pre>
 *   appPackageName|transmissionRisk|key.intervalNumber.intervalCount,...|REGION,...|verificationAuthorityName
 * </pre>
 *
 * Keys and regions are sorted so that submission order does not matter, regions are upper cased.
 */
public final class PublishCleartext {

  private static final String FIELD_SEPARATOR = "|";
  private static final String LIST_SEPARATOR  = ",";

  private PublishCleartext() {}

  public static String toCleartext(Publish publish) {
    return String.join(FIELD_SEPARATOR,
                       publish.appPackageName(),
                       Integer.toString(publish.transmissionRisk()),
                       sortedKeys(publish.keys()),
                       sortedRegions(publish.regions()),
                       publish.verificationAuthorityName());
  }

  public static byte[] encode(Publish publish) {
    return toCleartext(publish).getBytes(StandardCharsets.UTF_8);
  }

  private static String sortedKeys(List<ExposureKey> keys) {
    return keys.stream()
               .map(k -> k.key() + "." + k.intervalNumber() + "." + k.intervalCount())
               .sorted()
               .collect(Collectors.joining(LIST_SEPARATOR));
  }

  private static String sortedRegions(List<String> regions) {
    return regions.stream()
                  .map(r -> r.toUpperCase(Locale.ROOT))
                  .sorted()
                  .collect(Collectors.joining(LIST_SEPARATOR));
  }
}
