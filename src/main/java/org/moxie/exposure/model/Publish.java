package org.moxie.exposure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A request to publish exposure keys. Field values are treated as already validated
 * by the handler that decoded the request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Publish(
  @JsonProperty("temporaryExposureKeys") List<ExposureKey> keys,
  @JsonProperty("regions") List<String> regions,
  @JsonProperty("appPackageName") String appPackageName,
  @JsonProperty("transmissionRisk") int transmissionRisk,
  @JsonProperty("verificationPayload") String verificationAuthorityName,
  @JsonProperty("deviceVerificationPayload") String deviceVerificationPayload
) {
  public Publish {
    keys                      = keys == null ? List.of() : List.copyOf(keys);
    regions                   = regions == null ? List.of() : List.copyOf(regions);
    appPackageName            = appPackageName == null ? "" : appPackageName;
    verificationAuthorityName = verificationAuthorityName == null ? "" : verificationAuthorityName;
    deviceVerificationPayload = deviceVerificationPayload == null ? "" : deviceVerificationPayload;

    if (transmissionRisk < 0 || transmissionRisk > 255) {
      throw new IllegalArgumentException("Transmission risk out of range: " + transmissionRisk);
    }
  }
}
