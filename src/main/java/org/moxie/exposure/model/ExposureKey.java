package org.moxie.exposure.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single temporary exposure key as submitted by a device.
 *
 * @param key            base64 encoded key material, exactly as transmitted
 * @param intervalNumber first 10 minute interval the key was valid for
 * @param intervalCount  number of intervals the key was valid for
 */
public record ExposureKey(
  @JsonProperty("key") String key,
  @JsonProperty("rollingStartNumber") int intervalNumber,
  @JsonProperty("rollingPeriod") int intervalCount
) {
  public ExposureKey {
    Objects.requireNonNull(key, "Exposure key cannot be null");
  }
}
