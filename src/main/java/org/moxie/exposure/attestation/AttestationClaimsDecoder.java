package org.moxie.exposure.attestation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Base64;
import java.util.Objects;

import static org.moxie.exposure.attestation.AttestationException.Reason.MALFORMED_CLAIMS;

/**
 * Decodes the payload segment of a signed statement into {@link AttestationClaims}.
 * The timestamp and package name are required, every other claim falls back to its empty value
 * since not every attestation version reports it.
 */
public class AttestationClaimsDecoder {

  private final ObjectMapper mapper;

  public AttestationClaimsDecoder(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
  }

  public AttestationClaims decode(String payloadSegment) throws AttestationException {
    JsonNode root;

    try {
      root = mapper.readTree(Base64.getUrlDecoder().decode(payloadSegment));
    } catch (IOException | IllegalArgumentException e) {
      throw new AttestationException(MALFORMED_CLAIMS, "unable to decode attestation claims", e);
    }

    if (root == null || !root.isObject()) {
      throw new AttestationException(MALFORMED_CLAIMS, "attestation claims are not a JSON object");
    }

    JsonNode timestamp = root.get("timestampMs");

    if (timestamp == null || !timestamp.isIntegralNumber() || !timestamp.canConvertToLong()) {
      throw new AttestationException(MALFORMED_CLAIMS, "attestation claims missing numeric timestampMs");
    }

    JsonNode packageName = root.get("apkPackageName");

    if (packageName == null || !packageName.isTextual()) {
      throw new AttestationException(MALFORMED_CLAIMS, "attestation claims missing apkPackageName");
    }

    try {
      return mapper.treeToValue(root, AttestationClaims.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new AttestationException(MALFORMED_CLAIMS, "attestation claims have an unexpected shape: " + e.getMessage(), e);
    }
  }
}
