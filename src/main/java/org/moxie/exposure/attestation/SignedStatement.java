package org.moxie.exposure.attestation;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.moxie.exposure.attestation.AttestationException.Reason.MALFORMED_STATEMENT;
import static org.moxie.exposure.attestation.AttestationException.Reason.MISSING_CERTIFICATE_CHAIN;

/**
 * A device attestation statement in JWS compact serialization, with its certificate chain
 * carried in the {@code x5c} header.
 * The original segment text is kept, the signature covers exactly {@code header.payload}.
 */
public final class SignedStatement {

  private static final String X5C_HEADER = "x5c";

  private final DecodedJWT   jwt;
  private final String       algorithm;
  private final List<byte[]> certificateChain;

  private SignedStatement(DecodedJWT jwt, String algorithm, List<byte[]> certificateChain) {
    this.jwt              = jwt;
    this.algorithm        = algorithm;
    this.certificateChain = certificateChain;
  }

  /**
   * Split and decode a compact signed statement.
   *
   * @param raw statement text as received from the device
   * @return the parsed statement
   * @throws AttestationException {@code MALFORMED_STATEMENT} if the text is not a well formed JWS,
   *                              {@code MISSING_CERTIFICATE_CHAIN} if the header carries no certificates
   */
  public static SignedStatement parse(String raw) throws AttestationException {
    if (raw == null || raw.isBlank()) {
      throw new AttestationException(MALFORMED_STATEMENT, "attestation statement is empty");
    }

    String[] segments = raw.split("\\.", -1);

    if (segments.length != 3) {
      throw new AttestationException(MALFORMED_STATEMENT, "attestation statement must have 3 segments, got " + segments.length);
    }

    for (String segment : segments) {
      if (segment.isEmpty()) {
        throw new AttestationException(MALFORMED_STATEMENT, "attestation statement has an empty segment");
      }
    }

    DecodedJWT jwt;

    try {
      jwt = JWT.decode(raw);
      Base64.getUrlDecoder().decode(jwt.getSignature());
    } catch (JWTDecodeException | IllegalArgumentException e) {
      throw new AttestationException(MALFORMED_STATEMENT, "unable to decode attestation statement: " + e.getMessage(), e);
    }

    String algorithm = jwt.getAlgorithm();

    if (algorithm == null || algorithm.isEmpty()) {
      throw new AttestationException(MALFORMED_STATEMENT, "attestation statement header has no alg");
    }

    return new SignedStatement(jwt, algorithm, decodeCertificateChain(jwt.getHeaderClaim(X5C_HEADER)));
  }

  private static List<byte[]> decodeCertificateChain(Claim x5c) throws AttestationException {
    if (x5c.isMissing() || x5c.isNull()) {
      throw new AttestationException(MISSING_CERTIFICATE_CHAIN, "attestation statement header has no x5c certificate chain");
    }

    List<String> encoded;

    try {
      encoded = x5c.asList(String.class);
    } catch (JWTDecodeException e) {
      throw new AttestationException(MALFORMED_STATEMENT, "x5c header is not a list of certificates", e);
    }

    if (encoded == null) {
      throw new AttestationException(MALFORMED_STATEMENT, "x5c header is not a list of certificates");
    }

    if (encoded.isEmpty()) {
      throw new AttestationException(MISSING_CERTIFICATE_CHAIN, "attestation statement x5c certificate chain is empty");
    }

    List<byte[]> chain = new ArrayList<>(encoded.size());

    for (int i = 0; i < encoded.size(); i++) {
      String entry = encoded.get(i);

      if (entry == null || entry.isEmpty()) {
        throw new AttestationException(MALFORMED_STATEMENT, "x5c entry " + i + " is empty");
      }

      try {
        // x5c entries are standard base64 DER, not base64url
        chain.add(Base64.getDecoder().decode(entry));
      } catch (IllegalArgumentException e) {
        throw new AttestationException(MALFORMED_STATEMENT, "x5c entry " + i + " is not valid base64", e);
      }
    }

    return Collections.unmodifiableList(chain);
  }

  public String algorithm() {
    return algorithm;
  }

  public String headerSegment() {
    return jwt.getHeader();
  }

  public String payloadSegment() {
    return jwt.getPayload();
  }

  public String signatureSegment() {
    return jwt.getSignature();
  }

  /**
   * @return copies of the DER encoded certificates, leaf first
   */
  public List<byte[]> certificateChain() {
    return certificateChain.stream()
                           .map(byte[]::clone)
                           .collect(Collectors.toUnmodifiableList());
  }

  DecodedJWT decoded() {
    return jwt;
  }
}
