package org.moxie.exposure.attestation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;
import static org.moxie.exposure.attestation.AttestationException.Reason.MALFORMED_STATEMENT;
import static org.moxie.exposure.attestation.AttestationException.Reason.MISSING_CERTIFICATE_CHAIN;

class SignedStatementTest {

  private String   statement;
  private String[] segments;

  @BeforeEach
  void setUp() throws Exception {
    statement = Fixtures.safetyNetStatement();
    segments  = statement.split("\\.");
  }

  @Test
  void parse_safetyNetStatement_keepsOriginalSegments() throws AttestationException {
    SignedStatement parsed = SignedStatement.parse(statement);

    assertEquals("RS256", parsed.algorithm());
    assertEquals(segments[0], parsed.headerSegment());
    assertEquals(segments[1], parsed.payloadSegment());
    assertEquals(segments[2], parsed.signatureSegment());
  }

  @Test
  void parse_safetyNetStatement_decodesCertificateChain() throws AttestationException {
    SignedStatement parsed = SignedStatement.parse(statement);

    assertEquals(2, parsed.certificateChain().size());
    // DER SEQUENCE tag
    assertEquals(0x30, parsed.certificateChain().get(0)[0]);
    assertThrows(UnsupportedOperationException.class, () -> parsed.certificateChain().clear());
  }

  @Test
  void certificateChain_modifiedByCaller_parsedChainUnchanged() throws AttestationException {
    SignedStatement parsed = SignedStatement.parse(statement);

    parsed.certificateChain().get(0)[0] = 0;

    assertEquals(0x30, parsed.certificateChain().get(0)[0]);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "abc", "a.b", "a.b.c.d", "a..c", ".b.c"})
  void parse_wrongSegments_malformed(String raw) {
    AttestationException e = assertThrows(AttestationException.class, () -> SignedStatement.parse(raw));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
  }

  @Test
  void parse_missingSignature_malformed() {
    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(segments[0] + "." + segments[1] + "."));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
  }

  @Test
  void parse_headerNotBase64_malformed() {
    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse("!!!." + segments[1] + "." + segments[2]));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
    assertNotNull(e.getCause());
  }

  @Test
  void parse_payloadNotJson_malformed() {
    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(segments[0] + "." + segment("not json") + "." + segments[2]));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
  }

  @Test
  void parse_signatureNotBase64_malformed() {
    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(segments[0] + "." + segments[1] + ".***"));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
  }

  @Test
  void parse_noAlgorithm_malformed() {
    String header = segment("{\"x5c\":[\"MIIB\"]}");

    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(header + "." + segments[1] + "." + segments[2]));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
  }

  @Test
  void parse_noCertificateChain_missingChain() {
    String header = segment("{\"alg\":\"RS256\"}");

    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(header + "." + segments[1] + "." + segments[2]));
    assertEquals(MISSING_CERTIFICATE_CHAIN, e.getReason());
  }

  @Test
  void parse_emptyCertificateChain_missingChain() {
    String header = segment("{\"alg\":\"RS256\",\"x5c\":[]}");

    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(header + "." + segments[1] + "." + segments[2]));
    assertEquals(MISSING_CERTIFICATE_CHAIN, e.getReason());
  }

  @Test
  void parse_certificateChainNotList_malformed() {
    String header = segment("{\"alg\":\"RS256\",\"x5c\":\"MIIB\"}");

    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(header + "." + segments[1] + "." + segments[2]));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
  }

  @Test
  void parse_certificateNotBase64_malformed() {
    String header = segment("{\"alg\":\"RS256\",\"x5c\":[\"%%%\"]}");

    AttestationException e = assertThrows(AttestationException.class,
                                          () -> SignedStatement.parse(header + "." + segments[1] + "." + segments[2]));
    assertEquals(MALFORMED_STATEMENT, e.getReason());
    assertEquals(AttestationException.Category.FORMAT, e.getCategory());
  }

  private static String segment(String json) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
