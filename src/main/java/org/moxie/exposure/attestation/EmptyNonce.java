package org.moxie.exposure.attestation;

/**
 * A nonce that never binds to anything. Validation against it always fails with
 * {@link AttestationException.Reason#MISSING_NONCE}.
 */
final class EmptyNonce implements Nonce {

  static final EmptyNonce INSTANCE = new EmptyNonce();

  private EmptyNonce() {}

  @Override
  public String nonce() {
    return "";
  }

  @Override
  public String toString() {
    return "EmptyNonce";
  }
}
