package org.moxie.exposure.attestation;

import org.moxie.exposure.model.Publish;

/**
 * The value a device attestation must carry to be accepted for a specific request.
 */
public interface Nonce {

  /**
   * Render the nonce as it is expected inside the attestation.
   *
   * @return nonce string, empty if there is no nonce to bind to
   */
  String nonce();

  static Nonce of(Publish publish) {
    return new PublishNonce(publish);
  }

  static Nonce empty() {
    return EmptyNonce.INSTANCE;
  }
}
