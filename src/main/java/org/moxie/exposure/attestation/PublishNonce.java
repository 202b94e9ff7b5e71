package org.moxie.exposure.attestation;

import org.moxie.exposure.model.Publish;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;

/**
 * Nonce bound to the exact contents of a publish request: the base64 encoded SHA-256
 * of its {@link PublishCleartext}.
 */
public final class PublishNonce implements Nonce {

  private final Publish publish;

  public PublishNonce(Publish publish) {
    this.publish = Objects.requireNonNull(publish, "Publish cannot be null");
  }

  @Override
  public String nonce() {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(PublishCleartext.encode(publish));
      return Base64.getEncoder().encodeToString(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new AssertionError("SHA-256 algorithm not available", e);
    }
  }

  @Override
  public String toString() {
    return "PublishNonce[" + nonce() + "]";
  }
}
