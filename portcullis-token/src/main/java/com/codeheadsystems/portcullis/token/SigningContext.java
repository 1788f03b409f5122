package com.codeheadsystems.portcullis.token;

import com.auth0.jwt.algorithms.Algorithm;
import java.util.Arrays;
import java.util.Objects;

/**
 * Issuer id and shared secret used to sign and verify tokens exchanged with the identity
 * service. One instance normally lives as long as the API key it was built from.
 * <p>
 * Only HMAC-SHA256 is supported. The secret is copied on the way in and never exposed again.
 */
public final class SigningContext {

  /**
   * The only algorithm the codec signs with or accepts.
   */
  public static final String HS256 = "HS256";

  private final String issuerId;
  private final byte[] secret;
  private final Algorithm signer;

  /**
   * Instantiates a new Signing context.
   *
   * @param issuerId the API key id, used as issuer and audience
   * @param secret   the API key secret
   */
  public SigningContext(final String issuerId, final byte[] secret) {
    this.issuerId = Objects.requireNonNull(issuerId, "issuerId");
    Objects.requireNonNull(secret, "secret");
    if (issuerId.isBlank()) {
      throw new IllegalArgumentException("issuerId must not be blank");
    }
    if (secret.length == 0) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    this.secret = secret.clone();
    this.signer = Algorithm.HMAC256(this.secret);
  }

  /**
   * The issuer id.
   *
   * @return the issuer id
   */
  public String issuerId() {
    return issuerId;
  }

  /**
   * The signing algorithm name, always {@value #HS256}.
   *
   * @return the algorithm
   */
  public String algorithm() {
    return HS256;
  }

  Algorithm signer() {
    return signer;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SigningContext)) {
      return false;
    }
    SigningContext that = (SigningContext) o;
    return issuerId.equals(that.issuerId) && Arrays.equals(secret, that.secret);
  }

  @Override
  public int hashCode() {
    return 31 * issuerId.hashCode() + Arrays.hashCode(secret);
  }

  @Override
  public String toString() {
    return "SigningContext[issuerId=" + issuerId + ", algorithm=" + HS256 + "]";
  }
}
