package com.codeheadsystems.portcullis.client.config;

import com.codeheadsystems.portcullis.token.SigningContext;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * API key credentials. The id doubles as the issuer of every signed ID Site token; the
 * secret is the HMAC key and the HTTP Basic password.
 *
 * @param id     the api key id
 * @param secret the api key secret
 */
public record ApiKey(String id, String secret) {

  public ApiKey {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(secret, "secret");
    if (id.isBlank() || secret.isBlank()) {
      throw new IllegalArgumentException("API key id and secret must not be blank");
    }
  }

  /**
   * Signing context for tokens exchanged with ID Site.
   *
   * @return the signing context
   */
  public SigningContext signingContext() {
    return new SigningContext(id, secret.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Value of the {@code Authorization} header for management calls.
   *
   * @return the header value
   */
  public String basicAuthorization() {
    String credentials = id + ":" + secret;
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "ApiKey[id=" + id + ", secret=****]";
  }
}
