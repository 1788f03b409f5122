package com.codeheadsystems.portcullis.model.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope returned by the identity service for any 4xx or 5xx response.
 * <p>
 * Two shapes are seen on the wire. Management endpoints return
 * {@code {status, code, message, developerMessage, moreInfo}}; the OAuth token endpoint returns
 * {@code {error, error_description}} and sometimes a {@code message}. Both are read into this
 * one record; fields that are absent stay {@code null}.
 *
 * @param status           HTTP status echoed in the body
 * @param code             service-specific numeric error code
 * @param message          end-user facing message
 * @param developerMessage developer facing message
 * @param moreInfo         documentation link for the error code
 * @param error            OAuth2 error identifier (e.g. {@code invalid_grant})
 * @param errorDescription OAuth2 error description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(
    @JsonProperty("status") Integer status,
    @JsonProperty("code") Integer code,
    @JsonProperty("message") String message,
    @JsonProperty("developerMessage") String developerMessage,
    @JsonProperty("moreInfo") String moreInfo,
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {

  /**
   * Whether this body is in the OAuth2 {@code error} shape rather than the service envelope.
   *
   * @return true for OAuth2 shaped bodies
   */
  public boolean isOAuthError() {
    return error != null && code == null && developerMessage == null;
  }

  /**
   * Whether any recognizable field was present at all.
   *
   * @return true if the body carried at least a message, code or OAuth error
   */
  public boolean hasContent() {
    return message != null || code != null || developerMessage != null || error != null;
  }
}
