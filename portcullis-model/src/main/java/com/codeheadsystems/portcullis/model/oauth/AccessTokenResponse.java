package com.codeheadsystems.portcullis.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful password or refresh grant.
 * <p>
 * Used by: {@code POST {application}/oauth/token} response
 *
 * @param accessToken     the signed access token
 * @param refreshToken    the refresh token that can be exchanged for a new pair
 * @param tokenType       token type, normally {@code Bearer}
 * @param expiresIn       access token lifetime in seconds
 * @param accessTokenHref href of the access token resource, used for revocation
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessTokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Integer expiresIn,
    @JsonProperty("access_token_href") String accessTokenHref) {
}
