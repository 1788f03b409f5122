package com.codeheadsystems.portcullis.client.model;

import com.codeheadsystems.portcullis.model.oauth.AccessTokenResponse;

/**
 * Token pair returned by a password or refresh grant. Nothing is cached; the caller owns it.
 *
 * @param accessToken     the access token
 * @param refreshToken    the refresh token
 * @param tokenType       the token type
 * @param expiresIn       lifetime of the access token in seconds
 * @param accessTokenHref href used to revoke the access token
 */
public record AccessToken(String accessToken, String refreshToken, String tokenType, int expiresIn,
                          String accessTokenHref) {

  public static AccessToken from(final AccessTokenResponse response) {
    return new AccessToken(response.accessToken(), response.refreshToken(), response.tokenType(),
        response.expiresIn() == null ? 0 : response.expiresIn(), response.accessTokenHref());
  }

  @Override
  public String toString() {
    return "AccessToken[tokenType=" + tokenType + ", expiresIn=" + expiresIn
        + ", accessTokenHref=" + accessTokenHref + "]";
  }
}
