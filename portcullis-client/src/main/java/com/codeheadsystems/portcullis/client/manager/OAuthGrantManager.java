package com.codeheadsystems.portcullis.client.manager;

import com.codeheadsystems.portcullis.client.accessor.IdentityServiceAccessor;
import com.codeheadsystems.portcullis.client.exceptions.PortcullisAccessorException;
import com.codeheadsystems.portcullis.client.exceptions.StaleRefreshException;
import com.codeheadsystems.portcullis.client.model.AccessToken;
import com.codeheadsystems.portcullis.client.model.TokenValidationResult;
import com.codeheadsystems.portcullis.model.oauth.AccessTokenResponse;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth2 grants against the application's token endpoint.
 * <p>
 * Every call is exactly one request. Tokens are not cached, refreshed in the background or
 * retried; the {@link AccessToken} values handed out are immutable and are never touched by a
 * later call, successful or not.
 */
@Singleton
public class OAuthGrantManager {

  private static final Logger log = LoggerFactory.getLogger(OAuthGrantManager.class);

  static final String GRANT_TYPE = "grant_type";
  static final String PASSWORD = "password";
  static final String REFRESH_TOKEN = "refresh_token";
  private static final String BEARER = "bearer";

  private final IdentityServiceAccessor accessor;

  @Inject
  public OAuthGrantManager(final IdentityServiceAccessor accessor) {
    log.info("OAuthGrantManager()");
    this.accessor = accessor;
  }

  /**
   * Password grant.
   *
   * @param username the username or email
   * @param password the password
   * @return the access token
   */
  public AccessToken passwordGrant(final String username, final String password) {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    log.debug("passwordGrant(username={})", username);
    Map<String, String> form = new LinkedHashMap<>();
    form.put(GRANT_TYPE, PASSWORD);
    form.put("username", username);
    form.put(PASSWORD, password);
    return toAccessToken(accessor.tokenGrant(form));
  }

  /**
   * Refresh grant.
   *
   * @param refreshToken the refresh token
   * @return the new token pair
   */
  public AccessToken refreshGrant(final String refreshToken) {
    if (refreshToken == null || refreshToken.isBlank()) {
      throw new IllegalArgumentException("refreshToken must not be empty");
    }
    log.debug("refreshGrant()");
    Map<String, String> form = new LinkedHashMap<>();
    form.put(GRANT_TYPE, REFRESH_TOKEN);
    form.put(REFRESH_TOKEN, refreshToken);
    return toAccessToken(accessor.tokenGrant(form));
  }

  /**
   * Exchanges the refresh token of {@code current} for a new pair.
   *
   * @param current the token pair to refresh; left unchanged
   * @return the new token pair
   * @throws StaleRefreshException if the service handed back the same access token; the
   *                               returned pair, with its refresh token, is on the exception
   */
  public AccessToken refresh(final AccessToken current) {
    Objects.requireNonNull(current, "current");
    AccessToken refreshed = refreshGrant(current.refreshToken());
    if (Objects.equals(refreshed.accessToken(), current.accessToken())) {
      throw new StaleRefreshException(refreshed);
    }
    return refreshed;
  }

  /**
   * Validates an access token with the service.
   *
   * @param bearerToken a raw access token or an {@code Authorization} header value
   * @return the validation result
   * @throws com.codeheadsystems.portcullis.client.exceptions.ServiceException if the token is
   *                                                                           invalid, expired or revoked
   */
  public TokenValidationResult validate(final String bearerToken) {
    String token = stripBearer(bearerToken);
    log.debug("validate()");
    return TokenValidationResult.from(accessor.tokenInfo(token));
  }

  /**
   * Revokes the access token by deleting its resource.
   *
   * @param token the token
   */
  public void revoke(final AccessToken token) {
    Objects.requireNonNull(token, "token");
    if (token.accessTokenHref() == null || token.accessTokenHref().isBlank()) {
      throw new IllegalArgumentException("Access token has no href to revoke");
    }
    log.debug("revoke({})", token.accessTokenHref());
    accessor.delete(URI.create(token.accessTokenHref()));
  }

  private static AccessToken toAccessToken(AccessTokenResponse response) {
    if (response.accessToken() == null || response.accessToken().isBlank()) {
      throw new PortcullisAccessorException("Token response carried no access token", null);
    }
    return AccessToken.from(response);
  }

  private static String stripBearer(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("bearer token must not be empty");
    }
    String trimmed = value.trim();
    int prefix = BEARER.length();
    if (trimmed.regionMatches(true, 0, BEARER, 0, prefix)
        && (trimmed.length() == prefix || Character.isWhitespace(trimmed.charAt(prefix)))) {
      trimmed = trimmed.substring(prefix).trim();
    }
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bearer token must not be empty");
    }
    return trimmed;
  }
}
