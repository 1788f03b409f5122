package com.codeheadsystems.portcullis.client.idsite;

import com.codeheadsystems.portcullis.client.error.IdSiteError;
import com.codeheadsystems.portcullis.client.exceptions.LocalValidationException;
import com.codeheadsystems.portcullis.client.model.IdSiteOptions;
import com.codeheadsystems.portcullis.token.SigningContext;
import com.codeheadsystems.portcullis.token.TokenClaims;
import com.codeheadsystems.portcullis.token.TokenCodec;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the URL that sends an end user to the hosted ID Site.
 * <p>
 * The request is a signed token in the {@code jwtRequest} query parameter of
 * {@code {ssoBaseUrl}/sso} (or {@code /sso/logout}). Its claims name the application as
 * subject, the API key id as issuer and audience, and carry the callback URI, path and state.
 * Nothing is sent anywhere; the caller redirects the browser.
 */
public class IdSiteRequestBuilder {

  private static final Logger log = LoggerFactory.getLogger(IdSiteRequestBuilder.class);

  private static final String SSO_PATH = "/sso";
  private static final String LOGOUT_PATH = "/sso/logout";
  private static final String JWT_REQUEST = "jwtRequest";

  private final TokenCodec tokenCodec;
  private final SigningContext signingContext;
  private final String applicationHref;
  private final Clock clock;

  /**
   * Instantiates a new Id site request builder.
   *
   * @param tokenCodec      the token codec
   * @param signingContext  the signing context
   * @param applicationHref the application the user logs in to
   * @param clock           the clock used for {@code iat}
   */
  public IdSiteRequestBuilder(final TokenCodec tokenCodec,
                              final SigningContext signingContext,
                              final URI applicationHref,
                              final Clock clock) {
    this.tokenCodec = tokenCodec;
    this.signingContext = signingContext;
    this.applicationHref = applicationHref.toString();
    this.clock = clock;
  }

  /**
   * Builds the redirect URL.
   *
   * @param ssoBaseUrl base URL of the ID Site
   * @param options    the options
   * @return the absolute URL to redirect the user to
   * @throws LocalValidationException if the callback URI is missing or blank
   */
  public String buildAuthorizationUrl(final URI ssoBaseUrl, final IdSiteOptions options) {
    Objects.requireNonNull(ssoBaseUrl, "ssoBaseUrl");
    Objects.requireNonNull(options, "options");
    if (options.callbackUri() == null || options.callbackUri().isBlank()) {
      throw new LocalValidationException(IdSiteError.INVALID_CALLBACK_URI.toApiError());
    }
    String jti = UUID.randomUUID().toString();
    TokenClaims claims = TokenClaims.builder()
        .withIssuedAt(clock.instant())
        .withJwtId(jti)
        .withIssuer(signingContext.issuerId())
        .withAudience(signingContext.issuerId())
        .withSubject(applicationHref)
        .withCallbackUri(options.callbackUri())
        .withPath(options.path())
        .withState(options.state())
        .build();
    String token = tokenCodec.encode(claims, signingContext);

    String base = ssoBaseUrl.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String path = options.logout() ? LOGOUT_PATH : SSO_PATH;
    log.debug("buildAuthorizationUrl(jti={}, logout={})", jti, options.logout());
    return base + path + "?" + JWT_REQUEST + "=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
  }
}
