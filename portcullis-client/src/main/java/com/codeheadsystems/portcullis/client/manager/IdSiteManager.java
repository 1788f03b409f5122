package com.codeheadsystems.portcullis.client.manager;

import com.codeheadsystems.portcullis.client.config.PortcullisClientConfig;
import com.codeheadsystems.portcullis.client.idsite.IdSiteCallbackVerifier;
import com.codeheadsystems.portcullis.client.idsite.IdSiteRequestBuilder;
import com.codeheadsystems.portcullis.client.model.IdSiteOptions;
import com.codeheadsystems.portcullis.client.model.IdSiteResult;
import com.codeheadsystems.portcullis.token.SigningContext;
import com.codeheadsystems.portcullis.token.TokenCodec;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosted login (ID Site) for the configured application.
 * <p>
 * Both directions are signed with the API key: {@link #createIdSiteUrl} signs the outgoing
 * request, {@link #handleIdSiteCallback} verifies the token ID Site sends back. Neither touches
 * the network.
 */
@Singleton
public class IdSiteManager {

  private static final Logger log = LoggerFactory.getLogger(IdSiteManager.class);

  private final PortcullisClientConfig config;
  private final SigningContext signingContext;
  private final IdSiteRequestBuilder requestBuilder;
  private final IdSiteCallbackVerifier callbackVerifier;

  /**
   * Instantiates a new Id site manager.
   *
   * @param config     the config
   * @param tokenCodec the token codec
   * @param clock      the clock
   */
  @Inject
  public IdSiteManager(final PortcullisClientConfig config, final TokenCodec tokenCodec, final Clock clock) {
    log.info("IdSiteManager({})", config.ssoBaseUrl());
    this.config = config;
    this.signingContext = config.apiKey().signingContext();
    this.requestBuilder = new IdSiteRequestBuilder(tokenCodec, signingContext, config.applicationHref(), clock);
    this.callbackVerifier = new IdSiteCallbackVerifier(tokenCodec, clock, config.clockSkew());
  }

  /**
   * URL to redirect the end user to.
   *
   * @param options the options
   * @return the url
   */
  public String createIdSiteUrl(final IdSiteOptions options) {
    log.debug("createIdSiteUrl(path={})", options.path());
    return requestBuilder.buildAuthorizationUrl(config.ssoBaseUrl(), options);
  }

  /**
   * Verifies the URL ID Site redirected back to.
   *
   * @param responseUrl the full callback URL including {@code jwtResponse}
   * @return the id site result
   */
  public IdSiteResult handleIdSiteCallback(final String responseUrl) {
    log.debug("handleIdSiteCallback()");
    return callbackVerifier.handleCallback(responseUrl, signingContext);
  }
}
