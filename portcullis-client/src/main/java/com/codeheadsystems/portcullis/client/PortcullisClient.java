package com.codeheadsystems.portcullis.client;

import com.codeheadsystems.portcullis.client.accessor.IdentityServiceAccessor;
import com.codeheadsystems.portcullis.client.config.PortcullisClientConfig;
import com.codeheadsystems.portcullis.client.error.ErrorClassifier;
import com.codeheadsystems.portcullis.client.manager.AccountWorkflowManager;
import com.codeheadsystems.portcullis.client.manager.AuthenticationManager;
import com.codeheadsystems.portcullis.client.manager.IdSiteManager;
import com.codeheadsystems.portcullis.client.manager.OAuthGrantManager;
import com.codeheadsystems.portcullis.token.TokenCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers that do not use a DI container. Wires the accessor and managers for
 * one application; all parts are stateless between calls and the instance can be shared across
 * threads.
 * <pre>{@code
 * PortcullisClient client = PortcullisClient.create(
 *     PortcullisClientConfig.fromCompositeUrl(System.getenv("PORTCULLIS_APPLICATION_URL")));
 * AccessToken token = client.oauth().passwordGrant("jdoe", "secret");
 * }</pre>
 */
public class PortcullisClient {

  private static final Logger log = LoggerFactory.getLogger(PortcullisClient.class);

  private final PortcullisClientConfig config;
  private final IdSiteManager idSiteManager;
  private final OAuthGrantManager oAuthGrantManager;
  private final AuthenticationManager authenticationManager;
  private final AccountWorkflowManager accountWorkflowManager;

  /**
   * Instantiates a new Portcullis client.
   *
   * @param config       the config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param clock        the clock used for ID Site tokens
   */
  public PortcullisClient(final PortcullisClientConfig config,
                          final HttpClient httpClient,
                          final ObjectMapper objectMapper,
                          final Clock clock) {
    log.info("PortcullisClient({})", config.applicationHref());
    this.config = config;
    TokenCodec tokenCodec = new TokenCodec(objectMapper);
    IdentityServiceAccessor accessor = new IdentityServiceAccessor(
        httpClient, objectMapper, config, new ErrorClassifier(objectMapper));
    this.idSiteManager = new IdSiteManager(config, tokenCodec, clock);
    this.oAuthGrantManager = new OAuthGrantManager(accessor);
    this.authenticationManager = new AuthenticationManager(accessor);
    this.accountWorkflowManager = new AccountWorkflowManager(accessor);
  }

  /**
   * Client with a default HTTP client, object mapper and the system clock.
   *
   * @param config the config
   * @return the client
   */
  public static PortcullisClient create(final PortcullisClientConfig config) {
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .build();
    return new PortcullisClient(config, httpClient, new ObjectMapper(), Clock.systemUTC());
  }

  public PortcullisClientConfig config() {
    return config;
  }

  public IdSiteManager idSite() {
    return idSiteManager;
  }

  public OAuthGrantManager oauth() {
    return oAuthGrantManager;
  }

  public AuthenticationManager authentication() {
    return authenticationManager;
  }

  public AccountWorkflowManager accounts() {
    return accountWorkflowManager;
  }
}
