package com.codeheadsystems.portcullis.client.config;

import com.codeheadsystems.portcullis.client.exceptions.ApplicationLoadException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;

/**
 * Everything a client needs to talk to one application of the identity service.
 * <p>
 * For most uses {@link #forApplication(ApiKey, URI)} is enough: the ID Site base URL defaults to
 * the scheme and authority of the application href. {@link #fromCompositeUrl(String)} accepts
 * the single-string form {@code https://<id>:<secret>@host/v1/applications/<app>} that is
 * handy in environment variables.
 *
 * @param apiKey          the api key
 * @param applicationHref href of the application all calls act on
 * @param ssoBaseUrl      base URL of the hosted ID Site; {@code /sso} is appended
 * @param connectTimeout  HTTP connect timeout
 * @param requestTimeout  per-request timeout, covering the full response
 * @param clockSkew       how far in the future an ID Site {@code iat} may be
 */
public record PortcullisClientConfig(ApiKey apiKey,
                                     URI applicationHref,
                                     URI ssoBaseUrl,
                                     Duration connectTimeout,
                                     Duration requestTimeout,
                                     Duration clockSkew) {

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(60);

  private static final String APPLICATIONS_PATH = "/applications/";

  public PortcullisClientConfig {
    Objects.requireNonNull(apiKey, "apiKey");
    applicationHref = stripTrailingSlash(Objects.requireNonNull(applicationHref, "applicationHref"));
    ssoBaseUrl = stripTrailingSlash(Objects.requireNonNull(ssoBaseUrl, "ssoBaseUrl"));
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(clockSkew, "clockSkew");
    if (!applicationHref.isAbsolute()) {
      throw new IllegalArgumentException("applicationHref must be absolute: " + applicationHref);
    }
  }

  /**
   * Config with default timeouts and an ID Site on the application's host.
   *
   * @param apiKey          the api key
   * @param applicationHref the application href
   * @return the config
   */
  public static PortcullisClientConfig forApplication(final ApiKey apiKey, final URI applicationHref) {
    return new PortcullisClientConfig(apiKey, applicationHref, origin(applicationHref),
        DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, DEFAULT_CLOCK_SKEW);
  }

  /**
   * Parses {@code scheme://<apiKeyId>:<apiKeySecret>@host[:port]/.../applications/<id>}.
   *
   * @param compositeUrl the composite url
   * @return the config
   * @throws ApplicationLoadException if the URL is not of that form
   */
  public static PortcullisClientConfig fromCompositeUrl(final String compositeUrl) {
    if (compositeUrl == null || compositeUrl.isBlank()) {
      throw new ApplicationLoadException("Application URL is empty", null);
    }
    URI uri;
    try {
      uri = new URI(compositeUrl.trim());
    } catch (URISyntaxException e) {
      throw new ApplicationLoadException("Invalid application URL: " + e.getReason(), e);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new ApplicationLoadException("Application URL must be absolute", null);
    }
    String userInfo = uri.getUserInfo();
    int separator = userInfo == null ? -1 : userInfo.indexOf(':');
    if (separator <= 0 || separator == userInfo.length() - 1) {
      throw new ApplicationLoadException(
          "Application URL must carry the API key as <id>:<secret>@ before the host", null);
    }
    String path = uri.getPath();
    if (path == null || !path.contains(APPLICATIONS_PATH)
        || path.endsWith(APPLICATIONS_PATH)) {
      throw new ApplicationLoadException("Application URL must point at an application resource", null);
    }
    ApiKey apiKey = new ApiKey(userInfo.substring(0, separator), userInfo.substring(separator + 1));
    try {
      URI applicationHref = new URI(uri.getScheme(), null, uri.getHost(), uri.getPort(), path, null, null);
      return forApplication(apiKey, applicationHref);
    } catch (URISyntaxException e) {
      throw new ApplicationLoadException("Invalid application URL: " + e.getReason(), e);
    }
  }

  /**
   * Same config with a different ID Site base URL.
   *
   * @param ssoBaseUrl the sso base url
   * @return the config
   */
  public PortcullisClientConfig withSsoBaseUrl(final URI ssoBaseUrl) {
    return new PortcullisClientConfig(apiKey, applicationHref, ssoBaseUrl, connectTimeout, requestTimeout, clockSkew);
  }

  /**
   * Same config with different timeouts.
   *
   * @param connectTimeout the connect timeout
   * @param requestTimeout the request timeout
   * @return the config
   */
  public PortcullisClientConfig withTimeouts(final Duration connectTimeout, final Duration requestTimeout) {
    return new PortcullisClientConfig(apiKey, applicationHref, ssoBaseUrl, connectTimeout, requestTimeout, clockSkew);
  }

  private static URI origin(URI href) {
    try {
      return new URI(href.getScheme(), null, href.getHost(), href.getPort(), null, null, null);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Cannot derive ID Site URL from " + href, e);
    }
  }

  private static URI stripTrailingSlash(URI uri) {
    String value = uri.toString();
    return value.endsWith("/") ? URI.create(value.substring(0, value.length() - 1)) : uri;
  }
}
