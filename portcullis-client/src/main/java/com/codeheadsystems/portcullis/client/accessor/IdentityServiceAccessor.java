package com.codeheadsystems.portcullis.client.accessor;

import com.codeheadsystems.portcullis.client.config.PortcullisClientConfig;
import com.codeheadsystems.portcullis.client.error.ErrorClassifier;
import com.codeheadsystems.portcullis.client.exceptions.PortcullisAccessorException;
import com.codeheadsystems.portcullis.model.account.LoginAttemptRequest;
import com.codeheadsystems.portcullis.model.account.LoginAttemptResponse;
import com.codeheadsystems.portcullis.model.account.PasswordChangeRequest;
import com.codeheadsystems.portcullis.model.account.PasswordResetRequest;
import com.codeheadsystems.portcullis.model.account.PasswordResetResponse;
import com.codeheadsystems.portcullis.model.account.VerificationEmailRequest;
import com.codeheadsystems.portcullis.model.account.VerificationEmailResponse;
import com.codeheadsystems.portcullis.model.oauth.AccessTokenResponse;
import com.codeheadsystems.portcullis.model.oauth.TokenInfoResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the identity service endpoints of one application.
 * <p>
 * Handles request serialization, HTTP dispatch, status-code checking, and response
 * deserialization. Every path is relative to the configured application href. Management calls
 * authenticate with the API key over HTTP Basic.
 * <p>
 * Any status of 400 or above goes through the {@link ErrorClassifier} and surfaces as a
 * {@link com.codeheadsystems.portcullis.client.exceptions.ServiceException}. I/O errors, timeouts
 * and interruptions are wrapped in {@link PortcullisAccessorException}. Nothing is retried: a
 * replayed grant can consume a one-time refresh token.
 */
@Singleton
public class IdentityServiceAccessor {

  private static final Logger log = LoggerFactory.getLogger(IdentityServiceAccessor.class);

  private static final String APPLICATION_JSON = "application/json";
  private static final String FORM_URLENCODED = "application/x-www-form-urlencoded";
  private static final String USER_AGENT = "portcullis-java/1.0";
  private static final String EXPAND_ACCOUNT = "?expand=account";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final PortcullisClientConfig config;
  private final ErrorClassifier errorClassifier;

  /**
   * Instantiates a new Identity service accessor.
   *
   * @param httpClient      the http client
   * @param objectMapper    the object mapper
   * @param config          the client config
   * @param errorClassifier the error classifier
   */
  @Inject
  public IdentityServiceAccessor(final HttpClient httpClient,
                                 final ObjectMapper objectMapper,
                                 final PortcullisClientConfig config,
                                 final ErrorClassifier errorClassifier) {
    log.info("IdentityServiceAccessor({})", config.applicationHref());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
    this.errorClassifier = errorClassifier;
  }

  // ── Login ────────────────────────────────────────────────────────────────

  /**
   * Submits a login attempt, asking for the account to be expanded inline.
   *
   * @param request the request
   * @return the login attempt response
   */
  public LoginAttemptResponse loginAttempt(final LoginAttemptRequest request) {
    log.debug("loginAttempt(accountStore={})", request.accountStore());
    return postJson("loginAttempt", applicationUri("/loginAttempts" + EXPAND_ACCOUNT), request,
        LoginAttemptResponse.class);
  }

  // ── OAuth ────────────────────────────────────────────────────────────────

  /**
   * Posts a grant to the token endpoint.
   *
   * @param form the form fields; {@code grant_type} is required
   * @return the access token response
   */
  public AccessTokenResponse tokenGrant(final Map<String, String> form) {
    log.debug("tokenGrant(grant_type={})", form.get("grant_type"));
    URI uri = applicationUri("/oauth/token");
    HttpRequest.Builder builder = baseRequest(uri)
        .header("Content-Type", FORM_URLENCODED)
        .POST(HttpRequest.BodyPublishers.ofString(formBody(form)));
    return send("tokenGrant", builder, AccessTokenResponse.class);
  }

  /**
   * Looks up an access token. Fails with a service error if the token is unknown, expired or
   * revoked.
   *
   * @param accessToken the raw access token
   * @return the token info response
   */
  public TokenInfoResponse tokenInfo(final String accessToken) {
    log.debug("tokenInfo()");
    URI uri = applicationUri("/authTokens/" + pathSegment(accessToken));
    return send("tokenInfo", baseRequest(uri).GET(), TokenInfoResponse.class);
  }

  /**
   * Deletes a resource by its href. The href must be on the application's own scheme, host and
   * port, since the request carries the API key.
   *
   * @param href the href
   * @throws IllegalArgumentException if the href points at another origin
   */
  public void delete(final URI href) {
    if (!sameOrigin(href, config.applicationHref())) {
      throw new IllegalArgumentException("Refusing to send API key credentials to another host: " + href.getHost());
    }
    log.debug("delete({})", href);
    execute("delete", baseRequest(href).DELETE().build());
  }

  // ── Account workflows ────────────────────────────────────────────────────

  /**
   * Starts a password reset; the service emails the account.
   *
   * @param request the request
   * @return the password reset response
   */
  public PasswordResetResponse passwordResetStart(final PasswordResetRequest request) {
    log.debug("passwordResetStart()");
    return postJson("passwordResetStart", applicationUri("/passwordResetTokens" + EXPAND_ACCOUNT), request,
        PasswordResetResponse.class);
  }

  /**
   * Fetches a password reset token, proving it is still valid.
   *
   * @param token the reset token from the email link
   * @return the password reset response
   */
  public PasswordResetResponse passwordResetToken(final String token) {
    log.debug("passwordResetToken()");
    URI uri = applicationUri("/passwordResetTokens/" + pathSegment(token) + EXPAND_ACCOUNT);
    return send("passwordResetToken", baseRequest(uri).GET(), PasswordResetResponse.class);
  }

  /**
   * Completes a password reset.
   *
   * @param token   the reset token
   * @param request the new password
   * @return the password reset response
   */
  public PasswordResetResponse passwordResetFinish(final String token, final PasswordChangeRequest request) {
    log.debug("passwordResetFinish()");
    URI uri = applicationUri("/passwordResetTokens/" + pathSegment(token) + EXPAND_ACCOUNT);
    return postJson("passwordResetFinish", uri, request, PasswordResetResponse.class);
  }

  /**
   * Asks the service to resend the account verification email.
   *
   * @param request the request
   * @return the verification email response
   */
  public VerificationEmailResponse verificationEmail(final VerificationEmailRequest request) {
    log.debug("verificationEmail()");
    HttpRequest.Builder builder = jsonPost(applicationUri("/verificationEmails"), request);
    HttpResponse<String> response = execute("verificationEmail", builder.build());
    // The service may answer 202 with no body.
    if (response.body() == null || response.body().isBlank()) {
      return new VerificationEmailResponse(request.login());
    }
    return read("verificationEmail", response, VerificationEmailResponse.class);
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private URI applicationUri(String relative) {
    return URI.create(config.applicationHref().toString() + relative);
  }

  private HttpRequest.Builder baseRequest(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(config.requestTimeout())
        .header("Accept", APPLICATION_JSON)
        .header("User-Agent", USER_AGENT)
        .header("Authorization", config.apiKey().basicAuthorization());
  }

  private <T> T postJson(String operation, URI uri, Object body, Class<T> responseType) {
    return send(operation, jsonPost(uri, body), responseType);
  }

  private HttpRequest.Builder jsonPost(URI uri, Object body) {
    String requestBody;
    try {
      requestBody = objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new IllegalArgumentException("Request body cannot be serialized: " + body.getClass().getSimpleName(), e);
    }
    return baseRequest(uri)
        .header("Content-Type", APPLICATION_JSON)
        .POST(HttpRequest.BodyPublishers.ofString(requestBody));
  }

  private <T> T send(String operation, HttpRequest.Builder builder, Class<T> responseType) {
    return read(operation, execute(operation, builder.build()), responseType);
  }

  private <T> T read(String operation, HttpResponse<String> response, Class<T> responseType) {
    String body = response.body();
    if (body == null || body.isBlank()) {
      throw new PortcullisAccessorException("Empty " + responseType.getSimpleName() + " returned by " + operation, null);
    }
    try {
      return objectMapper.readValue(body, responseType);
    } catch (IOException e) {
      throw new PortcullisAccessorException(
          "Unreadable " + responseType.getSimpleName() + " returned by " + operation, e);
    }
  }

  // Request URIs may carry tokens, so messages name the operation instead.
  private HttpResponse<String> execute(String operation, HttpRequest request) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new PortcullisAccessorException("HTTP request failed for " + operation, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PortcullisAccessorException("HTTP request interrupted for " + operation, e);
    }
    checkStatus(operation, response.statusCode(), response.body());
    return response;
  }

  private void checkStatus(String operation, int statusCode, String body) {
    if (errorClassifier.isError(statusCode)) {
      log.debug("{} returned HTTP {}", operation, statusCode);
      throw errorClassifier.classify(statusCode, body);
    }
  }

  private static boolean sameOrigin(URI href, URI application) {
    return href.isAbsolute()
        && application.getScheme().equalsIgnoreCase(href.getScheme())
        && application.getHost() != null
        && application.getHost().equalsIgnoreCase(href.getHost())
        && port(application) == port(href);
  }

  private static int port(URI uri) {
    if (uri.getPort() != -1) {
      return uri.getPort();
    }
    return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
  }

  private static String formBody(Map<String, String> form) {
    return form.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private static String pathSegment(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Path value must not be blank");
    }
    return encode(value);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }
}
