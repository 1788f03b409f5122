package com.codeheadsystems.portcullis.client.error;

import com.codeheadsystems.portcullis.client.exceptions.ServiceException;
import com.codeheadsystems.portcullis.model.error.ErrorResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a failed HTTP response from the identity service into a {@link ServiceException}.
 * <p>
 * The body is read as the service's error envelope. OAuth2-shaped bodies
 * ({@code {"error":"invalid_grant","error_description":"..."}}) are mapped onto the same fields
 * with the HTTP status as the code. Anything else gets the generic
 * {@link ApiError#unknown(int) unknown error}.
 */
@Singleton
public class ErrorClassifier {

  private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Error classifier.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public ErrorClassifier(final ObjectMapper objectMapper) {
    log.info("ErrorClassifier()");
    this.objectMapper = objectMapper;
  }

  /**
   * Whether the status is a failure this classifier handles.
   *
   * @param httpStatus the http status
   * @return true for 4xx and 5xx
   */
  public boolean isError(final int httpStatus) {
    return httpStatus >= 400;
  }

  /**
   * Classify a failed response.
   *
   * @param httpStatus the http status, at least 400
   * @param body       the response body, may be null or empty
   * @return the exception for the caller to throw
   */
  public ServiceException classify(final int httpStatus, final String body) {
    if (!isError(httpStatus)) {
      throw new IllegalArgumentException("Not an error status: " + httpStatus);
    }
    ApiError apiError = parse(httpStatus, body);
    log.debug("classify(httpStatus={}) -> code={}", httpStatus, apiError.code());
    return new ServiceException(apiError);
  }

  private ApiError parse(int httpStatus, String body) {
    if (body == null || body.isBlank()) {
      return ApiError.unknown(httpStatus);
    }
    ErrorResponse response;
    try {
      response = objectMapper.readValue(body, ErrorResponse.class);
    } catch (JsonProcessingException e) {
      log.debug("Error body for HTTP {} is not an error envelope: {}", httpStatus, e.getOriginalMessage());
      return ApiError.unknown(httpStatus);
    }
    if (response == null || !response.hasContent()) {
      return ApiError.unknown(httpStatus);
    }
    if (response.isOAuthError()) {
      String description = firstNonBlank(response.errorDescription(), response.message(), response.error());
      return new ApiError(httpStatus, httpStatus, description, response.error());
    }
    int status = response.status() != null ? response.status() : httpStatus;
    int code = response.code() != null ? response.code() : status;
    String message = firstNonBlank(response.message(), response.developerMessage(), ApiError.UNKNOWN_ERROR);
    String developerMessage = firstNonBlank(response.developerMessage(), message);
    return new ApiError(status, code, message, developerMessage, response.moreInfo());
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return ApiError.UNKNOWN_ERROR;
  }
}
