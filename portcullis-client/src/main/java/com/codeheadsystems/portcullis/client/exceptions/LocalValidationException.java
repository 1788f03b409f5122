package com.codeheadsystems.portcullis.client.exceptions;

import com.codeheadsystems.portcullis.client.error.ApiError;

/**
 * Input failed a check that the identity service also enforces. Raised before any request is
 * sent, with the error the service would have returned.
 */
public class LocalValidationException extends ApiErrorException {

  /**
   * Instantiates a new Local validation exception.
   *
   * @param apiError the api error
   */
  public LocalValidationException(final ApiError apiError) {
    super(apiError);
  }
}
