package com.codeheadsystems.portcullis.client.exceptions;

import com.codeheadsystems.portcullis.client.error.ApiError;

/**
 * The identity service answered with a 4xx or 5xx status.
 */
public class ServiceException extends ApiErrorException {

  /**
   * Instantiates a new Service exception.
   *
   * @param apiError the error read from the response
   */
  public ServiceException(final ApiError apiError) {
    super(apiError);
  }
}
