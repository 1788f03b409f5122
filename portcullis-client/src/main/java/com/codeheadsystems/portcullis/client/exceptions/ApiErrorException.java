package com.codeheadsystems.portcullis.client.exceptions;

import com.codeheadsystems.portcullis.client.error.ApiError;
import java.util.Objects;

/**
 * Base type for every failure that carries the service's error fields. Callers branch on
 * {@link #code()} or {@link #status()}; {@link #getMessage()} is the service's message.
 */
public abstract class ApiErrorException extends RuntimeException {

  private final ApiError apiError;

  /**
   * Instantiates a new Api error exception.
   *
   * @param apiError the api error
   */
  protected ApiErrorException(final ApiError apiError) {
    super(Objects.requireNonNull(apiError, "apiError").message());
    this.apiError = apiError;
  }

  public ApiError apiError() {
    return apiError;
  }

  public int status() {
    return apiError.status();
  }

  public int code() {
    return apiError.code();
  }

  public String developerMessage() {
    return apiError.developerMessage();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[status=" + apiError.status() + ", code=" + apiError.code()
        + ", message=" + apiError.message() + "]";
  }
}
