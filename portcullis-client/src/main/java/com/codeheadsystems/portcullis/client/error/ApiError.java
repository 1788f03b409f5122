package com.codeheadsystems.portcullis.client.error;

/**
 * The stable error fields every failure reported by this library carries, whether it came from
 * the identity service or was raised locally with the service's exact shape.
 *
 * @param status           HTTP status
 * @param code             service error code; equals {@code status} when the service gave none
 * @param message          end-user facing message
 * @param developerMessage developer facing message
 * @param moreInfo         documentation link, may be null
 */
public record ApiError(int status, int code, String message, String developerMessage, String moreInfo) {

  /**
   * Message used when the error body cannot be understood.
   */
  public static final String UNKNOWN_ERROR = "unknown error";

  /**
   * Instantiates a new Api error without a documentation link.
   *
   * @param status           the status
   * @param code             the code
   * @param message          the message
   * @param developerMessage the developer message
   */
  public ApiError(int status, int code, String message, String developerMessage) {
    this(status, code, message, developerMessage, null);
  }

  /**
   * Error synthesized for a failed response whose body is not an error envelope.
   *
   * @param httpStatus the http status
   * @return the api error
   */
  public static ApiError unknown(int httpStatus) {
    return new ApiError(httpStatus, httpStatus, UNKNOWN_ERROR, UNKNOWN_ERROR);
  }
}
