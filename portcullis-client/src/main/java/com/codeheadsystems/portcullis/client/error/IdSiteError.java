package com.codeheadsystems.portcullis.client.error;

/**
 * Failures of the ID Site flow that are detected locally but reported with the same
 * status, code and wording the identity service uses.
 * <p>
 * {@link #AUDIENCE_MISMATCH} deliberately reuses the "issued at time" developer message. The
 * service has always answered an audience mismatch that way and callers match on it.
 */
public enum IdSiteError {

  INVALID_CALLBACK_URI(400,
      IdSiteError.INVALID_CALLBACK_URI_MESSAGE,
      IdSiteError.INVALID_CALLBACK_URI_MESSAGE + ". Make sure the callback URI specified in your "
          + "ID Site configuration matches the value specified."),

  AUDIENCE_MISMATCH(10012,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      IdSiteError.ISSUED_IN_FUTURE_DEVELOPER_MESSAGE),

  INVALID_EXPIRATION(10017,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      "Token is invalid because the expiration time (exp) is not a valid timestamp"),

  EXPIRED(10011,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      "Token is no longer valid because it has expired"),

  INVALID_ISSUED_AT(10017,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      "Token is invalid because the issued at time (iat) is not a valid timestamp"),

  ISSUED_IN_FUTURE(10012,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      IdSiteError.ISSUED_IN_FUTURE_DEVELOPER_MESSAGE),

  MISSING_SUBJECT(10017,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      "Token is invalid because it does not name a subject (sub)"),

  INVALID_STATUS(10017,
      IdSiteError.TOKEN_INVALID_MESSAGE,
      "Token is invalid because the status claim is missing or not recognized");

  public static final String INVALID_CALLBACK_URI_MESSAGE = "The specified callback URI (cb_uri) is not valid";
  public static final String TOKEN_INVALID_MESSAGE = "Token is invalid";
  public static final String ISSUED_IN_FUTURE_DEVELOPER_MESSAGE =
      "Token is invalid because the issued at time (iat) is after the current time";

  private static final int HTTP_BAD_REQUEST = 400;

  private final int code;
  private final String message;
  private final String developerMessage;

  IdSiteError(final int code, final String message, final String developerMessage) {
    this.code = code;
    this.message = message;
    this.developerMessage = developerMessage;
  }

  public int code() {
    return code;
  }

  public String message() {
    return message;
  }

  public String developerMessage() {
    return developerMessage;
  }

  /**
   * This error in the common shape. All ID Site errors are HTTP 400.
   *
   * @return the api error
   */
  public ApiError toApiError() {
    return new ApiError(HTTP_BAD_REQUEST, code, message, developerMessage);
  }
}
