package com.codeheadsystems.portcullis.token.exceptions;

/**
 * The token is not three base64url segments of JSON.
 */
public class MalformedTokenException extends TokenDecodeException {

  /**
   * Instantiates a new Malformed token exception.
   *
   * @param message the message
   */
  public MalformedTokenException(final String message) {
    super(message, null);
  }

  /**
   * Instantiates a new Malformed token exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedTokenException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
