package com.codeheadsystems.portcullis.token.exceptions;

/**
 * Base type for tokens that cannot be trusted at all: the bytes are corrupt or the signature
 * does not verify. These are never documented service errors and are never retried.
 */
public class TokenDecodeException extends RuntimeException {

  /**
   * Instantiates a new Token decode exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public TokenDecodeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
