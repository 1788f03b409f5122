package com.codeheadsystems.portcullis.token.exceptions;

/**
 * The token signature does not match the signing secret, or the header names an algorithm
 * other than the one the signing context allows.
 */
public class SignatureInvalidException extends TokenDecodeException {

  /**
   * Instantiates a new Signature invalid exception.
   *
   * @param message the message
   */
  public SignatureInvalidException(final String message) {
    super(message, null);
  }
}
