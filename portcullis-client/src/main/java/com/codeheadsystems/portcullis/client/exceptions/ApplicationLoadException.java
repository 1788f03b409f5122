package com.codeheadsystems.portcullis.client.exceptions;

/**
 * A composite application URL could not be turned into a client configuration.
 */
public class ApplicationLoadException extends IllegalArgumentException {

  /**
   * Instantiates a new Application load exception.
   *
   * @param message the message
   * @param cause   the cause, may be null
   */
  public ApplicationLoadException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
