package com.codeheadsystems.portcullis.client.exceptions;

/**
 * The request never produced an HTTP response: connection failure, timeout or interruption.
 * Nothing is retried.
 */
public class PortcullisAccessorException extends RuntimeException {
  /**
   * Instantiates a new Portcullis accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public PortcullisAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
