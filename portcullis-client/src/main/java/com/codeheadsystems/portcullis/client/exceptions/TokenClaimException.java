package com.codeheadsystems.portcullis.client.exceptions;

import com.codeheadsystems.portcullis.client.error.IdSiteError;

/**
 * An ID Site response token had a valid signature but its claims were rejected.
 */
public class TokenClaimException extends ApiErrorException {

  private final IdSiteError error;

  /**
   * Instantiates a new Token claim exception.
   *
   * @param error the first failed check
   */
  public TokenClaimException(final IdSiteError error) {
    super(error.toApiError());
    this.error = error;
  }

  public IdSiteError error() {
    return error;
  }
}
