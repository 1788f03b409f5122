package com.codeheadsystems.portcullis.client.exceptions;

import com.codeheadsystems.portcullis.client.model.AccessToken;

/**
 * A refresh grant succeeded but handed back the access token it was meant to replace.
 * <p>
 * The service has already consumed the old refresh token by then, so the pair it returned is
 * kept here. Its refresh token is usually the only one the caller still has.
 */
public class StaleRefreshException extends IllegalStateException {

  private final transient AccessToken returned;

  /**
   * Instantiates a new Stale refresh exception.
   *
   * @param returned the token pair the refresh grant returned
   */
  public StaleRefreshException(final AccessToken returned) {
    super("Refresh grant returned the access token it was meant to replace");
    this.returned = returned;
  }

  public AccessToken returned() {
    return returned;
  }
}
