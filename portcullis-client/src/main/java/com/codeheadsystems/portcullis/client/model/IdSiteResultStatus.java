package com.codeheadsystems.portcullis.client.model;

import java.util.Optional;

/**
 * What the end user did on ID Site.
 */
public enum IdSiteResultStatus {
  REGISTERED,
  AUTHENTICATED,
  LOGOUT;

  /**
   * Parse the {@code status} claim.
   *
   * @param value the claim value
   * @return the status, or empty if unknown
   */
  public static Optional<IdSiteResultStatus> fromClaim(final String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (IdSiteResultStatus status : values()) {
      if (status.name().equals(value)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
