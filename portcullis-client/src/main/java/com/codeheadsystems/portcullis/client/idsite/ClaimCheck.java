package com.codeheadsystems.portcullis.client.idsite;

import com.codeheadsystems.portcullis.client.error.IdSiteError;
import com.codeheadsystems.portcullis.token.TokenClaims;
import java.util.Optional;

/**
 * One step of ID Site response validation.
 */
@FunctionalInterface
public interface ClaimCheck {

  /**
   * Check the claims.
   *
   * @param claims signature-verified claims
   * @return the failure, or empty if this check passes
   */
  Optional<IdSiteError> check(TokenClaims claims);
}
