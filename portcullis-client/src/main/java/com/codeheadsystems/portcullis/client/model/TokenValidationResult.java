package com.codeheadsystems.portcullis.client.model;

import com.codeheadsystems.portcullis.model.ResourceReference;
import com.codeheadsystems.portcullis.model.oauth.TokenInfoResponse;
import java.util.Map;

/**
 * Outcome of validating an access token with the identity service.
 *
 * @param href        the access token resource href
 * @param account     the account the token belongs to
 * @param application the issuing application
 * @param tenant      the tenant
 * @param jwt         the raw token
 * @param expandedJwt header, claims and signature as decoded by the service
 */
public record TokenValidationResult(String href, ResourceReference account, ResourceReference application,
                                    ResourceReference tenant, String jwt, Map<String, Object> expandedJwt) {

  public static TokenValidationResult from(final TokenInfoResponse response) {
    return new TokenValidationResult(response.href(), response.account(), response.application(),
        response.tenant(), response.jwt(),
        response.expandedJwt() == null ? Map.of() : response.expandedJwt());
  }
}
