package com.codeheadsystems.portcullis.model.oauth;

import com.codeheadsystems.portcullis.model.ResourceReference;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Wire model for a validated access token.
 * <p>
 * Used by: {@code GET {application}/authTokens/{token}} response
 *
 * @param href        href of the access token resource
 * @param account     the account the token was issued to
 * @param application the application that issued the token
 * @param tenant      the owning tenant
 * @param jwt         the raw access token
 * @param expandedJwt the decoded header, claims and signature as returned by the service
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenInfoResponse(
    @JsonProperty("href") String href,
    @JsonProperty("account") ResourceReference account,
    @JsonProperty("application") ResourceReference application,
    @JsonProperty("tenant") ResourceReference tenant,
    @JsonProperty("jwt") String jwt,
    @JsonProperty("expandedJwt") Map<String, Object> expandedJwt) {
}
