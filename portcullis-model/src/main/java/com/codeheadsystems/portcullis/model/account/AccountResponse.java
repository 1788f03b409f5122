package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an (expanded) account resource.
 *
 * @param href      the account href
 * @param username  the login username
 * @param email     the email address
 * @param givenName first name
 * @param surname   last name
 * @param status    ENABLED, DISABLED or UNVERIFIED
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountResponse(
    @JsonProperty("href") String href,
    @JsonProperty("username") String username,
    @JsonProperty("email") String email,
    @JsonProperty("givenName") String givenName,
    @JsonProperty("surname") String surname,
    @JsonProperty("status") String status) {
}
