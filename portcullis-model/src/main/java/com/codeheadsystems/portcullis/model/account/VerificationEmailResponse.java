package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned once a verification email has been queued.
 *
 * @param login the login the email was sent for
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerificationEmailResponse(@JsonProperty("login") String login) {
}
