package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a password reset token resource, requested with {@code expand=account}.
 *
 * @param href    the reset token href
 * @param email   the email the reset was sent to
 * @param account the account being reset
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PasswordResetResponse(
    @JsonProperty("href") String href,
    @JsonProperty("email") String email,
    @JsonProperty("account") AccountResponse account) {
}
