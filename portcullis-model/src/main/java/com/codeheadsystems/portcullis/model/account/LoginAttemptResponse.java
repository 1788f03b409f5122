package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful login attempt, requested with {@code expand=account}.
 *
 * @param account the authenticated account
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginAttemptResponse(@JsonProperty("account") AccountResponse account) {
}
