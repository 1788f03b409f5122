package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST {application}/passwordResetTokens}
 *
 * @param email the email of the account that should receive a reset email
 */
public record PasswordResetRequest(@JsonProperty("email") String email) {
}
