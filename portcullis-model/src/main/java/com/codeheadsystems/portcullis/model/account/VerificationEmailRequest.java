package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST {application}/verificationEmails}
 *
 * @param login username or email of the unverified account
 */
public record VerificationEmailRequest(@JsonProperty("login") String login) {
}
