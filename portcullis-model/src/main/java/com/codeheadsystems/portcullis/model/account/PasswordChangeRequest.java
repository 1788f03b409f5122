package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST {application}/passwordResetTokens/{token}}
 *
 * @param password the new password
 */
public record PasswordChangeRequest(@JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "PasswordChangeRequest[password=****]";
  }
}
