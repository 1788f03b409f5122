package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a credential login attempt.
 * <p>
 * Used by: {@code POST {application}/loginAttempts}
 *
 * @param type         the attempt type, always {@code basic}
 * @param value        base64 of {@code identifier:secret}
 * @param accountStore optional account store the attempt is pinned to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginAttemptRequest(
    @JsonProperty("type") String type,
    @JsonProperty("value") String value,
    @JsonProperty("accountStore") AccountStoreReference accountStore) {

  /**
   * The only attempt type the service accepts.
   */
  public static final String BASIC = "basic";
}
